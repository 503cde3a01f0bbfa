package com.secrecon.loader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A tab-separated table with a header row, addressed by column name. Data rows are streamed one
 * at a time; only the current row is held.
 */
final class TabularFile implements AutoCloseable {
    private final String fileName;
    private final BufferedReader reader;
    private final Map<String, Integer> columns;
    private int lineNumber = 1;

    private TabularFile(String fileName, BufferedReader reader, Map<String, Integer> columns) {
        this.fileName = fileName;
        this.reader = reader;
        this.columns = columns;
    }

    /**
     * Opens the file and checks its header.
     *
     * @throws LoaderException when the header is absent, lacks a required column, or cannot be read
     */
    static TabularFile open(Path path, Collection<String> requiredColumns) throws LoaderException {
        String fileName = path.getFileName().toString();
        BufferedReader reader;
        try {
            reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LoaderException("Failed to read " + fileName + ": " + e.getMessage(), e);
        }
        try {
            Map<String, Integer> columns = readHeader(fileName, reader.readLine(), requiredColumns);
            return new TabularFile(fileName, reader, columns);
        } catch (IOException e) {
            LoaderException failure = new LoaderException("Failed to read " + fileName + ": " + e.getMessage(), e);
            closeQuietly(reader, failure);
            throw failure;
        } catch (LoaderException e) {
            closeQuietly(reader, e);
            throw e;
        }
    }

    private static void closeQuietly(BufferedReader reader, Exception pending) {
        try {
            reader.close();
        } catch (IOException closeError) {
            pending.addSuppressed(closeError);
        }
    }

    private static Map<String, Integer> readHeader(String fileName, String header, Collection<String> requiredColumns)
            throws LoaderException {
        if (header == null) {
            throw new LoaderException("Missing header row in " + fileName);
        }
        if (!header.isEmpty() && header.charAt(0) == '\uFEFF') {
            header = header.substring(1);
        }
        Map<String, Integer> columns = new HashMap<>();
        String[] names = header.split("\t", -1);
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        List<String> missing = new ArrayList<>();
        for (String required : requiredColumns) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new LoaderException(fileName + " is missing required columns " + missing);
        }
        return columns;
    }

    String getFileName() {
        return fileName;
    }

    /**
     * Raw cells of the next non-blank data row, or {@code null} at the end of the file.
     *
     * @throws LoaderException when the file cannot be read
     */
    String[] next() throws LoaderException {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!line.isBlank()) {
                    return line.split("\t", -1);
                }
            }
            return null;
        } catch (IOException e) {
            throw new LoaderException("Failed to read " + fileName + " after line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    /** File line number of the row last returned by {@link #next()}, counting the header as line 1. */
    int lineNumber() {
        return lineNumber;
    }

    /** Trimmed cell value, or {@code null} when the column is absent or the cell is empty. */
    String field(String[] cells, String column) {
        Integer position = columns.get(column);
        if (position == null || position >= cells.length) {
            return null;
        }
        String value = cells[position].trim();
        return value.isEmpty() ? null : value;
    }

    @Override
    public void close() throws LoaderException {
        try {
            reader.close();
        } catch (IOException e) {
            throw new LoaderException("Failed to close " + fileName + ": " + e.getMessage(), e);
        }
    }
}
