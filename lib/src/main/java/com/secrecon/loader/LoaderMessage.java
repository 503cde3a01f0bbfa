package com.secrecon.loader;

/** A diagnostic produced while loading a dataset directory. */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public LoaderMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = level;
        this.message = message;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    /** Line the message refers to, or 0 when it concerns the whole file. */
    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        String location = sourceFilename == null ? "" : sourceFilename;
        if (sourceLineno > 0) {
            location = location + ":" + sourceLineno;
        }
        return level + " " + message + (location.isEmpty() ? "" : " (" + location + ")");
    }
}
