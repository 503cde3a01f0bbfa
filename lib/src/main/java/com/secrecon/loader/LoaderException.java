package com.secrecon.loader;

/**
 * Checked exception signalling that a dataset directory could not be loaded at all: the
 * directory or a required table is missing, a header lacks required columns, or reading failed.
 */
public final class LoaderException extends Exception {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
