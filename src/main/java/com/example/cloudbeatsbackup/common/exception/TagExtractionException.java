package com.example.cloudbeatsbackup.common.exception;

import java.nio.file.Path;

public class TagExtractionException extends BackupException {

    public static final String CODE = "TAG_EXTRACTION_FAILED";

    private final transient Path file;

    public TagExtractionException(Path file, Throwable cause) {
        super(CODE, "reading tags of " + file + " failed: " + describe(cause), null, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + message;
    }
}
