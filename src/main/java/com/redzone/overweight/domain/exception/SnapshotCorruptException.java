package com.redzone.overweight.domain.exception;

public class SnapshotCorruptException extends RuntimeException {

    public SnapshotCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
