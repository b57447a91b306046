package com.changelab.mentor.project;

public class PersistenceWriteException extends RuntimeException {
    public PersistenceWriteException(String projectId, Throwable cause) {
        super("Failed to write project " + projectId, cause);
    }
}
