package com.atcascade.core;

/**
 * A job table or directory layout that would let two jobs overwrite each
 * other's results. The run is aborted when this is raised.
 */
public class IntegrityException extends RuntimeException {

    public IntegrityException(String message) {
        super(message);
    }
}
