package com.pathwaygraph.core.json;

/**
 * Thrown when pathway or node-list JSON cannot be imported.
 */
public class PathwayImportException extends RuntimeException {

    public PathwayImportException(String message) {
        super(message);
    }

    public PathwayImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
