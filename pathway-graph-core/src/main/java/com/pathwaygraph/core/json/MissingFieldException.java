package com.pathwaygraph.core.json;

/**
 * Thrown when imported pathway JSON lacks a required field.
 *
 * <p>The field name is a path such as {@code condition_name} or {@code pit_orders[0].category}.
 */
public class MissingFieldException extends PathwayImportException {

    private final String fieldName;

    public MissingFieldException(String fieldName) {
        super("Missing required field: " + fieldName);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
