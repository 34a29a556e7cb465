package io.datastoreadmin.errors;

/**
 * Exception thrown when the schema-derived runtime metadata is structurally invalid.
 */
public class SchemaException extends DatastoreAdminException {

    public SchemaException(String message) {
        super(message);
    }
}
