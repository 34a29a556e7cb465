package io.datastoreadmin.errors;

/**
 * Exception thrown when a change to an index or index template cannot be performed.
 */
public class IndexOperationException extends DatastoreAdminException {

    public IndexOperationException(String message) {
        super(message);
    }

    public IndexOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
