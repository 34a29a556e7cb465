package io.datastoreadmin.errors;

/**
 * Base class of all errors raised by datastore administration.
 */
public class DatastoreAdminException extends RuntimeException {

    public DatastoreAdminException(String message) {
        super(message);
    }

    public DatastoreAdminException(String message, Throwable cause) {
        super(message, cause);
    }
}
