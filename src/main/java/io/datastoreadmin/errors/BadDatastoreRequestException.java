package io.datastoreadmin.errors;

/**
 * Exception thrown when the datastore rejects a request with a 4xx response.
 * The message carries the datastore's response so operators can diagnose the rejection.
 */
public class BadDatastoreRequestException extends DatastoreAdminException {

    public BadDatastoreRequestException(String message) {
        super(message);
    }
}
