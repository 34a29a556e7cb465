package io.datastoreadmin.errors;

public class RequestExceededDeadlineException extends DatastoreAdminException {

    public RequestExceededDeadlineException(String message, Throwable cause) {
        super(message, cause);
    }
}
