package io.datastoreadmin.errors;

/**
 * Exception thrown when the environment configuration is missing or invalid.
 */
public class ConfigException extends DatastoreAdminException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
