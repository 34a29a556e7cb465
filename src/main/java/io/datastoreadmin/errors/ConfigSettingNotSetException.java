package io.datastoreadmin.errors;

/**
 * Exception thrown when a required configuration setting has not been provided.
 */
public class ConfigSettingNotSetException extends ConfigException {

    public ConfigSettingNotSetException(String message) {
        super(message);
    }
}
