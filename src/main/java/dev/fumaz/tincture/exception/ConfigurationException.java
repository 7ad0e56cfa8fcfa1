package dev.fumaz.tincture.exception;

/**
 * Indicates an invalid registration or a type the container cannot construct.
 */
public class ConfigurationException extends ContainerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
