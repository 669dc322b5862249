package io.casengine.cli.config;

/**
 * Thrown when configuration loading fails: a missing file, invalid YAML, or a value that does not
 * convert or validate. The message is suitable for direct output on the command line.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
