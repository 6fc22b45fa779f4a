package it.unimib.datai.podvault.nodeagent.concurrency;

/**
 * The node agent configuration exists but could not be read.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
