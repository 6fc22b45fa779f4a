package it.unimib.datai.podvault.common.selector;

public final class InvalidSelectorException extends IllegalArgumentException {

    public InvalidSelectorException(String message) {
        super(message);
    }
}
