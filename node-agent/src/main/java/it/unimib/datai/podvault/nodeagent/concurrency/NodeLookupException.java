package it.unimib.datai.podvault.nodeagent.concurrency;

public final class NodeLookupException extends RuntimeException {

    private NodeLookupException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NodeLookupException notFound(String nodeName) {
        return new NodeLookupException("node " + nodeName + " not found", null);
    }

    public static NodeLookupException unavailable(String nodeName, Throwable cause) {
        return new NodeLookupException("failed to get node " + nodeName + ": " + cause.getMessage(), cause);
    }
}
