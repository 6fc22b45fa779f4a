package it.unimib.datai.podvault.nodeagent.config;

/**
 * The node this agent runs on and the namespace the agent is deployed in.
 */
public record NodeIdentity(String nodeName, String namespace) {
}
