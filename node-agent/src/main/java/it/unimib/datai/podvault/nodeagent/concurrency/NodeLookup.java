package it.unimib.datai.podvault.nodeagent.concurrency;

import io.fabric8.kubernetes.api.model.Node;

@FunctionalInterface
public interface NodeLookup {

    /**
     * @throws NodeLookupException if the node does not exist or cannot be fetched
     */
    Node get(String nodeName);
}
