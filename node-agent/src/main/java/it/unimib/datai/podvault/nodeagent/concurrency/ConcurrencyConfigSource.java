package it.unimib.datai.podvault.nodeagent.concurrency;

import it.unimib.datai.podvault.common.model.NodeAgentConfigs;

@FunctionalInterface
public interface ConcurrencyConfigSource {

    /**
     * Fetches the node agent configuration of the given namespace.
     *
     * @return the configuration, or {@code null} when none is defined
     * @throws ConfigLoadException if the configuration could not be fetched or decoded
     */
    NodeAgentConfigs load(String namespace) throws ConfigLoadException;
}
