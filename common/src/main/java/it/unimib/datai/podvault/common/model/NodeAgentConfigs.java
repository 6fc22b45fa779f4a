package it.unimib.datai.podvault.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Node agent configuration document stored in the node agent ConfigMap.
 *
 * @param dataPathConcurrency concurrency settings, {@code null} when the document does not carry any
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeAgentConfigs(DataPathConcurrency dataPathConcurrency) {
}
