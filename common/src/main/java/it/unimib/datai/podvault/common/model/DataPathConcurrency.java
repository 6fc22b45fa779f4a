package it.unimib.datai.podvault.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Cluster-wide concurrency settings for data path operations (backup and restore of volume data).
 *
 * @param globalConfig  number applied to every node; only values greater than zero are valid
 * @param perNodeConfig rules narrowing the global number for nodes selected by labels, in document order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataPathConcurrency(int globalConfig, List<RuledConfigs> perNodeConfig) {

    public DataPathConcurrency {
        perNodeConfig = perNodeConfig == null ? List.of() : List.copyOf(perNodeConfig);
    }
}
