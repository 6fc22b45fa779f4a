package it.unimib.datai.podvault.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fabric8.kubernetes.api.model.LabelSelector;

/**
 * A concurrency number bound to the nodes matched by a label selector.
 * The selector is kept as fetched and may not be parsable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuledConfigs(LabelSelector nodeSelector, int number) {

    public RuledConfigs {
        if (nodeSelector == null) {
            nodeSelector = new LabelSelector();
        }
    }
}
