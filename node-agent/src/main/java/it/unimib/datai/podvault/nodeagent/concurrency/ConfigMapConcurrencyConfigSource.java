package it.unimib.datai.podvault.nodeagent.concurrency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import it.unimib.datai.podvault.common.model.NodeAgentConfigs;
import it.unimib.datai.podvault.nodeagent.config.NodeAgentProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the node agent configuration from a ConfigMap holding a single JSON document.
 */
@Component
public class ConfigMapConcurrencyConfigSource implements ConcurrencyConfigSource {

    private final ObjectProvider<KubernetesClient> clientProvider;
    private final ObjectMapper objectMapper;
    private final String configMapName;

    public ConfigMapConcurrencyConfigSource(ObjectProvider<KubernetesClient> clientProvider,
                                            ObjectMapper objectMapper,
                                            NodeAgentProperties properties) {
        this.clientProvider = clientProvider;
        this.objectMapper = objectMapper;
        this.configMapName = properties.configMapNameOrDefault();
    }

    @Override
    public NodeAgentConfigs load(String namespace) throws ConfigLoadException {
        ConfigMap configMap;
        try {
            configMap = clientProvider.getObject().configMaps()
                    .inNamespace(namespace)
                    .withName(configMapName)
                    .get();
        } catch (KubernetesClientException e) {
            throw new ConfigLoadException("error to get node agent configs " + namespace + "/" + configMapName, e);
        }
        if (configMap == null) {
            return null;
        }

        Map<String, String> data = configMap.getData();
        if (data == null || data.isEmpty()) {
            throw new ConfigLoadException("data is not available in config map " + configMapName);
        }
        // The document key is not fixed; with several keys the last one wins.
        String json = new TreeMap<>(data).lastEntry().getValue();
        if (json == null || json.isBlank()) {
            throw new ConfigLoadException("data is not available in config map " + configMapName);
        }

        try {
            return objectMapper.readValue(json, NodeAgentConfigs.class);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("error to unmarshall configs from " + configMapName, e);
        }
    }
}
