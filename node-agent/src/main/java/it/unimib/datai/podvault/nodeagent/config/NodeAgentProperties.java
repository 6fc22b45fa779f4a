package it.unimib.datai.podvault.nodeagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "podvault.node-agent")
public record NodeAgentProperties(
        String nodeName,
        String namespace,
        String configMapName,
        String hostPodsPath,
        Integer defaultConcurrency
) {
    public static final String DEFAULT_NAMESPACE = "podvault";
    public static final String DEFAULT_CONFIG_MAP_NAME = "node-agent-config";
    public static final String DEFAULT_HOST_PODS_PATH = "/host_pods";

    public String configMapNameOrDefault() {
        return configMapName != null && !configMapName.isBlank() ? configMapName : DEFAULT_CONFIG_MAP_NAME;
    }

    public String hostPodsPathOrDefault() {
        return hostPodsPath != null && !hostPodsPath.isBlank() ? hostPodsPath : DEFAULT_HOST_PODS_PATH;
    }

    public int defaultConcurrencyOrDefault() {
        return defaultConcurrency != null && defaultConcurrency > 0 ? defaultConcurrency : 1;
    }
}
