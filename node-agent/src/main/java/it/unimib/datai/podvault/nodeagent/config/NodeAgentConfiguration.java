package it.unimib.datai.podvault.nodeagent.config;

import it.unimib.datai.podvault.nodeagent.hostpath.HostPodsDirectory;
import it.unimib.datai.podvault.nodeagent.hostpath.LocalHostPodsDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.function.UnaryOperator;

@Configuration
public class NodeAgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NodeAgentConfiguration.class);

    private final UnaryOperator<String> env;

    public NodeAgentConfiguration() {
        this(System::getenv);
    }

    NodeAgentConfiguration(UnaryOperator<String> env) {
        this.env = env;
    }

    @Bean
    public NodeIdentity nodeIdentity(NodeAgentProperties properties) {
        String nodeName = firstNonBlank(properties.nodeName(), env.apply("NODE_NAME"));
        if (nodeName == null) {
            throw new IllegalStateException(
                    "Node name is not set: configure podvault.node-agent.node-name or the NODE_NAME environment variable");
        }
        String namespace = firstNonBlank(properties.namespace(), env.apply("POD_NAMESPACE"));
        if (namespace == null) {
            namespace = NodeAgentProperties.DEFAULT_NAMESPACE;
        }
        log.info("Node agent running on node {} in namespace {}", nodeName, namespace);
        return new NodeIdentity(nodeName, namespace);
    }

    @Bean
    public HostPodsDirectory hostPodsDirectory(NodeAgentProperties properties) {
        return new LocalHostPodsDirectory(Path.of(properties.hostPodsPathOrDefault()));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
