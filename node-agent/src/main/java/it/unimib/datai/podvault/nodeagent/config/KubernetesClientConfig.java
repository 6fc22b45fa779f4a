package it.unimib.datai.podvault.nodeagent.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.vertx.VertxHttpClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Builds the API server client: the pod's ServiceAccount when running in a cluster,
 * the local kubeconfig otherwise.
 */
@Configuration
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);
    static final Path SA_TOKEN = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");
    static final Path SA_CA = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/ca.crt");

    private final Path tokenPath;
    private final Path caPath;
    private final UnaryOperator<String> env;

    public KubernetesClientConfig() {
        this(SA_TOKEN, SA_CA, System::getenv);
    }

    KubernetesClientConfig(Path tokenPath, Path caPath, UnaryOperator<String> env) {
        this.tokenPath = tokenPath;
        this.caPath = caPath;
        this.env = env;
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        if (Files.exists(tokenPath)) {
            return new KubernetesClientBuilder()
                    .withConfig(inClusterConfig())
                    .withHttpClientFactory(new VertxHttpClientFactory())
                    .build();
        }
        log.info("No ServiceAccount token at {}, using local kubeconfig", tokenPath);
        return new KubernetesClientBuilder()
                .withHttpClientFactory(new VertxHttpClientFactory())
                .build();
    }

    Config inClusterConfig() {
        String host = env.apply("KUBERNETES_SERVICE_HOST");
        String port = env.apply("KUBERNETES_SERVICE_PORT");
        if (host == null || host.isBlank() || port == null || port.isBlank()) {
            throw new IllegalStateException("Missing Kubernetes service host/port in the agent environment");
        }
        String token;
        try {
            token = Files.readString(tokenPath).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read in-cluster ServiceAccount credentials", e);
        }
        if (token.isEmpty()) {
            throw new IllegalStateException("ServiceAccount token is empty: " + tokenPath);
        }

        String masterUrl = "https://" + host + ":" + port;
        log.info("In-cluster API server {}, CA {}", masterUrl, caPath.toAbsolutePath());
        return new ConfigBuilder()
                .withMasterUrl(masterUrl)
                .withOauthToken(token)
                .withCaCertFile(caPath.toAbsolutePath().toString())
                .build();
    }
}
