package it.unimib.datai.podvault.nodeagent.startup;

import it.unimib.datai.podvault.nodeagent.concurrency.ConcurrencyResolver;
import it.unimib.datai.podvault.nodeagent.config.NodeAgentProperties;
import it.unimib.datai.podvault.nodeagent.config.NodeIdentity;
import it.unimib.datai.podvault.nodeagent.hostpath.HostPathValidationException;
import it.unimib.datai.podvault.nodeagent.hostpath.HostPathValidator;
import it.unimib.datai.podvault.nodeagent.metrics.NodeAgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Startup checks of the node agent. A host path mismatch aborts startup; the data path
 * concurrency always resolves to a usable number.
 */
@Component
public class NodeAgentStartup implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(NodeAgentStartup.class);

    private final HostPathValidator hostPathValidator;
    private final ConcurrencyResolver concurrencyResolver;
    private final NodeAgentMetrics metrics;
    private final NodeIdentity identity;
    private final int defaultConcurrency;

    private volatile int dataPathConcurrency;

    public NodeAgentStartup(HostPathValidator hostPathValidator,
                            ConcurrencyResolver concurrencyResolver,
                            NodeAgentMetrics metrics,
                            NodeIdentity identity,
                            NodeAgentProperties properties) {
        this.hostPathValidator = hostPathValidator;
        this.concurrencyResolver = concurrencyResolver;
        this.metrics = metrics;
        this.identity = identity;
        this.defaultConcurrency = properties.defaultConcurrencyOrDefault();
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            hostPathValidator.validate();
        } catch (HostPathValidationException e) {
            metrics.hostPathValidationFailed();
            log.error("Host path validation failed on node {}: {}", identity.nodeName(), e.getMessage());
            throw e;
        }

        dataPathConcurrency = concurrencyResolver.resolve(defaultConcurrency);
        metrics.dataPathConcurrency(dataPathConcurrency);
        log.info("Data path concurrency for node {} is {}", identity.nodeName(), dataPathConcurrency);
    }

    public int dataPathConcurrency() {
        return dataPathConcurrency;
    }
}
