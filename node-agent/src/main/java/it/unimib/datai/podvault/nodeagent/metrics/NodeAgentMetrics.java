package it.unimib.datai.podvault.nodeagent.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class NodeAgentMetrics {
    private final AtomicInteger dataPathConcurrency = new AtomicInteger();
    private final Counter hostPathValidationFailures;

    public NodeAgentMetrics(MeterRegistry registry) {
        Gauge.builder("podvault_datapath_concurrency", dataPathConcurrency, AtomicInteger::get)
                .description("Concurrent data path operations allowed on this node")
                .strongReference(true)
                .register(registry);
        this.hostPathValidationFailures = Counter.builder("podvault_host_path_validation_failures_total")
                .description("Host pods directory checks that found pods without volume directories")
                .register(registry);
    }

    public void dataPathConcurrency(int value) {
        dataPathConcurrency.set(value);
    }

    public void hostPathValidationFailed() {
        hostPathValidationFailures.increment();
    }
}
