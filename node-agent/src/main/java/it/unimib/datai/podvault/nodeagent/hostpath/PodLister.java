package it.unimib.datai.podvault.nodeagent.hostpath;

import io.fabric8.kubernetes.api.model.Pod;

import java.util.List;

/**
 * Lists the pods whose volumes the agent is expected to reach. Scoping to the
 * current node is up to the implementation.
 */
@FunctionalInterface
public interface PodLister {

    List<Pod> list();
}
