package it.unimib.datai.podvault.nodeagent.hostpath;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import it.unimib.datai.podvault.nodeagent.config.NodeIdentity;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Running pods scheduled on this node, across all namespaces.
 */
@Component
public class KubernetesPodLister implements PodLister {

    private final ObjectProvider<KubernetesClient> clientProvider;
    private final String nodeName;

    public KubernetesPodLister(ObjectProvider<KubernetesClient> clientProvider, NodeIdentity identity) {
        this.clientProvider = clientProvider;
        this.nodeName = identity.nodeName();
    }

    @Override
    public List<Pod> list() {
        return clientProvider.getObject().pods()
                .inAnyNamespace()
                .withField("spec.nodeName", nodeName)
                .withField("status.phase", "Running")
                .list()
                .getItems();
    }
}
