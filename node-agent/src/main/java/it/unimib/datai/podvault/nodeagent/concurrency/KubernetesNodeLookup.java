package it.unimib.datai.podvault.nodeagent.concurrency;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class KubernetesNodeLookup implements NodeLookup {

    private final ObjectProvider<KubernetesClient> clientProvider;

    public KubernetesNodeLookup(ObjectProvider<KubernetesClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public Node get(String nodeName) {
        Node node;
        try {
            node = clientProvider.getObject().nodes().withName(nodeName).get();
        } catch (KubernetesClientException e) {
            throw NodeLookupException.unavailable(nodeName, e);
        }
        if (node == null) {
            throw NodeLookupException.notFound(nodeName);
        }
        return node;
    }
}
