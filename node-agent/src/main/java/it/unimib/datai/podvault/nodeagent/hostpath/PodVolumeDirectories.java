package it.unimib.datai.podvault.nodeagent.hostpath;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.Map;

/**
 * Maps a pod to the name of its volume directory under the host pods root.
 */
public final class PodVolumeDirectories {

    /** Set by the kubelet on mirror pods of static pods; holds the id the volumes live under. */
    public static final String MIRROR_POD_ANNOTATION = "kubernetes.io/config.mirror";

    private PodVolumeDirectories() {
    }

    public static String expectedId(Pod pod) {
        ObjectMeta metadata = pod.getMetadata();
        Map<String, String> annotations = metadata.getAnnotations();
        if (annotations != null && annotations.containsKey(MIRROR_POD_ANNOTATION)) {
            return annotations.get(MIRROR_POD_ANNOTATION);
        }
        return metadata.getUid();
    }
}
