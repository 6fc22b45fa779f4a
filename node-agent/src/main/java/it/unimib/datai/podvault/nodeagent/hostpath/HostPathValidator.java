package it.unimib.datai.podvault.nodeagent.hostpath;

import io.fabric8.kubernetes.api.model.Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that every pod known to the API server has a volume directory under the host pods root.
 * Directories without a pod are tolerated, they belong to pods that are still being cleaned up.
 */
@Component
public class HostPathValidator {
    private static final Logger log = LoggerFactory.getLogger(HostPathValidator.class);
    static final String NO_UID = "<no uid>";

    private final PodLister podLister;
    private final HostPodsDirectory hostPods;

    public HostPathValidator(PodLister podLister, HostPodsDirectory hostPods) {
        this.podLister = podLister;
        this.hostPods = hostPods;
    }

    /**
     * @throws HostPathValidationException listing every pod without a volume directory, or when
     *                                     the directory or the pods cannot be listed
     */
    public void validate() {
        Set<String> dirs;
        try {
            dirs = hostPods.listEntries();
        } catch (IOException | UncheckedIOException e) {
            throw HostPathValidationException.unreadableRoot(hostPods.root(), e);
        }

        List<Pod> pods;
        try {
            pods = podLister.list();
        } catch (RuntimeException e) {
            throw HostPathValidationException.podsUnavailable(e);
        }

        List<MissingPodVolume> missing = new ArrayList<>();
        for (Pod pod : pods) {
            String expectedId = PodVolumeDirectories.expectedId(pod);
            if (expectedId != null && dirs.contains(expectedId)) {
                continue;
            }
            String podRef = pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
            String path = hostPods.root().resolve(expectedId != null ? expectedId : NO_UID).toString();
            log.debug("Could not find volumes for pod {} in host path {}", podRef, path);
            missing.add(new MissingPodVolume(podRef, expectedId, path));
        }

        if (!missing.isEmpty()) {
            throw HostPathValidationException.missingVolumes(missing);
        }
        log.debug("Host path {} holds volumes of all {} pod(s)", hostPods.root(), pods.size());
    }
}
