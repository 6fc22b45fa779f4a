package it.unimib.datai.podvault.nodeagent.hostpath;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public final class HostPathValidationException extends RuntimeException {

    private final List<MissingPodVolume> missing;

    private HostPathValidationException(String message, List<MissingPodVolume> missing, Throwable cause) {
        super(message, cause);
        this.missing = List.copyOf(missing);
    }

    public static HostPathValidationException missingVolumes(List<MissingPodVolume> missing) {
        String pods = missing.stream().map(MissingPodVolume::toString).collect(Collectors.joining(", "));
        return new HostPathValidationException(
                "unexpected directory structure for host-pods volume, could not find volumes of "
                        + missing.size() + " pod(s): " + pods
                        + "; ensure that the host-pods volume corresponds to the pods subdirectory of the kubelet root directory",
                missing,
                null
        );
    }

    public static HostPathValidationException unreadableRoot(Path root, Throwable cause) {
        return new HostPathValidationException("could not read pod volumes host path " + root, List.of(), cause);
    }

    public static HostPathValidationException podsUnavailable(Throwable cause) {
        return new HostPathValidationException("could not list pods on this node: " + cause.getMessage(), List.of(), cause);
    }

    public List<MissingPodVolume> missing() {
        return missing;
    }
}
