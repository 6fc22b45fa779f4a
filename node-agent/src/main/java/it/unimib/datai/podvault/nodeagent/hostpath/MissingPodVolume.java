package it.unimib.datai.podvault.nodeagent.hostpath;

/**
 * A pod whose volume directory is absent from the host pods root.
 *
 * @param pod        {@code namespace/name}
 * @param expectedId directory name the pod's volumes should live under
 * @param path       full path that was expected
 */
public record MissingPodVolume(String pod, String expectedId, String path) {

    @Override
    public String toString() {
        return pod + " (" + path + ")";
    }
}
