package it.unimib.datai.podvault.nodeagent.hostpath;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * The kubelet pods directory mounted into the agent, one sub-directory per pod.
 */
public interface HostPodsDirectory {

    Path root();

    Set<String> listEntries() throws IOException;
}
