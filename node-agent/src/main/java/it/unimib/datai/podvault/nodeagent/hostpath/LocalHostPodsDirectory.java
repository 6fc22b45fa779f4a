package it.unimib.datai.podvault.nodeagent.hostpath;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the immediate child directories of the host pods mount. Plain files are ignored.
 */
public class LocalHostPodsDirectory implements HostPodsDirectory {

    private final Path root;

    public LocalHostPodsDirectory(Path root) {
        this.root = root;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Set<String> listEntries() throws IOException {
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .collect(Collectors.toUnmodifiableSet());
        } catch (UncheckedIOException e) {
            // Read errors during iteration of the listing.
            throw e.getCause();
        }
    }
}
