package it.unimib.datai.podvault.nodeagent.hostpath;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class HostPathValidatorTest {

    @TempDir
    Path hostPods;

    private static final Pod FOO = pod("foo", "bar", "foo", null);
    private static final Pod ZOO = pod("zoo", "raz", "zoo", null);
    private static final Pod ZOO_MIRROR = pod("zoo", "raz", "zoo", "baz");

    @Test
    void validate_allPodVolumesPresent_succeeds() throws IOException {
        mkdirs("foo", "zoo");

        assertThatCode(() -> validator(FOO, ZOO).validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_mirrorPodResolvedThroughAnnotation_succeeds() throws IOException {
        mkdirs("foo", "baz");

        assertThatCode(() -> validator(FOO, ZOO_MIRROR).validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_mirrorPodUidDirectoryDoesNotCount() throws IOException {
        mkdirs("foo", "zoo");

        assertThatThrownBy(() -> validator(FOO, ZOO_MIRROR).validate())
                .isInstanceOfSatisfying(HostPathValidationException.class, e ->
                        assertThat(e.missing()).extracting(MissingPodVolume::expectedId).containsExactly("baz"));
    }

    @Test
    void validate_allPodVolumesMissing_listsEveryPod() throws IOException {
        mkdirs("unexpected-dir");

        assertThatThrownBy(() -> validator(FOO, ZOO_MIRROR).validate())
                .isInstanceOfSatisfying(HostPathValidationException.class, e -> {
                    assertThat(e.missing()).extracting(MissingPodVolume::expectedId).containsExactly("foo", "baz");
                    assertThat(e.missing()).extracting(MissingPodVolume::pod).containsExactly("bar/foo", "raz/zoo");
                    assertThat(e.getMessage()).contains("2 pod(s)").contains("bar/foo").contains("raz/zoo");
                });
    }

    @Test
    void validate_singleMissingPod_isReportedByName(CapturedOutput output) throws IOException {
        mkdirs("foo");

        assertThatThrownBy(() -> validator(FOO, ZOO).validate())
                .isInstanceOf(HostPathValidationException.class)
                .hasMessageContaining("raz/zoo (" + hostPods.resolve("zoo") + ")")
                .hasMessageNotContaining("bar/foo");
        assertThat(output.getOut()).contains("Could not find volumes for pod raz/zoo in host path " + hostPods.resolve("zoo"));
    }

    @Test
    void validate_extraDirectoriesAreIgnored() throws IOException {
        mkdirs("foo", "zoo", "stale-1", "stale-2");

        assertThatCode(() -> validator(FOO, ZOO).validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_noPods_succeeds() {
        assertThatCode(() -> validator().validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_filesDoNotCountAsPodDirectories() throws IOException {
        Files.writeString(hostPods.resolve("foo"), "not a directory");

        assertThatThrownBy(() -> validator(FOO).validate())
                .isInstanceOf(HostPathValidationException.class);
    }

    @Test
    void validate_unreadableRoot_fails() {
        HostPathValidator validator = new HostPathValidator(
                () -> List.of(FOO), new LocalHostPodsDirectory(hostPods.resolve("missing")));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(HostPathValidationException.class)
                .hasMessageContaining("could not read pod volumes host path")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void validate_podListingFails_fails() throws IOException {
        mkdirs("foo");
        HostPathValidator validator = new HostPathValidator(() -> {
            throw new IllegalStateException("api server down");
        }, new LocalHostPodsDirectory(hostPods));

        assertThatThrownBy(validator::validate)
                .isInstanceOf(HostPathValidationException.class)
                .hasMessageContaining("api server down");
    }

    @Test
    void validate_usesInjectedDirectoryListing() {
        HostPodsDirectory listing = new HostPodsDirectory() {
            @Override
            public Path root() {
                return Path.of("/host_pods");
            }

            @Override
            public Set<String> listEntries() {
                return Set.of("foo");
            }
        };

        assertThatThrownBy(() -> new HostPathValidator(() -> List.of(FOO, ZOO), listing).validate())
                .isInstanceOfSatisfying(HostPathValidationException.class, e ->
                        assertThat(e.missing()).containsExactly(new MissingPodVolume("raz/zoo", "zoo", "/host_pods/zoo")));
    }

    @Test
    void validate_listingFailsWhileIterating_reportsUnreadableRoot() {
        HostPodsDirectory listing = new HostPodsDirectory() {
            @Override
            public Path root() {
                return Path.of("/host_pods");
            }

            @Override
            public Set<String> listEntries() {
                throw new UncheckedIOException(new IOException("stale file handle"));
            }
        };

        assertThatThrownBy(() -> new HostPathValidator(() -> List.of(FOO), listing).validate())
                .isInstanceOf(HostPathValidationException.class)
                .hasMessageContaining("could not read pod volumes host path /host_pods")
                .hasCauseInstanceOf(UncheckedIOException.class);
    }

    @Test
    void validate_podWithoutUid_isReportedExplicitly() throws IOException {
        mkdirs("foo");

        assertThatThrownBy(() -> validator(FOO, pod("orphan", "ns", null, null)).validate())
                .isInstanceOfSatisfying(HostPathValidationException.class, e -> {
                    assertThat(e.missing()).containsExactly(
                            new MissingPodVolume("ns/orphan", null, hostPods.resolve("<no uid>").toString()));
                    assertThat(e.getMessage()).contains("ns/orphan").doesNotContain("/null");
                });
    }

    private HostPathValidator validator(Pod... pods) {
        return new HostPathValidator(() -> List.of(pods), new LocalHostPodsDirectory(hostPods));
    }

    private void mkdirs(String... names) throws IOException {
        for (String name : names) {
            Files.createDirectories(hostPods.resolve(name));
        }
    }

    static Pod pod(String name, String namespace, String uid, String mirror) {
        PodBuilder builder = new PodBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withUid(uid)
                .endMetadata();
        if (mirror != null) {
            builder.editMetadata().addToAnnotations(PodVolumeDirectories.MIRROR_POD_ANNOTATION, mirror).endMetadata();
        }
        return builder.build();
    }
}
