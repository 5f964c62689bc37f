package io.genoflow.core.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactStoreTest {

    private static final byte[] CONTENT = "chr1\t100\tA\tT".getBytes(StandardCharsets.UTF_8);

    @Nested
    class InMemory {

        private final InMemoryArtifactStore store = new InMemoryArtifactStore();

        @Test
        void shouldWriteAndReadBack() {
            ArtifactRef ref = store.write("variant_filter", "variants.vcf", CONTENT, "text/vcf");

            assertThat(ref.locator()).isEqualTo("mem://variant_filter/variants.vcf");
            assertThat(ref.mediaType()).isEqualTo("text/vcf");
            assertThat(store.exists(ref)).isTrue();
            assertThat(store.read(ref)).hasValueSatisfying(bytes -> assertThat(bytes).isEqualTo(CONTENT));
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        void shouldReturnEmptyForUnknownArtifact() {
            assertThat(store.read(ArtifactRef.of("mem://x/y"))).isEmpty();
            assertThat(store.exists(ArtifactRef.of("mem://x/y"))).isFalse();
        }
    }

    @Nested
    class FileSystem {

        @TempDir Path root;

        @Test
        void shouldWriteUnderTaskDirectory() throws Exception {
            FileSystemArtifactStore store = new FileSystemArtifactStore(root);

            ArtifactRef ref = store.write("scoring", "scores.tsv", CONTENT, null);

            Path written = Path.of(ref.locator());
            assertThat(written).isEqualTo(root.toAbsolutePath().resolve("scoring").resolve("scores.tsv"));
            assertThat(Files.readAllBytes(written)).isEqualTo(CONTENT);
            assertThat(store.read(ref)).isPresent();
            assertThat(store.exists(ref)).isTrue();
        }

        @Test
        void shouldRejectPathsEscapingRoot() {
            FileSystemArtifactStore store = new FileSystemArtifactStore(root);

            assertThatThrownBy(() -> store.write("scoring", "../../etc/passwd", CONTENT, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldReturnEmptyForMissingFile() throws Exception {
            FileSystemArtifactStore store = new FileSystemArtifactStore(root);

            assertThat(store.read(ArtifactRef.of(root.resolve("missing").toString()))).isEmpty();
        }

        @Test
        void shouldNormalizeRootBeforeCheckingContainment() throws Exception {
            Path dotted = root.resolve("runs").resolve("..").resolve("out");
            FileSystemArtifactStore store = new FileSystemArtifactStore(dotted);

            ArtifactRef ref = store.write("scoring", "scores.tsv", CONTENT, null);

            assertThat(store.getRoot()).isEqualTo(root.toAbsolutePath().resolve("out"));
            assertThat(Path.of(ref.locator())).startsWith(store.getRoot());
            assertThat(store.read(ref)).hasValueSatisfying(bytes -> assertThat(bytes).isEqualTo(CONTENT));
        }

        @Test
        void shouldNotReadLocatorsOutsideRoot() throws Exception {
            Path outside = Files.writeString(root.resolve("secret.txt"), "secret");
            FileSystemArtifactStore store = new FileSystemArtifactStore(root.resolve("store"));
            ArtifactRef escaping =
                    ArtifactRef.of(store.getRoot().resolve("scoring").resolve("../../secret.txt").toString());

            assertThat(Files.exists(outside)).isTrue();
            assertThat(store.read(ArtifactRef.of(outside.toString()))).isEmpty();
            assertThat(store.exists(ArtifactRef.of(outside.toString()))).isFalse();
            assertThat(store.read(escaping)).isEmpty();
            assertThat(store.exists(escaping)).isFalse();
        }
    }
}
