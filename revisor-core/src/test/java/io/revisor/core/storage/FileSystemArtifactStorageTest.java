package io.revisor.core.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.revisor.core.exception.FailureKind;
import io.revisor.core.task.Artifact;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileSystemArtifactStorage")
class FileSystemArtifactStorageTest {

    private static final String TASK_ID = "0f8fad5b-d9cb-469f-a165-70867728950e";

    @TempDir Path root;

    private FileSystemArtifactStorage storage;

    @BeforeEach
    void setUp() {
        storage = new FileSystemArtifactStorage(root.resolve("uploads"), root.resolve("fixed"));
    }

    @Nested
    @DisplayName("uploads")
    class Uploads {

        @Test
        @DisplayName("reads back a stored upload under its original name")
        void shouldRoundTripUpload() throws Exception {
            storage.putUploaded(TASK_ID, new Artifact("my script.py", "print(1)\n"));

            assertThat(storage.getUploaded(TASK_ID))
                    .contains(new Artifact("my script.py", "print(1)\n"));
            assertThat(root.resolve("uploads").resolve(TASK_ID).resolve("my_script.py")).exists();
        }

        @Test
        @DisplayName("returns empty for a task without upload")
        void shouldReturnEmptyWhenMissing() throws Exception {
            assertThat(storage.getUploaded(TASK_ID)).isEmpty();
        }

        @Test
        @DisplayName("rejects task ids that could escape the storage directory")
        void shouldRejectUnsafeTaskId() {
            assertThatThrownBy(() -> storage.putUploaded("../etc", new Artifact("a.py", "")))
                    .isInstanceOfSatisfying(
                            ArtifactStorageException.class,
                            e -> assertThat(e.getKind()).isEqualTo(FailureKind.PERMANENT));
        }
    }

    @Nested
    @DisplayName("derived artifacts")
    class Derived {

        @Test
        @DisplayName("writes content and metadata")
        void shouldWriteContentAndMetadata() throws Exception {
            String location = storage.putDerived(TASK_ID, "fixed_a.py", "a = 1\nb = 2\n");

            Path file = Path.of(location);
            assertThat(file).hasParent(root.resolve("fixed").resolve(TASK_ID));
            assertThat(Files.readString(file)).isEqualTo("a = 1\nb = 2\n");

            Properties meta = new Properties();
            try (Reader reader =
                    Files.newBufferedReader(
                            file.resolveSibling("fixed_a.py.meta.properties"), StandardCharsets.UTF_8)) {
                meta.load(reader);
            }
            assertThat(meta.getProperty("size_bytes")).isEqualTo("12");
            assertThat(meta.getProperty("line_count")).isEqualTo("2");
            assertThat(meta.getProperty("sha256")).hasSize(64);
            assertThat(meta.getProperty("original_name")).isEqualTo("fixed_a.py");
        }

        @Test
        @DisplayName("removes every file of a task")
        void shouldDeleteAll() throws Exception {
            storage.putUploaded(TASK_ID, new Artifact("a.py", "x"));
            storage.putDerived(TASK_ID, "fixed_a.py", "y");

            storage.deleteAll(TASK_ID);

            assertThat(root.resolve("uploads").resolve(TASK_ID)).doesNotExist();
            assertThat(root.resolve("fixed").resolve(TASK_ID)).doesNotExist();
        }
    }

    @Nested
    @DisplayName("ArtifactNames")
    class Names {

        @Test
        @DisplayName("strips directories and unsafe characters")
        void shouldSanitize() {
            assertThat(ArtifactNames.sanitize("../../etc/passwd")).isEqualTo("passwd");
            assertThat(ArtifactNames.sanitize("C:\\temp\\evil file.js")).isEqualTo("evil_file.js");
            assertThat(ArtifactNames.sanitize(".hidden")).isEqualTo("hidden");
            assertThat(ArtifactNames.sanitize("")).isEqualTo("artifact");
            assertThat(ArtifactNames.sanitize(null)).isEqualTo("artifact");
        }

        @Test
        @DisplayName("prefixes derived names")
        void shouldDeriveName() {
            assertThat(ArtifactNames.derivedName("main.go")).isEqualTo("fixed_main.go");
        }
    }
}
