package io.revisor.core.storage;

import io.revisor.core.exception.FailureKind;
import io.revisor.core.task.Artifact;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Artifact storage on the local file system.
///
/// ### Layout
/// ```
/// {uploadDir}/{taskId}/{safe name}
/// {uploadDir}/{taskId}/{safe name}.meta.properties
/// {derivedDir}/{taskId}/{safe name}
/// {derivedDir}/{taskId}/{safe name}.meta.properties
/// ```
///
/// Metadata files record the original name, size in bytes, line count, SHA-256 digest and
/// save time. Content is written to a temporary file first and moved into place, so
/// readers never see a partially written artifact.
///
/// @implNote Thread-safe for distinct tasks. Concurrent writes of the same name for the
/// same task are last-writer-wins.
public final class FileSystemArtifactStorage implements ArtifactStorage {

    private static final Logger logger =
            Logger.getLogger(FileSystemArtifactStorage.class.getName());

    static final String META_SUFFIX = ".meta.properties";

    private final Path uploadDir;
    private final Path derivedDir;
    private final Clock clock;

    public FileSystemArtifactStorage(Path uploadDir, Path derivedDir) {
        this(uploadDir, derivedDir, Clock.systemUTC());
    }

    public FileSystemArtifactStorage(Path uploadDir, Path derivedDir, Clock clock) {
        this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir must not be null");
        this.derivedDir = Objects.requireNonNull(derivedDir, "derivedDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void putUploaded(String taskId, Artifact artifact) throws ArtifactStorageException {
        Objects.requireNonNull(artifact, "artifact must not be null");
        Path dir = uploadDir.resolve(ArtifactNames.requireTaskId(taskId));
        write(dir, ArtifactNames.sanitize(artifact.name()), artifact.name(), artifact.content());
    }

    @Override
    public Optional<Artifact> getUploaded(String taskId) throws ArtifactStorageException {
        Path dir = uploadDir.resolve(ArtifactNames.requireTaskId(taskId));
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            List<Path> files =
                    entries.filter(Files::isRegularFile)
                            .filter(p -> !p.getFileName().toString().endsWith(META_SUFFIX))
                            .sorted(Comparator.comparing(Path::getFileName))
                            .toList();
            if (files.isEmpty()) {
                return Optional.empty();
            }
            Path file = files.get(0);
            String name = readOriginalName(file).orElse(file.getFileName().toString());
            return Optional.of(new Artifact(name, Files.readString(file, StandardCharsets.UTF_8)));
        } catch (CharacterCodingException e) {
            throw new ArtifactStorageException(
                    FailureKind.PERMANENT, "Stored upload is not valid UTF-8 text", e);
        } catch (IOException e) {
            throw new ArtifactStorageException(
                    FailureKind.TRANSIENT, "Failed to read upload of task " + taskId, e);
        }
    }

    @Override
    public String putDerived(String taskId, String name, String content)
            throws ArtifactStorageException {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Path dir = derivedDir.resolve(ArtifactNames.requireTaskId(taskId));
        return write(dir, ArtifactNames.sanitize(name), name, content).toString();
    }

    @Override
    public void deleteAll(String taskId) throws ArtifactStorageException {
        String id = ArtifactNames.requireTaskId(taskId);
        deleteTree(uploadDir.resolve(id));
        deleteTree(derivedDir.resolve(id));
    }

    private Path write(Path dir, String safeName, String originalName, String content)
            throws ArtifactStorageException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Path target = dir.resolve(safeName);
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, ".tmp-", ".part");
            Files.write(temp, bytes);
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            writeMetadata(dir.resolve(safeName + META_SUFFIX), originalName, content, bytes);
        } catch (IOException e) {
            throw new ArtifactStorageException(
                    FailureKind.TRANSIENT, "Failed to write artifact " + safeName, e);
        }
        logger.fine(() -> "Stored " + bytes.length + " bytes at " + target);
        return target;
    }

    private void writeMetadata(Path metaFile, String originalName, String content, byte[] bytes)
            throws IOException {
        Properties meta = new Properties();
        meta.setProperty("original_name", originalName);
        meta.setProperty("size_bytes", Long.toString(bytes.length));
        meta.setProperty("line_count", Long.toString(content.lines().count()));
        meta.setProperty("sha256", sha256(bytes));
        meta.setProperty("saved_at", clock.instant().toString());
        try (Writer writer = Files.newBufferedWriter(metaFile, StandardCharsets.UTF_8)) {
            meta.store(writer, null);
        }
    }

    private static Optional<String> readOriginalName(Path file) throws IOException {
        Path metaFile = file.resolveSibling(file.getFileName() + META_SUFFIX);
        if (!Files.isRegularFile(metaFile)) {
            return Optional.empty();
        }
        Properties meta = new Properties();
        try (Reader reader = Files.newBufferedReader(metaFile, StandardCharsets.UTF_8)) {
            meta.load(reader);
        }
        return Optional.ofNullable(meta.getProperty("original_name"));
    }

    private static void deleteTree(Path dir) throws ArtifactStorageException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new ArtifactStorageException(
                    FailureKind.TRANSIENT, "Failed to delete " + dir, e);
        }
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
