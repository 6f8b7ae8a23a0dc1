package io.revisor.core.storage;

import io.revisor.core.task.Artifact;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory artifact storage (default implementation).
///
/// Thread-safe, no external dependencies. Derived artifacts are reported at
/// `memory://{taskId}/{name}`.
public final class InMemoryArtifactStorage implements ArtifactStorage {

    private final Map<String, Artifact> uploads = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> derived = new ConcurrentHashMap<>();

    @Override
    public void putUploaded(String taskId, Artifact artifact) throws ArtifactStorageException {
        Objects.requireNonNull(artifact, "artifact must not be null");
        uploads.put(ArtifactNames.requireTaskId(taskId), artifact);
    }

    @Override
    public Optional<Artifact> getUploaded(String taskId) throws ArtifactStorageException {
        return Optional.ofNullable(uploads.get(ArtifactNames.requireTaskId(taskId)));
    }

    @Override
    public String putDerived(String taskId, String name, String content)
            throws ArtifactStorageException {
        Objects.requireNonNull(content, "content must not be null");
        String id = ArtifactNames.requireTaskId(taskId);
        String safeName = ArtifactNames.sanitize(name);
        derived.computeIfAbsent(id, key -> new ConcurrentHashMap<>()).put(safeName, content);
        return "memory://" + id + "/" + safeName;
    }

    @Override
    public void deleteAll(String taskId) throws ArtifactStorageException {
        String id = ArtifactNames.requireTaskId(taskId);
        uploads.remove(id);
        derived.remove(id);
    }

    /// Returns a derived artifact's content, mainly for inspection in tests.
    public Optional<String> getDerived(String taskId, String name) {
        Map<String, String> byName = derived.get(taskId);
        return byName == null
                ? Optional.empty()
                : Optional.ofNullable(byName.get(ArtifactNames.sanitize(name)));
    }
}
