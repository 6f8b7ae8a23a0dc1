package io.revisor.core.storage;

import io.revisor.core.task.Artifact;
import java.util.Optional;

/// Persistence for submitted and derived artifacts.
///
/// @see FileSystemArtifactStorage
/// @see InMemoryArtifactStorage
public interface ArtifactStorage {

    /// Stores the submitted artifact of a task.
    ///
    /// @throws ArtifactStorageException if the artifact cannot be stored
    void putUploaded(String taskId, Artifact artifact) throws ArtifactStorageException;

    /// Reads back the submitted artifact of a task.
    ///
    /// @return the artifact, or empty if none was stored for the task
    /// @throws ArtifactStorageException if stored data cannot be read
    Optional<Artifact> getUploaded(String taskId) throws ArtifactStorageException;

    /// Stores an artifact derived by the pipeline.
    ///
    /// @param taskId owning task, not null
    /// @param name desired file name, sanitized by the implementation, not null
    /// @param content artifact content, not null
    /// @return location of the stored artifact, never null
    /// @throws ArtifactStorageException if the artifact cannot be stored
    String putDerived(String taskId, String name, String content) throws ArtifactStorageException;

    /// Removes everything stored for a task. Missing data is not an error.
    void deleteAll(String taskId) throws ArtifactStorageException;
}
