package io.revisor.core.task;

import java.util.Objects;

/// Artifact produced by the terminal stage, typically the revised source file.
///
/// @param name file name of the derived artifact, not null
/// @param content derived content, not null
/// @param location where the artifact storage persisted it, not null
public record DerivedArtifact(String name, String content, String location) {

    public DerivedArtifact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    @Override
    public String toString() {
        return "DerivedArtifact[name=" + name + ", location=" + location + "]";
    }
}
