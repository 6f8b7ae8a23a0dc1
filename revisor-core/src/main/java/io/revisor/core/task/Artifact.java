package io.revisor.core.task;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Submitted source file: original file name and full text content.
///
/// @param name file name as supplied by the submitter, not null
/// @param content file content, not null, may be empty
public record Artifact(String name, String content) {

    public Artifact {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public String toString() {
        return "Artifact[name=" + name + ", bytes=" + sizeInBytes() + "]";
    }
}
