package io.revisor.core.result;

import java.nio.charset.StandardCharsets;

/// Size figures of an artifact.
///
/// @param lines number of lines
/// @param bytes UTF-8 encoded size
public record ArtifactStats(long lines, long bytes) {

    public static ArtifactStats of(String content) {
        if (content == null) {
            return new ArtifactStats(0, 0);
        }
        return new ArtifactStats(
                content.lines().count(), content.getBytes(StandardCharsets.UTF_8).length);
    }
}
