package io.revisor.core.storage;

import io.revisor.core.exception.FailureKind;
import java.util.regex.Pattern;

/// File and directory name rules shared by the storage implementations.
public final class ArtifactNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern TASK_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]{0,127}");
    private static final int MAX_LENGTH = 255;
    private static final String FALLBACK = "artifact";

    private ArtifactNames() {}

    /// Reduces a submitted file name to a safe single path segment.
    ///
    /// Directory components are dropped, characters outside `[A-Za-z0-9._-]` become `_`,
    /// leading dots are stripped and the result is capped at 255 characters.
    public static String sanitize(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String base = name.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String safe = UNSAFE.matcher(base).replaceAll("_");
        while (safe.startsWith(".")) {
            safe = safe.substring(1);
        }
        if (safe.length() > MAX_LENGTH) {
            safe = safe.substring(safe.length() - MAX_LENGTH);
        }
        return safe.isEmpty() ? FALLBACK : safe;
    }

    /// Name given to the revised version of a submitted file.
    public static String derivedName(String originalName) {
        return sanitize("fixed_" + sanitize(originalName));
    }

    static String requireTaskId(String taskId) throws ArtifactStorageException {
        if (taskId == null || !TASK_ID.matcher(taskId).matches()) {
            throw new ArtifactStorageException(FailureKind.PERMANENT, "Invalid task id: " + taskId);
        }
        return taskId;
    }
}
