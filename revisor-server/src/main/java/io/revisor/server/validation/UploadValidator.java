package io.revisor.server.validation;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Checks uploaded source files before a task is created for them.
///
/// ### Configuration Properties
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `revisor.upload.allowed-extensions` | `.py,.js,.ts,.java,.cpp,.c,.go,.rs,.rb` | Accepted file extensions |
/// | `revisor.upload.max-size-bytes` | `10485760` | Maximum file size (10 MiB) |
///
/// ### Rejections
/// - missing or blank file name: 400
/// - extension not allowed: 400
/// - empty file: 400
/// - file larger than the limit: 413
@ApplicationScoped
public class UploadValidator {

    private final List<String> allowedExtensions;
    private final long maxSizeBytes;

    @Inject
    public UploadValidator(
            @ConfigProperty(
                            name = "revisor.upload.allowed-extensions",
                            defaultValue = ".py,.js,.ts,.java,.cpp,.c,.go,.rs,.rb")
                    List<String> allowedExtensions,
            @ConfigProperty(name = "revisor.upload.max-size-bytes", defaultValue = "10485760")
                    long maxSizeBytes) {
        Objects.requireNonNull(allowedExtensions, "allowedExtensions must not be null");
        this.allowedExtensions =
                allowedExtensions.stream()
                        .map(String::strip)
                        .map(e -> e.toLowerCase(Locale.ROOT))
                        .toList();
        this.maxSizeBytes = maxSizeBytes;
    }

    /// Validates file name and size of an upload.
    ///
    /// @param fileName client-supplied file name, may be null
    /// @param sizeBytes upload size in bytes
    /// @throws BadRequestException if the name, extension or emptiness check fails
    /// @throws WebApplicationException with status 413 if the file is too large
    public void validate(String fileName, long sizeBytes) {
        if (fileName == null || fileName.isBlank()) {
            throw new BadRequestException("File name is required");
        }
        String extension = extensionOf(fileName);
        if (!allowedExtensions.contains(extension)) {
            throw new BadRequestException(
                    "Unsupported file type '"
                            + extension
                            + "'. Allowed: "
                            + String.join(", ", allowedExtensions));
        }
        if (sizeBytes <= 0) {
            throw new BadRequestException("File is empty");
        }
        if (sizeBytes > maxSizeBytes) {
            throw new WebApplicationException(
                    "File exceeds the maximum size of " + maxSizeBytes + " bytes",
                    Response.Status.REQUEST_ENTITY_TOO_LARGE);
        }
    }

    public List<String> allowedExtensions() {
        return allowedExtensions;
    }

    public long maxSizeBytes() {
        return maxSizeBytes;
    }

    static String extensionOf(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String base = fileName.substring(slash + 1);
        int dot = base.lastIndexOf('.');
        return dot <= 0 ? "" : base.substring(dot).toLowerCase(Locale.ROOT);
    }
}
