package io.revisor.server.validation;

/// Strips line breaks from user-supplied values before they reach the log.
///
/// Uploaded file names and path parameters are attacker-controlled; a name containing
/// `\n` could otherwise forge extra log lines.
///
/// ```
/// LOG.infov("Upload accepted: file={0}", LogSanitizer.sanitize(fileName));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or `"null"` if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
