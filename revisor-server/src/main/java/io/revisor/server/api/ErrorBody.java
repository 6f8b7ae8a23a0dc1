package io.revisor.server.api;

/// JSON body of every error response.
///
/// ```json
/// {"error": "Task 3f2a... has already finished", "status": 409}
/// ```
///
/// @param error message safe to show to the client
/// @param status HTTP status code, repeated for clients that only see the body
public record ErrorBody(String error, int status) {}
