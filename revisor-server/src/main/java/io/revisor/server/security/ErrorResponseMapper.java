package io.revisor.server.security;

import io.revisor.server.api.ErrorBody;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Turns every exception that escapes a review endpoint into an [ErrorBody].
///
/// The service raises 400, 404, 409 and 413 with messages written for the uploader, such as
/// `Task not found: ...` or `File is empty`; those reach the client unchanged. Any other
/// status gets a fixed text, and server errors never expose their cause. Stack traces stay
/// in the server log.
@Provider
public class ErrorResponseMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(ErrorResponseMapper.class);

    static final String SERVER_ERROR = "The review service failed to handle the request";

    /// Statuses whose message was written for the client, with the text used when absent.
    private static final Map<Integer, String> CLIENT_MESSAGES =
            Map.of(
                    400, "Invalid review request",
                    404, "Review task not found",
                    409, "Review task is not in a state that allows this",
                    413, "Uploaded file is too large");

    /// Statuses raised by the HTTP layer itself; their messages are not meant for clients.
    private static final Map<Integer, String> PROTOCOL_MESSAGES =
            Map.of(
                    405, "Method not allowed on review resources",
                    406, "Review resources produce JSON or an event stream",
                    415, "Uploads must be sent as multipart/form-data");

    @Override
    public Response toResponse(Throwable exception) {
        if (!(exception instanceof WebApplicationException rejected)) {
            LOG.errorv(exception, "Review request failed unexpectedly: {0}", exception.getClass());
            return respond(500, SERVER_ERROR);
        }

        int status = rejected.getResponse().getStatus();
        String message = clientMessage(status, rejected.getMessage());
        if (status >= 500) {
            LOG.errorv(exception, "Review request failed with {0}", status);
        } else {
            LOG.debugv("Review request rejected with {0}: {1}", status, message);
        }
        return respond(status, message);
    }

    static String clientMessage(int status, String raw) {
        if (status >= 500) {
            return SERVER_ERROR;
        }
        String fallback = CLIENT_MESSAGES.get(status);
        if (fallback != null) {
            return raw != null && !raw.isBlank() ? raw : fallback;
        }
        return PROTOCOL_MESSAGES.getOrDefault(status, "Review request rejected");
    }

    private static Response respond(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorBody(message, status))
                .build();
    }
}
