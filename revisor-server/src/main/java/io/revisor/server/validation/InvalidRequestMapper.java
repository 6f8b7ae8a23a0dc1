package io.revisor.server.validation;

import io.revisor.server.api.ErrorBody;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.StringJoiner;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/// Answers requests that fail parameter validation with 400 and an [ErrorBody] naming
/// each offending request parameter, for example
/// `taskId is not a review task id (expected a UUID as returned on upload)`.
///
/// The rejected values are never echoed back.
@Provider
public class InvalidRequestMapper implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(InvalidRequestMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        TreeSet<String> problems = new TreeSet<>();
        for (ConstraintViolation<?> violation : exception.getConstraintViolations()) {
            problems.add(parameterName(violation.getPropertyPath()) + " " + violation.getMessage());
        }
        StringJoiner message = new StringJoiner("; ");
        problems.forEach(message::add);

        LOG.debugv("Rejected review request: {0}", LogSanitizer.sanitize(message.toString()));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorBody(message.toString(), 400))
                .build();
    }

    /// The last node of a path such as `streamEvents.taskId` is the parameter itself.
    static String parameterName(Path path) {
        String last = "request";
        for (Path.Node node : path) {
            if (node.getName() != null) {
                last = node.getName();
            }
        }
        return last;
    }
}
