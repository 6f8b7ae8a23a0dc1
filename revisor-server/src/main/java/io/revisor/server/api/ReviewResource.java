package io.revisor.server.api;

import io.revisor.core.result.ReviewResult;
import io.revisor.core.task.Artifact;
import io.revisor.core.task.Task;
import io.revisor.core.task.TaskStatus;
import io.revisor.server.service.ReviewService;
import io.revisor.server.service.ReviewService.TaskAlreadyFinishedException;
import io.revisor.server.service.ReviewService.TaskNotFinishedException;
import io.revisor.server.service.ReviewService.TaskNotFoundException;
import io.revisor.server.service.ReviewService.TaskRunningException;
import io.revisor.server.validation.LogSanitizer;
import io.revisor.server.validation.UploadValidator;
import io.revisor.server.validation.ValidTaskId;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

/// REST API for code review tasks.
///
/// Provides endpoints for:
/// - uploading a source file as a new review task
/// - starting, inspecting, listing and deleting tasks
/// - fetching the assembled review result
///
/// Live progress is served by [ReviewEventResource].
///
/// ### Status Codes
/// | Condition | Status |
/// |---|---|
/// | unknown task id | 404 |
/// | starting a finished task | 409 |
/// | result of an unfinished task | 409 |
/// | deleting a running task | 409 |
/// | rejected upload | 400, or 413 when too large |
///
/// @see ReviewService for business logic
@Path("/api/v1/reviews")
@Produces(MediaType.APPLICATION_JSON)
public class ReviewResource {

    private static final Logger LOG = Logger.getLogger(ReviewResource.class);

    private final ReviewService reviewService;
    private final UploadValidator uploadValidator;

    @Inject
    public ReviewResource(ReviewService reviewService, UploadValidator uploadValidator) {
        this.reviewService = reviewService;
        this.uploadValidator = uploadValidator;
    }

    /// Uploads a source file and registers it as a review task.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/reviews?autoStart=true
    /// Content-Type: multipart/form-data
    ///
    /// file=@calculator.py
    /// ```
    ///
    /// ### Response (201 Created)
    /// ```json
    /// {"taskId": "3f2a...", "fileName": "calculator.py", "status": "PENDING"}
    /// ```
    @POST
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Response upload(
            @RestForm("file") FileUpload file,
            @QueryParam("autoStart") @DefaultValue("false") boolean autoStart) {
        if (file == null) {
            throw new BadRequestException("Multipart field 'file' is required");
        }
        uploadValidator.validate(file.fileName(), file.size());

        Artifact artifact = new Artifact(file.fileName(), readContent(file));
        LOG.infov(
                "Upload received: file={0}, bytes={1}, autoStart={2}",
                LogSanitizer.sanitize(artifact.name()), file.size(), autoStart);

        Task task;
        try {
            task = reviewService.submit(artifact, autoStart);
        } catch (TaskAlreadyFinishedException e) {
            throw new ClientErrorException(e.getMessage(), Response.Status.CONFLICT);
        }

        return Response.created(URI.create("/api/v1/reviews/" + task.id()))
                .entity(
                        Map.of(
                                "taskId", task.id(),
                                "fileName", artifact.name(),
                                "status", task.status().name()))
                .build();
    }

    /// Starts the review pipeline of an uploaded task.
    ///
    /// ### Response (202 Accepted)
    /// The task snapshot as [TaskView].
    @POST
    @Path("/{taskId}/start")
    public Response start(@PathParam("taskId") @ValidTaskId String taskId) {
        try {
            Task task = reviewService.start(taskId);
            return Response.accepted().entity(TaskView.from(task)).build();
        } catch (TaskNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        } catch (TaskAlreadyFinishedException e) {
            throw new ClientErrorException(e.getMessage(), Response.Status.CONFLICT);
        }
    }

    /// Gets the status and per-stage progress of a task.
    @GET
    @Path("/{taskId}")
    public TaskView get(@PathParam("taskId") @ValidTaskId String taskId) {
        try {
            return TaskView.from(reviewService.getTask(taskId));
        } catch (TaskNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        }
    }

    /// Gets the assembled review of a finished task.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {
    ///   "taskId": "3f2a...",
    ///   "status": "COMPLETED",
    ///   "fileName": "calculator.py",
    ///   "sections": [{"index": 0, "name": "structural-analysis", "report": "..."}],
    ///   "combinedReport": "## 1. structural-analysis\n\n...",
    ///   "outputArtifact": {"name": "fixed_calculator.py", "content": "...", "location": "..."},
    ///   "inputStats": {"lines": 42, "bytes": 1024},
    ///   "outputStats": {"lines": 45, "bytes": 1100}
    /// }
    /// ```
    @GET
    @Path("/{taskId}/result")
    public ReviewResult result(@PathParam("taskId") @ValidTaskId String taskId) {
        try {
            return reviewService.getResult(taskId);
        } catch (TaskNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        } catch (TaskNotFinishedException e) {
            throw new ClientErrorException(e.getMessage(), Response.Status.CONFLICT);
        }
    }

    /// Lists tasks newest first.
    ///
    /// ### Request
    /// ```
    /// GET /api/v1/reviews?status=RUNNING&offset=0&limit=20
    /// ```
    @GET
    public Map<String, Object> list(
            @QueryParam("status") String status,
            @QueryParam("offset") @DefaultValue("0") @Min(0) int offset,
            @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(500) int limit) {
        List<TaskView> tasks =
                reviewService.listTasks(parseStatus(status), offset, limit).stream()
                        .map(TaskView::from)
                        .toList();
        return Map.of("tasks", tasks, "offset", offset, "limit", limit);
    }

    /// Deletes a pending or finished task and its stored files.
    @DELETE
    @Path("/{taskId}")
    public Response delete(@PathParam("taskId") @ValidTaskId String taskId) {
        try {
            reviewService.deleteTask(taskId);
            return Response.noContent().build();
        } catch (TaskNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        } catch (TaskRunningException e) {
            throw new ClientErrorException(e.getMessage(), Response.Status.CONFLICT);
        }
    }

    static TaskStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.valueOf(status.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unknown status: " + LogSanitizer.sanitize(status));
        }
    }

    private static String readContent(FileUpload file) {
        try {
            return Files.readString(file.uploadedFile(), StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new BadRequestException("File is not valid UTF-8 text");
        } catch (IOException e) {
            LOG.errorv(
                    e, "Could not read uploaded file {0}", LogSanitizer.sanitize(file.fileName()));
            throw new InternalServerErrorException("Could not read uploaded file");
        }
    }
}
