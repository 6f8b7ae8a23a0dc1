package io.revisor.adapter.langchain4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.revisor.core.exception.FailureKind;
import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.reasoning.ReasoningException;
import io.revisor.core.reasoning.ReasoningRequest;
import io.revisor.core.reasoning.ReasoningResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// [ReasoningEngine] backed by a LangChain4j [ChatModel].
///
/// Each call sends the stage instructions as the system message and the artifact plus all
/// prior stage reports as the user message. Stages that expect a revision get a single
/// `submit_revision` tool whose arguments carry the report and the full revised file, so
/// the revised content never has to be scraped out of free text.
///
/// ### Failure Classification
/// Provider exceptions are classified by walking the cause chain:
/// - I/O errors, timeouts, rate limits and upstream 5xx responses are `TRANSIENT`
/// - everything else, including malformed tool arguments and empty replies, is `PERMANENT`
///
/// @implNote Thread-safe if the underlying [ChatModel] is. LangChain4j's HTTP-backed models
/// are.
public class LangChain4jReasoningEngine implements ReasoningEngine {

    private static final Logger logger =
            Logger.getLogger(LangChain4jReasoningEngine.class.getName());

    static final String REVISION_TOOL = "submit_revision";
    static final String REPORT_FIELD = "report";
    static final String REVISED_CONTENT_FIELD = "revised_content";

    /// Failures worth another attempt. LangChain4j maps provider timeouts, 429 and 5xx
    /// responses onto [RetriableException] subtypes.
    private static final List<Class<? extends Throwable>> TRANSIENT_TYPES =
            List.of(
                    RetriableException.class,
                    dev.langchain4j.exception.TimeoutException.class,
                    RateLimitException.class,
                    InternalServerException.class,
                    IOException.class,
                    TimeoutException.class);

    private static final ToolSpecification REVISION_TOOL_SPEC =
            ToolSpecification.builder()
                    .name(REVISION_TOOL)
                    .description("Submit the review report together with the complete fixed file.")
                    .parameters(
                            JsonObjectSchema.builder()
                                    .addStringProperty(
                                            REPORT_FIELD,
                                            "Explanation of every change that was made")
                                    .addStringProperty(
                                            REVISED_CONTENT_FIELD,
                                            "Full content of the fixed file, not a diff")
                                    .required(REPORT_FIELD, REVISED_CONTENT_FIELD)
                                    .build())
                    .build();

    private final ChatModel model;
    private final ObjectMapper mapper;

    public LangChain4jReasoningEngine(ChatModel model) {
        this(model, new ObjectMapper());
    }

    public LangChain4jReasoningEngine(ChatModel model, ObjectMapper mapper) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ReasoningResult invoke(String stageName, ReasoningRequest request)
            throws ReasoningException {
        Objects.requireNonNull(stageName, "stageName must not be null");
        Objects.requireNonNull(request, "request must not be null");

        ChatRequest chatRequest = buildChatRequest(request);
        logger.fine(
                "Invoking model for stage " + stageName + " of task " + request.taskId());

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException e) {
            throw classify(stageName, e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new ReasoningException(
                    FailureKind.PERMANENT, "Model returned no message for stage " + stageName);
        }
        AiMessage message = response.aiMessage();
        return request.expectsRevision()
                ? parseRevision(stageName, message)
                : parseReport(stageName, message);
    }

    ChatRequest buildChatRequest(ReasoningRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(request.instructions()));
        messages.add(UserMessage.from(renderUserPrompt(request)));

        ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
        if (request.expectsRevision()) {
            builder.toolSpecifications(List.of(REVISION_TOOL_SPEC)).toolChoice(ToolChoice.REQUIRED);
        }
        return builder.build();
    }

    static String renderUserPrompt(ReasoningRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("File: ").append(request.artifact().name()).append("\n\n");
        prompt.append("```\n").append(request.artifact().content()).append("\n```\n");

        List<String> prior = request.priorReports();
        for (int i = 0; i < prior.size(); i++) {
            prompt.append("\n### Report ")
                    .append(i + 1)
                    .append("\n\n")
                    .append(prior.get(i))
                    .append('\n');
        }
        if (request.expectsRevision()) {
            prompt.append("\nCall `")
                    .append(REVISION_TOOL)
                    .append("` with your report and the complete fixed file.\n");
        }
        return prompt.toString();
    }

    private ReasoningResult parseReport(String stageName, AiMessage message)
            throws ReasoningException {
        String text = message.text();
        if (text == null || text.isBlank()) {
            throw new ReasoningException(
                    FailureKind.PERMANENT, "Model returned an empty report for stage " + stageName);
        }
        return ReasoningResult.report(text);
    }

    private ReasoningResult parseRevision(String stageName, AiMessage message)
            throws ReasoningException {
        if (!message.hasToolExecutionRequests()) {
            throw new ReasoningException(
                    FailureKind.PERMANENT,
                    "Model did not call " + REVISION_TOOL + " for stage " + stageName);
        }
        ToolExecutionRequest call =
                message.toolExecutionRequests().stream()
                        .filter(r -> REVISION_TOOL.equals(r.name()))
                        .findFirst()
                        .orElseThrow(
                                () ->
                                        new ReasoningException(
                                                FailureKind.PERMANENT,
                                                "Model called an unknown tool for stage "
                                                        + stageName));

        JsonNode arguments;
        try {
            arguments = mapper.readTree(call.arguments());
        } catch (JsonProcessingException e) {
            throw new ReasoningException(
                    FailureKind.PERMANENT, "Malformed " + REVISION_TOOL + " arguments", e);
        }

        JsonNode report = arguments == null ? null : arguments.get(REPORT_FIELD);
        JsonNode revised = arguments == null ? null : arguments.get(REVISED_CONTENT_FIELD);
        if (report == null || !report.isTextual() || revised == null || !revised.isTextual()) {
            throw new ReasoningException(
                    FailureKind.PERMANENT,
                    REVISION_TOOL
                            + " arguments must contain string fields "
                            + REPORT_FIELD
                            + " and "
                            + REVISED_CONTENT_FIELD);
        }
        return ReasoningResult.withRevision(report.asText(), revised.asText());
    }

    static ReasoningException classify(String stageName, RuntimeException error) {
        FailureKind kind = isTransient(error) ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        logger.warning(
                "Model call for stage "
                        + stageName
                        + " failed ("
                        + kind
                        + "): "
                        + error.getClass().getSimpleName());
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new ReasoningException(kind, message, error);
    }

    static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            for (Class<? extends Throwable> type : TRANSIENT_TYPES) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
