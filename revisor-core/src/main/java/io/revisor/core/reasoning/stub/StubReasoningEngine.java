package io.revisor.core.reasoning.stub;

import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.reasoning.ReasoningRequest;
import io.revisor.core.reasoning.ReasoningResult;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Reasoning engine that answers without calling any model.
///
/// Useful for exercising the pipeline, the REST layer and event streaming without network
/// access or API tokens.
///
/// ### Response Resolution Order
/// 1. Report registered for the stage name via [#registerReport(String, String)]
/// 2. Auto-generated report describing the artifact and the prior stage count
///
/// When the request expects a revision, the revised content is the registered revision if
/// any, otherwise the unchanged input content.
///
/// @implNote Thread-safe. Registered responses live in concurrent maps.
public class StubReasoningEngine implements ReasoningEngine {

    private static final Logger logger = Logger.getLogger(StubReasoningEngine.class.getName());

    private final Map<String, String> reports = new ConcurrentHashMap<>();
    private final Map<String, String> revisions = new ConcurrentHashMap<>();

    /// Registers the report returned for every call from `stageName`.
    public StubReasoningEngine registerReport(String stageName, String report) {
        reports.put(
                Objects.requireNonNull(stageName, "stageName must not be null"),
                Objects.requireNonNull(report, "report must not be null"));
        return this;
    }

    /// Registers the revised content returned when `stageName` expects a revision.
    public StubReasoningEngine registerRevision(String stageName, String revisedContent) {
        revisions.put(
                Objects.requireNonNull(stageName, "stageName must not be null"),
                Objects.requireNonNull(revisedContent, "revisedContent must not be null"));
        return this;
    }

    @Override
    public ReasoningResult invoke(String stageName, ReasoningRequest request) {
        logger.info(
                "[STUB] Stage '"
                        + stageName
                        + "' reviewing "
                        + request.artifact().name()
                        + " ("
                        + request.artifact().content().length()
                        + " chars)");

        String report = reports.get(stageName);
        if (report == null) {
            report = generateReport(stageName, request);
        }
        if (!request.expectsRevision()) {
            return ReasoningResult.report(report);
        }
        String revised = revisions.getOrDefault(stageName, request.artifact().content());
        return ReasoningResult.withRevision(report, revised);
    }

    private static String generateReport(String stageName, ReasoningRequest request) {
        long lines = request.artifact().content().lines().count();
        return String.format(
                """
                        [STUB REPORT from %s]

                        File: %s
                        Lines: %d
                        Prior reports: %d

                        This is a stub report for testing purposes.""",
                stageName,
                request.artifact().name(),
                lines,
                request.priorReports().size());
    }
}
