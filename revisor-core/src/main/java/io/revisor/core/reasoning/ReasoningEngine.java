package io.revisor.core.reasoning;

/// Capability that turns an artifact plus stage instructions into a report.
///
/// Implementations handle model selection, prompting and transport. They classify every
/// failure as transient or permanent before it leaves the call.
///
/// @implNote Implementations must be thread-safe; one engine serves all stages and tasks.
///
/// @see io.revisor.core.reasoning.stub.StubReasoningEngine
public interface ReasoningEngine {

    /// Runs one reasoning call.
    ///
    /// @param stageName name of the calling stage, not null
    /// @param request call input, not null
    /// @return the result, never null
    /// @throws ReasoningException classified failure
    ReasoningResult invoke(String stageName, ReasoningRequest request) throws ReasoningException;
}
