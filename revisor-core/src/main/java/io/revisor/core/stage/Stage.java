package io.revisor.core.stage;

/// One step of a review pipeline.
///
/// Implementations receive everything they need through the [StageContext] and report back
/// through the returned [StageOutcome] or a thrown [StageFailure]. They never read or write
/// task state themselves; the pipeline executor owns every registry transition.
///
/// ### Contracts
/// - `execute` may be called more than once for the same task and index (one call per
///   attempt); the attempt number is available in the context
/// - an attempt may be abandoned after the stage timeout, in which case the executing
///   thread is interrupted; the executor may already run the next attempt at that point,
///   so a stage with side effects must check the interrupt flag before performing them
///   (blocking calls that ignore interrupts keep running until they return)
/// - unchecked exceptions are treated as permanent failures
///
/// @implNote Implementations must be thread-safe: the same stage instance serves every task.
///
/// @see ReasoningStage
/// @see Pipeline
public interface Stage {

    /// Stage label, unique within a pipeline.
    String name();

    /// Runs one attempt of this stage.
    ///
    /// @param context inputs for the attempt, never null
    /// @return the stage outcome, never null
    /// @throws StageFailure classified failure; transient failures may be retried
    StageOutcome execute(StageContext context) throws StageFailure;
}
