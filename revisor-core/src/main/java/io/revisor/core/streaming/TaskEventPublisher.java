package io.revisor.core.streaming;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Receiver of task events emitted by the pipeline executor.
///
/// Implementations must not block: `publish` is called on the thread that runs the task.
///
/// @see TaskEventBroadcaster
@FunctionalInterface
public interface TaskEventPublisher {

    void publish(TaskEvent event);

    static TaskEventPublisher noop() {
        return event -> {};
    }

    /// Fans out every event to the given publishers in order.
    ///
    /// An exception from one delegate is logged and does not prevent the remaining
    /// delegates from receiving the event.
    static TaskEventPublisher composite(List<TaskEventPublisher> delegates) {
        List<TaskEventPublisher> copy = List.copyOf(delegates);
        Logger logger = Logger.getLogger(TaskEventPublisher.class.getName());
        return event -> {
            Objects.requireNonNull(event, "event must not be null");
            for (TaskEventPublisher delegate : copy) {
                try {
                    delegate.publish(event);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Publisher failed on " + event.type(), e);
                }
            }
        };
    }
}
