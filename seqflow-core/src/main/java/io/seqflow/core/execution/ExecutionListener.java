package io.seqflow.core.execution;

/// Receives streaming progress as soon as each event has been decoded.
///
/// Events arrive on the thread that reads the response, in stream order. Implementations
/// should return quickly; a slow listener delays reading the next line.
///
/// @see ExecutionEvent
@FunctionalInterface
public interface ExecutionListener {

    /// Listener that ignores all events.
    ExecutionListener NOOP = event -> {};

    /// Called for every decoded event.
    ///
    /// @param event the event, not null
    void onEvent(ExecutionEvent event);
}
