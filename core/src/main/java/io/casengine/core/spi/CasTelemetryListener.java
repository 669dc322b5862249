package io.casengine.core.spi;

/**
 * SPI for observability hooks. Front ends provide implementations that bridge to a metrics or
 * tracing system; the core has no telemetry dependencies.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they do NOT
 * affect the computation.
 */
public interface CasTelemetryListener {

    /** Called when an entry point begins. */
    void onOperationStarted(OperationStartedEvent event);

    /** Called when an entry point returns a result. */
    void onOperationCompleted(OperationCompletedEvent event);

    /** Called when an entry point throws a {@code CasException}. */
    void onOperationFailed(OperationFailedEvent event);

    // --- Event records ---

    /** Event emitted when an operation starts. */
    record OperationStartedEvent(String operation, String source) {}

    /** Event emitted when an operation completes successfully. */
    record OperationCompletedEvent(String operation, String source, long durationMs, int stepCount) {}

    /** Event emitted when an operation fails. */
    record OperationFailedEvent(String operation, String source, long durationMs, String errorType, String errorDetail) {}
}
