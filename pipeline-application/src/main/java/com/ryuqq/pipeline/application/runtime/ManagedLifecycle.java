package com.ryuqq.pipeline.application.runtime;

/**
 * Explicit start/stop lifecycle for components that own threads or broker attachments.
 *
 * <p><strong>States:</strong> NEW → RUNNING → STOPPED. A stopped component is never restarted;
 * create a new instance instead.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>{@link #start()} acquires workers and attachments</li>
 *   <li>{@link #stop()} drains in-flight work before releasing them</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ManagedLifecycle {

    /**
     * Starts the component.
     *
     * @throws IllegalStateException if already started or stopped
     */
    void start();

    /**
     * Drains in-flight work and releases resources. Calling it again is a no-op.
     */
    void stop();

    /**
     * @return true between a successful {@link #start()} and {@link #stop()}
     */
    boolean isRunning();
}
