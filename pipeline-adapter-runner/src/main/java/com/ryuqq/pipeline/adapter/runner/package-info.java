/**
 * Runtime adapter: wires transport, validation, state machine and alerting into a
 * {@link com.ryuqq.pipeline.application.orchestrator.PipelineOrchestrator}.
 *
 * <ul>
 *   <li>{@code transport} - broadcast with direct-delivery fallback</li>
 *   <li>{@code validation} - correlation and deadlines</li>
 *   <li>{@code pipeline} - stage state machine</li>
 *   <li>{@code alert} - severity classification and alert lifecycle</li>
 * </ul>
 */
package com.ryuqq.pipeline.adapter.runner;
