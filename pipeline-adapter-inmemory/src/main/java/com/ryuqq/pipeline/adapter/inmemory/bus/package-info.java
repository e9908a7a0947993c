/**
 * In-memory broadcast channel for tests and single-process deployments.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.bus;
