/**
 * In-memory repositories, de-duplication registry and audit log.
 *
 * <p>Thread-safe reference implementations of the storage SPIs, suitable for tests and
 * single-process deployments.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.store;
