/**
 * Lifecycle contract shared by the runtime components.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.runtime;
