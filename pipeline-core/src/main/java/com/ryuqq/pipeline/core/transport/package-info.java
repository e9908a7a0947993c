/**
 * Event transport contract: publish with fallback, ordered per-topic subscription and the
 * audit trail record.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.transport;
