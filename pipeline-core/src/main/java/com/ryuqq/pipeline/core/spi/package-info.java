/**
 * Service Provider Interfaces for the broadcast broker, direct delivery and storage.
 *
 * <p>Adapters implement these; the runner module depends on them only.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.spi;
