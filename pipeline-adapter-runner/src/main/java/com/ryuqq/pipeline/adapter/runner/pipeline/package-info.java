/**
 * Product pipeline state machine with per-item serialization and validation gates.
 */
package com.ryuqq.pipeline.adapter.runner.pipeline;
