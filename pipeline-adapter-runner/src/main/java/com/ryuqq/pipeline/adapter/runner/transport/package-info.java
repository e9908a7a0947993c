/**
 * Event transport: broadcast first, direct delivery as fallback, per-topic ordered dispatch.
 */
package com.ryuqq.pipeline.adapter.runner.transport;
