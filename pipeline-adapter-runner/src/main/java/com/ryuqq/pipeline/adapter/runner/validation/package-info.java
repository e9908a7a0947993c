/**
 * Cross-module validation: correlation, first-write-wins resolution, deadline enforcement.
 */
package com.ryuqq.pipeline.adapter.runner.validation;
