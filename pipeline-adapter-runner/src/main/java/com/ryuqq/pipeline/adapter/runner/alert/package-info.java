/**
 * Alert classification, persistence and resolution.
 */
package com.ryuqq.pipeline.adapter.runner.alert;
