/**
 * 알림 모델.
 *
 * <p>알림은 추가 전용이며 {@link com.ryuqq.pipeline.core.alert.Alert#resolve(String, java.time.Instant)}로만
 * 상태가 바뀝니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.alert;
