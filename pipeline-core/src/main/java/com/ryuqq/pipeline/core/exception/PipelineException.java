package com.ryuqq.pipeline.core.exception;

/**
 * 파이프라인 오케스트레이터 도메인 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 비검사 예외이며, 호출자가 분기할 수 있도록
 * 안정적인 오류 코드를 함께 제공합니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>PIPE-TRANSITION - 허용되지 않은 단계 전이</li>
 *   <li>PIPE-REJECTED - 게이트 검증 거절 또는 차단 상태</li>
 *   <li>PIPE-TIMEOUT - 검증 응답 기한 초과</li>
 *   <li>PIPE-DELIVERY - 브로드캐스트와 직접 전달 모두 실패</li>
 *   <li>PIPE-DUPLICATE - 이미 처리한 봉투 재수신</li>
 *   <li>PIPE-NOT-FOUND - 조회 대상 없음</li>
 *   <li>PIPE-RESOLVED - 이미 해결된 대상</li>
 *   <li>PIPE-MALFORMED - 해석할 수 없는 봉투</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class PipelineException extends RuntimeException {

    private final String errorCode;

    protected PipelineException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    protected PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: PIPE-TRANSITION)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
