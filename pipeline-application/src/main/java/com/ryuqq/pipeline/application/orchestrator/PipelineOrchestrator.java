package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;
import com.ryuqq.pipeline.core.exception.DeliveryFailedException;
import com.ryuqq.pipeline.core.exception.InvalidTransitionException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.exception.ValidationRejectedException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.validation.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * 파이프라인 오케스트레이터 경계 (Boundary).
 *
 * <p>외부 협력자(API 라우트, 스케줄러, 다른 모듈 어댑터)가 호출하는 동기 연산 집합입니다.
 * 모든 연산은 즉시 결과 또는 타입이 지정된 예외로 반환되며, 오래 걸리는 조정은 이벤트 봉투로만
 * 이루어집니다.</p>
 *
 * <p><strong>주요 흐름:</strong></p>
 * <pre>
 * PipelineItem item = orchestrator.createPipelineItem("Linen Shirt", "tops", "designer");
 * orchestrator.advance(item.id(), "designer");                  // DISCOVERY → IDEATION
 * ...
 * ValidationHandle margin = orchestrator.requestValidation(item.id(), ValidationType.MARGIN_CHECK, Map.of());
 * // finance 모듈이 margin_check_response를 보내면 handle이 완료됨
 * orchestrator.advance(item.id(), "designer");                  // SOURCING → SAMPLING
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PipelineOrchestrator {

    /**
     * 새 아이템을 DISCOVERY 단계로 생성.
     *
     * @param title 제목
     * @param category 카테고리 (nullable)
     * @param actor 생성 주체
     * @return 생성된 아이템
     */
    PipelineItem createPipelineItem(String title, String category, String actor);

    /**
     * 다음 단계로 진행.
     *
     * <p>호출 시점의 단계를 기대 단계로 삼습니다. 같은 아이템에 동시에 호출되면 하나만 전이하고
     * 나머지는 충돌({@link InvalidTransitionException})을 받습니다.</p>
     *
     * @param id 아이템 식별자
     * @param actor 수행 주체
     * @return 전이 후 아이템
     * @throws NotFoundException 아이템이 없는 경우
     * @throws InvalidTransitionException 종료 단계, 게이트 미충족, 동시 전이 충돌
     * @throws ValidationRejectedException 게이트 검증이 거절 또는 기한 초과된 경우
     */
    PipelineItem advance(PipelineItemId id, String actor);

    /**
     * 기대 단계를 지정한 진행 (낙관적 동시성 검사).
     *
     * @param id 아이템 식별자
     * @param actor 수행 주체
     * @param expectedStage 호출자가 관찰한 현재 단계
     * @return 전이 후 아이템
     * @throws InvalidTransitionException 현재 단계가 expectedStage와 다른 경우 (충돌)
     */
    PipelineItem advance(PipelineItemId id, String actor, Stage expectedStage);

    /**
     * 관리자 강제 단계 이동. 이력에 OVERRIDE로 기록되고 대기 중 검증은 취소됩니다.
     *
     * @param id 아이템 식별자
     * @param actor 수행 주체
     * @param target 이동할 단계 (CANCELLED 불가)
     * @param reason 사유
     * @return 전이 후 아이템
     */
    PipelineItem override(PipelineItemId id, String actor, Stage target, String reason);

    /**
     * 아이템 취소. 대기 중 검증은 취소되어 늦은 응답이 반영되지 않습니다.
     *
     * @param id 아이템 식별자
     * @param actor 수행 주체
     * @param reason 사유 (nullable)
     * @return 취소된 아이템
     */
    PipelineItem cancel(PipelineItemId id, String actor, String reason);

    /**
     * 현재 단계에 대한 검증 요청.
     *
     * @param id 아이템 식별자
     * @param type 검증 종류
     * @param payload 요청 payload (nullable)
     * @return 검증 핸들
     * @throws InvalidTransitionException 현재 단계가 해당 검증을 요구하지 않는 경우
     * @throws ValidationRejectedException 같은 검증이 거절된 뒤 해제되지 않은 경우
     * @throws DeliveryFailedException 요청 봉투를 전달하지 못한 경우
     */
    ValidationHandle requestValidation(PipelineItemId id, ValidationType type, Map<String, Object> payload);

    /**
     * 현재 단계가 요구하는 모든 검증 요청 (이미 대기 중이거나 승인된 것은 제외).
     *
     * @param id 아이템 식별자
     * @return 새로 발행된 핸들
     */
    List<ValidationHandle> requestValidations(PipelineItemId id);

    /**
     * 검증 응답을 직접 제출 (이벤트 경로를 거치지 않는 동기 변형).
     *
     * @param correlationId 상관관계 식별자
     * @param verdict 판정
     * @param summary 요약 (nullable)
     * @return 해결된 결과
     * @throws NotFoundException 알 수 없는 상관관계 식별자인 경우
     * @throws AlreadyResolvedException 이미 해결된 경우
     */
    ValidationResult submitValidationResponse(CorrelationId correlationId, Verdict verdict, String summary);

    /**
     * 거절 또는 기한 초과된 검증을 사람이 해제.
     *
     * @param id 아이템 식별자
     * @param type 검증 종류
     * @param actor 해제 주체
     * @return 해제 후 아이템
     */
    PipelineItem clearRejection(PipelineItemId id, ValidationType type, String actor);

    /**
     * @param id 아이템 식별자
     * @return 아이템
     * @throws NotFoundException 아이템이 없는 경우
     */
    PipelineItem getItem(PipelineItemId id);

    /**
     * @param stage 단계 필터 (null이면 전체)
     * @return 아이템 목록
     */
    List<PipelineItem> listItems(Stage stage);

    /**
     * @param query 조회 조건
     * @return 최신순 알림 목록
     */
    List<Alert> listAlerts(AlertQuery query);

    /**
     * @param alertId 알림 식별자
     * @param resolvedBy 해결 주체 (nullable)
     * @return 해결된 알림
     * @throws NotFoundException 알림이 없는 경우
     * @throws AlreadyResolvedException 이미 해결된 경우
     */
    Alert resolveAlert(String alertId, String resolvedBy);

    /**
     * 수동 알림 생성.
     *
     * @param severity 심각도
     * @param category 분류
     * @param title 제목
     * @param message 본문
     * @return 생성된 알림
     */
    Alert raiseAlert(AlertSeverity severity, String category, String title, String message);

    /**
     * 직접 전달 경로(웹훅)로 도착한 봉투 수신.
     *
     * <p>해석할 수 없는 입력은 예외 없이 버려지고 malformed_event 알림으로 기록됩니다.</p>
     *
     * @param json 와이어 JSON
     */
    void receiveWebhook(String json);
}
