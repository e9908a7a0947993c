package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.adapter.runner.alert.AlertManager;
import com.ryuqq.pipeline.adapter.runner.pipeline.PipelineStateMachine;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationOrchestrator;
import com.ryuqq.pipeline.application.orchestrator.PipelineOrchestrator;
import com.ryuqq.pipeline.application.orchestrator.ValidationHandle;
import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.transport.DeliveryPath;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.validation.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * {@link PipelineOrchestrator} 기본 구현.
 *
 * <p>상태 머신, 검증 관리자, 알림 관리자, 전송에 위임하는 얇은 진입점입니다.
 * 웹훅 본문은 직접 전달 경로({@link DeliveryPath#FALLBACK})로 도착한 봉투로 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private final PipelineStateMachine stateMachine;
    private final ValidationOrchestrator validations;
    private final AlertManager alerts;
    private final EventTransport transport;

    public DefaultPipelineOrchestrator(
        PipelineStateMachine stateMachine,
        ValidationOrchestrator validations,
        AlertManager alerts,
        EventTransport transport
    ) {
        if (stateMachine == null) {
            throw new IllegalArgumentException("stateMachine cannot be null");
        }
        if (validations == null) {
            throw new IllegalArgumentException("validations cannot be null");
        }
        if (alerts == null) {
            throw new IllegalArgumentException("alerts cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.stateMachine = stateMachine;
        this.validations = validations;
        this.alerts = alerts;
        this.transport = transport;
    }

    @Override
    public PipelineItem createPipelineItem(String title, String category, String actor) {
        return stateMachine.create(title, category, actor);
    }

    @Override
    public PipelineItem advance(PipelineItemId id, String actor) {
        return stateMachine.advance(id, actor);
    }

    @Override
    public PipelineItem advance(PipelineItemId id, String actor, Stage expectedStage) {
        return stateMachine.advance(id, actor, expectedStage);
    }

    @Override
    public PipelineItem override(PipelineItemId id, String actor, Stage target, String reason) {
        return stateMachine.override(id, actor, target, reason);
    }

    @Override
    public PipelineItem cancel(PipelineItemId id, String actor, String reason) {
        return stateMachine.cancel(id, actor, reason);
    }

    @Override
    public ValidationHandle requestValidation(PipelineItemId id, ValidationType type, Map<String, Object> payload) {
        return stateMachine.validate(id, type, payload, null);
    }

    @Override
    public List<ValidationHandle> requestValidations(PipelineItemId id) {
        return stateMachine.requestValidations(id);
    }

    @Override
    public ValidationResult submitValidationResponse(CorrelationId correlationId, Verdict verdict, String summary) {
        return validations.submitResponse(correlationId, verdict, summary);
    }

    @Override
    public PipelineItem clearRejection(PipelineItemId id, ValidationType type, String actor) {
        return stateMachine.clearRejection(id, type, actor);
    }

    @Override
    public PipelineItem getItem(PipelineItemId id) {
        return stateMachine.get(id);
    }

    @Override
    public List<PipelineItem> listItems(Stage stage) {
        return stateMachine.list(stage);
    }

    @Override
    public List<Alert> listAlerts(AlertQuery query) {
        return alerts.list(query);
    }

    @Override
    public Alert resolveAlert(String alertId, String resolvedBy) {
        return alerts.resolve(alertId, resolvedBy);
    }

    @Override
    public Alert raiseAlert(AlertSeverity severity, String category, String title, String message) {
        return alerts.raise(severity, category, title, message);
    }

    @Override
    public void receiveWebhook(String json) {
        transport.receiveWire(json, DeliveryPath.FALLBACK);
    }
}
