package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.adapter.runner.alert.AlertManager;
import com.ryuqq.pipeline.adapter.runner.pipeline.PipelineStateMachine;
import com.ryuqq.pipeline.adapter.runner.transport.FallbackEventTransport;
import com.ryuqq.pipeline.adapter.runner.transport.HttpDirectDelivery;
import com.ryuqq.pipeline.adapter.runner.transport.ModuleEndpoints;
import com.ryuqq.pipeline.adapter.runner.transport.TransportConfig;
import com.ryuqq.pipeline.adapter.runner.validation.ReaperConfig;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationConfig;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationOrchestrator;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationTimeoutReaper;
import com.ryuqq.pipeline.application.orchestrator.PipelineOrchestrator;
import com.ryuqq.pipeline.application.runtime.ManagedLifecycle;
import com.ryuqq.pipeline.core.contract.EnvelopeCodec;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.pipeline.GatePolicy;
import com.ryuqq.pipeline.core.spi.AlertRepository;
import com.ryuqq.pipeline.core.spi.BroadcastChannel;
import com.ryuqq.pipeline.core.spi.DeduplicationRegistry;
import com.ryuqq.pipeline.core.spi.DirectDelivery;
import com.ryuqq.pipeline.core.spi.EventAuditLog;
import com.ryuqq.pipeline.core.spi.PipelineItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 오케스트레이터 구성 요소 조립 및 수명 주기 관리.
 *
 * <p><strong>시작 순서:</strong> 검증 관리자(응답 구독) → 알림 구독 → 전송 → 기한 스캐너.
 * 구독이 모두 등록된 뒤 전송이 채널에 붙으므로 시작 직후 도착한 이벤트도 유실되지 않습니다.</p>
 *
 * <p><strong>종료 순서:</strong> 시작의 역순. 전송은 토픽 대기열을 모두 비운 뒤 종료합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * try (PipelineRuntime runtime = PipelineRuntime.builder(ModuleName.DESIGN)
 *         .channel(channel)
 *         .endpoints(ModuleEndpoints.fromEnvironment())
 *         .itemRepository(items)
 *         .alertRepository(alerts)
 *         .deduplication(dedup)
 *         .build()) {
 *     runtime.start();
 *     PipelineOrchestrator orchestrator = runtime.orchestrator();
 *     ...
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PipelineRuntime implements ManagedLifecycle, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineRuntime.class);

    private final ModuleName localModule;
    private final FallbackEventTransport transport;
    private final ValidationOrchestrator validations;
    private final ValidationTimeoutReaper reaper;
    private final PipelineStateMachine stateMachine;
    private final AlertManager alerts;
    private final DefaultPipelineOrchestrator orchestrator;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private PipelineRuntime(Builder builder) {
        this.localModule = builder.localModule;
        this.transport = new FallbackEventTransport(
            builder.localModule,
            builder.channel,
            builder.directDelivery,
            builder.endpoints,
            builder.codec,
            builder.transportConfig,
            builder.auditLog,
            builder.clock
        );
        this.validations = new ValidationOrchestrator(
            transport, builder.deduplication, builder.validationConfig, builder.clock);
        this.reaper = new ValidationTimeoutReaper(validations, builder.reaperConfig, builder.clock);
        this.stateMachine = new PipelineStateMachine(
            builder.itemRepository, validations, transport, builder.gatePolicy, builder.clock);
        this.alerts = new AlertManager(builder.alertRepository, builder.deduplication, builder.clock);
        this.orchestrator = new DefaultPipelineOrchestrator(stateMachine, validations, alerts, transport);

        validations.addResultListener(stateMachine::recordValidationResult);
    }

    public static Builder builder(ModuleName localModule) {
        return new Builder(localModule);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("PipelineRuntime already started");
        }
        validations.start();
        alerts.register(transport);
        transport.start();
        reaper.start();
        log.info("Pipeline runtime started for module {}", localModule.wireName());
    }

    @Override
    public void stop() {
        if (!started.get()) {
            return;
        }
        reaper.stop();
        validations.stop();
        transport.stop();
        log.info("Pipeline runtime stopped for module {}", localModule.wireName());
    }

    @Override
    public boolean isRunning() {
        return transport.isRunning();
    }

    @Override
    public void close() {
        stop();
    }

    public PipelineOrchestrator orchestrator() {
        return orchestrator;
    }

    public FallbackEventTransport transport() {
        return transport;
    }

    public ValidationOrchestrator validations() {
        return validations;
    }

    public ValidationTimeoutReaper reaper() {
        return reaper;
    }

    public PipelineStateMachine stateMachine() {
        return stateMachine;
    }

    public AlertManager alerts() {
        return alerts;
    }

    /**
     * {@link PipelineRuntime} 빌더.
     *
     * <p>채널과 저장소 세 가지(항목, 알림, 중복 제거)는 필수입니다. 나머지는 기본값을 사용합니다:
     * HTTP 직접 전달, 빈 엔드포인트 표, 기본 설정, 기본 게이트 정책, UTC 시스템 시계.</p>
     */
    public static final class Builder {

        private final ModuleName localModule;
        private BroadcastChannel channel;
        private DirectDelivery directDelivery;
        private ModuleEndpoints endpoints = ModuleEndpoints.empty();
        private EnvelopeCodec codec;
        private TransportConfig transportConfig = new TransportConfig();
        private ValidationConfig validationConfig = new ValidationConfig();
        private ReaperConfig reaperConfig = new ReaperConfig();
        private GatePolicy gatePolicy = GatePolicy.defaults();
        private PipelineItemRepository itemRepository;
        private AlertRepository alertRepository;
        private DeduplicationRegistry deduplication;
        private EventAuditLog auditLog;
        private Clock clock = Clock.systemUTC();

        private Builder(ModuleName localModule) {
            if (localModule == null) {
                throw new IllegalArgumentException("localModule cannot be null");
            }
            this.localModule = localModule;
        }

        public Builder channel(BroadcastChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder directDelivery(DirectDelivery directDelivery) {
            this.directDelivery = directDelivery;
            return this;
        }

        public Builder endpoints(ModuleEndpoints endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder transportConfig(TransportConfig transportConfig) {
            this.transportConfig = transportConfig;
            return this;
        }

        public Builder validationConfig(ValidationConfig validationConfig) {
            this.validationConfig = validationConfig;
            return this;
        }

        public Builder reaperConfig(ReaperConfig reaperConfig) {
            this.reaperConfig = reaperConfig;
            return this;
        }

        public Builder gatePolicy(GatePolicy gatePolicy) {
            this.gatePolicy = gatePolicy;
            return this;
        }

        public Builder itemRepository(PipelineItemRepository itemRepository) {
            this.itemRepository = itemRepository;
            return this;
        }

        public Builder alertRepository(AlertRepository alertRepository) {
            this.alertRepository = alertRepository;
            return this;
        }

        public Builder deduplication(DeduplicationRegistry deduplication) {
            this.deduplication = deduplication;
            return this;
        }

        /**
         * @param auditLog 감사 로그 (선택)
         */
        public Builder auditLog(EventAuditLog auditLog) {
            this.auditLog = auditLog;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @return 조립된 런타임 (시작 전)
         * @throws IllegalArgumentException 필수 구성 요소가 없는 경우
         */
        public PipelineRuntime build() {
            if (channel == null) {
                throw new IllegalArgumentException("channel cannot be null");
            }
            if (itemRepository == null) {
                throw new IllegalArgumentException("itemRepository cannot be null");
            }
            if (alertRepository == null) {
                throw new IllegalArgumentException("alertRepository cannot be null");
            }
            if (deduplication == null) {
                throw new IllegalArgumentException("deduplication cannot be null");
            }
            if (directDelivery == null) {
                directDelivery = new HttpDirectDelivery();
            }
            if (codec == null) {
                codec = new EnvelopeCodec();
            }
            return new PipelineRuntime(this);
        }
    }
}
