package com.ryuqq.pipeline.core.pipeline;

import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.statemachine.Stage;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 단계별 게이트 검증 정책.
 *
 * <p>단계 S가 검증 V를 요구하면, S를 벗어나는 진행(advance)은 V가 현재 단계에서
 * APPROVED로 해결된 뒤에만 허용됩니다. 한 단계가 여러 검증을 요구하면 모두 승인되어야 합니다.</p>
 *
 * <p><strong>기본 정책:</strong></p>
 * <ul>
 *   <li>SOURCING - MARGIN_CHECK</li>
 *   <li>SAMPLING - CAPACITY_CHECK</li>
 *   <li>PRODUCTION - PRODUCT_APPROVAL</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GatePolicy {

    private final Map<Stage, Set<ValidationType>> requirements;

    private GatePolicy(Map<Stage, Set<ValidationType>> requirements) {
        EnumMap<Stage, Set<ValidationType>> copy = new EnumMap<>(Stage.class);
        requirements.forEach((stage, types) -> {
            if (stage == null || types == null) {
                throw new IllegalArgumentException("gate entries cannot be null");
            }
            if (stage.isTerminal() && !types.isEmpty()) {
                throw new IllegalArgumentException("terminal stage cannot be gated: " + stage);
            }
            if (!types.isEmpty()) {
                copy.put(stage, Collections.unmodifiableSet(EnumSet.copyOf(types)));
            }
        });
        this.requirements = Collections.unmodifiableMap(copy);
    }

    /**
     * @return 기본 게이트 정책
     */
    public static GatePolicy defaults() {
        EnumMap<Stage, Set<ValidationType>> gates = new EnumMap<>(Stage.class);
        gates.put(Stage.SOURCING, EnumSet.of(ValidationType.MARGIN_CHECK));
        gates.put(Stage.SAMPLING, EnumSet.of(ValidationType.CAPACITY_CHECK));
        gates.put(Stage.PRODUCTION, EnumSet.of(ValidationType.PRODUCT_APPROVAL));
        return new GatePolicy(gates);
    }

    /**
     * @return 게이트가 없는 정책
     */
    public static GatePolicy none() {
        return new GatePolicy(Map.of());
    }

    /**
     * @param requirements 단계별 요구 검증
     * @return 지정한 정책
     */
    public static GatePolicy of(Map<Stage, Set<ValidationType>> requirements) {
        if (requirements == null) {
            throw new IllegalArgumentException("requirements cannot be null");
        }
        return new GatePolicy(requirements);
    }

    /**
     * 한 단계의 요구 검증을 교체한 사본 반환.
     *
     * @param stage 단계
     * @param types 요구 검증 (비어 있으면 게이트 제거)
     * @return 새 정책
     */
    public GatePolicy withGate(Stage stage, ValidationType... types) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        EnumMap<Stage, Set<ValidationType>> gates = new EnumMap<>(Stage.class);
        gates.putAll(requirements);
        if (types == null || types.length == 0) {
            gates.remove(stage);
        } else {
            gates.put(stage, EnumSet.copyOf(Arrays.asList(types)));
        }
        return new GatePolicy(gates);
    }

    /**
     * @param stage 단계
     * @return 단계를 벗어나기 위해 필요한 검증 (없으면 빈 집합)
     */
    public Set<ValidationType> requiredFor(Stage stage) {
        return requirements.getOrDefault(stage, Set.of());
    }

    public boolean isGated(Stage stage) {
        return requirements.containsKey(stage);
    }

    @Override
    public String toString() {
        return "GatePolicy" + requirements;
    }
}
