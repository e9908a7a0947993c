package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.statemachine.Stage;

import java.util.List;
import java.util.Optional;

/**
 * 파이프라인 아이템 저장소 SPI.
 *
 * <p>상태 머신은 아이템 잠금을 잡은 상태에서만 {@link #save(PipelineItem)}를 호출하므로,
 * 구현은 같은 아이템에 대한 동시 쓰기를 고려하지 않아도 됩니다. 아이템은 삭제되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PipelineItemRepository {

    /**
     * 스냅샷 저장 (같은 id는 덮어씀).
     *
     * @param item 저장할 스냅샷
     * @throws IllegalArgumentException item이 null인 경우
     */
    void save(PipelineItem item);

    /**
     * @param id 아이템 식별자
     * @return 스냅샷, 없으면 empty
     */
    Optional<PipelineItem> findById(PipelineItemId id);

    /**
     * 생성 순서대로 목록 조회.
     *
     * @param stage 단계 필터 (null이면 전체)
     * @return 아이템 목록
     */
    List<PipelineItem> list(Stage stage);
}
