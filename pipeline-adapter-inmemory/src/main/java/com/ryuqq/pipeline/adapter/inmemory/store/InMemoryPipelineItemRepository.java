package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.spi.PipelineItemRepository;
import com.ryuqq.pipeline.core.statemachine.Stage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link PipelineItemRepository} SPI.
 *
 * <p>Snapshots are immutable, so storing the reference is enough; {@link #save(PipelineItem)}
 * replaces the previous snapshot of the same id.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryPipelineItemRepository implements PipelineItemRepository {

    private static final Comparator<PipelineItem> CREATION_ORDER =
        Comparator.comparing(PipelineItem::createdAt).thenComparing(item -> item.id().getValue());

    private final ConcurrentHashMap<PipelineItemId, PipelineItem> items;

    public InMemoryPipelineItemRepository() {
        this.items = new ConcurrentHashMap<>();
    }

    @Override
    public void save(PipelineItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        items.put(item.id(), item);
    }

    @Override
    public Optional<PipelineItem> findById(PipelineItemId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<PipelineItem> list(Stage stage) {
        return items.values().stream()
            .filter(item -> stage == null || item.currentStage() == stage)
            .sorted(CREATION_ORDER)
            .collect(Collectors.toList());
    }

    public int size() {
        return items.size();
    }

    /**
     * Removes every item. Used for test cleanup only.
     */
    public void clear() {
        items.clear();
    }
}
