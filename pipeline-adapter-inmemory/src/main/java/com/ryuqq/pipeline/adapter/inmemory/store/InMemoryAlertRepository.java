package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.spi.AlertRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AlertRepository} SPI.
 *
 * <p>Listing is newest first by {@code createdAt}; alerts created in the same instant are
 * ordered by insertion, newest first.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAlertRepository implements AlertRepository {

    private static final Comparator<Stored> NEWEST_FIRST =
        Comparator.comparing((Stored stored) -> stored.alert().createdAt())
            .thenComparingLong(Stored::sequence)
            .reversed();

    private final ConcurrentHashMap<String, Stored> alerts;
    private final AtomicLong sequence;

    public InMemoryAlertRepository() {
        this.alerts = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Overwriting an alert keeps its original insertion position.</p>
     */
    @Override
    public void save(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("alert cannot be null");
        }
        alerts.compute(alert.id(), (id, existing) -> existing == null
            ? new Stored(sequence.incrementAndGet(), alert)
            : new Stored(existing.sequence(), alert));
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        if (alertId == null) {
            throw new IllegalArgumentException("alertId cannot be null");
        }
        Stored stored = alerts.get(alertId);
        return stored == null ? Optional.empty() : Optional.of(stored.alert());
    }

    @Override
    public List<Alert> list(AlertQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        return alerts.values().stream()
            .filter(stored -> query.matches(stored.alert()))
            .sorted(NEWEST_FIRST)
            .limit(query.limit())
            .map(Stored::alert)
            .collect(Collectors.toList());
    }

    public int size() {
        return alerts.size();
    }

    public void clear() {
        alerts.clear();
    }

    private record Stored(long sequence, Alert alert) {
    }
}
