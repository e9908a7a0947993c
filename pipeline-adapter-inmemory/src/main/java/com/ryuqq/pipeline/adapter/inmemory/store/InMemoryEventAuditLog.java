package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.spi.EventAuditLog;
import com.ryuqq.pipeline.core.transport.EventAuditRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventAuditLog} SPI with a bounded capacity.
 *
 * <p>When the capacity is exceeded the oldest records are dropped.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventAuditLog implements EventAuditLog {

    private static final int DEFAULT_CAPACITY = 10_000;

    private final ConcurrentLinkedDeque<EventAuditRecord> records;
    private final AtomicInteger size;
    private final int capacity;

    public InMemoryEventAuditLog() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity maximum number of retained records
     * @throws IllegalArgumentException if capacity is not positive
     */
    public InMemoryEventAuditLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, but was: " + capacity);
        }
        this.records = new ConcurrentLinkedDeque<>();
        this.size = new AtomicInteger();
        this.capacity = capacity;
    }

    @Override
    public void record(EventAuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        records.addLast(record);
        if (size.incrementAndGet() > capacity && records.pollFirst() != null) {
            size.decrementAndGet();
        }
    }

    @Override
    public List<EventAuditRecord> findByEnvelopeId(String envelopeId) {
        return records.stream()
            .filter(record -> Objects.equals(record.envelopeId(), envelopeId))
            .collect(Collectors.toList());
    }

    @Override
    public List<EventAuditRecord> recent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
        List<EventAuditRecord> result = new ArrayList<>(Math.min(limit, capacity));
        Iterator<EventAuditRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return result;
    }

    public int size() {
        return size.get();
    }

    public void clear() {
        records.clear();
        size.set(0);
    }
}
