package com.ryuqq.pipeline.adapter.runner.alert;

import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.spi.AlertRepository;
import com.ryuqq.pipeline.core.spi.DeduplicationRegistry;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns notable events into persisted alerts.
 *
 * <p>Each envelope is classified with {@link SeverityTable}; a matching kind becomes an OPEN
 * {@link Alert}. Envelopes are de-duplicated by id, so an event that arrives over both broadcast
 * and direct delivery produces one alert.</p>
 *
 * <p>Alerts are logged at a level matching their severity: CRITICAL as error, HIGH and MEDIUM
 * as warn, LOW as info.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    static final String CONSUMER_NAME = "alert-manager";

    private final AlertRepository repository;
    private final DeduplicationRegistry deduplication;
    private final Clock clock;

    public AlertManager(AlertRepository repository, DeduplicationRegistry deduplication, Clock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (deduplication == null) {
            throw new IllegalArgumentException("deduplication cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.deduplication = deduplication;
        this.clock = clock;
    }

    /**
     * Subscribes to every alert-worthy kind, {@code unclassified} included.
     *
     * @param transport the transport to listen on
     * @return the created subscriptions
     */
    public List<Subscription> register(EventTransport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        List<Subscription> subscriptions = new ArrayList<>();
        for (EventKind kind : SeverityTable.alertKinds()) {
            subscriptions.add(transport.subscribe(kind, this::onEvent));
        }
        return subscriptions;
    }

    /**
     * Classifies an envelope and stores the resulting alert.
     *
     * @param envelope the received envelope
     * @return the created alert, or empty for duplicates and kinds that raise no alert
     */
    public Optional<Alert> onEvent(EventEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (!deduplication.firstSeen(CONSUMER_NAME, envelope.id())) {
            log.debug("Duplicate envelope {} ({}) ignored", envelope.id(), envelope.type());
            return Optional.empty();
        }
        Optional<SeverityTable.Classification> classification = SeverityTable.classify(envelope);
        if (classification.isEmpty()) {
            return Optional.empty();
        }
        SeverityTable.Classification c = classification.get();
        Alert alert = Alert.open(c.severity(), c.category(), c.title(), c.message(), envelope, clock.instant());
        repository.save(alert);
        logAlert(alert);
        return Optional.of(alert);
    }

    /**
     * Creates a manual alert.
     */
    public Alert raise(AlertSeverity severity, String category, String title, String message) {
        Alert alert = Alert.open(severity, category, title, message, null, clock.instant());
        repository.save(alert);
        logAlert(alert);
        return alert;
    }

    /**
     * Marks an open alert resolved.
     *
     * @throws NotFoundException if no alert has the id
     * @throws AlreadyResolvedException if the alert is already resolved
     */
    public synchronized Alert resolve(String alertId, String resolvedBy) {
        if (alertId == null || alertId.isBlank()) {
            throw new IllegalArgumentException("alertId cannot be null or blank");
        }
        Alert alert = repository.findById(alertId)
            .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
        Alert resolved = alert.resolve(resolvedBy, clock.instant());
        repository.save(resolved);
        log.info("Alert {} ({}) resolved by {}", alertId, alert.title(), resolvedBy);
        return resolved;
    }

    /**
     * @throws NotFoundException if no alert has the id
     */
    public Alert get(String alertId) {
        return repository.findById(alertId)
            .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
    }

    public List<Alert> list(AlertQuery query) {
        return repository.list(query == null ? new AlertQuery() : query);
    }

    private void logAlert(Alert alert) {
        switch (alert.severity()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}: {}", alert.category(), alert.title(), alert.message());
            case HIGH -> log.warn("[ALERT-HIGH] {} - {}: {}", alert.category(), alert.title(), alert.message());
            case MEDIUM -> log.warn("[ALERT-MEDIUM] {} - {}: {}", alert.category(), alert.title(), alert.message());
            case LOW -> log.info("[ALERT-LOW] {} - {}: {}", alert.category(), alert.title(), alert.message());
        }
    }
}
