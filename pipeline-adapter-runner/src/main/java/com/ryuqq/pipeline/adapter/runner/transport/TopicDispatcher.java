package com.ryuqq.pipeline.adapter.runner.transport;

import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.transport.DeliveryPath;
import com.ryuqq.pipeline.core.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 토픽 단위 순차 디스패처.
 *
 * <p>토픽마다 단일 스레드 실행기를 두어, 같은 토픽의 봉투는 받은 순서대로 한 번에 하나씩
 * 핸들러에 전달됩니다. 서로 다른 토픽은 서로를 막지 않습니다.</p>
 *
 * <p>핸들러 예외는 로그로 남기고 다음 구독자/다음 봉투 처리를 계속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TopicDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TopicDispatcher.class);

    private final String topic;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final ExecutorService worker;
    private volatile Thread workerThread;

    TopicDispatcher(String topic) {
        this.topic = topic;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-topic-" + topic);
            thread.setDaemon(true);
            workerThread = thread;
            return thread;
        });
    }

    String topic() {
        return topic;
    }

    void add(Subscription subscription) {
        subscriptions.add(subscription);
    }

    /**
     * 구독 해제.
     *
     * <p>이미 대기열에 있는 봉투가 모두 처리된 뒤에 제거되며, 해제 이후의 봉투는 전달되지 않습니다.</p>
     */
    boolean remove(Subscription subscription) {
        if (Thread.currentThread() == workerThread) {
            return subscriptions.remove(subscription);
        }
        Future<Boolean> removal;
        try {
            removal = worker.submit(() -> subscriptions.remove(subscription));
        } catch (RejectedExecutionException e) {
            return subscriptions.remove(subscription);
        }
        try {
            return removal.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Unsubscribe interrupted for topic " + topic, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unsubscribe failed for topic " + topic, e.getCause());
        }
    }

    boolean hasSubscribers() {
        return !subscriptions.isEmpty();
    }

    /**
     * 경로를 받아들이는 구독자가 하나라도 있는지 확인.
     */
    boolean accepts(DeliveryPath path) {
        for (Subscription subscription : subscriptions) {
            if (subscription.mode().accepts(path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 봉투를 토픽 대기열에 추가.
     *
     * @param envelope 전달할 봉투
     * @param path 봉투가 도착한 경로
     */
    void dispatch(EventEnvelope envelope, DeliveryPath path) {
        try {
            worker.execute(() -> deliver(envelope, path));
        } catch (RejectedExecutionException e) {
            log.warn("Topic {} stopped, dropping envelope {} ({})", topic, envelope.id(), envelope.type());
        }
    }

    private void deliver(EventEnvelope envelope, DeliveryPath path) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.mode().accepts(path)) {
                continue;
            }
            try {
                subscription.handler().handle(envelope);
            } catch (RuntimeException e) {
                log.error("Handler {} failed on envelope {} ({}): {}",
                    subscription.id(), envelope.id(), envelope.type(), e.getMessage(), e);
            }
        }
    }

    /**
     * 대기열을 비우고 종료.
     *
     * @param timeoutMs 최대 대기 시간
     * @return 제한 시간 내 모두 처리되었으면 true
     */
    boolean drain(long timeoutMs) {
        worker.shutdown();
        try {
            if (worker.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
            List<Runnable> dropped = worker.shutdownNow();
            log.warn("Topic {} did not drain within {}ms, {} envelopes dropped", topic, timeoutMs, dropped.size());
            return false;
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
