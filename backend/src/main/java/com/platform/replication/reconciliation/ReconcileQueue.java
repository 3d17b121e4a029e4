package com.platform.replication.reconciliation;

import com.platform.replication.error.ReconcileTimeoutException;
import com.platform.replication.model.IntentKey;
import com.platform.replication.model.ReplicationIntent;
import com.platform.replication.observability.MetricsRegistry;
import com.platform.replication.observability.StructuredLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Work queue feeding a fixed pool of reconcile workers.
 *
 * A key is never processed by two workers at once. A key added while it is being processed
 * is queued again once the running reconcile finishes, and adding a key that is already
 * waiting is a no-op. Each reconcile is bounded by a timeout, after which the worker thread
 * is interrupted and the key requeued as failed.
 */
@Slf4j
@Component
public class ReconcileQueue {

    private final KeyReconciler reconciler;
    private final IntentStore intentStore;
    private final ControllerHealth controllerHealth;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final int workerCount;
    private final Duration reconcileTimeout;
    private final Duration failureRequeue;

    private final Object lock = new Object();
    private final Deque<IntentKey> queue = new ArrayDeque<>();
    private final Set<IntentKey> dirty = new HashSet<>();
    private final Set<IntentKey> processing = new HashSet<>();

    private ExecutorService workers;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    @Autowired
    public ReconcileQueue(
            KeyReconciler reconciler,
            IntentStore intentStore,
            ControllerHealth controllerHealth,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            @Value("${replication.controller.max-concurrent-reconciles:2}") int maxConcurrentReconciles,
            @Value("${replication.controller.reconcile-timeout-ms:300000}") long reconcileTimeoutMs,
            @Value("${replication.controller.failure-requeue-ms:10000}") long failureRequeueMs) {
        if (maxConcurrentReconciles < 1) {
            throw new IllegalArgumentException("max-concurrent-reconciles must be at least 1");
        }
        this.reconciler = reconciler;
        this.intentStore = intentStore;
        this.controllerHealth = controllerHealth;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.workerCount = maxConcurrentReconciles;
        this.reconcileTimeout = Duration.ofMillis(reconcileTimeoutMs);
        this.failureRequeue = Duration.ofMillis(failureRequeueMs);
        metricsRegistry.registerGauge("replication.queue.depth", this::depth);
    }

    @PostConstruct
    public void start() {
        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread thread = new Thread(r, "reconcile-worker-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "reconcile-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        controllerHealth.setReady(true);
        log.info("Reconcile queue started with {} workers, timeout {}", workerCount, reconcileTimeout);
    }

    @PreDestroy
    public void stop() {
        controllerHealth.setReady(false);
        running = false;
        synchronized (lock) {
            lock.notifyAll();
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Reconcile workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Reconcile queue stopped");
    }

    /**
     * Queue a key for reconciliation.
     */
    public void add(IntentKey key) {
        synchronized (lock) {
            if (!dirty.add(key)) {
                return;
            }
            if (!processing.contains(key)) {
                queue.addLast(key);
                lock.notifyAll();
            }
        }
    }

    /**
     * Queue a key once a delay has passed.
     */
    public void addAfter(IntentKey key, Duration delay) {
        if (!running) {
            return;
        }
        scheduler.schedule(() -> add(key), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    public void onIntentChanged(IntentChangedEvent event) {
        log.debug("Intent {} changed ({})", event.key(), event.type());
        add(event.key());
    }

    /**
     * Queue every stored intent so backend drift is noticed without change events.
     */
    @Scheduled(fixedDelayString = "${replication.controller.resync-interval-ms:300000}",
               initialDelayString = "${replication.controller.resync-interval-ms:300000}")
    public void resyncAll() {
        int count = 0;
        for (ReplicationIntent intent : intentStore.list()) {
            add(intent.key());
            count++;
        }
        log.debug("Periodic resync queued {} intents", count);
    }

    public int depth() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public boolean isProcessing(IntentKey key) {
        synchronized (lock) {
            return processing.contains(key);
        }
    }

    private void workerLoop() {
        while (running) {
            IntentKey key;
            try {
                key = take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            try {
                process(key);
            } finally {
                done(key);
            }
        }
    }

    private IntentKey take() throws InterruptedException {
        synchronized (lock) {
            while (queue.isEmpty() && running) {
                lock.wait();
            }
            if (!running) {
                return null;
            }
            IntentKey key = queue.pollFirst();
            dirty.remove(key);
            processing.add(key);
            return key;
        }
    }

    private void done(IntentKey key) {
        synchronized (lock) {
            processing.remove(key);
            if (dirty.contains(key)) {
                queue.addLast(key);
                lock.notifyAll();
            }
        }
    }

    private void process(IntentKey key) {
        Watchdog watchdog = new Watchdog(Thread.currentThread());
        ScheduledFuture<?> timer = scheduler.schedule(watchdog::fire, reconcileTimeout.toMillis(), TimeUnit.MILLISECONDS);

        ReconcileResult result;
        try {
            result = reconciler.reconcile(key);
        } catch (RuntimeException e) {
            log.error("Reconcile of {} threw unexpectedly", key, e);
            result = ReconcileResult.failed(failureRequeue, String.valueOf(e.getMessage()));
        } finally {
            timer.cancel(false);
            watchdog.finish();
            // drop an interrupt that was aimed at this reconcile
            Thread.interrupted();
        }

        if (watchdog.hasFired()) {
            ReconcileTimeoutException timeout = ReconcileTimeoutException.timedOut(key.toString(), reconcileTimeout);
            log.warn("{}", timeout.describe());
            metricsRegistry.recordReconcileTimeout();
            structuredLogger.reconcile().timedOut(key.toString(), reconcileTimeout.toMillis());
            result = ReconcileResult.failed(failureRequeue, timeout.describe());
        }

        controllerHealth.recordReconcile(result.outcome() == ReconcileResult.Outcome.SUCCEEDED
            || result.outcome() == ReconcileResult.Outcome.GONE);
        if (result.shouldRequeue()) {
            addAfter(key, result.requeueAfter());
        }
    }

    /**
     * Interrupts the worker once, unless the reconcile finished first.
     */
    private static final class Watchdog {
        private final Thread worker;
        private boolean finished;
        private boolean fired;

        Watchdog(Thread worker) {
            this.worker = worker;
        }

        synchronized void fire() {
            if (!finished) {
                fired = true;
                worker.interrupt();
            }
        }

        synchronized void finish() {
            finished = true;
        }

        synchronized boolean hasFired() {
            return fired;
        }
    }
}
