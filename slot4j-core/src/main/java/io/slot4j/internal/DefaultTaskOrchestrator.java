package io.slot4j.internal;

import io.slot4j.AccountDirectory;
import io.slot4j.AlertSink;
import io.slot4j.PipelineService;
import io.slot4j.PublishService;
import io.slot4j.SlotAllocator;
import io.slot4j.TaskOrchestrator;
import io.slot4j.core.Alert;
import io.slot4j.core.ExecutionTask;
import io.slot4j.core.NotFoundException;
import io.slot4j.core.PipelineRegistry;
import io.slot4j.core.PipelineResult;
import io.slot4j.core.PipelineStatus;
import io.slot4j.core.PublishResult;
import io.slot4j.core.PublishStatus;
import io.slot4j.core.RetryAnchor;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.Slot4jException;
import io.slot4j.core.SlotStatus;
import io.slot4j.core.StageExecutionException.Stage;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.ValidationException;
import io.slot4j.core.spi.ScheduleConfigStore;
import io.slot4j.core.spi.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Control loop that claims due slots, runs produce and publish on two bounded pools and retries failures.
 *
 * <p>Threading model:
 * <ul>
 *   <li>Task state is only touched while holding {@code stateLock}: by the control loop and by {@link #cancelTask}.</li>
 *   <li>Workers never see live tasks. They post a {@link StageOutcome} to {@code completions}; the next tick applies it.</li>
 *   <li>Every attempt carries a token. Outcomes of cancelled or timed-out attempts are stale and dropped.</li>
 * </ul>
 */
public class DefaultTaskOrchestrator implements TaskOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskOrchestrator.class);

    private static final Comparator<ExecutionTask> ADMISSION_ORDER = Comparator
            .comparingInt(ExecutionTask::getPriority).reversed()
            .thenComparing(ExecutionTask::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ScheduleConfigStore configStore;
    private final SlotAllocator allocator;
    private final TaskStore taskStore;
    private final PipelineRegistry pipelines;
    private final PublishService publisher;
    private final AccountDirectory accounts;
    private final AlertSink alertSink;
    private final OrchestratorOptions options;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, ExecutionTask> tasks = new LinkedHashMap<>();
    private final Map<String, InFlight> inFlight = new HashMap<>();
    private final ConcurrentLinkedQueue<StageOutcome> completions = new ConcurrentLinkedQueue<>();
    private final Semaphore wakeSignal = new Semaphore(0);
    private final AtomicLong attemptSeq = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService producePool;
    private ExecutorService publishPool;
    private Thread pollerThread;
    private int systemErrorCount = 0;
    private LocalDate lastSlotCleanup;

    // startedAt stays null while the unit waits for a pool thread
    private record InFlight(Stage stage, long token, Future<?> future, AtomicReference<Instant> startedAt) {
    }

    public DefaultTaskOrchestrator(ScheduleConfigStore configStore,
                                   SlotAllocator allocator,
                                   TaskStore taskStore,
                                   PipelineRegistry pipelines,
                                   PublishService publisher,
                                   AccountDirectory accounts,
                                   AlertSink alertSink,
                                   OrchestratorOptions options,
                                   Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.pipelines = Objects.requireNonNull(pipelines, "pipelines must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.accounts = Objects.requireNonNull(accounts, "accounts must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Reload unfinished tasks, then start the pools and the control loop. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration every = Objects.requireNonNull(options.processEvery(), "processEvery must not be null");
        if (every.isZero() || every.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("slot4j.orchestrator.processEvery must be a positive duration");
        }
        if (options.produceConcurrency() < 1 || options.publishConcurrency() < 1) {
            started.set(false);
            throw new IllegalArgumentException("slot4j.orchestrator concurrency must be at least 1");
        }

        log.info("Orchestrator starting with processEvery={}, produceConcurrency={}, publishConcurrency={}, maxRetries={}, retryDelay={}, retryAnchor={}, stageTimeout={}",
                every,
                options.produceConcurrency(),
                options.publishConcurrency(),
                options.maxRetries(),
                options.retryDelay(),
                options.retryAnchor(),
                options.stageTimeout());

        startWorkers();
        reloadUnfinished();

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("slot4j.orchestrator");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Orchestrator started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Orchestrator stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        stopWorkers();

        stateLock.lock();
        try {
            inFlight.clear();
            completions.clear();
        } finally {
            stateLock.unlock();
        }
        wakeSignal.drainPermits();
        log.info("Orchestrator stopped successfully.");
    }

    /**
     * Worker pools only; {@link #start()} adds the control loop on top.
     */
    void startWorkers() {
        if (producePool == null) {
            producePool = Executors.newFixedThreadPool(options.produceConcurrency(), namedDaemon("slot4j.produce"));
        }
        if (publishPool == null) {
            publishPool = Executors.newFixedThreadPool(options.publishConcurrency(), namedDaemon("slot4j.publish"));
        }
    }

    void stopWorkers() {
        shutdown(producePool);
        shutdown(publishPool);
        producePool = null;
        publishPool = null;
    }

    @Override
    public void tick() {
        stateLock.lock();
        try {
            Instant now = clock.instant();
            drainCompletions(now);
            enforceStageTimeout(now);
            claimDueSlots(now);
            admitProduce(now);
            admitPublish(now);
            sweepRetries(now);
            prune(now);
            cleanupSlots(now);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public ExecutionTask trigger(String configId, String accountId) {
        ScheduleConfig config = configStore.findById(configId)
                .orElseThrow(() -> new NotFoundException("config", configId));
        Instant now = clock.instant();

        String account = accountId;
        if (account == null) {
            account = allocator.allocateAccount(configId, now)
                    .or(() -> accounts.listActiveAccounts(config.getGroupId()).stream().findFirst())
                    .orElseThrow(() -> new ValidationException("No account available for configId=" + configId));
        }

        stateLock.lock();
        try {
            ExecutionTask task = newTask(config, account, null, now);
            taskStore.save(task);
            tasks.put(task.getTaskId(), task);
            log.info("Task triggered manually taskId={} configId={} accountId={}", task.getTaskId(), configId, account);
            wakeSignal.release();
            return task.copy();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public Optional<ExecutionTask> getTaskStatus(String taskId) {
        stateLock.lock();
        try {
            ExecutionTask t = tasks.get(taskId);
            if (t != null) {
                return Optional.of(t.copy());
            }
        } finally {
            stateLock.unlock();
        }
        return taskStore.findById(taskId);
    }

    @Override
    public boolean cancelTask(String taskId) {
        stateLock.lock();
        try {
            ExecutionTask task = tasks.get(taskId);
            if (task == null) {
                return false;
            }
            PipelineStatus ps = task.getPipelineStatus();
            if (ps != PipelineStatus.PENDING && ps != PipelineStatus.RUNNING) {
                return false;
            }

            InFlight running = inFlight.remove(taskId);
            if (running != null) {
                running.future().cancel(true);
            }

            task.setPipelineStatus(PipelineStatus.CANCELLED);
            task.setPublishStatus(PublishStatus.CANCELLED);
            task.setCompletedAt(clock.instant());
            moveSlot(task, SlotStatus.SKIPPED);
            persist(task);

            log.info("Task cancelled taskId={} configId={} wasRunning={}", taskId, task.getConfigId(), running != null);
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<ExecutionTask> listTasks() {
        stateLock.lock();
        try {
            return tasks.values().stream()
                    .sorted(Comparator.comparing(ExecutionTask::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                    .map(ExecutionTask::copy)
                    .toList();
        } finally {
            stateLock.unlock();
        }
    }

    void reloadUnfinished() {
        stateLock.lock();
        try {
            int reloaded = 0;
            for (ExecutionTask t : taskStore.findUnfinished()) {
                if (tasks.containsKey(t.getTaskId())) {
                    continue;
                }
                boolean reset = false;
                if (t.getPipelineStatus() == PipelineStatus.RUNNING) {
                    t.setPipelineStatus(PipelineStatus.PENDING);
                    reset = true;
                }
                if (t.getPublishStatus() == PublishStatus.PUBLISHING) {
                    t.setPublishStatus(PublishStatus.SCHEDULED);
                    reset = true;
                }
                if (reset) {
                    persist(t);
                }
                tasks.put(t.getTaskId(), t);
                reloaded++;
            }
            if (reloaded > 0) {
                log.info("Orchestrator reloaded unfinished tasks count={}", reloaded);
            }
        } finally {
            stateLock.unlock();
        }
    }

    private void drainCompletions(Instant now) {
        StageOutcome o;
        while ((o = completions.poll()) != null) {
            InFlight current = inFlight.get(o.taskId());
            if (current == null || current.token() != o.token()) {
                log.debug("Stale stage outcome dropped taskId={} stage={} token={}", o.taskId(), o.stage(), o.token());
                continue;
            }
            inFlight.remove(o.taskId());

            ExecutionTask task = tasks.get(o.taskId());
            if (task == null || task.isCancelled()) {
                continue;
            }
            if (o.success()) {
                applySuccess(task, o, now);
            } else {
                applyFailure(task, o.stage(), o.error(), now);
            }
        }
    }

    private void applySuccess(ExecutionTask task, StageOutcome o, Instant now) {
        if (o.stage() == Stage.PRODUCE) {
            task.setPipelineStatus(PipelineStatus.COMPLETED);
            task.setPipelineResult(new LinkedHashMap<>(o.result()));
            task.setPublishStatus(PublishStatus.SCHEDULED);
            task.setErrorMessage(null);
            log.info("Task produced taskId={} configId={} accountId={}", task.getTaskId(), task.getConfigId(), task.getAccountId());
        } else {
            task.setPublishStatus(PublishStatus.PUBLISHED);
            task.setPublishResult(new LinkedHashMap<>(o.result()));
            task.setErrorMessage(null);
            task.setCompletedAt(now);
            moveSlot(task, SlotStatus.COMPLETED);
            log.info("Task published taskId={} configId={} accountId={}", task.getTaskId(), task.getConfigId(), task.getAccountId());
        }
        persist(task);
    }

    private void applyFailure(ExecutionTask task, Stage stage, String error, Instant now) {
        if (stage == Stage.PRODUCE) {
            task.setPipelineStatus(PipelineStatus.FAILED);
        } else {
            task.setPublishStatus(PublishStatus.FAILED);
            moveSlot(task, SlotStatus.FAILED);
        }
        task.setRetryCount(task.getRetryCount() + 1);
        task.setErrorMessage(error);
        task.setFailedAt(now);

        boolean exhausted = task.getRetryCount() > options.maxRetries();
        if (exhausted) {
            task.setCompletedAt(now);
            if (stage == Stage.PRODUCE) {
                moveSlot(task, SlotStatus.FAILED);
            }
        }
        persist(task);

        log.error("Task {} failed taskId={} configId={} accountId={} retryCount={} permanent={} msg={}",
                stage.name().toLowerCase(Locale.ROOT), task.getTaskId(), task.getConfigId(), task.getAccountId(),
                task.getRetryCount(), exhausted, error);
        sendAlert(task, (stage == Stage.PRODUCE ? "Produce" : "Publish") + " failed: " + error, now);
    }

    private void enforceStageTimeout(Instant now) {
        Duration timeout = options.stageTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        Iterator<Map.Entry<String, InFlight>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, InFlight> e = it.next();
            InFlight f = e.getValue();
            Instant started = f.startedAt().get();
            if (started == null || now.isBefore(started.plus(timeout))) {
                continue;
            }
            it.remove();
            f.future().cancel(true);

            ExecutionTask task = tasks.get(e.getKey());
            if (task != null && !task.isCancelled()) {
                applyFailure(task, f.stage(), "timed out after " + timeout, now);
            }
        }
    }

    private void claimDueSlots(Instant now) {
        Instant horizon = now.plus(options.leadTime());
        for (ScheduleConfig config : configStore.findActive()) {
            try {
                claimForConfig(config, now, horizon);
            } catch (Exception e) {
                log.error("Slot claim failed configId={} msg={}", config.getConfigId(), e.getMessage(), e);
            }
        }
    }

    private void claimForConfig(ScheduleConfig config, Instant now, Instant horizon) {
        Instant from = now.minus(options.leadTime());
        allocator.skipMissedSlots(config.getConfigId(), from);
        while (true) {
            Optional<TimeSlot> next = allocator.getNextSlot(config.getConfigId(), from);
            if (next.isEmpty()) {
                return;
            }
            TimeSlot slot = next.get();
            Instant slotTime = slot.toInstant(allocator.zone());
            if (slotTime.isAfter(horizon)) {
                return;
            }

            ExecutionTask task = newTask(config, slot.getAccountId(), slot.getSlotId(), now);
            task.setScheduledAt(slotTime);
            allocator.updateSlotStatus(slot.getSlotId(), SlotStatus.SCHEDULED, task.getTaskId());
            taskStore.save(task);
            tasks.put(task.getTaskId(), task);

            log.info("Slot claimed slotId={} taskId={} configId={} accountId={} at={}",
                    slot.getSlotId(), task.getTaskId(), config.getConfigId(), slot.getAccountId(), slot.localDateTime());
        }
    }

    private void admitProduce(Instant now) {
        if (producePool == null) {
            return;
        }
        long running = tasks.values().stream().filter(t -> t.getPipelineStatus() == PipelineStatus.RUNNING).count();
        long capacity = options.produceConcurrency() - running;
        if (capacity <= 0) {
            return;
        }

        List<ExecutionTask> admitted = tasks.values().stream()
                .filter(t -> t.getPipelineStatus() == PipelineStatus.PENDING)
                .sorted(ADMISSION_ORDER)
                .limit(capacity)
                .toList();

        for (ExecutionTask task : admitted) {
            task.setPipelineStatus(PipelineStatus.RUNNING);
            task.setStartedAt(now);
            persist(task);
            submitProduce(task);
        }
    }

    private void admitPublish(Instant now) {
        if (publishPool == null) {
            return;
        }
        long publishing = tasks.values().stream().filter(t -> t.getPublishStatus() == PublishStatus.PUBLISHING).count();
        long capacity = options.publishConcurrency() - publishing;
        if (capacity <= 0) {
            return;
        }

        List<ExecutionTask> admitted = tasks.values().stream()
                .filter(t -> t.getPipelineStatus() == PipelineStatus.COMPLETED)
                .filter(t -> t.getPublishStatus() == PublishStatus.PENDING || t.getPublishStatus() == PublishStatus.SCHEDULED)
                .sorted(ADMISSION_ORDER)
                .limit(capacity)
                .toList();

        for (ExecutionTask task : admitted) {
            task.setPublishStatus(PublishStatus.PUBLISHING);
            persist(task);
            submitPublish(task);
        }
    }

    private void submitProduce(ExecutionTask task) {
        String taskId = task.getTaskId();
        String pipelineId = task.getPipelineId();
        Map<String, Object> config = task.getPipelineConfig() == null ? Map.of() : new LinkedHashMap<>(task.getPipelineConfig());
        long token = attemptSeq.incrementAndGet();
        AtomicReference<Instant> started = new AtomicReference<>();

        Future<?> f = producePool.submit(() -> {
            started.set(clock.instant());
            StageOutcome outcome;
            try {
                PipelineService pipeline = pipelines.getRequired(pipelineId);
                log.debug("Produce started taskId={} pipelineId={}", taskId, pipelineId);
                PipelineResult r = pipeline.execute(config);
                outcome = r != null && r.success()
                        ? StageOutcome.succeeded(taskId, Stage.PRODUCE, token, r.artifact())
                        : StageOutcome.failed(taskId, Stage.PRODUCE, token, r == null ? "pipeline returned no result" : r.error());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = StageOutcome.failed(taskId, Stage.PRODUCE, token, "interrupted");
            } catch (Exception e) {
                outcome = StageOutcome.failed(taskId, Stage.PRODUCE, token, describe(e));
            }
            post(outcome);
        });
        inFlight.put(taskId, new InFlight(Stage.PRODUCE, token, f, started));
    }

    private void submitPublish(ExecutionTask task) {
        String taskId = task.getTaskId();
        String accountId = task.getAccountId();
        Map<String, Object> artifact = task.getPipelineResult() == null ? Map.of() : new LinkedHashMap<>(task.getPipelineResult());
        long token = attemptSeq.incrementAndGet();
        AtomicReference<Instant> started = new AtomicReference<>();

        Future<?> f = publishPool.submit(() -> {
            started.set(clock.instant());
            StageOutcome outcome;
            try {
                log.debug("Publish started taskId={} accountId={}", taskId, accountId);
                PublishResult r = publisher.publish(accountId, artifact);
                outcome = r != null && r.success()
                        ? StageOutcome.succeeded(taskId, Stage.PUBLISH, token, r.result())
                        : StageOutcome.failed(taskId, Stage.PUBLISH, token, r == null ? "publisher returned no result" : r.error());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = StageOutcome.failed(taskId, Stage.PUBLISH, token, "interrupted");
            } catch (Exception e) {
                outcome = StageOutcome.failed(taskId, Stage.PUBLISH, token, describe(e));
            }
            post(outcome);
        });
        inFlight.put(taskId, new InFlight(Stage.PUBLISH, token, f, started));
    }

    private void post(StageOutcome outcome) {
        completions.offer(outcome);
        wakeSignal.release();
    }

    private void sweepRetries(Instant now) {
        for (ExecutionTask task : tasks.values()) {
            if (!isRetryEligible(task, now)) {
                continue;
            }
            if (task.getPipelineStatus() == PipelineStatus.FAILED) {
                task.setPipelineStatus(PipelineStatus.PENDING);
            } else {
                task.setPublishStatus(PublishStatus.SCHEDULED);
                moveSlot(task, SlotStatus.SCHEDULED);
            }
            task.setErrorMessage(null);
            persist(task);
            log.info("Task retry scheduled taskId={} attempt={} maxRetries={}", task.getTaskId(), task.getRetryCount(), options.maxRetries());
        }
    }

    boolean isRetryEligible(ExecutionTask task, Instant now) {
        if (!task.hasFailedStage() || task.isTerminal(options.maxRetries()) || task.getCompletedAt() != null) {
            return false;
        }
        if (task.getRetryCount() < 1) {
            return false;
        }
        Instant anchor = options.retryAnchor() == RetryAnchor.FAILED_AT ? task.getFailedAt() : task.getStartedAt();
        if (anchor == null) {
            anchor = task.getFailedAt();
        }
        return anchor == null || !now.isBefore(anchor.plus(options.retryDelay()));
    }

    private void prune(Instant now) {
        Iterator<ExecutionTask> it = tasks.values().iterator();
        int pruned = 0;
        while (it.hasNext()) {
            ExecutionTask t = it.next();
            if (t.getCompletedAt() != null
                    && !inFlight.containsKey(t.getTaskId())
                    && !now.isBefore(t.getCompletedAt().plus(options.taskRetention()))) {
                it.remove();
                pruned++;
            }
        }
        if (pruned > 0) {
            log.debug("Pruned finished tasks count={}", pruned);
        }
    }

    private void cleanupSlots(Instant now) {
        if (options.slotRetentionDays() <= 0) {
            return;
        }
        try {
            LocalDate today = LocalDate.ofInstant(now, allocator.zone());
            if (today.equals(lastSlotCleanup)) {
                return;
            }
            lastSlotCleanup = today;
            allocator.cleanup(options.slotRetentionDays());
        } catch (Exception e) {
            log.error("Slot cleanup failed msg={}", e.getMessage(), e);
        }
    }

    private ExecutionTask newTask(ScheduleConfig config, String accountId, String slotId, Instant now) {
        ExecutionTask task = new ExecutionTask();
        task.setTaskId("task_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        task.setConfigId(config.getConfigId());
        task.setGroupId(config.getGroupId());
        task.setAccountId(accountId);
        task.setPipelineId(config.getPipelineId());
        task.setSlotId(slotId);
        task.setPipelineConfig(new LinkedHashMap<>(config.getPipelineConfig()));
        task.setPriority(config.getPriority());
        task.setCreatedAt(now);
        task.setScheduledAt(now);
        return task;
    }

    private void moveSlot(ExecutionTask task, SlotStatus status) {
        if (task.getSlotId() == null) {
            return;
        }
        try {
            allocator.updateSlotStatus(task.getSlotId(), status, task.getTaskId());
        } catch (Slot4jException e) {
            log.warn("Slot status update skipped slotId={} taskId={} status={} msg={}",
                    task.getSlotId(), task.getTaskId(), status, e.getMessage());
        }
    }

    private void persist(ExecutionTask task) {
        try {
            taskStore.save(task);
        } catch (Exception e) {
            log.error("Task save failed taskId={} msg={}", task.getTaskId(), e.getMessage(), e);
        }
    }

    private void sendAlert(ExecutionTask task, String message, Instant now) {
        try {
            alertSink.notify(new Alert(task.getTaskId(), task.getAccountId(), message, now));
        } catch (Exception e) {
            log.error("Alert dispatch failed taskId={} msg={}", task.getTaskId(), e.getMessage(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("slot4j orchestrator tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(errorBackoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                // a finished worker wakes the loop early so its outcome is applied promptly
                if (wakeSignal.tryAcquire(options.processEvery().toMillis(), TimeUnit.MILLISECONDS)) {
                    wakeSignal.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // errorBackoff doubling per consecutive failure, capped at 60s.
    private Duration errorBackoff(int failCount) {
        long base = Math.max(1, options.errorBackoff().toMillis());
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        return Duration.ofMillis(Math.min(base << exp, 60_000L));
    }

    private void shutdown(ExecutorService pool) {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory namedDaemon(String name) {
        AtomicLong seq = new AtomicLong();
        return r -> {
            Thread t = new Thread(r);
            t.setName(name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
