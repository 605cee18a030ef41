package io.slot4j.internal;

import io.slot4j.RecurrenceScheduler;
import io.slot4j.ScheduleAction;
import io.slot4j.core.RecurrenceKind;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.spi.ScheduleConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-thread poller over the registered {@link ScheduleConfig}s.
 *
 * <p>Each tick fires every active config whose {@code nextRunAt} has passed, then records
 * {@code lastRunAt} and the following occurrence. ONCE configs are deactivated after firing.
 * A failing action leaves {@code nextRunAt} untouched, so the config is retried on the next tick.
 */
public class DefaultRecurrenceScheduler implements RecurrenceScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultRecurrenceScheduler.class);

    private final ScheduleConfigStore configStore;
    private final RecurrenceCalculator calculator;
    private final ScheduleAction action;
    private final RecurrenceOptions options;
    private final Clock clock;

    private final ConcurrentHashMap<String, ScheduleConfig> configs = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object tickLock = new Object();

    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultRecurrenceScheduler(ScheduleConfigStore configStore,
                                      RecurrenceCalculator calculator,
                                      ScheduleAction action,
                                      RecurrenceOptions options,
                                      Clock clock) {
        this.configStore = Objects.requireNonNull(configStore, "configStore must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(options.checkInterval(), "checkInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("slot4j.recurrence.checkInterval must be a positive duration");
        }

        int loaded = 0;
        for (ScheduleConfig stored : configStore.findAll()) {
            if (configs.putIfAbsent(stored.getConfigId(), stored) == null) {
                if (stored.isActive() && stored.getNextRunAt() == null) {
                    schedule(stored, clock.instant());
                    configStore.save(stored);
                }
                loaded++;
            }
        }
        log.info("Recurrence scheduler starting with checkInterval={}, loadedConfigs={}", interval, loaded);

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("slot4j.recurrence");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Recurrence scheduler stopping...");
        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        log.info("Recurrence scheduler stopped.");
    }

    @Override
    public ScheduleConfig register(ScheduleConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(config.getConfigId(), "configId must not be null");

        synchronized (tickLock) {
            ScheduleConfig c = config.copy();
            if (c.getCreatedAt() == null) {
                c.setCreatedAt(clock.instant());
            }
            if (c.isActive() && c.getNextRunAt() == null) {
                schedule(c, clock.instant());
            }
            configStore.save(c);
            configs.put(c.getConfigId(), c);
            log.info("Schedule registered configId={} kind={} active={} nextRunAt={}",
                    c.getConfigId(), c.getRecurrenceKind(), c.isActive(), c.getNextRunAt());
            return c.copy();
        }
    }

    @Override
    public boolean pause(String configId) {
        synchronized (tickLock) {
            ScheduleConfig c = configs.get(configId);
            if (c == null) {
                return false;
            }
            c.setActive(false);
            configStore.save(c);
            log.info("Schedule paused configId={}", configId);
            return true;
        }
    }

    @Override
    public boolean resume(String configId) {
        synchronized (tickLock) {
            ScheduleConfig c = configs.get(configId);
            if (c == null) {
                return false;
            }
            c.setActive(true);
            schedule(c, clock.instant());
            configStore.save(c);
            log.info("Schedule resumed configId={} active={} nextRunAt={}", configId, c.isActive(), c.getNextRunAt());
            return c.isActive();
        }
    }

    @Override
    public boolean remove(String configId) {
        synchronized (tickLock) {
            boolean removed = configs.remove(configId) != null;
            if (removed) {
                log.info("Schedule removed configId={}", configId);
            }
            return removed;
        }
    }

    @Override
    public Optional<ScheduleConfig> get(String configId) {
        ScheduleConfig c = configs.get(configId);
        return c == null ? Optional.empty() : Optional.of(c.copy());
    }

    @Override
    public List<ScheduleConfig> getScheduleStatus() {
        return configs.values().stream()
                .sorted(Comparator.comparing(ScheduleConfig::getConfigId))
                .map(ScheduleConfig::copy)
                .toList();
    }

    @Override
    public int tick() {
        synchronized (tickLock) {
            Instant now = clock.instant();
            int fired = 0;
            for (ScheduleConfig c : configs.values()) {
                if (!c.isActive() || c.getNextRunAt() == null || c.getNextRunAt().isAfter(now)) {
                    continue;
                }
                try {
                    if (fire(c, now)) {
                        fired++;
                    }
                } catch (RuntimeException e) {
                    // keep evaluating the remaining configs
                    log.error("Schedule evaluation failed configId={} msg={}", c.getConfigId(), e.getMessage(), e);
                }
            }
            log.debug("Recurrence tick now={} configs={} fired={}", now, configs.size(), fired);
            return fired;
        }
    }

    private boolean fire(ScheduleConfig c, Instant now) {
        try {
            log.info("Schedule firing configId={} kind={} dueAt={}", c.getConfigId(), c.getRecurrenceKind(), c.getNextRunAt());
            action.fire(c.copy(), now);
        } catch (Exception e) {
            log.error("Schedule action failed configId={} msg={}", c.getConfigId(), e.getMessage(), e);
            return false;
        }

        c.setLastRunAt(now);
        if (c.getRecurrenceKind() == RecurrenceKind.ONCE) {
            c.setActive(false);
            c.setNextRunAt(null);
        } else {
            schedule(c, now);
        }

        try {
            configStore.save(c);
        } catch (Exception e) {
            log.error("Schedule state save failed configId={} msg={}", c.getConfigId(), e.getMessage(), e);
        }
        return true;
    }

    // Sets nextRunAt from `from`; a config without a next run is deactivated.
    private void schedule(ScheduleConfig c, Instant from) {
        Optional<Instant> next = calculator.calculateNextRun(c, from);
        if (next.isPresent()) {
            c.setNextRunAt(next.get());
        } else {
            c.setNextRunAt(null);
            c.setActive(false);
            log.warn("Schedule deactivated, no next run configId={} kind={}", c.getConfigId(), c.getRecurrenceKind());
        }
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("slot4j recurrence tick failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(options.checkInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures: 1s, 2s, 4s, ... capped at 60s.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
