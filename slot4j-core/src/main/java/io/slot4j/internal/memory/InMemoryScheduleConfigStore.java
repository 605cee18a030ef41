package io.slot4j.internal.memory;

import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.spi.ScheduleConfigStore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScheduleConfigStore implements ScheduleConfigStore {

    private final ConcurrentHashMap<String, ScheduleConfig> configs = new ConcurrentHashMap<>();

    @Override
    public void save(ScheduleConfig config) {
        Objects.requireNonNull(config.getConfigId(), "configId must not be null");
        configs.put(config.getConfigId(), config.copy());
    }

    @Override
    public Optional<ScheduleConfig> findById(String configId) {
        ScheduleConfig c = configs.get(configId);
        return c == null ? Optional.empty() : Optional.of(c.copy());
    }

    @Override
    public List<ScheduleConfig> findActive() {
        return findAll().stream().filter(ScheduleConfig::isActive).toList();
    }

    @Override
    public List<ScheduleConfig> findAll() {
        return configs.values().stream()
                .sorted(Comparator.comparing(ScheduleConfig::getConfigId))
                .map(ScheduleConfig::copy)
                .toList();
    }
}
