package io.slot4j.core.spi;

import io.slot4j.core.ScheduleConfig;

import java.util.List;
import java.util.Optional;

public interface ScheduleConfigStore {

    void save(ScheduleConfig config);

    Optional<ScheduleConfig> findById(String configId);

    List<ScheduleConfig> findActive();

    List<ScheduleConfig> findAll();
}
