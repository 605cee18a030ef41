package io.slot4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.spi.ScheduleConfigStore;
import io.slot4j.core.spi.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class MongoScheduleConfigStore implements ScheduleConfigStore {

    private static final Sort BY_ID = Sort.by(Sort.Order.asc("_id"));

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoScheduleConfigStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(ScheduleConfig config) {
        Objects.requireNonNull(config.getConfigId(), "configId must not be null");
        try {
            mongoTemplate.save(toDocument(config));
        } catch (DataAccessException e) {
            throw new StoreException("schedule_configs save failed configId=" + config.getConfigId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ScheduleConfig> findById(String configId) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(configId, ScheduleConfigDocument.class)).map(this::toModel);
        } catch (DataAccessException e) {
            throw new StoreException("schedule_configs findById failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ScheduleConfig> findActive() {
        return find(new Query(Criteria.where("active").is(true)).with(BY_ID));
    }

    @Override
    public List<ScheduleConfig> findAll() {
        return find(new Query().with(BY_ID));
    }

    private List<ScheduleConfig> find(Query q) {
        try {
            return mongoTemplate.find(q, ScheduleConfigDocument.class).stream().map(this::toModel).toList();
        } catch (DataAccessException e) {
            throw new StoreException("schedule_configs find failed: " + e.getMessage(), e);
        }
    }

    private ScheduleConfigDocument toDocument(ScheduleConfig c) {
        ScheduleConfigDocument doc = new ScheduleConfigDocument();
        doc.setId(c.getConfigId());
        doc.setGroupId(c.getGroupId());
        doc.setPipelineId(c.getPipelineId());
        doc.setRecurrenceKind(c.getRecurrenceKind());
        doc.setRecurrenceParams(toMap(c.getRecurrenceParams()));
        doc.setPipelineConfig(toMap(c.getPipelineConfig()));
        doc.setPriority(c.getPriority());
        doc.setActive(c.isActive());
        doc.setLastRunAt(c.getLastRunAt());
        doc.setNextRunAt(c.getNextRunAt());
        doc.setCreatedAt(c.getCreatedAt());
        return doc;
    }

    private ScheduleConfig toModel(ScheduleConfigDocument doc) {
        ScheduleConfig c = new ScheduleConfig();
        c.setConfigId(doc.getId());
        c.setGroupId(doc.getGroupId());
        c.setPipelineId(doc.getPipelineId());
        c.setRecurrenceKind(doc.getRecurrenceKind());
        c.setRecurrenceParams(doc.getRecurrenceParams());
        c.setPipelineConfig(doc.getPipelineConfig());
        c.setPriority(doc.getPriority());
        c.setActive(doc.isActive());
        c.setLastRunAt(doc.getLastRunAt());
        c.setNextRunAt(doc.getNextRunAt());
        c.setCreatedAt(doc.getCreatedAt());
        return c;
    }

    private Map<String, Object> toMap(Map<String, Object> value) {
        return value == null ? null : objectMapper.convertValue(value, new TypeReference<>() {
        });
    }
}
