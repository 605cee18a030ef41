package io.slot4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.ExecutionTask;
import io.slot4j.core.spi.StoreException;
import io.slot4j.core.spi.TaskStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for execution tasks. Saves replace the whole document.
 */
public class MongoTaskStore implements TaskStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoTaskStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void save(ExecutionTask task) {
        Objects.requireNonNull(task.getTaskId(), "taskId must not be null");
        try {
            mongoTemplate.save(toDocument(task));
        } catch (DataAccessException e) {
            throw new StoreException("execution_tasks save failed taskId=" + task.getTaskId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ExecutionTask> findById(String taskId) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(taskId, ExecutionTaskDocument.class)).map(this::toModel);
        } catch (DataAccessException e) {
            throw new StoreException("execution_tasks findById failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ExecutionTask> findUnfinished() {
        Query q = new Query(Criteria.where("completedAt").is(null))
                .with(Sort.by(Sort.Order.asc("createdAt")));
        try {
            return mongoTemplate.find(q, ExecutionTaskDocument.class).stream().map(this::toModel).toList();
        } catch (DataAccessException e) {
            throw new StoreException("execution_tasks findUnfinished failed: " + e.getMessage(), e);
        }
    }

    private ExecutionTaskDocument toDocument(ExecutionTask t) {
        ExecutionTaskDocument doc = new ExecutionTaskDocument();
        doc.setId(t.getTaskId());
        doc.setConfigId(t.getConfigId());
        doc.setGroupId(t.getGroupId());
        doc.setAccountId(t.getAccountId());
        doc.setPipelineId(t.getPipelineId());
        doc.setSlotId(t.getSlotId());
        doc.setPipelineConfig(toMap(t.getPipelineConfig()));
        doc.setPipelineStatus(t.getPipelineStatus());
        doc.setPipelineResult(toMap(t.getPipelineResult()));
        doc.setPublishStatus(t.getPublishStatus());
        doc.setPublishResult(toMap(t.getPublishResult()));
        doc.setPriority(t.getPriority());
        doc.setRetryCount(t.getRetryCount());
        doc.setErrorMessage(t.getErrorMessage());
        doc.setCreatedAt(t.getCreatedAt());
        doc.setScheduledAt(t.getScheduledAt());
        doc.setStartedAt(t.getStartedAt());
        doc.setFailedAt(t.getFailedAt());
        doc.setCompletedAt(t.getCompletedAt());
        return doc;
    }

    private ExecutionTask toModel(ExecutionTaskDocument doc) {
        ExecutionTask t = new ExecutionTask();
        t.setTaskId(doc.getId());
        t.setConfigId(doc.getConfigId());
        t.setGroupId(doc.getGroupId());
        t.setAccountId(doc.getAccountId());
        t.setPipelineId(doc.getPipelineId());
        t.setSlotId(doc.getSlotId());
        t.setPipelineConfig(doc.getPipelineConfig());
        if (doc.getPipelineStatus() != null) {
            t.setPipelineStatus(doc.getPipelineStatus());
        }
        t.setPipelineResult(doc.getPipelineResult());
        if (doc.getPublishStatus() != null) {
            t.setPublishStatus(doc.getPublishStatus());
        }
        t.setPublishResult(doc.getPublishResult());
        t.setPriority(doc.getPriority());
        t.setRetryCount(doc.getRetryCount());
        t.setErrorMessage(doc.getErrorMessage());
        t.setCreatedAt(doc.getCreatedAt());
        t.setScheduledAt(doc.getScheduledAt());
        t.setStartedAt(doc.getStartedAt());
        t.setFailedAt(doc.getFailedAt());
        t.setCompletedAt(doc.getCompletedAt());
        return t;
    }

    private Map<String, Object> toMap(Map<String, Object> value) {
        return value == null ? null : objectMapper.convertValue(value, new TypeReference<>() {
        });
    }
}
