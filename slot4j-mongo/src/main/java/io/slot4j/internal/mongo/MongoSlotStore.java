package io.slot4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.SlotStatus;
import io.slot4j.core.TimeSlot;
import io.slot4j.core.spi.SlotStore;
import io.slot4j.core.spi.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for time slots.
 *
 * <p>Every write is a single-document atomic operation:
 * <ul>
 *   <li>{@link #saveAll} upserts by slot key via {@code findAndModify}</li>
 *   <li>{@link #compareAndSetStatus} matches on {@code _id} plus the expected status, so a lost race returns empty</li>
 * </ul>
 */
public class MongoSlotStore implements SlotStore {

    static final DateTimeFormatter SLOT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private static final Sort BY_TIME = Sort.by(Sort.Order.asc("slotTime"));

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoSlotStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<TimeSlot> saveAll(List<TimeSlot> slots) {
        Objects.requireNonNull(slots, "slots must not be null");
        return execute("saveAll", () -> {
            Instant now = Instant.now();
            FindAndModifyOptions options = FindAndModifyOptions.options().upsert(true).returnNew(true);

            List<TimeSlot> saved = new ArrayList<>(slots.size());
            for (TimeSlot slot : slots) {
                Query q = new Query(keyCriteria(slot));

                Update u = new Update()
                        .set("slotTime", slotTime(slot.localDateTime()))
                        .set("slotIndex", slot.getSlotIndex())
                        .set("status", slot.getStatus())
                        .set("updatedAt", now)
                        .setOnInsert("createdAt", now);
                if (slot.getMetadata() != null) {
                    u.set("metadata", toMap(slot.getMetadata()));
                }
                if (slot.getTaskId() != null) {
                    u.set("taskId", slot.getTaskId());
                }

                TimeSlotDocument doc = mongoTemplate.findAndModify(q, u, options, TimeSlotDocument.class);
                saved.add(toModel(doc));
            }
            return saved;
        });
    }

    @Override
    public Optional<TimeSlot> findById(String slotId) {
        return execute("findById", () ->
                Optional.ofNullable(mongoTemplate.findById(slotId, TimeSlotDocument.class)).map(this::toModel));
    }

    @Override
    public Optional<TimeSlot> findFirstPending(String configId, LocalDateTime from) {
        Query q = new Query(Criteria.where("configId").is(configId)
                .and("status").is(SlotStatus.PENDING)
                .and("slotTime").gte(slotTime(from)))
                .with(BY_TIME);
        return execute("findFirstPending", () ->
                Optional.ofNullable(mongoTemplate.findOne(q, TimeSlotDocument.class)).map(this::toModel));
    }

    @Override
    public List<TimeSlot> findPendingBefore(String configId, LocalDateTime before) {
        Query q = new Query(Criteria.where("configId").is(configId)
                .and("status").is(SlotStatus.PENDING)
                .and("slotTime").lt(slotTime(before)))
                .with(BY_TIME);
        return findAll("findPendingBefore", q);
    }

    @Override
    public List<TimeSlot> findByConfigAndDate(String configId, LocalDate date, SlotStatus status) {
        Criteria c = Criteria.where("configId").is(configId).and("slotDate").is(date.toString());
        if (status != null) {
            c = c.and("status").is(status);
        }
        return findAll("findByConfigAndDate", new Query(c).with(BY_TIME));
    }

    @Override
    public List<TimeSlot> findByAccountBetween(String accountId, LocalDate fromDate, LocalDate toDate) {
        Query q = new Query(Criteria.where("accountId").is(accountId)
                .and("slotDate").gte(fromDate.toString()).lte(toDate.toString()))
                .with(BY_TIME);
        return findAll("findByAccountBetween", q);
    }

    @Override
    public Optional<TimeSlot> findLatest(String configId) {
        Query q = new Query(Criteria.where("configId").is(configId))
                .with(Sort.by(Sort.Order.desc("slotTime")));
        return execute("findLatest", () ->
                Optional.ofNullable(mongoTemplate.findOne(q, TimeSlotDocument.class)).map(this::toModel));
    }

    @Override
    public Optional<TimeSlot> compareAndSetStatus(String slotId, SlotStatus expected, SlotStatus next, String taskId) {
        Criteria c = Criteria.where("_id").is(slotId);
        if (expected != null) {
            // prevent a stale write-back when another writer moved the slot first
            c = c.and("status").is(expected);
        }
        Update u = new Update()
                .set("status", next)
                .set("updatedAt", Instant.now());
        if (taskId != null) {
            u.set("taskId", taskId);
        }
        Criteria criteria = c;

        return execute("compareAndSetStatus", () -> Optional.ofNullable(
                mongoTemplate.findAndModify(new Query(criteria), u, FindAndModifyOptions.options().returnNew(true), TimeSlotDocument.class)
        ).map(this::toModel));
    }

    @Override
    public long deleteByConfigDateAndStatus(String configId, LocalDate date, SlotStatus status) {
        Query q = new Query(Criteria.where("configId").is(configId)
                .and("slotDate").is(date.toString())
                .and("status").is(status));
        return execute("deleteByConfigDateAndStatus", () ->
                mongoTemplate.remove(q, TimeSlotDocument.class).getDeletedCount());
    }

    @Override
    public long deleteBefore(LocalDate cutoff, Collection<SlotStatus> statuses) {
        Query q = new Query(Criteria.where("slotDate").lt(cutoff.toString())
                .and("status").in(statuses));
        return execute("deleteBefore", () -> mongoTemplate.remove(q, TimeSlotDocument.class).getDeletedCount());
    }

    @Override
    public long countPendingFrom(String configId, LocalDateTime from) {
        Query q = new Query(Criteria.where("configId").is(configId)
                .and("status").is(SlotStatus.PENDING)
                .and("slotTime").gte(slotTime(from)));
        return execute("countPendingFrom", () -> mongoTemplate.count(q, TimeSlotDocument.class));
    }

    static String slotTime(LocalDateTime at) {
        return SLOT_TIME.format(at);
    }

    private static Criteria keyCriteria(TimeSlot slot) {
        return Criteria.where("configId").is(slot.getConfigId())
                .and("accountId").is(slot.getAccountId())
                .and("slotDate").is(slot.getSlotDate().toString())
                .and("slotHour").is(slot.getSlotHour())
                .and("slotMinute").is(slot.getSlotMinute());
    }

    private List<TimeSlot> findAll(String op, Query q) {
        return execute(op, () -> mongoTemplate.find(q, TimeSlotDocument.class).stream().map(this::toModel).toList());
    }

    private Map<String, Object> toMap(Map<String, Object> value) {
        return objectMapper.convertValue(value, new TypeReference<>() {
        });
    }

    TimeSlot toModel(TimeSlotDocument doc) {
        TimeSlot s = new TimeSlot();
        s.setSlotId(doc.getId());
        s.setConfigId(doc.getConfigId());
        s.setAccountId(doc.getAccountId());
        s.setSlotDate(LocalDate.parse(doc.getSlotDate()));
        s.setSlotHour(doc.getSlotHour());
        s.setSlotMinute(doc.getSlotMinute());
        s.setSlotIndex(doc.getSlotIndex());
        s.setStatus(doc.getStatus() == null ? SlotStatus.PENDING : doc.getStatus());
        s.setTaskId(doc.getTaskId());
        s.setMetadata(doc.getMetadata());
        s.setCreatedAt(doc.getCreatedAt());
        s.setUpdatedAt(doc.getUpdatedAt());
        return s;
    }

    private static <T> T execute(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreException("time_slots " + op + " failed: " + e.getMessage(), e);
        }
    }
}
