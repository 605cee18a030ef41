package io.slot4j.config;

import io.slot4j.internal.mongo.ExecutionTaskDocument;
import io.slot4j.internal.mongo.ScheduleConfigDocument;
import io.slot4j.internal.mongo.TimeSlotDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for slot4j.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code slot4j.ensure-indexes-on-startup=true};
 * in production they usually belong to migrations.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>ux_slot_key</b> (time_slots, unique): { configId: 1, accountId: 1, slotDate: 1, slotHour: 1, slotMinute: 1 }
 *       <br/>Enforces one slot per (config, account, minute); the upsert key of slot generation.</li>
 *   <li><b>idx_slot_due</b> (time_slots): { configId: 1, status: 1, slotTime: 1 }
 *       <br/>Used to find the next pending slot of a config.</li>
 *   <li><b>idx_task_status</b> (execution_tasks): { pipelineStatus: 1, publishStatus: 1 }</li>
 *   <li><b>idx_config_active</b> (schedule_configs): { active: 1, nextRunAt: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.time_slots.createIndex(
 *   { configId: 1, accountId: 1, slotDate: 1, slotHour: 1, slotMinute: 1 },
 *   { name: "ux_slot_key", unique: true }
 * );
 * db.time_slots.createIndex({ configId: 1, status: 1, slotTime: 1 }, { name: "idx_slot_due" });
 * db.execution_tasks.createIndex({ pipelineStatus: 1, publishStatus: 1 }, { name: "idx_task_status" });
 * db.schedule_configs.createIndex({ active: 1, nextRunAt: 1 }, { name: "idx_config_active" });
 * </pre>
 */
public class Slot4jMongoIndexConfig {

    public static final String UX_SLOT_KEY = "ux_slot_key";
    public static final String IDX_SLOT_DUE = "idx_slot_due";
    public static final String IDX_TASK_STATUS = "idx_task_status";
    public static final String IDX_CONFIG_ACTIVE = "idx_config_active";

    private final MongoTemplate mongoTemplate;

    public Slot4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create every required index. Not run implicitly; see the class docs.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(TimeSlotDocument.class).ensureIndex(slotKeyIndex());
        mongoTemplate.indexOps(TimeSlotDocument.class).ensureIndex(slotDueIndex());
        mongoTemplate.indexOps(ExecutionTaskDocument.class).ensureIndex(taskStatusIndex());
        mongoTemplate.indexOps(ScheduleConfigDocument.class).ensureIndex(configActiveIndex());
    }

    public static Index slotKeyIndex() {
        return new Index()
                .on("configId", Sort.Direction.ASC)
                .on("accountId", Sort.Direction.ASC)
                .on("slotDate", Sort.Direction.ASC)
                .on("slotHour", Sort.Direction.ASC)
                .on("slotMinute", Sort.Direction.ASC)
                .unique()
                .named(UX_SLOT_KEY);
    }

    public static Index slotDueIndex() {
        return new Index()
                .on("configId", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .on("slotTime", Sort.Direction.ASC)
                .named(IDX_SLOT_DUE);
    }

    public static Index taskStatusIndex() {
        return new Index()
                .on("pipelineStatus", Sort.Direction.ASC)
                .on("publishStatus", Sort.Direction.ASC)
                .named(IDX_TASK_STATUS);
    }

    public static Index configActiveIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_CONFIG_ACTIVE);
    }
}
