package com.example.dispatcher.model;

import com.example.dispatcher.queue.JobType;
import java.time.Instant;

/** repeating_triggers の 1 行。trigger_key は queue と job_type の組で一意。 */
public record RepeatingTriggerRecord(
    String triggerKey,
    JobType jobType,
    String payloadJson,
    String cron,
    Instant nextRunAt,
    Instant lastRunAt) {}
