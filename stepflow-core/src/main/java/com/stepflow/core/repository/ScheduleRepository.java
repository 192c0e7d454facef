package com.stepflow.core.repository;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for cron schedules.
 */
public interface ScheduleRepository {

    Schedule save(Schedule schedule);

    Optional<Schedule> findById(String scheduleId);

    List<Schedule> findByWorkflow(String workflowId);

    List<Schedule> findAll();

    /**
     * Active schedules whose nextRunAt is at or before now, oldest first.
     */
    List<Schedule> findDue(Instant now, int limit);

    /**
     * @return true if the schedule existed
     */
    boolean setActive(String scheduleId, boolean active);

    /**
     * Advance a schedule past its current occurrence and create the triggered
     * execution, in one transaction.
     *
     * The advance is a compare-and-set on {@code expectedNextRunAt}: if another
     * scheduler instance already advanced the schedule, nothing is written.
     *
     * @param scheduleId schedule to advance
     * @param expectedNextRunAt nextRunAt observed by the caller
     * @param newNextRunAt following occurrence
     * @param firedAt firing instant, stored as lastRunAt
     * @param toCreate execution to insert, or null to advance without triggering
     * @param creationLogs entries recording the creation of {@code toCreate}, written with it
     * @return true if this call won the compare-and-set
     */
    boolean advanceAndTrigger(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt,
                              Instant firedAt, Execution toCreate, List<ExecutionLogEntry> creationLogs);
}
