package com.stepflow.engine.persistence;

import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.repository.ScheduleRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ScheduleRepository.
 * For demonstration and testing purposes.
 */
@Repository
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "memory")
public class InMemoryScheduleRepository implements ScheduleRepository {

    private final InMemoryDatabase db;

    public InMemoryScheduleRepository(InMemoryDatabase db) {
        this.db = db;
    }

    @Override
    public Schedule save(Schedule schedule) {
        synchronized (db.lock()) {
            db.schedules.put(schedule.scheduleId(), schedule);
            return schedule;
        }
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        synchronized (db.lock()) {
            return Optional.ofNullable(db.schedules.get(scheduleId));
        }
    }

    @Override
    public List<Schedule> findByWorkflow(String workflowId) {
        synchronized (db.lock()) {
            return db.schedules.values().stream()
                .filter(s -> s.workflowId().equals(workflowId))
                .collect(Collectors.toList());
        }
    }

    @Override
    public List<Schedule> findAll() {
        synchronized (db.lock()) {
            return List.copyOf(db.schedules.values());
        }
    }

    @Override
    public List<Schedule> findDue(Instant now, int limit) {
        synchronized (db.lock()) {
            return db.schedules.values().stream()
                .filter(s -> s.active() && s.nextRunAt() != null && !s.nextRunAt().isAfter(now))
                .sorted(Comparator.comparing(Schedule::nextRunAt))
                .limit(limit)
                .collect(Collectors.toList());
        }
    }

    @Override
    public boolean setActive(String scheduleId, boolean active) {
        synchronized (db.lock()) {
            Schedule schedule = db.schedules.get(scheduleId);
            if (schedule == null) {
                return false;
            }
            db.schedules.put(scheduleId, schedule.withActive(active));
            return true;
        }
    }

    @Override
    public boolean advanceAndTrigger(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt,
                                     Instant firedAt, Execution toCreate,
                                     List<ExecutionLogEntry> creationLogs) {
        synchronized (db.lock()) {
            Schedule schedule = db.schedules.get(scheduleId);
            if (schedule == null || !schedule.active()
                    || !Objects.equals(schedule.nextRunAt(), expectedNextRunAt)) {
                return false;
            }
            db.schedules.put(scheduleId, new Schedule(
                schedule.scheduleId(),
                schedule.workflowId(),
                schedule.cronExpression(),
                schedule.active(),
                newNextRunAt,
                firedAt,
                schedule.createdAt()
            ));
            if (toCreate != null) {
                db.executions.put(toCreate.executionId(), toCreate);
                creationLogs.forEach(db::appendLog);
            }
            return true;
        }
    }
}
