package com.stepflow.engine.service;

import com.stepflow.core.exception.InvalidCronExpressionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.repository.ScheduleRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.core.schedule.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Management of cron schedules.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final Clock clock;

    public ScheduleService(ScheduleRepository scheduleRepository,
                           WorkflowDefinitionRepository definitionRepository,
                           Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.definitionRepository = definitionRepository;
        this.clock = clock;
    }

    /**
     * Create an active schedule firing the workflow on every occurrence of the cron expression.
     *
     * @throws InvalidCronExpressionException if the expression does not parse or never fires
     * @throws NotFoundException if the workflow does not exist
     */
    public Schedule create(String workflowId, String cronExpression) {
        CronExpressions.validate(cronExpression);
        if (definitionRepository.findLatest(workflowId).isEmpty()) {
            throw new NotFoundException("Workflow", workflowId);
        }

        Instant now = clock.instant();
        Schedule schedule = scheduleRepository.save(
            Schedule.create(workflowId, cronExpression, firstRun(cronExpression, now), now));
        log.info("Created schedule {} for workflow {} ({}), first run at {}",
            schedule.scheduleId(), workflowId, cronExpression, schedule.nextRunAt());
        return schedule;
    }

    public Schedule get(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new NotFoundException("Schedule", scheduleId));
    }

    /**
     * List schedules, optionally restricted to one workflow.
     */
    public List<Schedule> list(String workflowId) {
        return workflowId != null
            ? scheduleRepository.findByWorkflow(workflowId)
            : scheduleRepository.findAll();
    }

    /**
     * Reactivate a schedule. Occurrences missed while inactive are skipped:
     * the next run is computed from now.
     */
    public Schedule activate(String scheduleId) {
        Schedule schedule = get(scheduleId);
        Schedule active = schedule.withActive(true)
            .withNextRunAt(firstRun(schedule.cronExpression(), clock.instant()));
        scheduleRepository.save(active);
        log.info("Activated schedule {}, next run at {}", scheduleId, active.nextRunAt());
        return active;
    }

    public Schedule deactivate(String scheduleId) {
        if (!scheduleRepository.setActive(scheduleId, false)) {
            throw new NotFoundException("Schedule", scheduleId);
        }
        log.info("Deactivated schedule {}", scheduleId);
        return get(scheduleId);
    }

    /**
     * Deactivate every schedule of a workflow.
     *
     * @return number of schedules deactivated
     */
    public int deactivateAll(String workflowId) {
        int count = 0;
        for (Schedule schedule : scheduleRepository.findByWorkflow(workflowId)) {
            if (schedule.active() && scheduleRepository.setActive(schedule.scheduleId(), false)) {
                count++;
            }
        }
        return count;
    }

    private static Instant firstRun(String cronExpression, Instant now) {
        return CronExpressions.nextAfter(cronExpression, now)
            .orElseThrow(() -> new InvalidCronExpressionException(cronExpression,
                new IllegalArgumentException("expression has no future occurrence")));
    }
}
