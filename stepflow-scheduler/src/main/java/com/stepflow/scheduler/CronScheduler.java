package com.stepflow.scheduler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ScheduleRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.core.schedule.CronExpressions;
import com.stepflow.engine.logging.LoggingContext;
import com.stepflow.engine.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires cron schedules by creating executions.
 *
 * Each due schedule is advanced with a compare-and-set on the nextRunAt the
 * poll observed, and the execution is inserted in the same transaction. Any
 * number of scheduler instances may poll concurrently, and a restart never
 * fires an occurrence twice. Occurrences missed while no scheduler ran are
 * collapsed into one firing.
 */
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private static final int BATCH_SIZE = 100;

    public static final String TRIGGER_TYPE = "schedule";

    private final ScheduleRepository scheduleRepository;
    private final WorkflowDefinitionRepository definitionRepository;
    private final ExecutionMetrics metrics;
    private final Clock clock;
    private final Duration pollInterval;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public CronScheduler(ScheduleRepository scheduleRepository,
                         WorkflowDefinitionRepository definitionRepository,
                         ExecutionMetrics metrics,
                         Clock clock,
                         Duration pollInterval) {
        this.scheduleRepository = scheduleRepository;
        this.definitionRepository = definitionRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Cron scheduler already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "stepflow-cron"));
        scheduler.scheduleWithFixedDelay(this::safePoll,
            pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Cron scheduler started, polling every {}", pollInterval);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Cron scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Error polling schedules", e);
        }
    }

    /**
     * Fire every schedule that is due now.
     *
     * @return number of executions created
     */
    public int pollOnce() {
        Instant now = clock.instant();
        List<Schedule> due = scheduleRepository.findDue(now, BATCH_SIZE);
        int created = 0;
        for (Schedule schedule : due) {
            try (LoggingContext ctx = LoggingContext.forSchedule(schedule.scheduleId(), schedule.workflowId())) {
                if (fire(schedule, now)) {
                    created++;
                }
            } catch (Exception e) {
                log.error("Failed to fire schedule {}", schedule.scheduleId(), e);
            }
        }
        return created;
    }

    private boolean fire(Schedule schedule, Instant now) {
        Instant scheduledAt = schedule.nextRunAt();
        Instant following = CronExpressions.nextAfter(schedule.cronExpression(), now).orElse(null);

        Optional<WorkflowDefinition> definition = definitionRepository.findLatest(schedule.workflowId())
            .filter(WorkflowDefinition::active);
        Execution toCreate = definition
            .map(d -> Execution.create(d, triggerPayload(schedule, scheduledAt), now))
            .orElse(null);

        List<ExecutionLogEntry> creationLogs = toCreate == null ? List.of() : List.of(
            ExecutionLogEntry.info(toCreate.executionId(), toCreate.currentNodeId(),
                "Execution created by schedule trigger on version " + toCreate.workflowVersion(), now));
        if (!scheduleRepository.advanceAndTrigger(
                schedule.scheduleId(), scheduledAt, following, now, toCreate, creationLogs)) {
            log.debug("Schedule {} occurrence {} already fired elsewhere", schedule.scheduleId(), scheduledAt);
            return false;
        }

        if (toCreate == null) {
            log.info("Skipped schedule {} occurrence {}: workflow {} missing or inactive",
                schedule.scheduleId(), scheduledAt, schedule.workflowId());
            metrics.scheduleFired(schedule.workflowId(), false);
            return false;
        }

        metrics.scheduleFired(schedule.workflowId(), true);
        metrics.executionCreated(schedule.workflowId(), TRIGGER_TYPE);
        log.info("Schedule {} fired execution {} for occurrence {}, next run at {}",
            schedule.scheduleId(), toCreate.executionId(), scheduledAt, following);
        return true;
    }

    private static ObjectNode triggerPayload(Schedule schedule, Instant scheduledAt) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("triggerType", TRIGGER_TYPE);
        payload.put("scheduleId", schedule.scheduleId());
        payload.put("cronExpression", schedule.cronExpression());
        payload.put("scheduledAt", scheduledAt.toString());
        return payload;
    }
}
