package com.stepflow.engine.service;

import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.exception.WorkflowValidationException;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ScheduleRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.core.validation.WorkflowDefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Publishing and lookup of versioned workflow definitions.
 *
 * Publishing never mutates an existing version: it stores the definition under
 * the next version number. The cron trigger of the latest version drives the
 * workflow's schedule.
 */
public class WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionService.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final ScheduleRepository scheduleRepository;
    private final ScheduleService scheduleService;
    private final Clock clock;

    public WorkflowDefinitionService(WorkflowDefinitionRepository definitionRepository,
                                     ScheduleRepository scheduleRepository,
                                     ScheduleService scheduleService,
                                     Clock clock) {
        this.definitionRepository = definitionRepository;
        this.scheduleRepository = scheduleRepository;
        this.scheduleService = scheduleService;
        this.clock = clock;
    }

    /**
     * Validate and store a definition as the next version of its workflow.
     *
     * @param draft definition; its version, active flag and creation time are ignored
     * @return the stored version
     * @throws WorkflowValidationException if the graph or trigger is invalid
     */
    public WorkflowDefinition publish(WorkflowDefinition draft) {
        WorkflowDefinitionValidator.validate(draft);
        checkWebhookPath(draft);

        int version = definitionRepository.getNextVersion(draft.workflowId());
        WorkflowDefinition stored = draft.withVersion(version, clock.instant()).withActive(true);
        definitionRepository.save(stored);
        syncSchedule(stored);

        log.info("Published workflow {} version {} ({} nodes)",
            stored.workflowId(), stored.version(), stored.nodes().size());
        return stored;
    }

    public WorkflowDefinition get(String workflowId, int version) {
        return definitionRepository.find(workflowId, version)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId + ":" + version));
    }

    public WorkflowDefinition getLatest(String workflowId) {
        return definitionRepository.findLatest(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    public List<WorkflowDefinition> listVersions(String workflowId) {
        List<WorkflowDefinition> versions = definitionRepository.listVersions(workflowId);
        if (versions.isEmpty()) {
            throw new NotFoundException("Workflow", workflowId);
        }
        return versions;
    }

    public List<WorkflowDefinition> listLatest() {
        return definitionRepository.listLatest();
    }

    /**
     * Deactivate a workflow and its schedules. Running executions are not affected.
     */
    public WorkflowDefinition deactivate(String workflowId) {
        if (!definitionRepository.deactivate(workflowId)) {
            throw new NotFoundException("Workflow", workflowId);
        }
        int schedules = scheduleService.deactivateAll(workflowId);
        log.info("Deactivated workflow {} and {} schedule(s)", workflowId, schedules);
        return getLatest(workflowId);
    }

    private void checkWebhookPath(WorkflowDefinition draft) {
        String path = draft.triggerConfig().webhookPath();
        if (path == null || path.isBlank()) {
            return;
        }
        for (WorkflowDefinition other : definitionRepository.listLatest()) {
            if (!other.workflowId().equals(draft.workflowId())
                    && other.active()
                    && path.equals(other.triggerConfig().webhookPath())) {
                throw new WorkflowValidationException("triggerConfig.webhookPath",
                    "already used by workflow " + other.workflowId());
            }
        }
    }

    private void syncSchedule(WorkflowDefinition latest) {
        String cron = latest.triggerConfig().hasCron() ? latest.triggerConfig().cronExpression() : null;
        boolean keep = false;
        for (Schedule schedule : scheduleRepository.findByWorkflow(latest.workflowId())) {
            if (!schedule.active()) {
                continue;
            }
            if (schedule.cronExpression().equals(cron) && !keep) {
                keep = true;
            } else {
                scheduleRepository.setActive(schedule.scheduleId(), false);
                log.info("Deactivated schedule {} superseded by version {}", schedule.scheduleId(), latest.version());
            }
        }
        if (cron != null && !keep) {
            scheduleService.create(latest.workflowId(), cron);
        }
    }
}
