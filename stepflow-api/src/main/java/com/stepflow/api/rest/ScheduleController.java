package com.stepflow.api.rest;

import com.stepflow.core.model.Schedule;
import com.stepflow.engine.service.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for cron schedules.
 */
@RestController
@RequestMapping("/api/v1/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PostMapping
    public ResponseEntity<Schedule> create(@RequestBody CreateScheduleRequest request) {
        Schedule schedule = scheduleService.create(request.workflowId(), request.cronExpression());
        return ResponseEntity.status(HttpStatus.CREATED).body(schedule);
    }

    @GetMapping
    public ResponseEntity<List<Schedule>> list(@RequestParam(required = false) String workflowId) {
        return ResponseEntity.ok(scheduleService.list(workflowId));
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<Schedule> get(@PathVariable String scheduleId) {
        return ResponseEntity.ok(scheduleService.get(scheduleId));
    }

    /**
     * Reactivate a schedule. Occurrences missed while inactive are skipped.
     */
    @PostMapping("/{scheduleId}/activate")
    public ResponseEntity<Schedule> activate(@PathVariable String scheduleId) {
        return ResponseEntity.ok(scheduleService.activate(scheduleId));
    }

    @PostMapping("/{scheduleId}/deactivate")
    public ResponseEntity<Schedule> deactivate(@PathVariable String scheduleId) {
        return ResponseEntity.ok(scheduleService.deactivate(scheduleId));
    }

    // ========== DTOs ==========

    public record CreateScheduleRequest(String workflowId, String cronExpression) {}
}
