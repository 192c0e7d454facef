package com.stepflow.engine.service;

import com.stepflow.core.exception.InvalidCronExpressionException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.test.InMemoryStepflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ScheduleServiceTest {

    private InMemoryStepflow stepflow;
    private ScheduleService service;

    @BeforeEach
    void setUp() {
        stepflow = new InMemoryStepflow();
        service = stepflow.scheduleService();
        stepflow.register(TestWorkflows.linear("nightly", "export"));
    }

    @Test
    @DisplayName("A new schedule is active with its first occurrence after now")
    void createComputesFirstRun() {
        Schedule schedule = service.create("nightly", "0 2 * * *");

        assertThat(schedule.active()).isTrue();
        assertThat(schedule.nextRunAt()).isEqualTo(Instant.parse("2024-01-16T02:00:00Z"));
        assertThat(schedule.lastRunAt()).isNull();
        assertThat(service.get(schedule.scheduleId())).isEqualTo(schedule);
        assertThat(service.list("nightly")).hasSize(1);
        assertThat(service.list(null)).hasSize(1);
    }

    @Test
    @DisplayName("Malformed expressions and unknown workflows are rejected")
    void createValidates() {
        assertThatThrownBy(() -> service.create("nightly", "every day"))
            .isInstanceOf(InvalidCronExpressionException.class);
        assertThatThrownBy(() -> service.create("nightly", "61 * * * *"))
            .isInstanceOf(InvalidCronExpressionException.class);
        assertThatThrownBy(() -> service.create("missing", "0 2 * * *"))
            .isInstanceOf(NotFoundException.class);
        assertThat(service.list(null)).isEmpty();
    }

    @Test
    @DisplayName("Reactivation skips occurrences missed while inactive")
    void reactivationSkipsMissedRuns() {
        Schedule schedule = service.create("nightly", "0 * * * *");
        assertThat(service.deactivate(schedule.scheduleId()).active()).isFalse();

        stepflow.clock.advance(Duration.ofHours(5).plusMinutes(10));
        Schedule reactivated = service.activate(schedule.scheduleId());

        assertThat(reactivated.active()).isTrue();
        assertThat(reactivated.nextRunAt()).isEqualTo(Instant.parse("2024-01-15T16:00:00Z"));
    }

    @Test
    @DisplayName("deactivateAll counts only schedules that were active")
    void deactivateAll() {
        service.create("nightly", "0 * * * *");
        Schedule second = service.create("nightly", "0 2 * * *");
        service.deactivate(second.scheduleId());

        assertThat(service.deactivateAll("nightly")).isEqualTo(1);
        assertThat(service.list("nightly")).noneMatch(Schedule::active);
        assertThatThrownBy(() -> service.deactivate("missing")).isInstanceOf(NotFoundException.class);
    }
}
