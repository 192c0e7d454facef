package com.stepflow.engine.persistence;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stepflow.core.exception.InvalidStateTransitionException;
import com.stepflow.core.exception.LeaseLostException;
import com.stepflow.core.exception.NotFoundException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionQuery;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogLevel;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.StepResult;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.test.MutableClock;
import com.stepflow.core.test.TestWorkflows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryExecutionStoreTest {

    private static final Duration LEASE = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryExecutionStore store;
    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        InMemoryDatabase db = new InMemoryDatabase();
        store = new InMemoryExecutionStore(db, clock);
        definition = TestWorkflows.linear("orders", "A", "B");
        new InMemoryWorkflowDefinitionRepository(db).save(definition);
    }

    @Test
    @DisplayName("Concurrent claimers never receive the same execution")
    void concurrentClaimsAreExclusive() throws Exception {
        int executions = 200;
        for (int i = 0; i < executions; i++) {
            store.createExecution(definition, JsonNodeFactory.instance.numberNode(i));
            clock.advance(Duration.ofMillis(1));
        }

        int workers = 8;
        Map<String, AtomicInteger> claims = new ConcurrentHashMap<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String workerId = "worker-" + w;
            futures.add(pool.submit(() -> {
                start.await();
                Optional<Execution> claimed;
                while ((claimed = store.claim(workerId, LEASE)).isPresent()) {
                    claims.computeIfAbsent(claimed.get().executionId(), k -> new AtomicInteger()).incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(claims).hasSize(executions);
        assertThat(claims.values()).allMatch(count -> count.get() == 1);
        assertThat(store.countActiveLeases(clock.instant())).isEqualTo(executions);
    }

    @Test
    @DisplayName("Claims are granted oldest first")
    void claimsOldestFirst() {
        Execution first = store.createExecution(definition, null);
        clock.advanceSeconds(1);
        store.createExecution(definition, null);

        assertThat(store.claim("w1", LEASE)).map(Execution::executionId).contains(first.executionId());
    }

    @Test
    @DisplayName("An expired lease can be claimed by another worker")
    void expiredLeaseIsReclaimable() {
        Execution execution = store.createExecution(definition, null);
        store.claim("w1", LEASE).orElseThrow();

        assertThat(store.claim("w2", LEASE)).isEmpty();
        clock.advance(LEASE);
        Execution reclaimed = store.claim("w2", LEASE).orElseThrow();

        assertThat(reclaimed.executionId()).isEqualTo(execution.executionId());
        assertThat(reclaimed.leaseOwner()).isEqualTo("w2");
        assertThatThrownBy(() -> store.renewLease(execution.executionId(), "w1", LEASE))
            .isInstanceOf(LeaseLostException.class);
    }

    @Test
    @DisplayName("persistStep rejects a stale holder and a terminal execution")
    void persistStepChecksLeaseAndStatus() {
        Execution execution = store.createExecution(definition, null);
        Execution claimed = store.claim("w1", LEASE).orElseThrow();
        Execution completed = claimed.toBuilder().status(ExecutionStatus.COMPLETED).completedAt(clock.instant()).build();

        assertThatThrownBy(() -> store.persistStep(execution.executionId(), "w2", StepResult.of(completed, List.of())))
            .isInstanceOf(LeaseLostException.class);

        store.persistStep(execution.executionId(), "w1", StepResult.of(completed, List.of(
            ExecutionLogEntry.info(execution.executionId(), "A", "done", clock.instant()))));

        assertThatThrownBy(() -> store.persistStep(execution.executionId(), "w1", StepResult.of(completed, List.of())))
            .isInstanceOf(LeaseLostException.class);
        assertThat(store.findById(execution.executionId()).orElseThrow().status()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    @DisplayName("Explicitly paused executions are not claimable until resumed")
    void pauseAndResume() {
        Execution execution = store.createExecution(definition, null);

        Execution paused = store.pause(execution.executionId());
        assertThat(paused.isExplicitlyPaused()).isTrue();
        clock.advance(Duration.ofHours(1));
        assertThat(store.claim("w1", LEASE)).isEmpty();

        Execution resumed = store.resume(execution.executionId());
        assertThat(resumed.status()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(resumed.nextRetryAt()).isEqualTo(clock.instant());
        assertThat(store.claim("w1", LEASE)).isPresent();
    }

    @Test
    @DisplayName("Pause is refused while a worker holds the lease")
    void pauseRefusedWhileLeased() {
        Execution execution = store.createExecution(definition, null);
        store.claim("w1", LEASE).orElseThrow();

        assertThatThrownBy(() -> store.pause(execution.executionId()))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Cancelling a terminal or unknown execution is rejected")
    void cancelRejectsTerminalAndUnknown() {
        Execution execution = store.createExecution(definition, null);
        store.requestCancellation(execution.executionId(), "first");

        assertThatThrownBy(() -> store.requestCancellation(execution.executionId(), "again"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> store.requestCancellation("missing", null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Logs are sequenced per execution and filterable")
    void logsAreSequencedAndFiltered() {
        Execution execution = store.createExecution(definition, null);
        String id = execution.executionId();
        store.appendLog(ExecutionLogEntry.info(id, "A", "one", clock.instant()));
        store.appendLog(ExecutionLogEntry.error(id, "B", "two", clock.instant()));
        store.appendLog(ExecutionLogEntry.info(id, "B", "three", clock.instant()));

        List<ExecutionLogEntry> all = store.findLogs(LogQuery.page(id, 0, 10));
        assertThat(all).extracting(ExecutionLogEntry::message).containsExactly("one", "two", "three");
        assertThat(all).extracting(ExecutionLogEntry::sequence).isSorted();

        assertThat(store.findLogs(new LogQuery(id, "B", null, 0, 10))).hasSize(2);
        assertThat(store.countLogs(new LogQuery(id, null, LogLevel.ERROR, 0, 10))).isEqualTo(1);
        assertThat(store.findLogs(LogQuery.page(id, 1, 2)))
            .extracting(ExecutionLogEntry::message).containsExactly("three");
    }

    @Test
    @DisplayName("Retention deletes only terminal executions older than the cutoff")
    void deleteTerminalBefore() {
        Execution old = store.createExecution(definition, null);
        store.requestCancellation(old.executionId(), null);
        Execution live = store.createExecution(definition, null);

        clock.advance(Duration.ofDays(2));
        Execution recent = store.createExecution(definition, null);
        store.requestCancellation(recent.executionId(), null);

        int deleted = store.deleteTerminalBefore(clock.instant().minus(Duration.ofDays(1)));

        assertThat(deleted).isEqualTo(1);
        assertThat(store.findById(old.executionId())).isEmpty();
        assertThat(store.findLogs(LogQuery.page(old.executionId(), 0, 10))).isEmpty();
        assertThat(store.findById(live.executionId())).isPresent();
        assertThat(store.findById(recent.executionId())).isPresent();
    }

    @Test
    @DisplayName("Queries filter by workflow and status, newest first")
    void queryFilters() {
        Execution first = store.createExecution(definition, null);
        clock.advanceSeconds(1);
        Execution second = store.createExecution(definition, null);
        store.requestCancellation(second.executionId(), null);

        assertThat(store.query(ExecutionQuery.all()))
            .extracting(Execution::executionId).containsExactly(second.executionId(), first.executionId());
        assertThat(store.query(new ExecutionQuery("orders", ExecutionStatus.PENDING, 10, 0)))
            .extracting(Execution::executionId).containsExactly(first.executionId());
        assertThat(store.countByStatus())
            .containsEntry(ExecutionStatus.PENDING, 1L)
            .containsEntry(ExecutionStatus.CANCELLED, 1L);
    }
}
