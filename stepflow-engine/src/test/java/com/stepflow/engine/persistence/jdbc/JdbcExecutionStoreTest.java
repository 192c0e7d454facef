package com.stepflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.stepflow.core.exception.LeaseLostException;
import com.stepflow.core.model.Execution;
import com.stepflow.core.model.ExecutionLogEntry;
import com.stepflow.core.model.ExecutionStatus;
import com.stepflow.core.model.LogQuery;
import com.stepflow.core.model.NodeOutcome;
import com.stepflow.core.model.Schedule;
import com.stepflow.core.model.Signal;
import com.stepflow.core.model.StateBlob;
import com.stepflow.core.model.StepResult;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.ExecutionStore;
import com.stepflow.core.repository.ScheduleRepository;
import com.stepflow.core.repository.SignalRepository;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import com.stepflow.core.test.MutableClock;
import com.stepflow.core.test.TestWorkflows;
import com.stepflow.engine.config.StepflowProperties;
import com.stepflow.engine.execution.ExecutionEngine;
import com.stepflow.engine.metrics.ExecutionMetrics;
import com.stepflow.engine.test.ScriptedInvoker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
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

/**
 * Store guarantees against a real PostgreSQL: exclusive claims, lease-fenced
 * writes, exactly-once signal resume and compare-and-set schedule advance.
 */
@SpringJUnitConfig(JdbcExecutionStoreTest.Config.class)
@Testcontainers(disabledWithoutDocker = true)
class JdbcExecutionStoreTest {

    private static final Duration LEASE = Duration.ofSeconds(30);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("stepflow_test")
        .withUsername("test")
        .withPassword("test");

    @Configuration
    @EnableTransactionManagement
    static class Config {

        @Bean
        DataSource dataSource() {
            DriverManagerDataSource dataSource = new DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
            new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
            return dataSource;
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        MutableClock clock() {
            return new MutableClock();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        ExecutionStore executionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, MutableClock clock) {
            return new JdbcExecutionStore(jdbcTemplate, objectMapper, clock);
        }

        @Bean
        SignalRepository signalRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, MutableClock clock) {
            return new JdbcSignalRepository(jdbcTemplate, objectMapper, clock);
        }

        @Bean
        ScheduleRepository scheduleRepository(JdbcTemplate jdbcTemplate, ExecutionStore executionStore) {
            return new JdbcScheduleRepository(jdbcTemplate, executionStore);
        }

        @Bean
        WorkflowDefinitionRepository definitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper);
        }
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ExecutionStore store;

    @Autowired
    private SignalRepository signals;

    @Autowired
    private ScheduleRepository schedules;

    @Autowired
    private WorkflowDefinitionRepository definitions;

    private WorkflowDefinition definition;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE workflow_schedules, workflow_signals, execution_checkpoints, "
            + "execution_logs, workflow_executions, workflow_definitions CASCADE");
        clock.setTime(MutableClock.DEFAULT_START);
        definition = TestWorkflows.linear("orders", "A", "B", "C");
        definitions.save(definition);
    }

    @Test
    @DisplayName("Concurrent claimers never lease the same row")
    void concurrentClaimsAreExclusive() throws Exception {
        int executions = 40;
        for (int i = 0; i < executions; i++) {
            store.createExecution(definition, JsonNodeFactory.instance.numberNode(i));
            clock.advance(Duration.ofMillis(1));
        }

        int workers = 6;
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
            f.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(claims).hasSize(executions);
        assertThat(claims.values()).allMatch(count -> count.get() == 1);
    }

    @Test
    @DisplayName("A worker whose lease was re-granted cannot write")
    void zombieWriteIsRejected() {
        Execution execution = store.createExecution(definition, null);
        Execution stale = store.claim("w1", LEASE).orElseThrow();
        clock.advance(LEASE.plusSeconds(1));
        store.claim("w2", LEASE).orElseThrow();

        Execution completed = stale.toBuilder().status(ExecutionStatus.COMPLETED).completedAt(clock.instant()).build();
        assertThatThrownBy(() -> store.persistStep(execution.executionId(), "w1",
                StepResult.of(completed, List.of())))
            .isInstanceOf(LeaseLostException.class);
        assertThatThrownBy(() -> store.renewLease(execution.executionId(), "w1", LEASE))
            .isInstanceOf(LeaseLostException.class);

        Execution stored = store.findById(execution.executionId()).orElseThrow();
        assertThat(stored.status()).isEqualTo(ExecutionStatus.PENDING);
        assertThat(stored.leaseOwner()).isEqualTo("w2");
    }

    @Test
    @DisplayName("The engine runs a workflow end to end with retries against the database")
    void engineRunsAgainstDatabase() {
        Execution execution = store.createExecution(definition,
            JsonNodeFactory.instance.objectNode().put("order", 1));
        ScriptedInvoker invoker = new ScriptedInvoker()
            .script("B", NodeOutcome.retryable("TIMEOUT", "slow"));
        ExecutionEngine engine = new ExecutionEngine(store, signals, definitions, invoker,
            new ExecutionMetrics(new SimpleMeterRegistry(), store), StepflowProperties.defaults(), clock);

        Execution paused = engine.run(store.claim("w1", LEASE).orElseThrow(), "w1");
        assertThat(paused.status()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(store.claim("w1", LEASE)).isEmpty();

        clock.advance(Duration.ofMinutes(10));
        Execution done = engine.run(store.claim("w1", LEASE).orElseThrow(), "w1");

        assertThat(done.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.retryCount()).isEqualTo(1);
        assertThat(store.findCheckpoints(execution.executionId())).hasSize(3);
        List<ExecutionLogEntry> logs = store.findLogs(LogQuery.page(execution.executionId(), 0, 100));
        assertThat(logs).extracting(ExecutionLogEntry::sequence).isSorted();
        assertThat(logs).extracting(ExecutionLogEntry::message).contains("Execution completed");
    }

    @Test
    @DisplayName("Two resumes with different signals of the awaited type succeed only once")
    void signalResumesOnce() {
        Execution execution = store.createExecution(definition, null);
        ScriptedInvoker invoker = new ScriptedInvoker().script("A", NodeOutcome.suspend("approved"));
        ExecutionEngine engine = new ExecutionEngine(store, signals, definitions, invoker,
            new ExecutionMetrics(new SimpleMeterRegistry(), store), StepflowProperties.defaults(), clock);
        Execution waiting = engine.run(store.claim("w1", LEASE).orElseThrow(), "w1");
        assertThat(waiting.status()).isEqualTo(ExecutionStatus.WAITING_SIGNAL);

        Signal first = signals.record(Signal.create(execution.executionId(), "approved",
            JsonNodeFactory.instance.objectNode().put("n", 1), clock.instant()));
        Signal second = signals.record(Signal.create(execution.executionId(), "approved",
            JsonNodeFactory.instance.objectNode().put("n", 2), clock.instant()));

        Optional<Execution> resumed = signals.resumeWithSignal(first.signalId(), null);
        Optional<Execution> again = signals.resumeWithSignal(second.signalId(), null);

        assertThat(resumed).isPresent();
        assertThat(resumed.get().status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(StateBlob.signal(resumed.get().stateBlob(), "approved").get("n").asInt()).isEqualTo(1);
        assertThat(again).isEmpty();
        assertThat(signals.findById(first.signalId()).orElseThrow().processed()).isTrue();
        assertThat(signals.findById(second.signalId()).orElseThrow().processed()).isFalse();
    }

    @Test
    @DisplayName("A schedule occurrence is advanced and triggered at most once")
    void scheduleAdvanceIsCompareAndSet() {
        Instant due = clock.instant();
        Schedule schedule = schedules.save(Schedule.create("orders", "0 * * * *", due, clock.instant()));
        Instant next = due.plus(Duration.ofHours(1));

        Execution firstRun = Execution.create(definition, null, clock.instant());
        Execution secondRun = Execution.create(definition, null, clock.instant());
        boolean first = schedules.advanceAndTrigger(schedule.scheduleId(), due, next, due, firstRun,
            List.of(ExecutionLogEntry.info(firstRun.executionId(), "A", "Execution created by schedule", due)));
        boolean second = schedules.advanceAndTrigger(schedule.scheduleId(), due, next, due, secondRun,
            List.of(ExecutionLogEntry.info(secondRun.executionId(), "A", "Execution created by schedule", due)));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.findById(firstRun.executionId())).isPresent();
        assertThat(store.findById(secondRun.executionId())).isEmpty();
        assertThat(store.findLogs(LogQuery.page(firstRun.executionId(), 0, 10)))
            .extracting(ExecutionLogEntry::message)
            .containsExactly("Execution created by schedule");
        assertThat(store.countLogs(LogQuery.page(secondRun.executionId(), 0, 10))).isZero();
        assertThat(schedules.findById(schedule.scheduleId()).orElseThrow().nextRunAt()).isEqualTo(next);
        assertThat(schedules.findDue(clock.instant(), 10)).isEmpty();
    }
}
