package com.stepflow.engine.persistence;

import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * For demonstration and testing purposes.
 */
@Repository
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "memory")
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final InMemoryDatabase db;

    public InMemoryWorkflowDefinitionRepository(InMemoryDatabase db) {
        this.db = db;
    }

    @Override
    public void save(WorkflowDefinition definition) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions =
                db.definitions.computeIfAbsent(definition.workflowId(), k -> new TreeMap<>());
            if (versions.containsKey(definition.version())) {
                throw new IllegalArgumentException("Workflow definition already exists: " + definition.id());
            }
            versions.put(definition.version(), definition);
        }
    }

    @Override
    public Optional<WorkflowDefinition> find(String workflowId, int version) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions = db.definitions.get(workflowId);
            return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
        }
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String workflowId) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions = db.definitions.get(workflowId);
            return versions == null || versions.isEmpty()
                ? Optional.empty()
                : Optional.of(versions.lastEntry().getValue());
        }
    }

    @Override
    public List<WorkflowDefinition> listVersions(String workflowId) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions = db.definitions.get(workflowId);
            return versions == null ? List.of() : new ArrayList<>(versions.descendingMap().values());
        }
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        synchronized (db.lock()) {
            return db.definitions.values().stream()
                .filter(v -> !v.isEmpty())
                .map(v -> v.lastEntry().getValue())
                .sorted(Comparator.comparing(WorkflowDefinition::workflowId))
                .collect(Collectors.toList());
        }
    }

    @Override
    public int getNextVersion(String workflowId) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions = db.definitions.get(workflowId);
            return versions == null || versions.isEmpty() ? 1 : versions.lastKey() + 1;
        }
    }

    @Override
    public boolean deactivate(String workflowId) {
        synchronized (db.lock()) {
            TreeMap<Integer, WorkflowDefinition> versions = db.definitions.get(workflowId);
            if (versions == null) {
                return false;
            }
            for (Map.Entry<Integer, WorkflowDefinition> entry : versions.entrySet()) {
                entry.setValue(entry.getValue().withActive(false));
            }
            return true;
        }
    }
}
