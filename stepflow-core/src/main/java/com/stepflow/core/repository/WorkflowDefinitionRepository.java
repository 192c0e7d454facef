package com.stepflow.core.repository;

import com.stepflow.core.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Workflow definition versions are immutable once stored, apart from the active flag.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a new workflow definition version.
     *
     * @param definition The workflow definition to store
     * @throws IllegalArgumentException if the (workflowId, version) pair already exists
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by id and version.
     */
    Optional<WorkflowDefinition> find(String workflowId, int version);

    /**
     * Find the latest version of a workflow definition.
     */
    Optional<WorkflowDefinition> findLatest(String workflowId);

    /**
     * List all versions of a workflow definition, newest first.
     */
    List<WorkflowDefinition> listVersions(String workflowId);

    /**
     * Latest version of every workflow.
     */
    List<WorkflowDefinition> listLatest();

    /**
     * Get the next available version number for a workflow.
     *
     * @return The next version number (1 if no versions exist)
     */
    int getNextVersion(String workflowId);

    /**
     * Mark every version of the workflow inactive.
     *
     * @return true if the workflow exists
     */
    boolean deactivate(String workflowId);
}
