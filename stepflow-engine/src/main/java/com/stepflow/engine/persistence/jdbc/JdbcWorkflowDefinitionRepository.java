package com.stepflow.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stepflow.core.model.NodeDefinition;
import com.stepflow.core.model.RetryPolicy;
import com.stepflow.core.model.TriggerConfig;
import com.stepflow.core.model.WorkflowDefinition;
import com.stepflow.core.repository.WorkflowDefinitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.stepflow.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.stepflow.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of WorkflowDefinitionRepository.
 * Nodes, edges and the retry policy are stored as JSONB documents.
 */
@Repository("jdbcWorkflowDefinitionRepository")
@ConditionalOnProperty(name = "stepflow.store-type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowDefinitionRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<WorkflowDefinition> rowMapper;

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = (rs, rowNum) -> WorkflowDefinition.builder()
            .workflowId(rs.getString("workflow_id"))
            .version(rs.getInt("version"))
            .name(rs.getString("name"))
            .description(rs.getString("description"))
            .nodes(readNodes(json.fromJson(rs.getString("nodes_json"))))
            .edges(readEdges(json.fromJson(rs.getString("edges_json"))))
            .entryNodeId(rs.getString("entry_node_id"))
            .triggerConfig(new TriggerConfig(rs.getString("cron_expression"), rs.getString("webhook_path")))
            .retryPolicy(readRetryPolicy(json.fromJson(rs.getString("retry_policy_json"))))
            .active(rs.getBoolean("active"))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .build();
    }

    @Override
    @Transactional
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (
                workflow_id, version, name, description, nodes_json, edges_json,
                entry_node_id, cron_expression, webhook_path, retry_policy_json, active, created_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?::jsonb, ?, ?)
            """;

        try {
            jdbcTemplate.update(sql,
                definition.workflowId(),
                definition.version(),
                definition.name(),
                definition.description(),
                json.toJson(writeNodes(definition.nodes())),
                json.toJson(writeEdges(definition.edges())),
                definition.entryNodeId(),
                definition.triggerConfig().cronExpression(),
                definition.triggerConfig().webhookPath(),
                json.toJson(writeRetryPolicy(definition.retryPolicy())),
                definition.active(),
                toTimestamp(definition.createdAt())
            );
        } catch (DuplicateKeyException e) {
            throw new IllegalArgumentException("Workflow definition already exists: " + definition.id(), e);
        }
        log.debug("Stored workflow definition {}", definition.id());
    }

    @Override
    public Optional<WorkflowDefinition> find(String workflowId, int version) {
        List<WorkflowDefinition> results = jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE workflow_id = ? AND version = ?",
            rowMapper, workflowId, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String workflowId) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE workflow_id = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<WorkflowDefinition> results = jdbcTemplate.query(sql, rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<WorkflowDefinition> listVersions(String workflowId) {
        return jdbcTemplate.query(
            "SELECT * FROM workflow_definitions WHERE workflow_id = ? ORDER BY version DESC",
            rowMapper, workflowId);
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        String sql = """
            SELECT DISTINCT ON (workflow_id) * FROM workflow_definitions
            ORDER BY workflow_id, version DESC
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    @Override
    public int getNextVersion(String workflowId) {
        Integer max = jdbcTemplate.queryForObject(
            "SELECT MAX(version) FROM workflow_definitions WHERE workflow_id = ?",
            Integer.class, workflowId);
        return max == null ? 1 : max + 1;
    }

    @Override
    @Transactional
    public boolean deactivate(String workflowId) {
        int rows = jdbcTemplate.update(
            "UPDATE workflow_definitions SET active = FALSE WHERE workflow_id = ?", workflowId);
        return rows > 0;
    }

    private ArrayNode writeNodes(List<NodeDefinition> nodes) {
        ArrayNode array = json.mapper().createArrayNode();
        for (NodeDefinition node : nodes) {
            ObjectNode n = array.addObject();
            n.put("nodeId", node.nodeId());
            n.put("type", node.type());
            n.set("config", node.config());
            if (node.timeout() != null) {
                n.put("timeoutMs", node.timeout().toMillis());
            }
        }
        return array;
    }

    private static List<NodeDefinition> readNodes(JsonNode array) {
        List<NodeDefinition> nodes = new ArrayList<>();
        for (JsonNode n : array) {
            Duration timeout = n.hasNonNull("timeoutMs") ? Duration.ofMillis(n.get("timeoutMs").asLong()) : null;
            nodes.add(new NodeDefinition(n.get("nodeId").asText(), n.get("type").asText(), n.get("config"), timeout));
        }
        return nodes;
    }

    private ObjectNode writeEdges(Map<String, List<String>> edges) {
        ObjectNode object = json.mapper().createObjectNode();
        edges.forEach((from, targets) -> {
            ArrayNode array = object.putArray(from);
            targets.forEach(array::add);
        });
        return object;
    }

    private static Map<String, List<String>> readEdges(JsonNode object) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> targets = new ArrayList<>();
            field.getValue().forEach(t -> targets.add(t.asText()));
            edges.put(field.getKey(), List.copyOf(targets));
        }
        return edges;
    }

    private ObjectNode writeRetryPolicy(RetryPolicy policy) {
        if (policy == null) {
            return null;
        }
        ObjectNode object = json.mapper().createObjectNode();
        object.put("maxRetries", policy.maxRetries());
        object.put("baseDelayMs", policy.baseDelay().toMillis());
        object.put("backoffMultiplier", policy.backoffMultiplier());
        object.put("maxDelayMs", policy.maxDelay().toMillis());
        return object;
    }

    private static RetryPolicy readRetryPolicy(JsonNode object) {
        if (object == null || object.isNull()) {
            return null;
        }
        return new RetryPolicy(
            object.get("maxRetries").asInt(),
            Duration.ofMillis(object.get("baseDelayMs").asLong()),
            object.get("backoffMultiplier").asDouble(),
            Duration.ofMillis(object.get("maxDelayMs").asLong())
        );
    }
}
