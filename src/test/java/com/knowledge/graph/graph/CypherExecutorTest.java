package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.NodeType;
import com.knowledge.graph.salience.SalienceRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CypherExecutor Tests")
class CypherExecutorTest {

    private GraphConnection connection;
    private CypherExecutor executor;

    @BeforeEach
    void setUp() {
        connection = mock(GraphConnection.class);
        executor = new CypherExecutor(connection);
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<Map<String, Object>> paramsCaptor() {
        return ArgumentCaptor.forClass(Map.class);
    }

    @Test
    @DisplayName("Batch access is a single UNWIND statement")
    void incrementAccessSingleStatement() {
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();

        executor.incrementAccess(List.of("a", "b", "c"), 0.075, 1_000L);

        verify(connection, times(1)).execute(query.capture(), params.capture());
        assertTrue(query.getValue().contains("UNWIND $entityKeys AS key"));
        assertEquals(List.of("a", "b", "c"), params.getValue().get("entityKeys"));
        assertEquals(0.075, params.getValue().get("delta"));
        assertEquals(SalienceRules.CORE_THRESHOLD, params.getValue().get("coreThreshold"));
        assertEquals(SalienceRules.ACTIVE_THRESHOLD, params.getValue().get("activeThreshold"));
    }

    @Test
    @DisplayName("Salience adjustments clamp inside the statement")
    void adjustSalienceClamps() {
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);

        executor.adjustSalience(List.of("a"), -0.2, 1_000L);

        verify(connection).execute(query.capture(), anyMap());
        assertTrue(query.getValue().contains("WHEN adjusted < 0.0 THEN 0.0"));
        assertFalse(query.getValue().contains("access_count"));
    }

    @Test
    @DisplayName("Labels come from the node type, values stay parameters")
    void labelFromNodeType() {
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        when(connection.query(anyString(), anyMap())).thenReturn(List.of());

        executor.findByNormalizedNameContainment("o'reilly", NodeType.NAMED_ENTITY, "u1");

        verify(connection).query(query.capture(), params.capture());
        assertTrue(query.getValue().contains("MATCH (n:Entity)"));
        assertFalse(query.getValue().contains("o'reilly"));
        assertEquals("o'reilly", params.getValue().get("normalizedName"));
    }

    @Test
    @DisplayName("Node merge reports creation by comparing creation ids")
    void mergeNode() {
        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        when(connection.query(anyString(), anyMap())).thenReturn(List.of());
        Map<String, Object> fields = new HashMap<>();
        fields.put("entityKey", "k1");
        fields.put("description", null);

        executor.mergeNode(NodeType.PERSON, fields, "creation-1", 5L);

        verify(connection).query(query.capture(), params.capture());
        assertTrue(query.getValue().contains("MERGE (n:Person {entity_key: $entityKey})"));
        assertTrue(query.getValue().contains("n.creation_id = $creationId AS created"));
        assertEquals("Person", params.getValue().get("nodeType"));
        assertEquals("creation-1", params.getValue().get("creationId"));
        assertTrue(params.getValue().containsKey("description"));
    }

    @Test
    @DisplayName("Edge merge rejects unsafe relationship types before touching the graph")
    void mergeEdgeValidatesType() {
        assertThrows(IllegalArgumentException.class,
                () -> executor.mergeEdge("KNOWS]->(x) DETACH DELETE x//", Map.of(), 1L));
        verifyNoInteractions(connection);
    }

    @Test
    @DisplayName("Notes are appended with a cap on the list")
    void appendNoteCapped() {
        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();

        executor.appendNote("k1", "{\"content\":\"x\"}", 100, 1L);

        verify(connection).execute(contains("size(notes) > $maxNotes"), params.capture());
        assertEquals(100, params.getValue().get("maxNotes"));
    }
}
