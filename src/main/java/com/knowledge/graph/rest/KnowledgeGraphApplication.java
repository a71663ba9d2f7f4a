package com.knowledge.graph.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Knowledge Graph API",
                version = "1.0.0",
                description = "Per-user knowledge graph: mention resolution to stable entities, " +
                        "fused ranked retrieval with one-hop expansion, and salience tracking. " +
                        "Built on FalkorDB."
        )
)
public class KnowledgeGraphApplication extends Application {
}
