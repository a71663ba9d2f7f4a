package com.knowledge.graph.rest;

import com.knowledge.graph.api.KnowledgeGraph;
import com.knowledge.graph.core.model.ResolutionResult;
import com.knowledge.graph.graph.GraphStoreException;
import com.knowledge.graph.resolve.DataIntegrityException;
import com.knowledge.graph.rest.dto.AccessRequest;
import com.knowledge.graph.rest.dto.ErrorResponse;
import com.knowledge.graph.rest.dto.ExploreRequestDto;
import com.knowledge.graph.rest.dto.ExploreResponse;
import com.knowledge.graph.rest.dto.ResolveRequest;
import com.knowledge.graph.rest.dto.ResolveResponse;
import com.knowledge.graph.retrieval.ExploreResult;
import com.knowledge.graph.retrieval.ExploreResultFormatter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST resource for resolution, explore and access recording.
 *
 * <p>Errors map to statuses by type: invalid input 400, key collision 409, store
 * unavailable 503, anything else 500.</p>
 */
@Path("/api/v1/graph")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Knowledge Graph", description = "Resolve mentions, explore the graph and record access")
public class KnowledgeGraphResource {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphResource.class);

    private final KnowledgeGraph graph;

    @Inject
    public KnowledgeGraphResource(KnowledgeGraph graph) {
        this.graph = graph;
    }

    /**
     * POST /api/v1/graph/resolve
     */
    @POST
    @Path("/resolve")
    @Operation(summary = "Resolve a mention",
            description = "Maps a mention to an existing entity or creates one. Never guesses: " +
                    "a confident match, a creation, or an error.")
    @APIResponse(responseCode = "200", description = "Mention resolved")
    @APIResponse(responseCode = "400", description = "Invalid name, type or user")
    @APIResponse(responseCode = "409", description = "Entity key held by an unrelated node")
    @APIResponse(responseCode = "503", description = "Graph store unavailable")
    public Response resolve(ResolveRequest request) {
        return handle("/api/v1/graph/resolve", () -> {
            ResolutionResult result = graph.resolve(request.toMention());
            return Response.ok(ResolveResponse.from(result)).build();
        });
    }

    /**
     * POST /api/v1/graph/explore
     */
    @POST
    @Path("/explore")
    @Operation(summary = "Explore the graph",
            description = "Fuses vector, fuzzy-text and relationship signals, weights by salience, " +
                    "selects per-type seeds and expands one hop.")
    @APIResponse(responseCode = "200", description = "Best-effort ranked results")
    @APIResponse(responseCode = "400", description = "No queries and no text matches")
    public Response explore(ExploreRequestDto request) {
        return handle("/api/v1/graph/explore", () -> {
            ExploreResult result = graph.explore(request.toRequest());
            String markdown = request.wantsMarkdown() ? ExploreResultFormatter.format(result) : null;
            return Response.ok(ExploreResponse.from(result, markdown)).build();
        });
    }

    /**
     * POST /api/v1/graph/access
     */
    @POST
    @Path("/access")
    @Operation(summary = "Record access",
            description = "Counts one access per distinct key in a single bulk update.")
    @APIResponse(responseCode = "200", description = "Access recorded")
    public Response recordAccess(AccessRequest request) {
        return handle("/api/v1/graph/access", () -> {
            graph.recordAccess(request.entityKeys());
            return Response.ok(Map.of("recorded", request.entityKeys().size())).build();
        });
    }

    private Response handle(String path, Supplier<Response> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (DataIntegrityException e) {
            log.error("request.conflict path={} entityKey={} error={}", path, e.getEntityKey(), e.getMessage());
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path))
                    .build();
        } catch (GraphStoreException e) {
            log.error("request.storeUnavailable path={} error={}", path, e.getMessage(), e);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable("Graph store unavailable. Retry later.", path))
                    .build();
        } catch (Exception e) {
            log.error("request.failed path={} error={}", path, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
