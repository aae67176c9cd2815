package com.chaineditor.controllers;

import com.chaineditor.AppLogger;
import com.chaineditor.chain.WorkflowValidationException;
import com.chaineditor.model.SubmittedNode;
import com.chaineditor.model.WorkflowDefinition;
import com.chaineditor.session.EditSession;
import com.chaineditor.session.EditorEventLoop;
import com.chaineditor.storage.WorkflowStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;

/**
 * Saving the open chain as a workflow, and re-opening saved workflows in the editor.
 */
public class WorkflowController implements Controller {

    private final WorkflowStore workflowStore;
    private final EditSession session;
    private final EditorEventLoop loop;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public WorkflowController(WorkflowStore workflowStore, EditSession session, EditorEventLoop loop,
                              ObjectMapper objectMapper) {
        this.workflowStore = workflowStore;
        this.session = session;
        this.loop = loop;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/workflows", this::getWorkflows);
        app.get("/api/workflows/{id}", this::getWorkflow);
        app.post("/api/workflows", this::saveWorkflow);
        app.post("/api/workflows/{id}/open", this::openWorkflow);
        app.delete("/api/workflows/{id}", this::deleteWorkflow);
    }

    private void getWorkflows(Context ctx) {
        try {
            ctx.json(workflowStore.list());
        } catch (Exception e) {
            logger.error("Error listing workflows: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getWorkflow(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            WorkflowDefinition definition = workflowStore.load(id);
            if (definition == null) {
                ctx.status(404).json(Map.of("error", "Workflow not found: " + id));
                return;
            }
            ctx.json(definition);
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error getting workflow: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void saveWorkflow(Context ctx) {
        try {
            String raw = ctx.body();
            JsonNode body = raw == null || raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);
            String name = body.path("name").asText("");
            if (name.isBlank()) {
                throw new WorkflowValidationException(Map.of("name", "Missing workflow name"));
            }
            loop.flush();
            List<SubmittedNode> nodes = loop.call(session::submit);

            WorkflowDefinition definition = null;
            String id = body.path("id").asText(null);
            if (id != null && !id.isBlank()) {
                definition = workflowStore.load(id);
            }
            if (definition == null) {
                definition = new WorkflowDefinition();
                definition.setId(id);
            }
            definition.setName(name);
            definition.setDescription(body.path("description").asText(definition.getDescription()));
            definition.setNodes(nodes);
            ctx.status(201).json(workflowStore.save(definition));
        } catch (WorkflowValidationException e) {
            ctx.status(422).json(Controller.validationBody(e));
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error saving workflow: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void openWorkflow(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            WorkflowDefinition definition = workflowStore.load(id);
            if (definition == null) {
                ctx.status(404).json(Map.of("error", "Workflow not found: " + id));
                return;
            }
            loop.run(() -> session.load(definition.getNodes()));
            ctx.json(Map.of("id", id, "nodes", loop.call(session::nodes)));
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error opening workflow: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void deleteWorkflow(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            if (workflowStore.delete(id)) {
                ctx.status(204);
            } else {
                ctx.status(404).json(Map.of("error", "Workflow not found: " + id));
            }
        } catch (SecurityException e) {
            ctx.status(403).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error deleting workflow: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
