package com.chaineditor.controllers;

import com.chaineditor.AppLogger;
import com.chaineditor.catalog.UnknownTemplateException;
import com.chaineditor.chain.ChainEditException;
import com.chaineditor.chain.SettleReport;
import com.chaineditor.chain.WorkflowValidationException;
import com.chaineditor.model.ParameterValueJson;
import com.chaineditor.model.WorkflowNode;
import com.chaineditor.session.EditSession;
import com.chaineditor.session.EditorEventLoop;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes for editing the node chain of the open workflow.
 *
 * Every edit runs on the editor loop. The response is written after the settle that
 * the edit scheduled has run, so it always shows the normalized chain.
 */
public class EditorController implements Controller {

    private final EditSession session;
    private final EditorEventLoop loop;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public EditorController(EditSession session, EditorEventLoop loop, ObjectMapper objectMapper) {
        this.session = session;
        this.loop = loop;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/editor/nodes", this::getNodes);
        app.get("/api/editor/state", this::getState);
        app.post("/api/editor/nodes", this::insertNode);
        app.delete("/api/editor/nodes/{index}", this::removeNode);
        app.post("/api/editor/nodes/move", this::moveNode);
        app.put("/api/editor/nodes/{index}/name", this::renameNode);
        app.put("/api/editor/nodes/{index}/minimized", this::setMinimized);
        app.put("/api/editor/nodes/{index}/parameters/{key}", this::setParameter);
        app.get("/api/editor/submission", this::getSubmission);
    }

    private void getNodes(Context ctx) {
        try {
            ctx.json(loop.call(session::nodes));
        } catch (Exception e) {
            handleError(ctx, "getting nodes", e);
        }
    }

    private void getState(Context ctx) {
        try {
            Map<String, Object> state = loop.call(() -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("state", session.getState().name());
                body.put("nodeCount", session.nodes().size());
                body.put("settleCount", session.getSettleCount());
                SettleReport last = session.getLastSettle();
                if (last != null) {
                    body.put("lastSettle", last);
                }
                return body;
            });
            ctx.json(state);
        } catch (Exception e) {
            handleError(ctx, "getting editor state", e);
        }
    }

    private void insertNode(Context ctx) {
        try {
            JsonNode body = readBody(ctx);
            String templateId = body.path("templateId").asText(null);
            if (templateId == null || templateId.isBlank()) {
                ctx.status(400).json(Map.of("error", "templateId required"));
                return;
            }
            JsonNode indexNode = body.get("index");
            String id = loop.call(() -> indexNode != null && indexNode.canConvertToInt()
                ? session.insert(templateId, indexNode.intValue())
                : session.insert(templateId));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("id", id);
            response.put("nodes", settledNodes());
            ctx.status(201).json(response);
        } catch (Exception e) {
            handleError(ctx, "inserting node", e);
        }
    }

    private void removeNode(Context ctx) {
        try {
            int index = indexParam(ctx);
            loop.run(() -> session.remove(index));
            ctx.json(Map.of("nodes", settledNodes()));
        } catch (Exception e) {
            handleError(ctx, "removing node", e);
        }
    }

    private void moveNode(Context ctx) {
        try {
            JsonNode body = readBody(ctx);
            if (body.hasNonNull("activeId") || body.hasNonNull("overId")) {
                String activeId = body.path("activeId").asText(null);
                String overId = body.path("overId").asText(null);
                loop.run(() -> session.moveById(activeId, overId));
            } else if (body.path("from").canConvertToInt() && body.path("to").canConvertToInt()) {
                int from = body.get("from").intValue();
                int to = body.get("to").intValue();
                loop.run(() -> session.move(from, to));
            } else {
                ctx.status(400).json(Map.of("error", "Provide from/to indices or activeId/overId"));
                return;
            }
            ctx.json(Map.of("nodes", settledNodes()));
        } catch (Exception e) {
            handleError(ctx, "moving node", e);
        }
    }

    private void renameNode(Context ctx) {
        try {
            int index = indexParam(ctx);
            JsonNode body = readBody(ctx);
            String name = body.path("name").asText("");
            String applied = loop.call(() -> session.renameField(index, name));
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("name", applied);
            response.put("nodes", settledNodes());
            ctx.json(response);
        } catch (Exception e) {
            handleError(ctx, "renaming node", e);
        }
    }

    private void setMinimized(Context ctx) {
        try {
            int index = indexParam(ctx);
            boolean minimized = readBody(ctx).path("minimized").asBoolean(false);
            loop.run(() -> session.setMinimized(index, minimized));
            ctx.json(Map.of("nodes", settledNodes()));
        } catch (Exception e) {
            handleError(ctx, "updating node", e);
        }
    }

    private void setParameter(Context ctx) {
        try {
            int index = indexParam(ctx);
            String key = ctx.pathParam("key");
            JsonNode value = readBody(ctx).get("value");
            loop.run(() -> session.setParameter(index, key, ParameterValueJson.fromJson(value)));
            ctx.json(Map.of("nodes", settledNodes()));
        } catch (Exception e) {
            handleError(ctx, "updating parameter", e);
        }
    }

    private void getSubmission(Context ctx) {
        try {
            loop.flush();
            ctx.json(Map.of("nodes", loop.call(session::submit)));
        } catch (Exception e) {
            handleError(ctx, "building submission", e);
        }
    }

    private List<WorkflowNode> settledNodes() {
        loop.flush();
        return loop.call(session::nodes);
    }

    private JsonNode readBody(Context ctx) throws JsonProcessingException {
        String raw = ctx.body();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(raw);
    }

    private int indexParam(Context ctx) {
        String raw = ctx.pathParam("index");
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ChainEditException("Invalid node index: " + raw);
        }
    }

    private void handleError(Context ctx, String action, Exception e) {
        if (e instanceof ChainEditException) {
            ctx.status(400).json(Controller.errorBody(e));
        } else if (e instanceof JsonProcessingException) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body"));
        } else if (e instanceof UnknownTemplateException) {
            ctx.status(404).json(Controller.errorBody(e));
        } else if (e instanceof WorkflowValidationException) {
            ctx.status(422).json(Controller.validationBody((WorkflowValidationException) e));
        } else {
            logger.error("Error " + action + ": " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
