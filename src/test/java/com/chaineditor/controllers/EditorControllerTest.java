package com.chaineditor.controllers;

import com.chaineditor.Main;
import com.chaineditor.catalog.BundledTemplateCatalog;
import com.chaineditor.session.EditSession;
import com.chaineditor.session.EditorEventLoop;
import com.chaineditor.session.InMemoryChainStore;
import com.chaineditor.storage.WorkflowStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditorControllerTest {

    private static final String FILTER = "Rule Based Filter";

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path workspace;

    private EditorEventLoop loop;
    private Javalin app;

    @BeforeEach
    void setUp() {
        loop = new EditorEventLoop();
        BundledTemplateCatalog catalog = new BundledTemplateCatalog(workspace, mapper);
        EditSession session = new EditSession(new InMemoryChainStore(), loop, catalog);
        app = Main.createApp(mapper, List.of(
            new TemplateController(catalog),
            new EditorController(session, loop, mapper),
            new WorkflowController(new WorkflowStore(workspace, mapper), session, loop, mapper)));
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    private JsonNode json(Response response) throws IOException {
        return mapper.readTree(response.body().string());
    }

    @Test
    void listsTemplates() {
        JavalinTest.test(app, (server, client) -> {
            Response response = client.get("/api/templates");
            assertEquals(200, response.code());
            assertEquals(6, json(response).size());
            assertEquals(404, client.get("/api/templates/nope").code());
        });
    }

    @Test
    void insertRespondsWithSettledChain() {
        JavalinTest.test(app, (server, client) -> {
            Response first = client.post("/api/editor/nodes", "{\"templateId\":\"rule-based-filter\"}");
            assertEquals(201, first.code());
            assertEquals(FILTER, json(first).path("nodes").get(0).path("name").asText());

            Response second = client.post("/api/editor/nodes", "{\"templateId\":\"rule-based-filter\"}");
            JsonNode nodes = json(second).path("nodes");
            assertEquals(FILTER + "1", nodes.get(0).path("name").asText());
            assertEquals(FILTER + "2", nodes.get(1).path("name").asText());
            assertEquals(FILTER + "1", nodes.get(1).path("previousNodeName").asText());
            assertEquals("={{ $('" + FILTER + "1').output}}", nodes.get(1).path("parameters").path("items").asText());

            JsonNode state = json(client.get("/api/editor/state"));
            assertEquals("IDLE", state.path("state").asText());
            assertEquals(2, state.path("nodeCount").asInt());
        });
    }

    @Test
    void moveAndRemove() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/api/editor/nodes", "{\"templateId\":\"post-datasource\"}");
            client.post("/api/editor/nodes", "{\"templateId\":\"duplicate-segment\"}");

            Response moved = client.post("/api/editor/nodes/move", "{\"from\":1,\"to\":0}");
            JsonNode nodes = json(moved).path("nodes");
            assertEquals("Duplicate Segment", nodes.get(0).path("name").asText());
            assertEquals("", nodes.get(0).path("previousNodeName").asText());
            assertEquals("Duplicate Segment", nodes.get(1).path("previousNodeName").asText());

            Response removed = client.delete("/api/editor/nodes/0");
            assertEquals(200, removed.code());
            assertEquals(1, json(removed).path("nodes").size());
        });
    }

    @Test
    void editErrorsMapToClientStatuses() {
        JavalinTest.test(app, (server, client) -> {
            assertEquals(404, client.post("/api/editor/nodes", "{\"templateId\":\"missing\"}").code());
            assertEquals(400, client.post("/api/editor/nodes", "{}").code());
            assertEquals(400, client.post("/api/editor/nodes", "{not json").code());
            assertEquals(400, client.delete("/api/editor/nodes/3").code());
            assertEquals(400, client.delete("/api/editor/nodes/abc").code());
            assertEquals(400, client.post("/api/editor/nodes/move", "{}").code());
        });
    }

    @Test
    void renameCollisionReturnsAppliedName() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/api/editor/nodes", "{\"templateId\":\"post-datasource\"}");
            client.post("/api/editor/nodes", "{\"templateId\":\"post-upserter\"}");

            JsonNode body = json(client.put("/api/editor/nodes/1/name", "{\"name\":\"Post Datasource\"}"));
            assertEquals("Post Datasource1", body.path("name").asText());
            assertEquals("Post Datasource1", body.path("nodes").get(0).path("name").asText());
            assertEquals("Post Datasource2", body.path("nodes").get(1).path("name").asText());
        });
    }

    @Test
    void submissionRejectsBlankNames() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/api/editor/nodes", "{\"templateId\":\"trigger-manual\"}");
            client.put("/api/editor/nodes/0/name", "{\"name\":\"\"}");

            Response response = client.get("/api/editor/submission");
            assertEquals(422, response.code());
            assertEquals("Missing node name", json(response).path("fieldErrors").path("nodes[0].name").asText());
        });
    }

    @Test
    void saveAndReopenWorkflow() {
        JavalinTest.test(app, (server, client) -> {
            client.post("/api/editor/nodes", "{\"templateId\":\"post-datasource\"}");
            client.post("/api/editor/nodes", "{\"templateId\":\"ai-summarization\"}");

            assertEquals(422, client.post("/api/workflows", "{\"name\":\" \"}").code());

            Response saved = client.post("/api/workflows", "{\"name\":\"Digest\"}");
            assertEquals(201, saved.code());
            JsonNode definition = json(saved);
            String id = definition.path("id").asText();
            assertEquals(2, definition.path("nodes").get(1).path("position").asInt());

            client.delete("/api/editor/nodes/1");
            JsonNode reopened = json(client.post("/api/workflows/" + id + "/open", ""));
            assertEquals(2, reopened.path("nodes").size());
            assertEquals("Post Datasource", reopened.path("nodes").get(1).path("previousNodeName").asText());

            assertEquals(1, json(client.get("/api/workflows")).size());
            assertEquals(204, client.delete("/api/workflows/" + id).code());
            assertEquals(404, client.get("/api/workflows/" + id).code());
            assertEquals(403, client.get("/api/workflows/bad.id").code());
        });
    }
}
