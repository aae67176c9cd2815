package com.chaineditor.controllers;

import com.chaineditor.AppLogger;
import com.chaineditor.catalog.TemplateCatalog;
import com.chaineditor.model.NodeTemplate;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the node template catalog.
 */
public class TemplateController implements Controller {

    private final TemplateCatalog catalog;
    private final AppLogger logger;

    public TemplateController(TemplateCatalog catalog) {
        this.catalog = catalog;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/templates", this::getTemplates);
        app.get("/api/templates/{id}", this::getTemplate);
    }

    private void getTemplates(Context ctx) {
        try {
            ctx.json(catalog.list());
        } catch (Exception e) {
            logger.error("Error listing templates: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getTemplate(Context ctx) {
        String id = ctx.pathParam("id");
        Optional<NodeTemplate> template = catalog.find(id);
        if (template.isPresent()) {
            ctx.json(template.get());
        } else {
            ctx.status(404).json(Map.of("error", "Template not found: " + id));
        }
    }
}
