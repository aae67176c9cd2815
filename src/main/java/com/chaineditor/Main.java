package com.chaineditor;

import com.chaineditor.catalog.BundledTemplateCatalog;
import com.chaineditor.controllers.Controller;
import com.chaineditor.controllers.EditorController;
import com.chaineditor.controllers.TemplateController;
import com.chaineditor.controllers.WorkflowController;
import com.chaineditor.session.EditSession;
import com.chaineditor.session.EditorEventLoop;
import com.chaineditor.session.InMemoryChainStore;
import com.chaineditor.storage.WorkflowStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.nio.file.Files;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            Files.createDirectories(config.getWorkspacePath());
            logger.info("Workspace initialized: " + config.getWorkspacePath());

            BundledTemplateCatalog catalog = new BundledTemplateCatalog(config.getWorkspacePath(), objectMapper);
            WorkflowStore workflowStore = new WorkflowStore(config.getWorkspacePath(), objectMapper);
            EditorEventLoop loop = new EditorEventLoop();
            EditSession session = new EditSession(new InMemoryChainStore(), loop, catalog);

            Javalin app = createApp(objectMapper, List.of(
                new TemplateController(catalog),
                new EditorController(session, loop, objectMapper),
                new WorkflowController(workflowStore, session, loop, objectMapper)
            ));

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                loop.close();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Chain Editor: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Build the Javalin app with every controller's routes and the shared exception handlers.
     */
    public static Javalin createApp(ObjectMapper mapper, List<Controller> controllers) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper));
            cfg.http.defaultContentType = "application/json";
        });
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Chain Editor v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(SecurityException.class, (e, ctx) -> {
            AppLogger.get().warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }
}
