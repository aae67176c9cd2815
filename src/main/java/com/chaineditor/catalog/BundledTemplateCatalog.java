package com.chaineditor.catalog;

import com.chaineditor.AppLogger;
import com.chaineditor.model.NodeTemplate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads bundled templates from the classpath (templates/catalog.json) and project
 * templates from .chain-editor/templates/*.json. Project templates shadow bundled ones by id.
 * A file may hold one template object or an array of them.
 */
public class BundledTemplateCatalog implements TemplateCatalog {

    static final String BUNDLED_CATALOG = "templates/catalog.json";

    private final ObjectMapper objectMapper;
    private final Path projectTemplatesDir;
    private final AppLogger logger = AppLogger.get();
    private final Map<String, NodeTemplate> templates = new LinkedHashMap<>();

    public BundledTemplateCatalog(Path workspaceRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.projectTemplatesDir = workspaceRoot != null
            ? workspaceRoot.resolve(".chain-editor").resolve("templates")
            : null;
        reload();
    }

    public synchronized void reload() {
        templates.clear();
        loadBundled();
        loadProject();
        logger.info("TemplateCatalog loaded " + templates.size() + " templates");
    }

    @Override
    public synchronized List<NodeTemplate> list() {
        return new ArrayList<>(templates.values());
    }

    @Override
    public synchronized Optional<NodeTemplate> find(String templateId) {
        return Optional.ofNullable(templateId == null ? null : templates.get(templateId));
    }

    private void loadBundled() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(BUNDLED_CATALOG)) {
            if (is == null) {
                logger.warn("Bundled template catalog not found on classpath: " + BUNDLED_CATALOG);
                return;
            }
            String json = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            register(objectMapper.readTree(json), BUNDLED_CATALOG);
        } catch (IOException e) {
            logger.warn("Failed to load bundled templates: " + e.getMessage());
        }
    }

    private void loadProject() {
        if (projectTemplatesDir == null || !Files.isDirectory(projectTemplatesDir)) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectTemplatesDir, "*.json")) {
            for (Path file : stream) {
                try {
                    String json = Files.readString(file, StandardCharsets.UTF_8);
                    register(objectMapper.readTree(json), file.getFileName().toString());
                } catch (IOException e) {
                    logger.warn("Failed to load project template " + file.getFileName() + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to scan project templates dir: " + e.getMessage());
        }
    }

    private void register(JsonNode node, String source) throws IOException {
        if (node.isArray()) {
            for (JsonNode entry : node) {
                register(entry, source);
            }
            return;
        }
        NodeTemplate template = objectMapper.treeToValue(node, NodeTemplate.class);
        if (template.getId() == null || template.getId().isBlank()) {
            logger.warn("Template missing id in " + source);
            return;
        }
        if (template.getType() == null || template.getType().isBlank()) {
            logger.warn("Template " + template.getId() + " missing type in " + source);
            return;
        }
        templates.put(template.getId(), template); // shadows bundled
    }
}
