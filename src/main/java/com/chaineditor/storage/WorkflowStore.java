package com.chaineditor.storage;

import com.chaineditor.AppLogger;
import com.chaineditor.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Persistence for saved workflows.
 *
 * Layout:
 *   .chain-editor/workflows/{workflowId}.json   one definition per file, written atomically
 */
public class WorkflowStore {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private final Path workflowsRoot;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public WorkflowStore(Path workspaceRoot, ObjectMapper objectMapper) {
        this.workflowsRoot = workspaceRoot.resolve(".chain-editor").resolve("workflows");
        this.objectMapper = objectMapper;
    }

    public String generateWorkflowId() {
        return "wf_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Create or overwrite a workflow. Assigns an id and timestamps where missing.
     */
    public WorkflowDefinition save(WorkflowDefinition definition) throws IOException {
        if (definition.getId() == null || definition.getId().isBlank()) {
            definition.setId(generateWorkflowId());
        }
        long now = System.currentTimeMillis();
        if (definition.getCreatedAt() == 0L) {
            definition.setCreatedAt(now);
        }
        definition.setUpdatedAt(now);
        Files.createDirectories(workflowsRoot);
        writeJsonAtomic(fileFor(definition.getId()), definition);
        logger.info("Workflow saved: " + definition.getId() + " (" + definition.getNodes().size() + " nodes)");
        return definition;
    }

    /**
     * Read a workflow, or null if none exists under {@code workflowId}.
     */
    public WorkflowDefinition load(String workflowId) throws IOException {
        Path file = fileFor(workflowId);
        if (!Files.exists(file)) {
            return null;
        }
        return objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), WorkflowDefinition.class);
    }

    /**
     * All readable workflows, most recently updated first. Unreadable files are logged and skipped.
     */
    public List<WorkflowDefinition> list() throws IOException {
        List<WorkflowDefinition> result = new ArrayList<>();
        if (!Files.isDirectory(workflowsRoot)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(workflowsRoot, "*.json")) {
            for (Path file : stream) {
                try {
                    result.add(objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8),
                        WorkflowDefinition.class));
                } catch (IOException e) {
                    logger.warn("Failed to read workflow: " + file.getFileName() + " (" + e.getMessage() + ")");
                }
            }
        }
        result.sort(Comparator.comparingLong(WorkflowDefinition::getUpdatedAt).reversed());
        return result;
    }

    public boolean delete(String workflowId) throws IOException {
        boolean deleted = Files.deleteIfExists(fileFor(workflowId));
        if (deleted) {
            logger.info("Workflow deleted: " + workflowId);
        }
        return deleted;
    }

    private Path fileFor(String workflowId) {
        if (workflowId == null || !ID_PATTERN.matcher(workflowId).matches()) {
            throw new SecurityException("Invalid workflow id: " + workflowId);
        }
        return workflowsRoot.resolve(workflowId + ".json");
    }

    /**
     * Atomic write: write to .tmp file, then rename.
     */
    private void writeJsonAtomic(Path target, Object value) throws IOException {
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
