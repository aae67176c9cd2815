package com.chaineditor;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Startup configuration.
 *
 * Layout under the workspace:
 *   .chain-editor/logs/chain-editor.log
 *   .chain-editor/templates/*.json      project templates
 *   .chain-editor/workflows/*.json      saved workflows
 */
public class AppConfig {

    static final String WORKSPACE_ENV = "CHAIN_EDITOR_WORKSPACE";
    static final int DEFAULT_PORT = 8080;

    private final Path workspacePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path workspacePath, Path logPath, int port, boolean devMode) {
        this.workspacePath = workspacePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getWorkspacePath() {
        return workspacePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * {@code $CHAIN_EDITOR_WORKSPACE} when set, otherwise {@code ~/Chain-Editor/workspace}.
     */
    static Path defaultWorkspacePath(String fromEnv) {
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Paths.get(fromEnv).toAbsolutePath().normalize();
        }
        return Paths.get(System.getProperty("user.home"), "Chain-Editor", "workspace");
    }

    static Path logFileFor(Path workspace) {
        return workspace.resolve(".chain-editor").resolve("logs").resolve("chain-editor.log");
    }

    /**
     * The preferred port when it can be bound, else whatever port the OS hands out.
     */
    static int resolvePort(int preferredPort) {
        try (ServerSocket socket = new ServerSocket(preferredPort)) {
            socket.setReuseAddress(true);
            return preferredPort;
        } catch (IOException busy) {
            try (ServerSocket socket = new ServerSocket(0)) {
                return socket.getLocalPort();
            } catch (IOException e) {
                // let Javalin report the bind failure
                return preferredPort;
            }
        }
    }

    public static class Builder {
        private Path workspacePath;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode;

        public Builder workspacePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.workspacePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        /**
         * Accepts {@code --workspace <dir>}, {@code --port <n>} (also in {@code --opt=value} form)
         * and {@code --dev}. Anything else is ignored.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String value = null;
                String option = arg;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    option = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                } else if (i + 1 < args.length && ("--workspace".equals(arg) || "--port".equals(arg))) {
                    value = args[++i];
                }

                switch (option) {
                    case "--workspace":
                        workspacePath(value);
                        break;
                    case "--port":
                        preferredPort = parsePort(value, preferredPort);
                        break;
                    case "--dev":
                        devMode = true;
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        Path getWorkspacePath() {
            return workspacePath;
        }

        int getPreferredPort() {
            return preferredPort;
        }

        boolean isDevMode() {
            return devMode;
        }

        public AppConfig build() throws IOException {
            Path workspace = workspacePath != null ? workspacePath : defaultWorkspacePath(System.getenv(WORKSPACE_ENV));
            Path logPath = logFileFor(workspace);
            Files.createDirectories(logPath.getParent());
            return new AppConfig(workspace, logPath, resolvePort(preferredPort), devMode);
        }

        private static int parsePort(String raw, int fallback) {
            if (raw == null) {
                return fallback;
            }
            try {
                int port = Integer.parseInt(raw.trim());
                return port >= 0 && port <= 65535 ? port : fallback;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
    }
}
