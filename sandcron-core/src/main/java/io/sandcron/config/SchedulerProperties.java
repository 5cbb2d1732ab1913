package io.sandcron.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for the scheduler loop and the sandbox runner.
 */
public class SchedulerProperties {
    private boolean enabled = true;
    private Duration pollInterval = Duration.ofSeconds(60);
    private Duration taskTimeout = Duration.ofMinutes(10);
    private int maxConcurrentTasks = 4;
    private long maxOutputBytes = 10L * 1024 * 1024;
    private String timezone = "UTC";
    private Path groupsDir = Path.of("groups");
    private Path dataDir = Path.of("data");
    private Path logsDir = Path.of("groups", "logs");
    private boolean journalEnabled = true;
    private boolean ensureIndexesOnStartup = false;
    private final Sandbox sandbox = new Sandbox();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public void setTaskTimeout(Duration taskTimeout) {
        this.taskTimeout = taskTimeout;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    public long getMaxOutputBytes() {
        return maxOutputBytes;
    }

    public void setMaxOutputBytes(long maxOutputBytes) {
        this.maxOutputBytes = maxOutputBytes;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    /**
     * Configured zone, falling back to UTC when unset or unknown.
     */
    public ZoneId zoneId() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            return ZoneId.of("UTC");
        }
    }

    public Path getGroupsDir() {
        return groupsDir;
    }

    public void setGroupsDir(Path groupsDir) {
        this.groupsDir = groupsDir;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path getLogsDir() {
        return logsDir;
    }

    public void setLogsDir(Path logsDir) {
        this.logsDir = logsDir;
    }

    public boolean isJournalEnabled() {
        return journalEnabled;
    }

    public void setJournalEnabled(boolean journalEnabled) {
        this.journalEnabled = journalEnabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    /**
     * How the default Docker-based sandbox command is built.
     */
    public static class Sandbox {
        private String command = "docker";
        private String image = "anthropic/claude-code:latest";
        private String entrypoint;
        private List<String> args = new ArrayList<>();
        private List<String> envPassthrough = new ArrayList<>(
                List.of("CLAUDE_CODE_OAUTH_TOKEN", "ANTHROPIC_API_KEY", "ANTHROPIC_BASE_URL"));

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getImage() {
            return image;
        }

        public void setImage(String image) {
            this.image = image;
        }

        public String getEntrypoint() {
            return entrypoint;
        }

        public void setEntrypoint(String entrypoint) {
            this.entrypoint = entrypoint;
        }

        public List<String> getArgs() {
            return args;
        }

        public void setArgs(List<String> args) {
            this.args = args;
        }

        public List<String> getEnvPassthrough() {
            return envPassthrough;
        }

        public void setEnvPassthrough(List<String> envPassthrough) {
            this.envPassthrough = envPassthrough;
        }
    }
}
