package io.seqflow.client;

import io.seqflow.client.registration.ConflictPolicy;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.eclipse.microprofile.config.Config;

/// Connection and behavior settings for a {@link SeqflowClient}.
///
/// ### Default Values
/// - `serverUrl`: `http://localhost:8080`
/// - `agentsPath`: `/api/v1/agents`
/// - `workflowsPath`: `/api/v1/sequential-workflows`
/// - `healthPath`: `/v1/health`
/// - `connectTimeout`: 10 seconds
/// - `requestTimeout`: 300 seconds, long enough for a full synchronous run
/// - `conflictPolicy`: {@link ConflictPolicy#REPLACE}
/// - `verifyRegistration`: `false`
///
/// ### Properties
/// ```
/// seqflow.server.url                        seqflow.client.connect-timeout-seconds
/// seqflow.server.agents-path                seqflow.client.request-timeout-seconds
/// seqflow.server.workflows-path             seqflow.registration.conflict-policy
/// seqflow.server.health-path                seqflow.registration.verify
/// ```
///
/// @implNote Immutable and thread-safe.
/// @see #load() for classpath, system property and environment configuration
public final class SeqflowClientConfig {

    /// Classpath resource read by {@link #load()}.
    public static final String RESOURCE_NAME = "seqflow-client.properties";

    static final String SERVER_URL = "seqflow.server.url";
    static final String AGENTS_PATH = "seqflow.server.agents-path";
    static final String WORKFLOWS_PATH = "seqflow.server.workflows-path";
    static final String HEALTH_PATH = "seqflow.server.health-path";
    static final String CONNECT_TIMEOUT = "seqflow.client.connect-timeout-seconds";
    static final String REQUEST_TIMEOUT = "seqflow.client.request-timeout-seconds";
    static final String CONFLICT_POLICY = "seqflow.registration.conflict-policy";
    static final String VERIFY_REGISTRATION = "seqflow.registration.verify";

    private final String serverUrl;
    private final String agentsPath;
    private final String workflowsPath;
    private final String healthPath;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final ConflictPolicy conflictPolicy;
    private final boolean verifyRegistration;

    private SeqflowClientConfig(Builder builder) {
        this.serverUrl =
                stripTrailingSlash(
                        Objects.requireNonNull(builder.serverUrl, "Server URL required"));
        this.agentsPath = normalizePath(builder.agentsPath, "agentsPath");
        this.workflowsPath = normalizePath(builder.workflowsPath, "workflowsPath");
        this.healthPath = normalizePath(builder.healthPath, "healthPath");
        this.connectTimeout =
                Objects.requireNonNull(builder.connectTimeout, "connectTimeout required");
        this.requestTimeout =
                Objects.requireNonNull(builder.requestTimeout, "requestTimeout required");
        this.conflictPolicy =
                Objects.requireNonNull(builder.conflictPolicy, "conflictPolicy required");
        this.verifyRegistration = builder.verifyRegistration;

        if (serverUrl.isBlank()) {
            throw new IllegalStateException("Server URL must not be blank");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalStateException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalStateException("requestTimeout must be positive");
        }
    }

    /// Returns a configuration with all defaults.
    ///
    /// @return default configuration, never null
    public static SeqflowClientConfig defaults() {
        return builder().build();
    }

    /// Binds a configuration from MicroProfile Config. Absent keys keep their defaults.
    ///
    /// Values are converted by the config implementation: whole seconds for timeouts,
    /// `true`/`false` for flags and case-insensitive constant names for the conflict policy.
    ///
    /// @param config config to read `seqflow.*` keys from, not null
    /// @return bound configuration, never null
    /// @throws IllegalArgumentException if a value cannot be converted
    public static SeqflowClientConfig fromConfig(Config config) {
        Objects.requireNonNull(config, "config must not be null");
        Builder builder = builder();
        config.getOptionalValue(SERVER_URL, String.class).ifPresent(builder::serverUrl);
        config.getOptionalValue(AGENTS_PATH, String.class).ifPresent(builder::agentsPath);
        config.getOptionalValue(WORKFLOWS_PATH, String.class).ifPresent(builder::workflowsPath);
        config.getOptionalValue(HEALTH_PATH, String.class).ifPresent(builder::healthPath);
        config.getOptionalValue(CONNECT_TIMEOUT, Long.class)
                .map(Duration::ofSeconds)
                .ifPresent(builder::connectTimeout);
        config.getOptionalValue(REQUEST_TIMEOUT, Long.class)
                .map(Duration::ofSeconds)
                .ifPresent(builder::requestTimeout);
        config.getOptionalValue(CONFLICT_POLICY, ConflictPolicy.class)
                .ifPresent(builder::conflictPolicy);
        config.getOptionalValue(VERIFY_REGISTRATION, Boolean.class)
                .ifPresent(builder::verifyRegistration);
        return builder.build();
    }

    /// Binds a configuration from in-memory properties, without system or environment
    /// overrides.
    ///
    /// @param properties source properties, not null
    /// @return bound configuration, never null
    /// @throws IllegalArgumentException if a value cannot be converted
    public static SeqflowClientConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Map<String, String> values = new HashMap<>();
        for (String key : properties.stringPropertyNames()) {
            values.put(key, properties.getProperty(key));
        }
        return fromConfig(
                new SmallRyeConfigBuilder()
                        .withSources(new PropertiesConfigSource(values, "properties", 100))
                        .build());
    }

    /// Reads {@value #RESOURCE_NAME} from the context class loader, overridable by system
    /// properties (`-Dseqflow.server.url=...`) and environment variables
    /// (`SEQFLOW_SERVER_URL`).
    ///
    /// @return bound configuration; defaults for every key nothing sets
    /// @throws UncheckedIOException if the resource exists but cannot be read
    public static SeqflowClientConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SeqflowClientConfig.class.getClassLoader();
        }
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder().addDefaultSources();
        URL resource = loader.getResource(RESOURCE_NAME);
        if (resource != null) {
            try {
                builder.withSources(new PropertiesConfigSource(resource, 150));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
            }
        }
        return fromConfig(builder.build());
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getAgentsPath() {
        return agentsPath;
    }

    public String getWorkflowsPath() {
        return workflowsPath;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /// Returns the per-request timeout. Streaming requests are bounded by it as well.
    ///
    /// @return request timeout, never null
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public boolean isVerifyRegistration() {
        return verifyRegistration;
    }

    /// Returns the path of one stored workflow.
    ///
    /// @param workflowId workflow id, not null
    /// @return `{workflowsPath}/{workflowId}`, never null
    public String workflowPath(String workflowId) {
        return workflowsPath + "/" + workflowId;
    }

    public Builder toBuilder() {
        return builder()
                .serverUrl(serverUrl)
                .agentsPath(agentsPath)
                .workflowsPath(workflowsPath)
                .healthPath(healthPath)
                .connectTimeout(connectTimeout)
                .requestTimeout(requestTimeout)
                .conflictPolicy(conflictPolicy)
                .verifyRegistration(verifyRegistration);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link SeqflowClientConfig}.
    public static final class Builder {
        private String serverUrl = "http://localhost:8080";
        private String agentsPath = "/api/v1/agents";
        private String workflowsPath = "/api/v1/sequential-workflows";
        private String healthPath = "/v1/health";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(300);
        private ConflictPolicy conflictPolicy = ConflictPolicy.REPLACE;
        private boolean verifyRegistration;

        private Builder() {}

        /// Sets the server base URL, e.g. `http://localhost:8080`.
        ///
        /// @param serverUrl base URL without path, not null
        /// @return this builder for chaining
        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl;
            return this;
        }

        public Builder agentsPath(String agentsPath) {
            this.agentsPath = agentsPath;
            return this;
        }

        public Builder workflowsPath(String workflowsPath) {
            this.workflowsPath = workflowsPath;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder conflictPolicy(ConflictPolicy conflictPolicy) {
            this.conflictPolicy = conflictPolicy;
            return this;
        }

        /// Enables a read-back of the stored definition after each registration.
        ///
        /// @param verifyRegistration `true` to verify
        /// @return this builder for chaining
        public Builder verifyRegistration(boolean verifyRegistration) {
            this.verifyRegistration = verifyRegistration;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @return new configuration, never null
        /// @throws IllegalStateException if the URL is blank or a timeout is not positive
        public SeqflowClientConfig build() {
            return new SeqflowClientConfig(this);
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String normalizePath(String path, String name) {
        Objects.requireNonNull(path, name + " required");
        String trimmed = stripTrailingSlash(path);
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    @Override
    public String toString() {
        return "SeqflowClientConfig{serverUrl='"
                + serverUrl
                + "', conflictPolicy="
                + conflictPolicy
                + ", verifyRegistration="
                + verifyRegistration
                + "}";
    }
}
