package com.agentrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the relay configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    private static final String DEFAULT_STATE_DIR = "~/.agentrelay";

    private final ObjectMapper objectMapper;
    private final Cache<String, RelayConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public RelayConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public RelayConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private RelayConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new RelayConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            RelayConfig config = objectMapper.readValue(raw, RelayConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new RelayConfig());
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new RelayConfig());
        }
    }

    /**
     * Fill in path defaults and missing sections.
     */
    static RelayConfig applyDefaults(RelayConfig config) {
        if (config.getStateDir() == null || config.getStateDir().isBlank()) {
            config.setStateDir(DEFAULT_STATE_DIR);
        }
        config.setStateDir(expandHome(config.getStateDir()).toString());
        if (config.getSessionDir() == null || config.getSessionDir().isBlank()) {
            config.setSessionDir(Path.of(config.getStateDir(), "sessions").toString());
        } else {
            config.setSessionDir(expandHome(config.getSessionDir()).toString());
        }
        if (config.getWorkspace() == null || config.getWorkspace().isBlank()) {
            config.setWorkspace(System.getProperty("user.dir"));
        } else {
            config.setWorkspace(expandHome(config.getWorkspace()).toString());
        }
        if (config.getRouter() == null) {
            config.setRouter(new RelayConfig.RouterConfig());
        }
        if (config.getHeartbeat() == null) {
            config.setHeartbeat(new RelayConfig.HeartbeatConfig());
        }
        if (config.getCron() == null) {
            config.setCron(new RelayConfig.CronConfig());
        }
        if (config.getCron().getStore() == null || config.getCron().getStore().isBlank()) {
            config.getCron().setStore(Path.of(config.getStateDir(), "cron-jobs.json").toString());
        }
        if (config.getBackend() == null) {
            config.setBackend(new RelayConfig.BackendConfig());
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Expand a leading ~ to the user home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    /** Environment lookup backed by a fixed map, for tests and embedding. */
    public static Function<String, String> envOf(Map<String, String> values) {
        return values::get;
    }
}
