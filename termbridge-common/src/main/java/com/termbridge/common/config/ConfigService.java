package com.termbridge.common.config;

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
 * Loads and caches the termbridge JSON configuration.
 *
 * <p>
 * {@code ${VAR}} and {@code ${VAR:-default}} references are substituted from
 * the environment before parsing. A missing or unreadable file yields the
 * defaults.
 */
@Slf4j
public class ConfigService {

    public static final Path DEFAULT_CONFIG_PATH = Path.of("~", ".termbridge", "termbridge.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TermBridgeConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config, served from cache while fresh.
     */
    public TermBridgeConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force a re-read from disk.
     */
    public TermBridgeConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TermBridgeConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return ConfigDefaults.apply(new TermBridgeConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            TermBridgeConfig config = objectMapper.readValue(raw, TermBridgeConfig.class);
            if (config == null) {
                config = new TermBridgeConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return ConfigDefaults.apply(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return ConfigDefaults.apply(new TermBridgeConfig());
        }
    }

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

    static Path expandHome(Path path) {
        String str = path.toString();
        if (str.equals("~") || str.startsWith("~/") || str.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home") + str.substring(1));
        }
        return path;
    }

    /**
     * Environment lookup backed by a fixed map, for tests and embedding.
     */
    public static Function<String, String> mapEnv(Map<String, String> values) {
        return values::get;
    }
}
