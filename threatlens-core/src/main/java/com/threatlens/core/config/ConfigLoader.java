package com.threatlens.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Utility for loading ThreatLens configuration.
 *
 * <p>Reads an optional {@code threatlens.yaml} with Jackson into {@link ThreatLensConfig} and
 * then overlays environment variables, which win over file values:
 * <ul>
 *   <li>{@code THREATLENS_API_KEY} - caller secret</li>
 *   <li>{@code OPENROUTER_API_KEY} - advisory provider credential</li>
 *   <li>{@code OPENROUTER_MODEL}, {@code OPENROUTER_PROVIDER}, {@code OPENROUTER_REFERER},
 *       {@code OPENROUTER_TITLE}, {@code OPENROUTER_BASE_URL} - advisory defaults</li>
 * </ul>
 *
 * <p>A missing or unparsable file is not an error: a warning is logged and defaults are used.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ThreatLensConfig config = ConfigLoader.load(Paths.get("threatlens.yaml"), System.getenv());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String ENV_API_KEY = "THREATLENS_API_KEY";
    public static final String ENV_ADVISORY_API_KEY = "OPENROUTER_API_KEY";
    public static final String ENV_ADVISORY_MODEL = "OPENROUTER_MODEL";
    public static final String ENV_ADVISORY_PROVIDER = "OPENROUTER_PROVIDER";
    public static final String ENV_ADVISORY_REFERER = "OPENROUTER_REFERER";
    public static final String ENV_ADVISORY_TITLE = "OPENROUTER_TITLE";
    public static final String ENV_ADVISORY_BASE_URL = "OPENROUTER_BASE_URL";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file (optional) and an environment map.
     *
     * @param configPath path to {@code threatlens.yaml}, or null to skip the file
     * @param environment environment variables, usually {@code System.getenv()}
     * @return configuration with environment overlay applied
     */
    public static ThreatLensConfig load(Path configPath, Map<String, String> environment) {
        return applyEnvironment(readFile(configPath), environment == null ? Map.of() : environment);
    }

    /**
     * Reads the YAML file, falling back to defaults when it is absent or invalid.
     *
     * @param configPath path to the file, or null
     * @return file configuration or defaults
     */
    static ThreatLensConfig readFile(Path configPath) {
        if (configPath == null) {
            return ThreatLensConfig.defaults();
        }
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ThreatLensConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ThreatLensConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ThreatLensConfig config = YAML_MAPPER.readValue(configPath.toFile(), ThreatLensConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ThreatLensConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ThreatLensConfig.defaults();
        }
    }

    private static ThreatLensConfig applyEnvironment(ThreatLensConfig config, Map<String, String> env) {
        AdvisorySettings advisory = config.advisory();
        AdvisorySettings overlaid = new AdvisorySettings(
            firstNonBlank(env.get(ENV_ADVISORY_API_KEY), advisory.apiKey()),
            firstNonBlank(env.get(ENV_ADVISORY_BASE_URL), advisory.baseUrl()),
            firstNonBlank(env.get(ENV_ADVISORY_MODEL), advisory.defaultModel()),
            firstNonBlank(env.get(ENV_ADVISORY_PROVIDER), advisory.provider()),
            firstNonBlank(env.get(ENV_ADVISORY_REFERER), advisory.referer()),
            firstNonBlank(env.get(ENV_ADVISORY_TITLE), advisory.title()),
            advisory.defaultTimeoutMs(),
            advisory.defaultMaxFindings(),
            advisory.largeChangeThreshold(),
            advisory.maxPromptDiffChars()
        );
        return new ThreatLensConfig(
            firstNonBlank(env.get(ENV_API_KEY), config.apiKey()),
            config.maxDiffChars(),
            overlaid
        );
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred.trim() : fallback;
    }
}
