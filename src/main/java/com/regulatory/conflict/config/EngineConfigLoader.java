package com.regulatory.conflict.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link EngineConfig} from JSON. Absent fields keep their defaults; present but
 * malformed fields fail the whole load.
 *
 * <pre>
 * {
 *   "confidenceThreshold": 0.6,
 *   "similarityThreshold": 0.8,
 *   "severityWeights": {"authorityGap": 0.4, "reach": 0.3, "urgency": 0.3},
 *   "precedenceTable": ["treaty", "EU", "national"],
 *   "delegationRules": {"aviation-safety": "EASA"},
 *   "harmonizationPolicy": "MOST_RESTRICTIVE",
 *   "slaWindows": {"1": "PT48H", "2": "PT24H", "3": "PT8H"},
 *   "stakeholders": {"1": "compliance-officer", "2": "legal-counsel"}
 * }
 * </pre>
 */
public class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "conflict-engine-defaults.json";

    private final ObjectMapper objectMapper;

    public EngineConfigLoader() {
        this(new ObjectMapper());
    }

    public EngineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read configuration from " + path, e);
        }
    }

    /**
     * Loads the configuration bundled with the library.
     */
    public EngineConfig loadDefaults() {
        return loadResource(DEFAULTS_RESOURCE);
    }

    /**
     * Loads a configuration from the classpath.
     */
    public EngineConfig loadResource(String resource) {
        InputStream in = EngineConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new InvalidConfigurationException("Configuration resource not found: " + resource);
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    public EngineConfig load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Configuration is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Configuration root must be a JSON object");
        }
        EngineConfig config = fromJson(root);
        log.info("config.loaded {}", config);
        return config;
    }

    EngineConfig fromJson(JsonNode root) {
        EngineConfig.Builder builder = EngineConfig.builder();

        if (root.has("confidenceThreshold")) {
            builder.confidenceThreshold(number(root, "confidenceThreshold"));
        }
        if (root.has("similarityThreshold")) {
            builder.similarityThreshold(number(root, "similarityThreshold"));
        }
        if (root.has("highSeverityThreshold")) {
            builder.highSeverityThreshold(number(root, "highSeverityThreshold"));
        }
        if (root.has("authorityScale")) {
            builder.authorityScale((int) number(root, "authorityScale"));
        }
        if (root.has("urgencyHorizonDays")) {
            builder.urgencyHorizonDays((int) number(root, "urgencyHorizonDays"));
        }
        if (root.has("severityWeights")) {
            JsonNode weights = object(root, "severityWeights");
            builder.severityWeights(new SeverityWeights(
                    number(weights, "authorityGap"),
                    number(weights, "reach"),
                    number(weights, "urgency")));
        }
        if (root.has("precedenceTable")) {
            builder.precedenceTable(PrecedenceTable.of(stringList(root, "precedenceTable")));
        }
        if (root.has("delegationRules")) {
            builder.delegationRules(stringMap(object(root, "delegationRules")));
        }
        if (root.has("harmonizationPolicy")) {
            String policy = text(root, "harmonizationPolicy");
            try {
                builder.harmonizationPolicy(HarmonizationPolicy.valueOf(policy));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Unknown harmonizationPolicy: " + policy, e);
            }
        }
        if (root.has("slaWindows") || root.has("stakeholders")) {
            Map<Integer, Duration> windows = new LinkedHashMap<>();
            if (root.has("slaWindows")) {
                stringMap(object(root, "slaWindows")).forEach((level, window) ->
                        windows.put(level(level), duration(window, "slaWindows." + level)));
            }
            Map<Integer, String> stakeholders = new LinkedHashMap<>();
            if (root.has("stakeholders")) {
                stringMap(object(root, "stakeholders")).forEach((level, ref) -> stakeholders.put(level(level), ref));
            }
            if (windows.isEmpty()) {
                throw new InvalidConfigurationException("stakeholders given without slaWindows");
            }
            builder.slaPolicy(SlaPolicy.of(windows, stakeholders));
        }
        if (root.has("similarityTimeout")) {
            builder.similarityTimeout(duration(text(root, "similarityTimeout"), "similarityTimeout"));
        }
        if (root.has("detectionParallelism")) {
            builder.detectionParallelism((int) number(root, "detectionParallelism"));
        }
        if (root.has("resolutionMaxRetries")) {
            builder.resolutionMaxRetries((int) number(root, "resolutionMaxRetries"));
        }
        if (root.has("notificationMaxAttempts")) {
            builder.notificationMaxAttempts((int) number(root, "notificationMaxAttempts"));
        }
        if (root.has("notificationTimeout")) {
            builder.notificationTimeout(duration(text(root, "notificationTimeout"), "notificationTimeout"));
        }
        return builder.build();
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new InvalidConfigurationException(field + " must be a number");
        }
        return value.asDouble();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new InvalidConfigurationException(field + " must be a string");
        }
        return value.asText();
    }

    private static JsonNode object(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new InvalidConfigurationException(field + " must be an object");
        }
        return value;
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new InvalidConfigurationException(field + " must be an array");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw new InvalidConfigurationException(field + " must only contain strings");
            }
            result.add(element.asText());
        }
        return result;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new InvalidConfigurationException("Value of '" + entry.getKey() + "' must be a string");
            }
            result.put(entry.getKey(), entry.getValue().asText());
        }
        return result;
    }

    private static int level(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Escalation level must be an integer: " + key, e);
        }
    }

    private static Duration duration(String value, String field) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException(field + " must be an ISO-8601 duration, got " + value, e);
        }
    }
}
