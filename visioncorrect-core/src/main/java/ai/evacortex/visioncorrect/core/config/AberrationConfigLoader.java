/*
 * VisionCorrect — Refractive Pre-Correction Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.visioncorrect.core.config;

import ai.evacortex.visioncorrect.core.exceptions.ConfigurationException;
import ai.evacortex.visioncorrect.core.optics.Prescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads and writes {@link AberrationConfig} as JSON:
 * <pre>
 * {
 *   "od": { "sphere": -2.0, "cylinder": -0.5, "axis": 90, "pupilRadius": 2.5, "viewingDistance": 1.25 },
 *   "os": { "sphere": -1.75 },
 *   "settings": { "kernelSize": 256, "epsilon": 0.001 }
 * }
 * </pre>
 * Missing fields fall back to an emmetropic prescription and {@link OpticsSettings#defaults()};
 * unknown fields are rejected.
 */
public final class AberrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(AberrationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "visioncorrect-default.json";

    private final ObjectMapper mapper;

    public AberrationConfigLoader() {
        this(new ObjectMapper());
    }

    public AberrationConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public AberrationConfig load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            AberrationConfig config = parse(in);
            log.info("Loaded aberration config from {}: OD={} OS={}", path, config.od(), config.os());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration " + path, e);
        }
    }

    public AberrationConfig loadResource(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = AberrationConfigLoader.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found on classpath: " + resource);
            }
            return parse(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration resource " + resource, e);
        }
    }

    public AberrationConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public void save(AberrationConfig config, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, config);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration " + path, e);
        }
    }

    private AberrationConfig parse(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration root must be a JSON object");
        }
        try {
            Prescription od = merge(root.get("od"), Prescription.emmetropic(), Prescription.class);
            Prescription os = merge(root.get("os"), Prescription.emmetropic(), Prescription.class);
            OpticsSettings settings = merge(root.get("settings"), OpticsSettings.defaults(), OpticsSettings.class);
            return new AberrationConfig(od, os, settings);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private <T> T merge(JsonNode overrides, T defaults, Class<T> type) throws IOException {
        ObjectNode base = mapper.valueToTree(defaults);
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new ConfigurationException("Expected an object for " + type.getSimpleName() + ", got " + overrides.getNodeType());
            }
            overrides.fields().forEachRemaining(e -> base.set(e.getKey(), e.getValue()));
        }
        return mapper.treeToValue(base, type);
    }
}
