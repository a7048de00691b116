package com.ctrlsys.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * TOML-backed block and system parameters with defaults and write-back.
 *
 * Layout of the file:
 *
 * <pre>
 * [cart.params]
 * dt = 0.01
 * max_iter = 0
 *
 * [cart.blocks.pid_vel]
 * kp = 4.0
 * </pre>
 *
 * Each lookup starts from the defaults supplied by the caller and overlays
 * whatever the file holds for that key, field by field. Keys missing from the
 * file keep their defaults; unknown keys are ignored. The effective values of
 * every lookup are remembered and written back by save(), so a first run with
 * no file produces a complete, editable file.
 */
@Log4j2
public final class ParameterStore {
    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private final Path file;
    private final String systemName;
    private final ObjectNode persisted;
    private final ObjectNode writeBack;

    /**
     * Opens the store. A missing file is treated as empty.
     *
     * @throws ParameterStoreException if the file exists but cannot be read or parsed.
     */
    public ParameterStore(Path file, String systemName) {
        this.file = file;
        this.systemName = systemName;
        this.persisted = Files.exists(file) ? read(file) : MAPPER.createObjectNode();

        this.writeBack = MAPPER.createObjectNode();
        writeBack.putObject(systemName).putObject("blocks");
        log.debug("Opened parameter store {} for '{}' (exists={})", file, systemName, Files.exists(file));
    }

    private static ObjectNode read(Path file) {
        try {
            JsonNode root = MAPPER.readTree(file.toFile());
            return root instanceof ObjectNode on ? on : MAPPER.createObjectNode();
        } catch (IOException e) {
            throw new ParameterStoreException("Cannot read parameter file " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    public String systemName() {
        return systemName;
    }

    /**
     * Effective parameters of the control system itself, key {@code <system>.params}.
     */
    public <T> T getSystemParams(T defaults) {
        JsonNode override = persisted.path(systemName).path("params");
        T value = merge(defaults, override, "params");
        ((ObjectNode) writeBack.get(systemName)).set("params", MAPPER.valueToTree(value));
        return value;
    }

    /**
     * Effective parameters of one block, key {@code <system>.blocks.<blockName>}.
     */
    public <T> T getBlockParams(String blockName, T defaults) {
        JsonNode override = persisted.path(systemName).path("blocks").path(blockName);
        T value = merge(defaults, override, blockName);
        ((ObjectNode) writeBack.get(systemName).get("blocks")).set(blockName, MAPPER.valueToTree(value));
        return value;
    }

    @SuppressWarnings("unchecked")
    private <T> T merge(T defaults, JsonNode override, String key) {
        JsonNode effective = MAPPER.valueToTree(defaults);
        if (!override.isMissingNode()) {
            if (effective instanceof ObjectNode base && override instanceof ObjectNode over)
                overlay(base, over);
            else
                effective = override;
        }
        try {
            return (T) MAPPER.treeToValue(effective, defaults.getClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ParameterStoreException(
                    "Invalid parameters for '" + key + "' in " + file + ": " + e.getMessage(), e);
        }
    }

    private static void overlay(ObjectNode base, ObjectNode over) {
        var fields = over.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            JsonNode current = base.get(entry.getKey());
            if (current instanceof ObjectNode cur && entry.getValue() instanceof ObjectNode next)
                overlay(cur, next);
            else
                base.set(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Writes every value looked up so far back to the file.
     *
     * @throws ParameterStoreException on I/O failure.
     */
    public void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            MAPPER.writeValue(file.toFile(), writeBack);
            log.info("Saved parameters of '{}' to {}", systemName, file);
        } catch (IOException e) {
            throw new ParameterStoreException("Cannot write parameter file " + file, e);
        }
    }

    /** The document save() would write, as TOML text. */
    public String toToml() {
        try {
            return MAPPER.writeValueAsString(writeBack);
        } catch (JsonProcessingException e) {
            throw new ParameterStoreException("Cannot serialise parameters of '" + systemName + "'", e);
        }
    }
}
