package io.friendlyclp.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ShellConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Reads the shell settings, filling every key the file leaves out from {@link ShellConfig#defaults()}.
     */
    public ShellConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ShellConfig.defaults();
        }

        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        if (existingNode == null || existingNode.isMissingNode()) {
            return ShellConfig.defaults();
        }
        if (!existingNode.isObject()) {
            throw new IOException("Shell config must be a JSON object: " + configPath);
        }

        // ShellConfig is flat, so keys from the file replace default keys one for one.
        ObjectNode merged = mapper.valueToTree(ShellConfig.defaults());
        merged.setAll((ObjectNode) existingNode);
        return mapper.treeToValue(merged, ShellConfig.class);
    }

    public void save(Path configPath, ShellConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        ShellConfig config = created || overwrite ? ShellConfig.defaults() : load(configPath);
        save(configPath, config);
        return new InitResult(configPath, created, !created && overwrite);
    }
}
