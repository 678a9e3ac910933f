package org.srm.alerting.config.settings;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.srm.alerting.config.settings.models.ToolSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads the tool settings, validating them against the bundled JSON schema first.
 */
public class ToolSettingsHelper {
    private static final Logger log = LoggerFactory.getLogger(ToolSettingsHelper.class);

    public static final String DEFAULT_SETTINGS = "classpath:settings/alerting-tool.json";
    private static final String SCHEMA = "classpath:settings/settings_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final ResourceLoader resourceLoader = new DefaultResourceLoader();

    public static ToolSettings loadDefault() {
        return load(DEFAULT_SETTINGS);
    }

    public static ToolSettings load(Path settingsFile) {
        return load("file:" + settingsFile.toAbsolutePath());
    }

    /**
     * @param location a Spring resource location, e.g. "classpath:settings/alerting-tool.json" or "file:/etc/tool.json"
     * @throws IllegalArgumentException if the resource is missing or does not match the schema
     */
    public static ToolSettings load(String location) {
        JsonNode settingsNode = readTree(location);
        validate(settingsNode, location);
        try {
            return mapper.treeToValue(settingsNode, ToolSettings.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to map settings: " + location, e);
        }
    }

    public static void validate(JsonNode settingsNode, String location) {
        JsonSchema schema = factory.getSchema(readTree(SCHEMA));
        Set<ValidationMessage> result = schema.validate(settingsNode);
        if (!result.isEmpty()) {
            String messages = result.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("\n - ", "\n - ", ""));
            throw new IllegalArgumentException("Settings " + location + " are invalid:" + messages);
        }
        log.debug("Settings {} are valid", location);
    }

    private static JsonNode readTree(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalArgumentException("Resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON in resource: " + location, e);
        }
    }

    /**
     * Expands "{date}" in a definition suffix.
     */
    public static String resolveSuffix(String suffix, LocalDate date) {
        if (suffix == null) {
            return null;
        }
        return suffix.replace("{date}", date.toString());
    }
}
