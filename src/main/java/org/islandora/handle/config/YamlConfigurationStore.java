package org.islandora.handle.config;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.filerepository.FileRepositoryUtility;

/**
 * YamlConfigurationStore holds the Handle associations read from the `associations` list of a
 * YAML document. Every entry needs a `content_model`, a `datastream` and a `transform`:
 *
 * <pre>
 * associations:
 *   - content_model: "islandora:sp_basic_image"
 *     datastream: "MODS"
 *     transform: "xsl/add_handle_identifier_mods.xsl"
 * </pre>
 */
public class YamlConfigurationStore implements ConfigurationStore {
    private static final Log logConfigStore = LogFactory.getLog(YamlConfigurationStore.class);
    private final List<Association> associations;

    public static final String ASSOCIATIONS_KEY = "associations";

    /**
     * Load associations from a YAML file.
     *
     * @param configYaml Path to the YAML document
     * @throws IOException              When the file is missing or cannot be parsed
     * @throws IllegalArgumentException When an association entry is incomplete
     */
    public YamlConfigurationStore(Path configYaml) throws IOException, IllegalArgumentException {
        FileRepositoryUtility.ensureNotNull(configYaml, "configYaml", "YamlConfigurationStore");
        this.associations = Collections.unmodifiableList(loadAssociations(configYaml));
        logConfigStore.debug(
            "Loaded " + associations.size() + " Handle associations from: " + configYaml);
    }

    /**
     * Hold the given associations, in the given order.
     *
     * @param associations Associations to serve
     */
    public YamlConfigurationStore(Collection<Association> associations) {
        FileRepositoryUtility.ensureNotNull(associations, "associations", "YamlConfigurationStore");
        this.associations = Collections.unmodifiableList(new ArrayList<>(associations));
    }

    @Override
    public List<Association> associationsFor(Collection<String> contentModels) {
        FileRepositoryUtility.ensureNotNull(contentModels, "contentModels", "associationsFor");
        List<Association> found = new ArrayList<>();
        for (String contentModel : contentModels) {
            for (Association association : associations) {
                if (association.contentModel().equals(contentModel)) {
                    found.add(association);
                }
            }
        }
        return found;
    }

    /**
     * @return Every configured association, in configuration order
     */
    public List<Association> getAssociations() {
        return associations;
    }

    /**
     * Read the `associations` list from a YAML document.
     *
     * @param configYaml Path to YAML document
     * @return Associations in document order
     * @throws IOException If the document doesn't exist or cannot be parsed
     */
    protected static List<Association> loadAssociations(Path configYaml) throws IOException {
        if (!Files.exists(configYaml)) {
            String errMsg = "Handle configuration does not exist at: " + configYaml;
            logConfigStore.fatal(errMsg);
            throw new IOException(errMsg);
        }
        File configYamlFile = configYaml.toFile();
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        HashMap<?, ?> configProperties;
        try {
            configProperties = om.readValue(configYamlFile, HashMap.class);

        } catch (IOException ioe) {
            logConfigStore.fatal(
                "Unable to read Handle configuration: " + configYaml + ". IOException: "
                    + ioe.getMessage());
            throw ioe;
        }

        List<Association> loaded = new ArrayList<>();
        Object entries = configProperties == null ? null : configProperties.get(ASSOCIATIONS_KEY);
        if (entries == null) {
            logConfigStore.warn("No '" + ASSOCIATIONS_KEY + "' found in: " + configYaml);
            return loaded;
        }
        if (!(entries instanceof List<?>)) {
            String errMsg = "'" + ASSOCIATIONS_KEY + "' must be a list in: " + configYaml;
            logConfigStore.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        int index = 0;
        for (Object entry : (List<?>) entries) {
            if (!(entry instanceof Map<?, ?>)) {
                String errMsg = "Association #" + index + " is not a mapping in: " + configYaml;
                logConfigStore.fatal(errMsg);
                throw new IllegalArgumentException(errMsg);
            }
            Map<?, ?> values = (Map<?, ?>) entry;
            loaded.add(new Association(
                requireValue(values, "content_model", index),
                requireValue(values, "datastream", index),
                requireValue(values, "transform", index)));
            index++;
        }
        return loaded;
    }

    private static String requireValue(Map<?, ?> values, String key, int index) {
        Object value = values.get(key);
        if (value == null || value.toString().trim().isEmpty()) {
            String errMsg = "Association #" + index + " is missing a value for: " + key;
            logConfigStore.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        return value.toString().trim();
    }
}
