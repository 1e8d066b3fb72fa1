package com.edgechat.model;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A chat model entry together with the backend instance currently attached to it.
 *
 * <p>Configuration values are stored as loaded and converted on read, so a value written as
 * {@code "0.7"} in YAML still serves as a float.
 */
public class Model {
    private static final Logger log = LoggerFactory.getLogger(Model.class);
    public static final String DEFAULT_VERSION = "1";

    private final String name;
    private final String version;
    private final String downloadFileName;
    private final boolean imported;
    private final boolean llmSupportImage;
    private final String genieModelDir;
    private final String genieHtpConfig;
    private final Map<ConfigKey, Object> configValues;
    private volatile ModelInstance instance;

    public Model(
            String name,
            String version,
            String downloadFileName,
            boolean imported,
            boolean llmSupportImage,
            String genieModelDir,
            String genieHtpConfig,
            Map<ConfigKey, Object> configValues) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        this.downloadFileName = downloadFileName;
        this.imported = imported;
        this.llmSupportImage = llmSupportImage;
        this.genieModelDir = genieModelDir;
        this.genieHtpConfig = genieHtpConfig;
        this.configValues = configValues == null || configValues.isEmpty()
                ? new EnumMap<>(ConfigKey.class)
                : new EnumMap<>(configValues);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDownloadFileName() {
        return downloadFileName;
    }

    public boolean isImported() {
        return imported;
    }

    public boolean isLlmSupportImage() {
        return llmSupportImage;
    }

    public String getGenieModelDir() {
        return genieModelDir;
    }

    public String getGenieHtpConfig() {
        return genieHtpConfig;
    }

    public ModelInstance getInstance() {
        return instance;
    }

    public void setInstance(ModelInstance instance) {
        this.instance = instance;
    }

    public void setConfigValue(ConfigKey key, Object value) {
        if (value == null) {
            configValues.remove(key);
        } else {
            configValues.put(key, value);
        }
    }

    public int getIntConfigValue(ConfigKey key, int defaultValue) {
        Object value = configValues.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                log.warn("Model {} has non-numeric {}={}; using {}", name, key.id(), text, defaultValue);
            }
        }
        return defaultValue;
    }

    public float getFloatConfigValue(ConfigKey key, float defaultValue) {
        Object value = configValues.get(key);
        if (value instanceof Number number) {
            return number.floatValue();
        }
        if (value instanceof String text) {
            try {
                return Float.parseFloat(text.trim());
            } catch (NumberFormatException e) {
                log.warn("Model {} has non-numeric {}={}; using {}", name, key.id(), text, defaultValue);
            }
        }
        return defaultValue;
    }

    public String getStringConfigValue(ConfigKey key, String defaultValue) {
        Object value = configValues.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public Path getPath(Path modelsDir) {
        return getPath(modelsDir, downloadFileName);
    }

    public Path getPath(Path modelsDir, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Model " + name + " has no file name to resolve");
        }
        if (imported) {
            return modelsDir.resolve(fileName);
        }
        return modelsDir.resolve(normalizedName()).resolve(version).resolve(fileName);
    }

    public String normalizedName() {
        return name.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
