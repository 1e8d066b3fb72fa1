package com.edgechat.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edgechat.model.ConfigKey;
import com.edgechat.model.Model;

/**
 * The models declared in {@link AppConfig}, keyed by name in declaration order.
 */
public class ModelCatalog {
    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);
    private final Map<String, Model> models;

    private ModelCatalog(Map<String, Model> models) {
        this.models = Collections.unmodifiableMap(models);
    }

    public static ModelCatalog fromConfig(AppConfig config) {
        Map<String, Model> models = new LinkedHashMap<>();
        for (AppConfig.ModelConfig entry : config.getModels()) {
            String name = entry.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Model entries require a name");
            }
            if (models.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate model name: " + name);
            }
            models.put(name, toModel(entry));
        }
        return new ModelCatalog(models);
    }

    public Optional<Model> find(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public List<String> names() {
        return new ArrayList<>(models.keySet());
    }

    public List<Model> models() {
        return new ArrayList<>(models.values());
    }

    private static Model toModel(AppConfig.ModelConfig entry) {
        Map<ConfigKey, Object> values = new EnumMap<>(ConfigKey.class);
        entry.getConfigValues().forEach((id, value) -> {
            Optional<ConfigKey> key = ConfigKey.fromId(id);
            if (key.isEmpty()) {
                log.warn("Ignoring unknown config value {} for model {}", id, entry.getName());
            } else if (value != null) {
                values.put(key.get(), value);
            }
        });
        return new Model(
                entry.getName(),
                entry.getVersion(),
                entry.getDownloadFileName(),
                entry.isImported(),
                entry.isLlmSupportImage(),
                entry.getGenieModelDir(),
                entry.getGenieHtpConfig(),
                values);
    }
}
