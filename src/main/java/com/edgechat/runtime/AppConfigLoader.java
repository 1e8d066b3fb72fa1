package com.edgechat.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            log.info("Config file {} not found; using defaults", config);
            return new AppConfig();
        }
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
