package com.autonomous.commit.service;

import com.autonomous.commit.config.EngineSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;

/**
 * Reads {@link EngineSettings} from a YAML file with snake_case keys. Durations are ISO-8601
 * strings ({@code PT30S}) or seconds.
 */
@Slf4j
@Service
public class EngineConfigLoaderService {

    @Value("${engine.config.path:config/engine.yaml}")
    private String configPath;

    private final ObjectMapper yamlMapper;

    public EngineConfigLoaderService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.registerModule(new JavaTimeModule());
    }

    public void setConfigPath(String path) {
        this.configPath = path;
    }

    public String getConfigPath() {
        return configPath;
    }

    /**
     * @return the settings in the file, or defaults when the file does not exist
     * @throws IllegalStateException if the file cannot be parsed or holds invalid values
     */
    public EngineSettings load() {
        File configFile = new File(configPath);
        if (!configFile.isFile()) {
            log.info("Engine config not found at {}, using defaults", configPath);
            return EngineSettings.defaults();
        }

        EngineSettings settings;
        try {
            settings = yamlMapper.readValue(configFile, EngineSettings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load engine config from " + configPath, e);
        }
        if (settings == null) {
            log.info("Engine config {} is empty, using defaults", configPath);
            return EngineSettings.defaults();
        }

        try {
            settings.validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid engine config " + configPath + ": " + e.getMessage(), e);
        }
        log.info("Loaded engine config from {}", configPath);
        return settings;
    }
}
