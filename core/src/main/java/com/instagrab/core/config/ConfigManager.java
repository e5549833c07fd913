package com.instagrab.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final Path configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(Path configFile) {
        this.configFile = configFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public synchronized Configuration getConfig() {
        return configuration;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public synchronized void save() {
        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(configFile, StandardCharsets.UTF_8)) {
                gson.toJson(configuration, w);
            }
            logger.debug("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save configuration", e);
        }
    }

    public synchronized void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        save();
    }

    private void load() {
        if (!Files.exists(configFile)) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration at {}", configFile);
            save();
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile);
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }
}
