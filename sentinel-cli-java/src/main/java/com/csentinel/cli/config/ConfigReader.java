package com.csentinel.cli.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a JSON configuration file.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds an invalid value
     */
    public SentinelConfigFile read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            SentinelConfigFile config = GSON.fromJson(reader, SentinelConfigFile.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            if (config.getMaxNestingDepth() < 1) {
                throw new ConfigReadException("max_nesting_depth must be positive, got "
                        + config.getMaxNestingDepth() + " in " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
