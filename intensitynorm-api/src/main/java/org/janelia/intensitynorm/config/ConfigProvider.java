package org.janelia.intensitynorm.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/intensitynorm.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties;

    private ConfigProvider() {
        this.properties = new Properties();
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream resourceStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (resourceStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                properties.load(resourceStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /**
     * Override current properties with the ones from the given file. A blank file name is ignored.
     */
    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        Path configFile = Paths.get(fileName);
        if (Files.notExists(configFile)) {
            throw new IllegalArgumentException("Config file " + fileName + " not found");
        }
        LOG.info("Read config from {}", configFile);
        try (InputStream fileStream = Files.newInputStream(configFile)) {
            properties.load(fileStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ConfigProvider fromMap(Map<String, String> values) {
        if (values != null) {
            values.forEach(properties::setProperty);
        }
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
