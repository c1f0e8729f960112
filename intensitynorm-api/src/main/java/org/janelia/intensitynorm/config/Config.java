package org.janelia.intensitynorm.config;

import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

/**
 * Layered application properties. Values loaded later override values loaded earlier.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    public String getStringPropertyValue(String name) {
        return getStringPropertyValue(name, null);
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = properties.getProperty(name);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public Integer getIntegerPropertyValue(String name, Integer defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (stringValue == null) {
            return defaultValue;
        }
        try {
            return Integer.valueOf(stringValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for " + name + ": " + stringValue, e);
        }
    }

    public Double getDoublePropertyValue(String name, Double defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (stringValue == null) {
            return defaultValue;
        }
        try {
            return Double.valueOf(stringValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + name + ": " + stringValue, e);
        }
    }

    public <E extends Enum<E>> E getEnumPropertyValue(String name, Class<E> enumType, E defaultValue) {
        String stringValue = getStringPropertyValue(name);
        if (stringValue == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(enumType, stringValue.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + stringValue, e);
        }
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
