package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when configuration is invalid or unusable.
 */
public class ConfigurationException extends TranscodeException {

    private final String configKey;
    private final String configValue;

    public ConfigurationException(String message, String configKey, String configValue) {
        super(message);
        this.configKey = configKey;
        this.configValue = configValue;
    }

    public ConfigurationException(String message, Throwable cause, String configKey, String configValue) {
        super(message, cause);
        this.configKey = configKey;
        this.configValue = configValue;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getConfigValue() {
        return configValue;
    }
}
