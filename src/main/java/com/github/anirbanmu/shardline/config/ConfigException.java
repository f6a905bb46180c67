package com.github.anirbanmu.shardline.config;

public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
