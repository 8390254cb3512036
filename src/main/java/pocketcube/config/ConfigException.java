package pocketcube.config;

import pocketcube.PocketCubeException;

public class ConfigException extends PocketCubeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
