package com.example.cloudbeatsbackup.common.exception;

public class ConfigurationException extends BackupException {

    public static final String CODE = "CONFIG_INVALID";

    public ConfigurationException(String message) {
        super(CODE, message);
    }

    public ConfigurationException(String message, String userAction) {
        super(CODE, message, userAction);
    }

    public ConfigurationException(String message, String userAction, Throwable cause) {
        super(CODE, message, userAction, cause);
    }
}
