package com.scoutiq.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing credentials or an invalid allowlist. Raised while the application context starts,
 * never while a query is being served.
 */
public class ConfigurationException extends ScoutException {

    public ConfigurationException(String message) {
        super(message, HttpStatus.INTERNAL_SERVER_ERROR, "CONFIGURATION_ERROR");
    }

    public static ConfigurationException missingCredential(String property) {
        return new ConfigurationException("Required credential is not configured: " + property);
    }

    public static ConfigurationException invalidAllowlist(String detail) {
        return new ConfigurationException("Invalid domain allowlist: " + detail);
    }
}
