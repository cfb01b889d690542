package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.error.ValidationException;
import com.qqsuccubus.chatgw.core.model.CreateSessionRequest;
import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.core.model.UpdateSessionRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level checks for session requests. Collects every failure before throwing.
 */
public final class SessionRequestValidator {
    private SessionRequestValidator() {
    }

    static final int NAME_MIN = 3;
    static final int NAME_MAX = 50;
    static final int QR_TIMEOUT_MIN_MS = 10_000;
    static final int QR_TIMEOUT_MAX_MS = 300_000;
    static final int MAX_RETRIES_MAX = 10;

    public static void validateCreate(CreateSessionRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (request == null) {
            addError(errors, "body", "request body is required");
            throw new ValidationException(errors);
        }
        if (request.getName() == null || request.getName().isBlank()) {
            addError(errors, "name", "name is required");
        } else {
            checkName(request.getName(), errors);
        }
        checkConfig(request.getConfig(), errors);
        checkWebhookUrl(request.getWebhookUrl(), errors);
        throwIfAny(errors);
    }

    public static void validateUpdate(UpdateSessionRequest request) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (request == null) {
            addError(errors, "body", "request body is required");
            throw new ValidationException(errors);
        }
        if (request.getName() != null) {
            checkName(request.getName(), errors);
        }
        checkConfig(request.getConfig(), errors);
        checkWebhookUrl(request.getWebhookUrl(), errors);
        throwIfAny(errors);
    }

    private static void checkName(String name, Map<String, List<String>> errors) {
        int length = name.trim().length();
        if (length < NAME_MIN || length > NAME_MAX) {
            addError(errors, "name", "name must be between " + NAME_MIN + " and " + NAME_MAX + " characters");
        }
    }

    private static void checkConfig(SessionConfig config, Map<String, List<String>> errors) {
        if (config == null) {
            return;
        }
        Integer qrTimeoutMs = config.getQrTimeoutMs();
        if (qrTimeoutMs != null && (qrTimeoutMs < QR_TIMEOUT_MIN_MS || qrTimeoutMs > QR_TIMEOUT_MAX_MS)) {
            addError(errors, "config.qrTimeoutMs",
                "qrTimeoutMs must be between " + QR_TIMEOUT_MIN_MS + " and " + QR_TIMEOUT_MAX_MS);
        }
        Integer maxRetries = config.getMaxRetries();
        if (maxRetries != null && (maxRetries < 0 || maxRetries > MAX_RETRIES_MAX)) {
            addError(errors, "config.maxRetries", "maxRetries must be between 0 and " + MAX_RETRIES_MAX);
        }
    }

    private static void checkWebhookUrl(String webhookUrl, Map<String, List<String>> errors) {
        if (webhookUrl == null) {
            return;
        }
        try {
            URI uri = new URI(webhookUrl);
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                addError(errors, "webhookUrl", "webhookUrl must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            addError(errors, "webhookUrl", "webhookUrl is not a valid URL: " + e.getReason());
        }
    }

    private static void addError(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, f -> new ArrayList<>()).add(message);
    }

    private static void throwIfAny(Map<String, List<String>> errors) {
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
