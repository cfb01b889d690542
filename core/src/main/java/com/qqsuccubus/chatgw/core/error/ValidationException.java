package com.qqsuccubus.chatgw.core.error;

import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class ValidationException extends GatewayException {

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(Map<String, List<String>> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, "Validation failed for fields " + fieldErrors.keySet(),
            Map.of("errors", fieldErrors));
        this.fieldErrors = Map.copyOf(fieldErrors);
    }
}
