package com.flagship.account_service.account;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_service.account.dto.AccountRequest;
import com.flagship.account_service.account.exception.DataValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a raw JSON payload into a validated {@link AccountRequest}.
 *
 * Rejects, as {@link DataValidationException}:
 * - a payload that is not a JSON object
 * - fields that cannot be converted (e.g. a malformed date_joined)
 * - fields that violate the request constraints (missing name or email, oversized values)
 *
 * All offending fields are reported together, keyed by their wire name.
 */
@Component
@RequiredArgsConstructor
public class AccountPayloadReader {

    static final String BAD_DATA_MESSAGE = "Invalid Account: body of request contained bad or no data";

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public AccountRequest read(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            String type = payload == null ? "nothing" : payload.getNodeType().name().toLowerCase();
            throw new DataValidationException(BAD_DATA_MESSAGE + " (expected a JSON object, got " + type + ")");
        }

        AccountRequest request;
        try {
            request = objectMapper.treeToValue(payload, AccountRequest.class);
        } catch (JsonProcessingException e) {
            throw new DataValidationException(BAD_DATA_MESSAGE, describe(e), e);
        }

        Set<ConstraintViolation<AccountRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> details = new TreeMap<>();
            for (ConstraintViolation<AccountRequest> violation : violations) {
                details.merge(toWireName(violation.getPropertyPath().toString()),
                    violation.getMessage(), (existing, replacement) -> existing);
            }
            throw new DataValidationException("Invalid Account: missing or invalid fields " + details.keySet(), details);
        }

        return request;
    }

    private Map<String, String> describe(JsonProcessingException e) {
        if (e instanceof JsonMappingException mappingException && !mappingException.getPath().isEmpty()) {
            String field = mappingException.getPath().get(0).getFieldName();
            if (field != null) {
                return Map.of(field, "Invalid value");
            }
        }
        return Map.of();
    }

    // phoneNumber -> phone_number
    static String toWireName(String propertyName) {
        return propertyName.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
