package com.deepansh.pawsagent.tool;

import com.deepansh.pawsagent.exception.ToolValidationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts raw model input into a handler's input type and checks its constraints.
 *
 * Unknown properties are rejected: a model inventing fields usually means it
 * misread the schema, and the error text tells it which field to drop.
 */
@Component
public class ToolInputValidator {

    private final ObjectMapper strictMapper;
    private final Validator validator;

    public ToolInputValidator(ObjectMapper objectMapper, Validator validator) {
        this.strictMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        this.validator = validator;
    }

    public <I> I validate(Object rawInput, Class<I> type) {
        I input;
        try {
            input = strictMapper.convertValue(rawInput != null ? rawInput : Map.of(), type);
        } catch (IllegalArgumentException e) {
            throw new ToolValidationException(rootMessage(e), e);
        }
        if (input == null) {
            throw new ToolValidationException("input is required");
        }

        Set<ConstraintViolation<I>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ToolValidationException(details);
        }
        return input;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) return root.getClass().getSimpleName();
        // Jackson appends the source location on a new line; the model does not need it
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
