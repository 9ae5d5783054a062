package com.botstate.validation;

import com.botstate.exception.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks the Bean Validation constraints of a record before it is appended to one of
 * the append-only logs. A record that fails is rejected as a whole.
 */
@Component
public class RecordValidator {

    private final Validator validator;

    public RecordValidator(Validator validator) {
        this.validator = validator;
    }

    public void validate(Object record, String description) {
        if (record == null) {
            throw new ValidationException(description + " is null");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .sorted()
                    .toList();
            throw new ValidationException("Invalid " + description, messages);
        }
    }
}
