package com.botstate.exception;

import java.util.List;
import java.util.Map;

/**
 * A record was rejected on append. Nothing was written.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, List<String> violations) {
        super(ErrorCode.VALIDATION_ERROR, message + ": " + String.join("; ", violations), Map.of("violations", violations));
    }
}
