package com.botstate.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * The snapshot namespace advanced after the caller's restore. The caller decides
 * whether to restore again and re-run reconciliation; this layer never retries.
 */
public class ConflictException extends BaseException {

    public ConflictException(String expectedRevision, String actualRevision) {
        super(
                ErrorCode.CONFLICT,
                String.format("Snapshot moved underneath this run: expected head=%s, actual head=%s",
                        expectedRevision, actualRevision),
                details(expectedRevision, actualRevision));
    }

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    private static Map<String, Object> details(String expected, String actual) {
        Map<String, Object> details = new HashMap<>();
        details.put("expectedRevision", expected);
        details.put("actualRevision", actual);
        return details;
    }
}
