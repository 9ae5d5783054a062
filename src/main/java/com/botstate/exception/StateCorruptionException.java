package com.botstate.exception;

import java.util.Map;

/**
 * A persisted file exists but violates its schema. Raised instead of substituting a
 * default wherever the default would lose state.
 */
public class StateCorruptionException extends BaseException {

    public StateCorruptionException(String file, String message) {
        super(ErrorCode.STATE_CORRUPTION, String.format("%s is corrupt: %s", file, message), Map.of("file", file));
    }

    public StateCorruptionException(String file, String message, Throwable cause) {
        super(ErrorCode.STATE_CORRUPTION, String.format("%s is corrupt: %s", file, message), cause);
    }
}
