package com.botstate.exception;

public class SourceUnavailableException extends BaseException {

    public SourceUnavailableException(String message) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SOURCE_UNAVAILABLE, message, cause);
    }
}
