package com.botstate.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Failure categories surfaced by the state layer. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND"),
    CONFLICT("CONFLICT"),
    SOURCE_UNAVAILABLE("SOURCE_UNAVAILABLE"),
    STATE_CORRUPTION("STATE_CORRUPTION"),
    STORAGE_ERROR("STORAGE_ERROR");

    private final String code;
}
