package com.botstate.exception;

public class NotFoundException extends BaseException {

    public NotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier));
    }
}
