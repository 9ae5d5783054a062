package com.botstate.exception;

/**
 * I/O failure of the working copy or the snapshot namespace.
 */
public class StateStorageException extends BaseException {

    public StateStorageException(String message) {
        super(ErrorCode.STORAGE_ERROR, message);
    }

    public StateStorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
