package com.sqlrecall.service.codec;

/**
 * A result table could not be serialized for storage, or a stored payload could not be read back.
 */
public class CachePayloadException extends Exception {

    public CachePayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
