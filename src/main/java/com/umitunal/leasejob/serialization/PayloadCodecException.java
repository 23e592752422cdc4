package com.umitunal.leasejob.serialization;

/**
 * Raised when a payload cannot be converted to or from its stored form.
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
