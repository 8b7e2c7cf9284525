package com.sentidash.backend.modules.magiclink.application;

public class MagicLinkDeliveryException extends RuntimeException {

    public MagicLinkDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
