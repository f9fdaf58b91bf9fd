package com.autolens.insight.resolver;

public class InvalidListingException extends RuntimeException {
    public InvalidListingException(String message) {
        super(message);
    }
}
