package io.hearthwarrio.pagelens.core;

/**
 * Thrown when the configured page engine lacks a capability an action needs.
 */
public class UnsupportedCapabilityException extends PagelensException {
    public UnsupportedCapabilityException(String message) {
        super(ErrorKind.UNSUPPORTED, message);
    }
}
