package com.crossmatch.pairing.api;

/**
 * Raised before any island is processed when the inputs or options cannot support a run,
 * e.g. photometry enabled without likelihood cubes.
 */
public class PairingConfigurationException extends RuntimeException {

    public PairingConfigurationException(String message) {
        super(message);
    }

    public PairingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
