package com.latticenoise;

/**
 * Thrown when a lattice, noise field or interpolation is set up with
 * parameters that cannot describe a valid gradient lattice: a bad dimension,
 * a grid shape that does not match it, or a corner count that is not 2^n.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
