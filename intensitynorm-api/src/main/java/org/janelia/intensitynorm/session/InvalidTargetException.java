package org.janelia.intensitynorm.session;

/**
 * Raised when an explicit target intensity is not a number in [0, 255].
 */
public class InvalidTargetException extends IllegalArgumentException {
    public InvalidTargetException(String message) {
        super(message);
    }
}
