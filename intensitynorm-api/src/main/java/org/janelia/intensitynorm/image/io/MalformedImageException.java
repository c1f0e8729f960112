package org.janelia.intensitynorm.image.io;

/**
 * Raised when an image source cannot be decoded into 8-bit gray images.
 */
public class MalformedImageException extends RuntimeException {
    public MalformedImageException(String message) {
        super(message);
    }

    public MalformedImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
