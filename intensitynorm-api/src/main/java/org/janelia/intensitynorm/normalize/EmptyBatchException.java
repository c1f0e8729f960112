package org.janelia.intensitynorm.normalize;

/**
 * Raised when a batch intensity is requested for a batch without any pixel.
 */
public class EmptyBatchException extends IllegalStateException {
    public EmptyBatchException(String message) {
        super(message);
    }
}
