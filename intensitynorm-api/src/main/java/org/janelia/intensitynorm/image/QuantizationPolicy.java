package org.janelia.intensitynorm.image;

/**
 * Conversion of a real valued intensity to an 8-bit sample. Values are always clipped to
 * [{@value #MIN_INTENSITY}, {@value #MAX_INTENSITY}] before they are converted.
 */
public enum QuantizationPolicy {
    TRUNCATE {
        @Override
        int toInteger(double clippedValue) {
            return (int) clippedValue;
        }
    },
    ROUND {
        @Override
        int toInteger(double clippedValue) {
            return (int) Math.round(clippedValue);
        }
    };

    public static final int MIN_INTENSITY = 0;
    public static final int MAX_INTENSITY = 255;

    public static double clip(double value) {
        if (Double.isNaN(value) || value < MIN_INTENSITY) {
            return MIN_INTENSITY;
        } else if (value > MAX_INTENSITY) {
            return MAX_INTENSITY;
        } else {
            return value;
        }
    }

    public int quantize(double value) {
        return toInteger(clip(value));
    }

    abstract int toInteger(double clippedValue);
}
