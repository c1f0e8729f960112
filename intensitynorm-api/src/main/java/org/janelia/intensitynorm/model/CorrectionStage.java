package org.janelia.intensitynorm.model;

/**
 * Correction stages in the order in which they are applied.
 */
public enum CorrectionStage {
    LinearScale,
    AdditiveAdjustment,
    SecondaryScale
}
