package org.janelia.intensitynorm.model;

public enum TargetSource {
    GLOBAL_AVERAGE, // pooled mean of all samples in the batch
    EXPLICIT
}
