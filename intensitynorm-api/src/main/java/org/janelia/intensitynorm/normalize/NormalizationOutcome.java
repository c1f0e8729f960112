package org.janelia.intensitynorm.normalize;

import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.intensitynorm.model.CorrectionStep;

public class NormalizationOutcome {
    private final RandomAccessibleInterval<UnsignedByteType> correctedImage;
    private final List<CorrectionStep> steps;

    NormalizationOutcome(RandomAccessibleInterval<UnsignedByteType> correctedImage, List<CorrectionStep> steps) {
        this.correctedImage = correctedImage;
        this.steps = Collections.unmodifiableList(steps);
    }

    public RandomAccessibleInterval<UnsignedByteType> getCorrectedImage() {
        return correctedImage;
    }

    /**
     * @return applied correction steps in order; never empty because the linear scale is always applied
     */
    public List<CorrectionStep> getSteps() {
        return steps;
    }

    public CorrectionStep getLastStep() {
        return steps.get(steps.size() - 1);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("steps", steps)
                .toString();
    }
}
