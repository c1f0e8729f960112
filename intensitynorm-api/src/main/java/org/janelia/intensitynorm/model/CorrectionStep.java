package org.janelia.intensitynorm.model;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

public class CorrectionStep {
    private final CorrectionStage stage;
    // multiplicative factor for the scaling stages, additive offset for the adjustment stage
    private final double parameter;
    private final double resultingMean;

    public CorrectionStep(CorrectionStage stage, double parameter, double resultingMean) {
        this.stage = stage;
        this.parameter = parameter;
        this.resultingMean = resultingMean;
    }

    public CorrectionStage getStage() {
        return stage;
    }

    public double getParameter() {
        return parameter;
    }

    public double getResultingMean() {
        return resultingMean;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        CorrectionStep that = (CorrectionStep) o;

        return new EqualsBuilder()
                .append(stage, that.stage)
                .append(parameter, that.parameter)
                .append(resultingMean, that.resultingMean)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(stage)
                .append(parameter)
                .append(resultingMean)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("stage", stage)
                .append("parameter", parameter)
                .append("resultingMean", resultingMean)
                .toString();
    }
}
