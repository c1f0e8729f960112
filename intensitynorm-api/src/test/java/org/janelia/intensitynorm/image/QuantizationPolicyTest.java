package org.janelia.intensitynorm.image;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class QuantizationPolicyTest {

    @Test
    public void quantizeValues() {
        class TestData {
            final double value;
            final int truncated;
            final int rounded;

            TestData(double value, int truncated, int rounded) {
                this.value = value;
                this.truncated = truncated;
                this.rounded = rounded;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(0, 0, 0),
                new TestData(10.4, 10, 10),
                new TestData(10.5, 10, 11),
                new TestData(10.99, 10, 11),
                new TestData(254.6, 254, 255),
                new TestData(300, 255, 255),
                new TestData(-20.7, 0, 0),
                new TestData(Double.NaN, 0, 0),
        };
        for (TestData td : testData) {
            assertEquals("Truncate " + td.value, td.truncated, QuantizationPolicy.TRUNCATE.quantize(td.value));
            assertEquals("Round " + td.value, td.rounded, QuantizationPolicy.ROUND.quantize(td.value));
        }
    }
}
