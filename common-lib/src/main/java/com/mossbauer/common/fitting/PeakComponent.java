package com.mossbauer.common.fitting;

import com.mossbauer.common.lineshape.LineShape;

/**
 * One line profile inside a {@link CompositeModel}. Holds positions into the model's
 * parameter vector rather than values, so the same component evaluates any candidate
 * point the optimizer proposes.
 */
public record PeakComponent(
    String prefix,
    LineShape lineShape,
    int amplitudeIndex,
    int centerIndex,
    int sigmaIndex,
    int shapeIndex          // -1 when the family has no secondary parameter
) {
    public double value(double x, double[] values) {
        double shape = shapeIndex >= 0 ? values[shapeIndex] : 0.0;
        return lineShape.value(x, values[amplitudeIndex], values[centerIndex], values[sigmaIndex], shape);
    }

    public double[] evaluate(double[] x, double[] values) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = value(x[i], values);
        }
        return out;
    }

    public double center(double[] values) {
        return values[centerIndex];
    }

    public double fwhm(double[] values) {
        double shape = shapeIndex >= 0 ? values[shapeIndex] : 0.0;
        return lineShape.fwhm(values[sigmaIndex], shape);
    }

    /** True when parameter {@code index} belongs to this component. */
    public boolean owns(int index) {
        return index == amplitudeIndex || index == centerIndex
            || index == sigmaIndex || (shapeIndex >= 0 && index == shapeIndex);
    }
}
