package com.mossbauer.common.lineshape;

import org.apache.commons.math3.complex.Complex;

/**
 * Real part of the Faddeeva function {@code w(z) = exp(−z²) erfc(−iz)} for the upper
 * half plane, using Humlicek's four-region rational approximation (W4, 1982).
 * Relative error is below 1e-4 everywhere, which is well under fit noise.
 */
final class Faddeeva {

    private static final Complex ONE_OVER_SQRT_PI = new Complex(0.5641896);

    private Faddeeva() {}

    static double real(double x, double y) {
        return w(x, y).getReal();
    }

    static Complex w(double x, double y) {
        Complex t = new Complex(y, -x);
        double s = Math.abs(x) + y;

        if (s >= 15.0) {
            // region I
            return t.multiply(ONE_OVER_SQRT_PI).divide(t.multiply(t).add(0.5));
        }
        if (s >= 5.5) {
            // region II
            Complex u = t.multiply(t);
            Complex num = t.multiply(u.multiply(0.5641896).add(1.410474));
            Complex den = u.multiply(u.add(3.0)).add(0.75);
            return num.divide(den);
        }
        if (y >= 0.195 * Math.abs(x) - 0.176) {
            // region III
            Complex num = t.multiply(0.5642236).add(3.778987)
                .multiply(t).add(11.96482)
                .multiply(t).add(20.20933)
                .multiply(t).add(16.4955);
            Complex den = t.add(6.699398)
                .multiply(t).add(21.69274)
                .multiply(t).add(39.27121)
                .multiply(t).add(38.82363)
                .multiply(t).add(16.4955);
            return num.divide(den);
        }
        // region IV
        Complex u = t.multiply(t);
        Complex num = horner(u, 36183.31, 3321.9905, 1540.787, 219.0313, 35.76683, 1.320522, 0.56419);
        Complex den = horner(u, 32066.6, 24322.84, 9022.228, 2186.181, 364.2191, 61.57037, 1.841439, 1.0);
        return u.exp().subtract(t.multiply(num).divide(den));
    }

    /** {@code c0 − u(c1 − u(c2 − u(...)))}, the alternating form region IV is tabulated in. */
    private static Complex horner(Complex u, double... c) {
        Complex acc = new Complex(c[c.length - 1]);
        for (int i = c.length - 2; i >= 0; i--) {
            acc = new Complex(c[i]).subtract(u.multiply(acc));
        }
        return acc;
    }
}
