package com.mossbauer.common.fitting;

import com.mossbauer.common.exception.FitConvergenceException;
import com.mossbauer.common.model.Spectrum;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Weighted nonlinear least squares of a {@link CompositeModel} against a spectrum.
 *
 * <h3>Objective</h3>
 * <pre>
 *   χ² = Σ ((model(vᵢ) − aᵢ) · wᵢ)²,   wᵢ = 1 / √(aᵢ + ε),   ε = 0.001
 * </pre>
 * The weights approximate Poisson counting statistics, so deep (low-count) regions
 * carry more weight than the baseline.
 *
 * <h3>Method</h3>
 * Levenberg–Marquardt. Bounds are enforced by clamping each proposed point into
 * {@code [min, max]}; parameters with {@code vary=false} are held at their value. The
 * Jacobian is built by central differences, one component at a time, since every
 * parameter only moves its own line profile (or the constant baseline).
 *
 * <p>Failure to converge or an under-determined problem raises
 * {@link FitConvergenceException}. No retry happens here.
 */
public final class SpectrumOptimizer {

    private static final Logger log = LoggerFactory.getLogger(SpectrumOptimizer.class);

    private static final double STEP_SCALE = 1.0e-6;
    private static final double STEP_FLOOR = 1.0e-2;
    private static final double COVARIANCE_THRESHOLD = 1.0e-14;

    private final OptimizerSettings settings;

    public SpectrumOptimizer(OptimizerSettings settings) {
        this.settings = settings;
    }

    public SpectrumOptimizer() {
        this(OptimizerSettings.defaults());
    }

    public OptimizedModel optimize(CompositeModel model, Spectrum spectrum) {
        double[] x = spectrum.velocity();
        double[] data = spectrum.absorption();
        int n = x.length;

        List<ModelParameter> parameters = model.parameters();
        int[] free = parameters.stream()
            .filter(ModelParameter::vary)
            .mapToInt(p -> model.indexOf(p.name()))
            .toArray();
        int nVar = free.length;
        int siteCount = model.siteCount();

        if (nVar == 0) {
            throw new FitConvergenceException("No free parameters to optimize", model.lineShape(), siteCount, 0);
        }
        if (n <= nVar) {
            throw new FitConvergenceException(
                "Not enough data points (" + n + ") for the number of variables",
                model.lineShape(), siteCount, nVar);
        }

        double[] initial = model.values();
        double[] template = initial.clone();
        double[] start = new double[nVar];
        for (int c = 0; c < nVar; c++) {
            start[c] = parameters.get(free[c]).clamp(initial[free[c]]);
        }

        double[] weights = weights(data);
        double[] squaredWeights = new double[n];
        for (int i = 0; i < n; i++) squaredWeights[i] = weights[i] * weights[i];

        LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(start)
            .target(data)
            .weight(new DiagonalMatrix(squaredWeights))
            .model(jacobianFunction(model, x, template, free))
            .parameterValidator(boundsValidator(parameters, free))
            .lazyEvaluation(false)
            .maxIterations(settings.maxIterations())
            .maxEvaluations(settings.evaluationsPerVariable() * (nVar + 1))
            .build();

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
            .withCostRelativeTolerance(settings.costRelativeTolerance())
            .withParameterRelativeTolerance(settings.parameterRelativeTolerance());

        LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = optimizer.optimize(problem);
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new FitConvergenceException("Optimizer did not converge: " + e.getMessage(),
                model.lineShape(), siteCount, nVar, e);
        }

        double[] values = expand(template, free, optimum.getPoint());
        double[] bestFit = model.evaluate(x, values);
        double[] residuals = new double[n];
        double chiSquared = 0.0;
        for (int i = 0; i < n; i++) {
            residuals[i] = data[i] - bestFit[i];
            double r = residuals[i] * weights[i];
            chiSquared += r * r;
        }
        if (!Double.isFinite(chiSquared) || !allFinite(values)) {
            throw new FitConvergenceException("Optimizer produced a non-finite solution",
                model.lineShape(), siteCount, nVar);
        }

        int dof = n - nVar;
        double reducedChiSquared = chiSquared / dof;
        Double[] stderr = standardErrors(optimum, free, values.length, reducedChiSquared, model);

        double logLikelihoodTerm = n * Math.log(Math.max(chiSquared, 1.0e-250 * n) / n);
        double aic = logLikelihoodTerm + 2.0 * nVar;
        double bic = logLikelihoodTerm + Math.log(n) * nVar;

        Map<String, double[]> components = model.evaluateComponents(x, values);

        log.info("[Optimizer] Fit converged. lineShape={} sites={} variables={} iterations={} evaluations={} chisqr={} redchi={}",
            model.lineShape().wireName(), siteCount, nVar, optimum.getIterations(), optimum.getEvaluations(),
            String.format("%.6g", chiSquared), String.format("%.6g", reducedChiSquared));

        return new OptimizedModel(model, initial, values, stderr, chiSquared, reducedChiSquared,
            n, nVar, optimum.getIterations(), optimum.getEvaluations(), aic, bic,
            bestFit, residuals, components);
    }

    /** {@code 1 / √(a + ε)}, with the radicand floored at ε for negative samples. */
    static double[] weights(double[] absorption) {
        double[] w = new double[absorption.length];
        for (int i = 0; i < absorption.length; i++) {
            double radicand = Math.max(absorption[i] + OptimizerSettings.EPSILON, OptimizerSettings.EPSILON);
            w[i] = 1.0 / Math.sqrt(radicand);
        }
        return w;
    }

    private static MultivariateJacobianFunction jacobianFunction(CompositeModel model, double[] x,
                                                                 double[] template, int[] free) {
        int[] owners = new int[free.length];
        for (int c = 0; c < free.length; c++) {
            owners[c] = model.ownerOf(free[c]);
        }
        return point -> {
            double[] values = expand(template, free, point);
            double[] y = model.evaluate(x, values);
            RealMatrix jacobian = new Array2DRowRealMatrix(x.length, free.length);

            for (int c = 0; c < free.length; c++) {
                int p = free[c];
                if (owners[c] < 0) {
                    // baseline enters the model linearly
                    for (int i = 0; i < x.length; i++) jacobian.setEntry(i, c, 1.0);
                    continue;
                }
                PeakComponent component = model.components().get(owners[c]);
                double h = STEP_SCALE * Math.max(Math.abs(values[p]), STEP_FLOOR);
                double[] plus = values.clone();
                double[] minus = values.clone();
                plus[p] += h;
                minus[p] -= h;
                for (int i = 0; i < x.length; i++) {
                    double derivative = (component.value(x[i], plus) - component.value(x[i], minus)) / (2.0 * h);
                    jacobian.setEntry(i, c, -derivative);
                }
            }
            return new Pair<>(new ArrayRealVector(y, false), jacobian);
        };
    }

    private static ParameterValidator boundsValidator(List<ModelParameter> parameters, int[] free) {
        return point -> {
            RealVector clamped = point.copy();
            for (int c = 0; c < free.length; c++) {
                clamped.setEntry(c, parameters.get(free[c]).clamp(point.getEntry(c)));
            }
            return clamped;
        };
    }

    private static double[] expand(double[] template, int[] free, RealVector point) {
        double[] values = template.clone();
        for (int c = 0; c < free.length; c++) {
            values[free[c]] = point.getEntry(c);
        }
        return values;
    }

    private static Double[] standardErrors(LeastSquaresOptimizer.Optimum optimum, int[] free, int size,
                                           double reducedChiSquared, CompositeModel model) {
        Double[] stderr = new Double[size];
        try {
            RealMatrix covariance = optimum.getCovariances(COVARIANCE_THRESHOLD);
            for (int c = 0; c < free.length; c++) {
                double variance = covariance.getEntry(c, c) * reducedChiSquared;
                stderr[free[c]] = variance >= 0.0 && Double.isFinite(variance) ? Math.sqrt(variance) : null;
            }
        } catch (SingularMatrixException e) {
            log.warn("[Optimizer] Covariance matrix is singular; uncertainties unavailable. lineShape={} sites={}",
                model.lineShape().wireName(), model.siteCount());
        }
        return stderr;
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
