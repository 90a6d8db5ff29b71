package com.mossbauer.common.fitting;

import com.mossbauer.common.lineshape.LineShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transmission model {@code baseline − Σ component(x)} built from {@code 2 × siteCount}
 * peak components of one line-shape family. Components {@code 2k} and {@code 2k+1}
 * (zero-based) form the doublet of site {@code k}.
 *
 * <p>Parameter names follow {@code peak{i}_{amplitude|center|sigma|gamma|fraction}}
 * with {@code i} starting at 1, plus a single {@value #BASELINE} term.
 */
public final class CompositeModel {

    public static final String BASELINE = "baseline";

    private final LineShape lineShape;
    private final int siteCount;
    private final List<ModelParameter> parameters;
    private final Map<String, Integer> indexByName;
    private final List<PeakComponent> components;
    private final int baselineIndex;

    private CompositeModel(LineShape lineShape, int siteCount, List<ModelParameter> parameters,
                           List<PeakComponent> components, int baselineIndex) {
        this.lineShape = lineShape;
        this.siteCount = siteCount;
        this.parameters = Collections.unmodifiableList(parameters);
        this.components = Collections.unmodifiableList(components);
        this.baselineIndex = baselineIndex;
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            index.put(parameters.get(i).name(), i);
        }
        this.indexByName = Collections.unmodifiableMap(index);
    }

    /** Creates the parameter layout with all values at zero and no bounds. */
    static CompositeModel create(LineShape lineShape, int siteCount) {
        List<ModelParameter> parameters = new ArrayList<>();
        List<PeakComponent> components = new ArrayList<>();
        for (int i = 1; i <= 2 * siteCount; i++) {
            String prefix = prefix(i);
            int amplitude = add(parameters, prefix + "amplitude");
            int center    = add(parameters, prefix + "center");
            int sigma     = add(parameters, prefix + "sigma");
            int shape     = lineShape.hasShapeParameter()
                ? add(parameters, prefix + lineShape.shapeParameter())
                : -1;
            components.add(new PeakComponent(prefix, lineShape, amplitude, center, sigma, shape));
        }
        int baseline = add(parameters, BASELINE);
        return new CompositeModel(lineShape, siteCount, parameters, components, baseline);
    }

    private static int add(List<ModelParameter> parameters, String name) {
        parameters.add(new ModelParameter(name));
        return parameters.size() - 1;
    }

    /** {@code peak3_} for the third component (one-based). */
    public static String prefix(int oneBasedIndex) {
        return "peak" + oneBasedIndex + "_";
    }

    public LineShape lineShape()              { return lineShape; }
    public int siteCount()                    { return siteCount; }
    public List<ModelParameter> parameters()  { return parameters; }
    public List<PeakComponent> components()   { return components; }
    public int baselineIndex()                { return baselineIndex; }

    public Optional<ModelParameter> find(String name) {
        Integer i = indexByName.get(name);
        return i == null ? Optional.empty() : Optional.of(parameters.get(i));
    }

    public ModelParameter parameter(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("No parameter named " + name));
    }

    public int indexOf(String name) {
        Integer i = indexByName.get(name);
        if (i == null) {
            throw new IllegalArgumentException("No parameter named " + name);
        }
        return i;
    }

    /** Current values of all parameters, in layout order. */
    public double[] values() {
        double[] out = new double[parameters.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = parameters.get(i).value();
        }
        return out;
    }

    public int variableCount() {
        return (int) parameters.stream().filter(ModelParameter::vary).count();
    }

    /**
     * Index of the component that owns parameter {@code index}, or -1 for the baseline.
     */
    public int ownerOf(int index) {
        for (int k = 0; k < components.size(); k++) {
            if (components.get(k).owns(index)) return k;
        }
        return -1;
    }

    public double evaluate(double x, double[] values) {
        double sum = 0.0;
        for (PeakComponent component : components) {
            sum += component.value(x, values);
        }
        return values[baselineIndex] - sum;
    }

    public double[] evaluate(double[] x, double[] values) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = evaluate(x[i], values);
        }
        return out;
    }

    /** Positive line profiles of every component, keyed by prefix, in component order. */
    public Map<String, double[]> evaluateComponents(double[] x, double[] values) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (PeakComponent component : components) {
            out.put(component.prefix(), component.evaluate(x, values));
        }
        return out;
    }

    /** Human-readable model expression, e.g. {@code baseline - (lorentzian(peak1_) + ...)}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(BASELINE).append(" - (");
        for (int k = 0; k < components.size(); k++) {
            if (k > 0) sb.append(" + ");
            sb.append(lineShape.wireName()).append("(prefix='").append(components.get(k).prefix()).append("')");
        }
        return sb.append(')').toString();
    }
}
