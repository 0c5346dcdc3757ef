package com.phillippitts.syd.service.schema;

import com.phillippitts.syd.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.phillippitts.syd.service.schema.ParameterGroup.BACKGROUND;
import static com.phillippitts.syd.service.schema.ParameterGroup.DATA;
import static com.phillippitts.syd.service.schema.ParameterGroup.ESTIMATE;
import static com.phillippitts.syd.service.schema.ParameterGroup.GLOBAL;
import static com.phillippitts.syd.service.schema.ParameterGroup.PARENT;
import static com.phillippitts.syd.service.schema.ParameterGroup.STAR;
import static com.phillippitts.syd.service.schema.ParameterType.BOOL;
import static com.phillippitts.syd.service.schema.ParameterType.FLOAT;
import static com.phillippitts.syd.service.schema.ParameterType.INT;
import static com.phillippitts.syd.service.schema.ParameterType.STRING;

/**
 * Declares every known parameter: its type, default and whether it may be overridden per star.
 *
 * <p>The catalog is immutable. {@link #standard()} returns the pipeline's declaration; tests
 * may build smaller catalogs through {@link #of(Collection)}.
 */
public final class ParameterCatalog {

    private final Map<String, ParameterDefinition> definitions;

    private ParameterCatalog(Map<String, ParameterDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    public static ParameterCatalog of(Collection<ParameterDefinition> definitions) {
        Map<String, ParameterDefinition> map = new LinkedHashMap<>();
        for (ParameterDefinition d : definitions) {
            if (map.put(d.name(), d) != null) {
                throw new IllegalArgumentException("Duplicate parameter declaration: " + d.name());
            }
        }
        return new ParameterCatalog(map);
    }

    /**
     * The full parameter declaration of the pipeline.
     */
    public static ParameterCatalog standard() {
        List<ParameterDefinition> d = new ArrayList<>();

        d.add(def("inpdir", STRING, "data", PARENT, "path to input data"));
        d.add(def("infdir", STRING, "info", PARENT, "path to star information"));
        d.add(def(ParameterNames.OUTDIR, STRING, "results", PARENT, "path to results"));
        d.add(def(ParameterNames.OVERWRITE, BOOL, false, PARENT, "allow files to be overwritten"));
        d.add(def("show", BOOL, false, PARENT, "show output figures"));
        d.add(def("ret", BOOL, false, PARENT, "return output in an interactive session"));
        d.add(def(ParameterNames.SAVE, BOOL, true, PARENT, "save all data products"));
        d.add(def("test", BOOL, false, PARENT, "test software functionality"));
        d.add(def("verbose", BOOL, false, PARENT, "verbose output"));

        d.add(override(ParameterNames.DNU, null, DATA, "spacing to fold the power spectrum [muHz]"));
        d.add(def("gap", INT, 20, DATA, "number of cadences that defines a gap"));
        d.add(def(ParameterNames.INFO, STRING, "info/star_info.csv", DATA, "path to star catalog"));
        d.add(def(ParameterNames.IGNORE, BOOL, false, DATA, "ignore the star catalog"));
        d.add(def("kep_corr", BOOL, false, DATA, "correct known Kepler artefacts"));
        d.add(def("lower_ff", FLOAT, null, DATA, "lower folded frequency to whiten mixed modes"));
        d.add(def("upper_ff", FLOAT, null, DATA, "upper folded frequency to whiten mixed modes"));
        d.add(def("lower_lc", FLOAT, null, DATA, "lower limit for time series data"));
        d.add(def("upper_lc", FLOAT, null, DATA, "upper limit for time series data"));
        d.add(override("lower_ps", null, DATA, "lower frequency limit of the power spectrum"));
        d.add(override("upper_ps", null, DATA, "upper frequency limit of the power spectrum"));
        d.add(def(ParameterNames.MODE, STRING, "load", DATA, "pipeline mode"));
        d.add(def("notching", BOOL, false, DATA, "notch mixed modes instead of simulating noise"));
        d.add(def(ParameterNames.OVERSAMPLING_FACTOR, INT, null, DATA, "oversampling of the input spectrum"));
        d.add(def("seed", INT, null, DATA, "seed for reproducible sampling"));
        d.add(def(ParameterNames.TODO, STRING, "info/todo.txt", DATA, "path to star list"));
        d.add(def("stitch", BOOL, false, DATA, "correct large gaps in the time series"));
        d.add(def(ParameterNames.N_THREADS, INT, 0, DATA, "worker count in parallel mode (0 = all)"));

        d.add(def("ask", BOOL, false, ESTIMATE, "ask which trial to use as the numax estimate"));
        d.add(def("binning", FLOAT, 0.005, ESTIMATE, "logarithmic binning width"));
        d.add(def(ParameterNames.BIN_MODE, STRING, "mean", ESTIMATE, "binning statistic"));
        d.add(def(ParameterNames.ESTIMATE, BOOL, true, ESTIMATE, "run the numax search stage"));
        d.add(def("adjust", BOOL, false, ESTIMATE, "adjust defaults from the numax estimate"));
        d.add(override("lower_ex", 1.0, ESTIMATE, "lower frequency limit for the search stage"));
        d.add(override("upper_ex", 8000.0, ESTIMATE, "upper frequency limit for the search stage"));
        d.add(def(ParameterNames.N_TRIALS, INT, 3, ESTIMATE, "number of numax trials"));
        d.add(def("smooth_width", FLOAT, 20.0, ESTIMATE, "box filter width [muHz]"));
        d.add(def("step", FLOAT, 0.25, ESTIMATE, "fractional step of the collapsed search"));

        d.add(def("background", BOOL, true, BACKGROUND, "run the background fit"));
        d.add(def("basis", STRING, "tau_sigma", BACKGROUND, "background parametrization"));
        d.add(def("box_filter", FLOAT, 1.0, BACKGROUND, "box smoothing filter [muHz]"));
        d.add(def("ind_width", FLOAT, 20.0, BACKGROUND, "independent averaging width [muHz]"));
        d.add(def(ParameterNames.N_LAWS, INT, null, BACKGROUND, "forced number of Harvey-like components"));
        d.add(override("lower_bg", 1.0, BACKGROUND, "lower frequency limit for the background fit"));
        d.add(override("upper_bg", 8000.0, BACKGROUND, "upper frequency limit for the background fit"));
        d.add(def("metric", STRING, "bic", BACKGROUND, "model selection metric (bic or aic)"));
        d.add(def("models", BOOL, false, BACKGROUND, "keep iterated background models"));
        d.add(def("n_rms", INT, 20, BACKGROUND, "points used to estimate red noise"));
        d.add(def("fix_wn", BOOL, false, BACKGROUND, "pin the white noise level"));

        d.add(def("cmap", STRING, "binary", GLOBAL, "echelle colormap"));
        d.add(def("clip_value", FLOAT, 3.0, GLOBAL, "echelle clipping value"));
        d.add(def("fft", BOOL, true, GLOBAL, "compute the ACF with FFTs"));
        d.add(def("globe", BOOL, true, GLOBAL, "run the global fit"));
        d.add(def("interp_ech", BOOL, false, GLOBAL, "bilinear interpolation of the echelle diagram"));
        d.add(def("lower_osc", FLOAT, null, GLOBAL, "lower bound of the ACF region"));
        d.add(def("upper_osc", FLOAT, null, GLOBAL, "upper bound of the ACF region"));
        d.add(def(ParameterNames.MC_ITER, INT, 1, GLOBAL, "Monte-Carlo iterations for uncertainties"));
        d.add(def("nox", INT, null, GLOBAL, "echelle x-axis resolution"));
        d.add(def(ParameterNames.NOY, STRING, "0+0", GLOBAL, "echelle orders and order shift"));
        d.add(def("npb", INT, 10, GLOBAL, "frequencies per echelle bin"));
        d.add(def("n_peaks", INT, 10, GLOBAL, "number of ACF peaks to highlight"));
        d.add(override(ParameterNames.NUMAX, null, GLOBAL, "initial numax, bypasses the search stage [muHz]"));
        d.add(def("osc_width", FLOAT, 1.0, GLOBAL, "fractional width of the power excess"));
        d.add(def("smooth_ech", FLOAT, null, GLOBAL, "echelle smoothing"));
        d.add(def("sm_par", FLOAT, null, GLOBAL, "Gaussian filter width for smoothed numax"));
        d.add(def("smooth_ps", FLOAT, 2.5, GLOBAL, "box filter before the ACF [muHz]"));
        d.add(def("threshold", FLOAT, 1.0, GLOBAL, "fractional FWHM of the ACF peak"));
        d.add(def("hey", BOOL, false, GLOBAL, "external echelle plugin"));
        d.add(def(ParameterNames.SAMPLES, BOOL, false, GLOBAL, "save Monte-Carlo samples"));

        d.add(def(ParameterNames.RADIUS, FLOAT, null, STAR, "stellar radius [Rsun]"));
        d.add(def(ParameterNames.LOGG, FLOAT, null, STAR, "surface gravity [log10 cgs]"));
        d.add(def(ParameterNames.TEFF, FLOAT, null, STAR, "effective temperature [K]"));
        d.add(override(ParameterNames.LOWER_ECH, null, STAR, "lower echelle mask bound [muHz]"));
        d.add(override(ParameterNames.UPPER_ECH, null, STAR, "upper echelle mask bound [muHz]"));

        return of(d);
    }

    private static ParameterDefinition def(String name, ParameterType type, Object defaultValue,
                                           ParameterGroup group, String description) {
        return new ParameterDefinition(name, type, defaultValue, false, group, description);
    }

    private static ParameterDefinition override(String name, Double defaultValue,
                                                ParameterGroup group, String description) {
        return new ParameterDefinition(name, FLOAT, defaultValue, true, group, description);
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Optional<ParameterDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * @throws ConfigurationException if the parameter is not declared
     */
    public ParameterDefinition get(String name) {
        ParameterDefinition d = definitions.get(name);
        if (d == null) {
            throw new ConfigurationException("Unknown parameter", name);
        }
        return d;
    }

    public Collection<ParameterDefinition> definitions() {
        return definitions.values();
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    public List<String> namesOfType(ParameterType type) {
        return definitions.values().stream()
                .filter(d -> d.type() == type)
                .map(ParameterDefinition::name)
                .toList();
    }

    /**
     * Names of parameters that accept one value per requested star.
     */
    public List<String> overrideNames() {
        return definitions.values().stream()
                .filter(ParameterDefinition::overrideCapable)
                .map(ParameterDefinition::name)
                .toList();
    }
}
