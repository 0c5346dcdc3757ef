package com.phillippitts.syd.service.schema;

/**
 * Names of parameters the core reads or derives directly.
 */
public final class ParameterNames {

    public static final String OUTDIR = "outdir";
    public static final String INFO = "info";
    public static final String TODO = "todo";
    public static final String IGNORE = "ignore";
    public static final String SAVE = "save";
    public static final String OVERWRITE = "overwrite";
    public static final String SAMPLES = "samples";
    public static final String MODE = "mode";
    public static final String N_THREADS = "n_threads";

    public static final String NUMAX = "numax";
    public static final String DNU = "dnu";
    public static final String ESTIMATE = "estimate";
    public static final String MC_ITER = "mc_iter";
    public static final String N_TRIALS = "n_trials";
    public static final String N_LAWS = "n_laws";
    public static final String OVERSAMPLING_FACTOR = "oversampling_factor";
    public static final String NOY = "noy";
    public static final String BIN_MODE = "bin_mode";

    public static final String RADIUS = "rs";
    public static final String LOGG = "logg";
    public static final String TEFF = "teff";
    public static final String LOWER_ECH = "lower_ech";
    public static final String UPPER_ECH = "upper_ech";

    /** Derived: dnu supplied explicitly alongside numax, kept before recomputation. */
    public static final String FORCE = "force";
    /** Derived: stellar mass in solar units. */
    public static final String MASS = "ms";

    private ParameterNames() {
        // Utility class - prevent instantiation
    }
}
