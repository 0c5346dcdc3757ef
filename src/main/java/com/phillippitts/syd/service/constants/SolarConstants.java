package com.phillippitts.syd.service.constants;

import java.util.List;

/**
 * Solar reference values and physical constants used by the scaling relations.
 *
 * <p>All values are CGS unless stated otherwise. Frequencies are in microhertz.
 */
public final class SolarConstants {

    /** Solar mass [g]. */
    public static final double M_SUN = 1.9891e33;

    /** Solar radius [cm]. */
    public static final double R_SUN = 6.95508e10;

    /** Mean solar density [g cm^-3]. */
    public static final double RHO_SUN = 1.41;

    /** Solar effective temperature [K]. */
    public static final double TEFF_SUN = 5777.0;

    /** Solar surface gravity [log10(cm s^-2)]. */
    public static final double LOGG_SUN = 4.4;

    /** Red-edge temperature of the solar-like oscillation amplitude relation [K]. */
    public static final double TEFFRED_SUN = 8907.0;

    /** Solar frequency of maximum oscillation power [muHz]. */
    public static final double NUMAX_SUN = 3090.0;

    /** Solar large frequency separation [muHz]. */
    public static final double DNU_SUN = 135.1;

    /** Solar width of the power excess [muHz]. */
    public static final double WIDTH_SUN = 1300.0;

    /** Solar granulation/activity timescales for the multi-component background [s]. */
    public static final List<Double> TAU_SUN = List.of(5.2e6, 1.8e5, 1.7e4, 2.5e3, 280.0, 80.0);

    /** Solar timescales when each component is fit on its own [s]. */
    public static final List<Double> TAU_SUN_SINGLE = List.of(3.8e6, 2.5e5, 1.5e5, 1.0e5, 230.0, 70.0);

    /** Gravitational constant [cm^3 g^-1 s^-2]. */
    public static final double G = 6.67428e-8;

    public static final double CM_TO_AU = 6.68459e-14;
    public static final double AU_TO_CM = 1.496e13;
    public static final double RAD_TO_DEG = 180.0 / Math.PI;
    public static final double DEG_TO_RAD = Math.PI / 180.0;

    private SolarConstants() {
        // Utility class - prevent instantiation
    }

    public static double cmToAu(double cm) {
        return cm * CM_TO_AU;
    }

    public static double auToCm(double au) {
        return au * AU_TO_CM;
    }

    public static double radToDeg(double radians) {
        return radians * RAD_TO_DEG;
    }

    public static double degToRad(double degrees) {
        return degrees * DEG_TO_RAD;
    }
}
