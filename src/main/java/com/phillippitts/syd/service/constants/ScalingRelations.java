package com.phillippitts.syd.service.constants;

import static com.phillippitts.syd.service.constants.SolarConstants.DNU_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.G;
import static com.phillippitts.syd.service.constants.SolarConstants.M_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.NUMAX_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.R_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.TEFF_SUN;

/**
 * Asteroseismic scaling relations used to derive dependent quantities for a star.
 *
 * <p>Radius and mass are in solar units, {@code logg} in log10(cgs), temperatures in K and
 * frequencies in muHz.
 */
public final class ScalingRelations {

    private static final double DNU_COEFFICIENT = 0.22;
    private static final double DNU_EXPONENT = 0.797;

    private ScalingRelations() {
        // Utility class - prevent instantiation
    }

    /**
     * Empirical large frequency separation for a given numax: {@code 0.22 * numax^0.797}.
     */
    public static double deltaNu(double numax) {
        return DNU_COEFFICIENT * Math.pow(numax, DNU_EXPONENT);
    }

    /**
     * Stellar mass from radius and surface gravity, {@code g R^2 / G}, in solar masses.
     *
     * @param radius radius in solar radii
     * @param logg surface gravity, log10 of cm s^-2
     */
    public static double mass(double radius, double logg) {
        double radiusCm = radius * R_SUN;
        return (radiusCm * radiusCm * Math.pow(10.0, logg) / G) / M_SUN;
    }

    /**
     * Frequency of maximum power from the solar-scaled acoustic cutoff relation.
     */
    public static double numax(double mass, double radius, double teff) {
        return NUMAX_SUN * mass * Math.pow(radius, -2.0) * Math.pow(teff / TEFF_SUN, -0.5);
    }

    /**
     * Large frequency separation from the mean-density relation.
     */
    public static double deltaNu(double mass, double radius) {
        return DNU_SUN * Math.pow(mass, 0.5) * Math.pow(radius, -1.5);
    }
}
