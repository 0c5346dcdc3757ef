package com.phillippitts.syd.service.constants;

import org.junit.jupiter.api.Test;

import static com.phillippitts.syd.service.constants.SolarConstants.DNU_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.G;
import static com.phillippitts.syd.service.constants.SolarConstants.M_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.NUMAX_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.R_SUN;
import static com.phillippitts.syd.service.constants.SolarConstants.TEFF_SUN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class ScalingRelationsTest {

    @Test
    void empiricalDeltaNuForNumaxOfHundred() {
        assertThat(ScalingRelations.deltaNu(100.0)).isCloseTo(8.638, within(0.01));
    }

    @Test
    void solarValuesGiveSolarMass() {
        double solarLogg = Math.log10(G * M_SUN / (R_SUN * R_SUN));

        assertThat(ScalingRelations.mass(1.0, solarLogg)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void solarStarReproducesSolarFrequencies() {
        assertThat(ScalingRelations.numax(1.0, 1.0, TEFF_SUN)).isCloseTo(NUMAX_SUN, within(1e-9));
        assertThat(ScalingRelations.deltaNu(1.0, 1.0)).isCloseTo(DNU_SUN, within(1e-9));
    }

    @Test
    void largerRadiusLowersBothFrequencies() {
        double mass = 1.2;
        assertThat(ScalingRelations.numax(mass, 4.0, 4800)).isLessThan(ScalingRelations.numax(mass, 1.0, 4800));
        assertThat(ScalingRelations.deltaNu(mass, 4.0)).isLessThan(ScalingRelations.deltaNu(mass, 1.0));
    }

    @Test
    void unitConversionsAreInverse() {
        assertThat(SolarConstants.auToCm(SolarConstants.cmToAu(1.0e13))).isCloseTo(1.0e13, withinPercentage(0.01));
        assertThat(SolarConstants.radToDeg(Math.PI)).isCloseTo(180.0, within(1e-9));
        assertThat(SolarConstants.degToRad(90.0)).isCloseTo(Math.PI / 2, within(1e-12));
    }
}
