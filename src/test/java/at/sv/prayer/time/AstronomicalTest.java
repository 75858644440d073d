package at.sv.prayer.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class AstronomicalTest {

    @Test
    void solarCoordinates_sampleFromAstronomicalAlgorithms() {
        // Meeus, Astronomical Algorithms, example 25.a: 1992 October 13.0 TD
        double jd = Astronomical.julianDay(1992, 10, 13, 0);
        double T = Astronomical.julianCentury(jd);
        double L0 = Astronomical.meanSolarLongitude(T);
        double epsilon0 = Astronomical.meanObliquityOfTheEcliptic(T);
        double epsilonApp = Astronomical.apparentObliquityOfTheEcliptic(T, epsilon0);
        double M = Astronomical.meanSolarAnomaly(T);
        double C = Astronomical.solarEquationOfTheCenter(T, M);
        double lambda = Astronomical.apparentSolarLongitude(T, L0);

        assertThat(T).isCloseTo(-0.072183436, within(1e-8));
        assertThat(L0).isCloseTo(201.80720, within(1e-5));
        assertThat(epsilon0).isCloseTo(23.44023, within(1e-5));
        assertThat(epsilonApp).isCloseTo(23.43999, within(1e-5));
        assertThat(M).isCloseTo(278.99397, within(1e-5));
        assertThat(C).isCloseTo(-1.89732, within(1e-5));
        assertThat(lambda).isCloseTo(199.90895, within(2e-5));

        SolarCoordinates solar = new SolarCoordinates(jd);
        assertThat(solar.getDeclination()).isCloseTo(-7.78507, within(1e-5));
        assertThat(solar.getRightAscension()).isCloseTo(198.38083, within(2e-5));
    }

    @Test
    void siderealTimeAndNutation_sampleFromAstronomicalAlgorithms() {
        // Meeus, examples 12.a and 22.a: 1987 April 10, 0h UT
        double jd = Astronomical.julianDay(1987, 4, 10, 0);
        double T = Astronomical.julianCentury(jd);
        double theta0 = Astronomical.meanSiderealTime(T);
        double L0 = Astronomical.meanSolarLongitude(T);
        double Lp = Astronomical.meanLunarLongitude(T);
        double omega = Astronomical.ascendingLunarNodeLongitude(T);
        double dPsi = Astronomical.nutationInLongitude(L0, Lp, omega);
        double dEpsilon = Astronomical.nutationInObliquity(L0, Lp, omega);
        double epsilon0 = Astronomical.meanObliquityOfTheEcliptic(T);

        assertThat(theta0).isCloseTo(197.693195, within(1e-5));
        assertThat(omega).isCloseTo(11.2531, within(1e-4));
        assertThat(dPsi).isCloseTo(-0.0010522, within(1e-4));
        assertThat(dEpsilon).isCloseTo(0.0026230556, within(2e-5));
        assertThat(epsilon0).isCloseTo(23.4409463889, within(1e-6));
        assertThat(epsilon0 + dEpsilon).isCloseTo(23.4435694444, within(2e-5));
        assertThat(new SolarCoordinates(jd).getApparentSiderealTime()).isCloseTo(197.6922296, within(2e-4));
    }

    @Test
    void julianDay_knownDates() {
        assertThat("2010-01-02", Astronomical.julianDay(2010, 1, 2, 0), is(2455198.5));
        assertThat("2015-06-12", Astronomical.julianDay(2015, 6, 12, 0), is(2457185.5));
        assertThat("2021-12-24", Astronomical.julianDay(2021, 12, 24, 0), is(2459572.5));
        assertThat(Astronomical.julianDay(2010, 1, 3, 12)).isCloseTo(2455200.0, within(1e-9));
    }

    @Test
    void julianDay_matchesEpochDayForAnyDate() {
        LocalDate date = LocalDate.of(1900, 3, 1);
        while (date.isBefore(LocalDate.of(2100, 3, 1))) {
            double expected = date.toEpochDay() + 2440587.5;
            assertThat("JD for " + date,
                    Astronomical.julianDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), 0),
                    is(expected));
            date = date.plusDays(37);
        }
    }

    @Test
    void interpolate_usesThreeSamples() {
        assertThat(Astronomical.interpolate(0.877366, 0.884226, 0.870531, 4.35 / 24)).isCloseTo(0.876125, within(1e-6));
        assertThat(Astronomical.interpolate(1, -1, 3, 0.6)).isCloseTo(2.2, within(1e-6));
    }

    @Test
    void interpolateAngles_unwindsBeforeInterpolating() {
        assertThat(Astronomical.interpolateAngles(1, -1, 3, 0.6)).isCloseTo(2.2, within(1e-6));
        assertThat(Astronomical.interpolateAngles(1, 359, 3, 0.6)).isCloseTo(2.2, within(1e-6));
    }

    @Test
    void unwindAngle_returnsValueInFullCircle() {
        assertThat(Astronomical.unwindAngle(-45)).isCloseTo(315, within(1e-9));
        assertThat(Astronomical.unwindAngle(361)).isCloseTo(1, within(1e-9));
        assertThat(Astronomical.unwindAngle(360)).isCloseTo(0, within(1e-9));
        assertThat(Astronomical.unwindAngle(259)).isCloseTo(259, within(1e-9));
        assertThat(Astronomical.unwindAngle(2592)).isCloseTo(72, within(1e-9));
    }

    @Test
    void closestAngle_returnsValueAroundZero() {
        assertThat(Astronomical.closestAngle(360)).isCloseTo(0, within(1e-9));
        assertThat(Astronomical.closestAngle(361)).isCloseTo(1, within(1e-9));
        assertThat(Astronomical.closestAngle(-360)).isCloseTo(0, within(1e-9));
        assertThat(Astronomical.closestAngle(-361)).isCloseTo(-1, within(1e-9));
        assertThat(Astronomical.closestAngle(180)).isCloseTo(180, within(1e-9));
        assertThat(Astronomical.closestAngle(-180)).isCloseTo(-180, within(1e-9));
        assertThat(Astronomical.closestAngle(359)).isCloseTo(-1, within(1e-9));
        assertThat(Astronomical.closestAngle(-359)).isCloseTo(1, within(1e-9));
        assertThat(Astronomical.closestAngle(1261)).isCloseTo(-179, within(1e-9));
    }

    @Test
    void altitudeOfCelestialBody_sunAtZenith_isNinetyDegrees() {
        assertThat(Astronomical.altitudeOfCelestialBody(10, 10, 0)).isCloseTo(90, within(1e-5));
        assertThat(Astronomical.altitudeOfCelestialBody(0, 0, 90)).isCloseTo(0, within(1e-9));
    }
}
