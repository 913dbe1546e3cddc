package io.github.jakubt4.kaal.model;

/**
 * The twelve sidereal signs, 30 degrees each, with their ruling planet.
 */
public enum Rashi {
    MESHA("Aries", Body.MARS),
    VRISHABHA("Taurus", Body.VENUS),
    MITHUNA("Gemini", Body.MERCURY),
    KARKA("Cancer", Body.MOON),
    SIMHA("Leo", Body.SUN),
    KANYA("Virgo", Body.MERCURY),
    TULA("Libra", Body.VENUS),
    VRISHCHIKA("Scorpio", Body.MARS),
    DHANU("Sagittarius", Body.JUPITER),
    MAKARA("Capricorn", Body.SATURN),
    KUMBHA("Aquarius", Body.SATURN),
    MEENA("Pisces", Body.JUPITER);

    private static final Rashi[] VALUES = values();

    private final String westernName;
    private final Body lord;

    Rashi(final String westernName, final Body lord) {
        this.westernName = westernName;
        this.lord = lord;
    }

    public static Rashi ofLongitude(final double siderealDegrees) {
        final var index = (int) Math.floor(Angles.normalize(siderealDegrees) / 30.0);
        return VALUES[Math.min(index, VALUES.length - 1)];
    }

    public String westernName() {
        return westernName;
    }

    public Body lord() {
        return lord;
    }
}
