package io.github.jakubt4.kaal.panchang;

/**
 * The thirty lunar days, Shukla Pratipada through Amavasya.
 */
public enum Tithi {
    SHUKLA_PRATIPADA("Pratipada"),
    SHUKLA_DWITIYA("Dwitiya"),
    SHUKLA_TRITIYA("Tritiya"),
    SHUKLA_CHATURTHI("Chaturthi"),
    SHUKLA_PANCHAMI("Panchami"),
    SHUKLA_SHASHTHI("Shashthi"),
    SHUKLA_SAPTAMI("Saptami"),
    SHUKLA_ASHTAMI("Ashtami"),
    SHUKLA_NAVAMI("Navami"),
    SHUKLA_DASHAMI("Dashami"),
    SHUKLA_EKADASHI("Ekadashi"),
    SHUKLA_DWADASHI("Dwadashi"),
    SHUKLA_TRAYODASHI("Trayodashi"),
    SHUKLA_CHATURDASHI("Chaturdashi"),
    PURNIMA("Purnima"),
    KRISHNA_PRATIPADA("Pratipada"),
    KRISHNA_DWITIYA("Dwitiya"),
    KRISHNA_TRITIYA("Tritiya"),
    KRISHNA_CHATURTHI("Chaturthi"),
    KRISHNA_PANCHAMI("Panchami"),
    KRISHNA_SHASHTHI("Shashthi"),
    KRISHNA_SAPTAMI("Saptami"),
    KRISHNA_ASHTAMI("Ashtami"),
    KRISHNA_NAVAMI("Navami"),
    KRISHNA_DASHAMI("Dashami"),
    KRISHNA_EKADASHI("Ekadashi"),
    KRISHNA_DWADASHI("Dwadashi"),
    KRISHNA_TRAYODASHI("Trayodashi"),
    KRISHNA_CHATURDASHI("Chaturdashi"),
    AMAVASYA("Amavasya");

    public static final int COUNT = 30;
    public static final double SPAN_DEGREES = 12.0;

    private static final Tithi[] VALUES = values();

    private final String displayName;

    Tithi(final String displayName) {
        this.displayName = displayName;
    }

    public static Tithi ofIndex(final int index) {
        return VALUES[index];
    }

    /**
     * 1-based number, 1..30.
     */
    public int number() {
        return ordinal() + 1;
    }

    public Paksha paksha() {
        return ordinal() < 15 ? Paksha.SHUKLA : Paksha.KRISHNA;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * e.g. "Shukla Ekadashi", "Purnima".
     */
    public String fullName() {
        if (this == PURNIMA || this == AMAVASYA) {
            return displayName;
        }
        return paksha() == Paksha.SHUKLA ? "Shukla " + displayName : "Krishna " + displayName;
    }
}
