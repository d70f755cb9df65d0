package com.srtpnl.domain.enums;

/**
 * Amortisation regime of the reference portfolio for a single period.
 *
 * <pre>
 * REPLENISHMENT -> PRO_RATA -> SEQUENTIAL
 * REPLENISHMENT -> SEQUENTIAL   (trigger in the first post-replenishment year)
 * </pre>
 *
 * <p>SEQUENTIAL is terminal: once a deal has switched to sequential amortisation it
 * never returns to PRO_RATA within the same scenario.
 */
public enum AmortisationRegime {
    REPLENISHMENT("Replenishment"),
    PRO_RATA("Pro-rata"),
    SEQUENTIAL("Sequential");

    private final String label;

    AmortisationRegime(String label) {
        this.label = label;
    }

    /** Display label used in ledger tables. */
    public String getLabel() {
        return label;
    }

    public boolean isAmortising() {
        return this != REPLENISHMENT;
    }
}
