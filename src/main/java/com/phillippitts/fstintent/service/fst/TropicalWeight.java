package com.phillippitts.fstintent.service.fst;

/**
 * Weight arithmetic in the tropical semiring, the default semiring of OpenFst grammars.
 *
 * <p>Weights are costs: {@link #ONE} (0.0) is the neutral "free" weight, {@link #ZERO}
 * (positive infinity) marks a non-final state. Extending a path adds costs.
 */
public final class TropicalWeight {

    /** Semiring zero: non-accepting. */
    public static final double ZERO = Double.POSITIVE_INFINITY;

    /** Semiring one: no cost. */
    public static final double ONE = 0.0;

    private TropicalWeight() {
        // Utility class - prevent instantiation
    }

    /**
     * Semiring product (path extension).
     */
    public static double times(double a, double b) {
        if (isZero(a) || isZero(b)) {
            return ZERO;
        }
        return a + b;
    }

    public static boolean isZero(double weight) {
        return weight == ZERO;
    }
}
