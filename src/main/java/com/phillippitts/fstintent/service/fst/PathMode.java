package com.phillippitts.fstintent.service.fst;

/**
 * Which output symbols {@link PathEnumerator} keeps for each path.
 */
public enum PathMode {
    /** Every non-epsilon symbol, tag and label markers included. Used for decoding. */
    ALL_SYMBOLS,
    /** Only literal tokens; symbols with the {@code __} meta prefix are skipped. */
    LITERAL_ONLY
}
