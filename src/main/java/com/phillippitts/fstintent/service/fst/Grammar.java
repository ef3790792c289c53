package com.phillippitts.fstintent.service.fst;

import java.util.Objects;

/**
 * A loaded grammar transducer together with its name. The name is derived from the grammar file
 * and doubles as the default intent name.
 *
 * @param name grammar name
 * @param fst  grammar transducer, read-only once loaded
 */
public record Grammar(String name, Fst fst) {

    public Grammar {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fst, "fst");
    }
}
