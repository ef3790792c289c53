package com.phillippitts.fstintent.domain;

import java.util.Objects;

/**
 * A named slot captured between a {@code __begin__} / {@code __end__} tag pair.
 *
 * @param entity slot name (the part of the tag before any colon)
 * @param value  replacement value from the tag, or the tokens matched inside it
 */
public record EntityValue(String entity, String value) {

    public EntityValue {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(value, "value");
    }
}
