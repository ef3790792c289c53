package com.phillippitts.fstintent.service.decode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tag state of {@link SymbolDecoder}: either no tag is open, or one tag is open together with the
 * literal tokens seen since it was opened.
 */
public interface DecoderState {

    /** No tag open. */
    record Idle() implements DecoderState {
    }

    /**
     * A tag is open.
     *
     * @param tag    full tag name, possibly {@code entity:value}
     * @param tokens literal tokens seen inside the tag
     */
    record InsideTag(String tag, List<String> tokens) implements DecoderState {

        public InsideTag {
            Objects.requireNonNull(tag, "tag");
            tokens = List.copyOf(tokens);
        }

        InsideTag append(String token) {
            List<String> extended = new ArrayList<>(tokens);
            extended.add(token);
            return new InsideTag(tag, extended);
        }
    }

    static DecoderState idle() {
        return new Idle();
    }
}
