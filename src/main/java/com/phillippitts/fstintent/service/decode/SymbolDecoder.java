package com.phillippitts.fstintent.service.decode;

import com.phillippitts.fstintent.domain.EntityValue;
import com.phillippitts.fstintent.domain.IntentRecord;
import com.phillippitts.fstintent.domain.RecognizedIntent;
import com.phillippitts.fstintent.exception.MalformedTagException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes the output symbols of one grammar path into an {@link IntentRecord}.
 *
 * <p>Each symbol drives a pure transition {@code (state, symbol) -> (state, entity?)}:
 * <ul>
 *   <li>{@code __begin__name} opens a tag (nested tags are rejected)</li>
 *   <li>{@code __end__name} closes the open tag of exactly that name and emits an entity</li>
 *   <li>{@code __label__name} supplies the intent name when none is given by the caller</li>
 *   <li>any other symbol is a literal token; inside a tag it is also collected for the entity</li>
 * </ul>
 *
 * <p>With tag replacement enabled, a tag named {@code entity:value} yields {@code value} instead
 * of the matched tokens. The entity name is always the part before the first colon. A tag left
 * open at the end of the path emits nothing.
 *
 * <p>Stateless and thread-safe.
 */
public final class SymbolDecoder {

    /**
     * @param symbols     output symbols of one path, markers included
     * @param intentName  externally supplied intent name, or null to take it from a label marker
     * @param replaceTags whether {@code entity:value} tags emit their value
     * @return decoded record with confidence 1 when it has text, 0 otherwise
     * @throws MalformedTagException if begin/end markers do not nest
     */
    public IntentRecord decode(List<String> symbols, String intentName, boolean replaceTags) {
        DecoderState state = DecoderState.idle();
        List<String> output = new ArrayList<>();
        List<EntityValue> entities = new ArrayList<>();
        String resolvedName = intentName;

        for (String raw : symbols) {
            MarkerSymbol symbol = MarkerSymbol.parse(raw);
            if (symbol.kind() == MarkerSymbol.Kind.LABEL) {
                if (resolvedName == null) {
                    resolvedName = symbol.argument();
                }
                continue;
            }
            if (symbol.kind() == MarkerSymbol.Kind.LITERAL) {
                output.add(symbol.argument());
            }
            Transition transition = next(state, symbol, replaceTags);
            state = transition.state();
            transition.entity().ifPresent(entities::add);
        }

        if (output.isEmpty()) {
            return new IntentRecord("", output, RecognizedIntent.none(), entities);
        }
        String name = resolvedName == null ? "" : resolvedName;
        return new IntentRecord(String.join(" ", output), output, new RecognizedIntent(name, 1.0), entities);
    }

    /**
     * Tag state transition for one symbol. Label markers never reach this method.
     */
    static Transition next(DecoderState state, MarkerSymbol symbol, boolean replaceTags) {
        return switch (symbol.kind()) {
            case EPSILON, LABEL -> new Transition(state, Optional.empty());
            case LITERAL -> state instanceof DecoderState.InsideTag open
                    ? new Transition(open.append(symbol.argument()), Optional.empty())
                    : new Transition(state, Optional.empty());
            case BEGIN -> {
                if (state instanceof DecoderState.InsideTag open) {
                    throw new MalformedTagException(open.tag(), symbol.argument());
                }
                yield new Transition(new DecoderState.InsideTag(symbol.argument(), List.of()), Optional.empty());
            }
            case END -> {
                if (!(state instanceof DecoderState.InsideTag open) || !open.tag().equals(symbol.argument())) {
                    String openTag = state instanceof DecoderState.InsideTag o ? o.tag() : null;
                    throw new MalformedTagException(openTag, symbol.argument());
                }
                yield new Transition(DecoderState.idle(), Optional.of(toEntity(open, replaceTags)));
            }
        };
    }

    private static EntityValue toEntity(DecoderState.InsideTag open, boolean replaceTags) {
        String tag = open.tag();
        int colon = tag.indexOf(':');
        String entity = colon >= 0 ? tag.substring(0, colon) : tag;
        String value = replaceTags && colon >= 0
                ? tag.substring(colon + 1)
                : String.join(" ", open.tokens());
        return new EntityValue(entity, value);
    }

    /**
     * Result of one transition.
     *
     * @param state  state after the symbol
     * @param entity entity emitted by a closing tag
     */
    record Transition(DecoderState state, Optional<EntityValue> entity) {
    }
}
