package com.phillippitts.fstintent.service.fst.io;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.service.fst.Arc;
import com.phillippitts.fstintent.service.fst.SymbolTable;
import com.phillippitts.fstintent.service.fst.TropicalWeight;
import com.phillippitts.fstintent.service.fst.VectorFst;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Reads transducers in the AT&T text format written by {@code fstprint}.
 *
 * <p>Line formats (fields separated by tabs or spaces):
 * <pre>
 * src dst ilabel olabel [weight]   arc
 * state [weight]                   final state
 * </pre>
 * The source state of the first line is the start state. Missing weights default to
 * {@link TropicalWeight#ONE}. Labels are symbols looked up in the given tables; with fixed tables a
 * purely numeric label that is not a symbol is taken as a label id and must exist in the table.
 *
 * <p>When {@code extendSymbols} is set, unknown symbols are added to the tables instead of being
 * rejected, which allows grammars printed without separate symbol files. Numeric labels are then
 * words like any other.
 */
public final class AttFstReader {

    private final SymbolTable inputSymbols;
    private final SymbolTable outputSymbols;
    private final boolean extendSymbols;

    public AttFstReader(SymbolTable inputSymbols, SymbolTable outputSymbols, boolean extendSymbols) {
        this.inputSymbols = Objects.requireNonNull(inputSymbols, "inputSymbols");
        this.outputSymbols = Objects.requireNonNull(outputSymbols, "outputSymbols");
        this.extendSymbols = extendSymbols;
    }

    /**
     * @param reader     source of the FST text; not closed by this method
     * @param sourceName name used in error messages
     * @return the parsed transducer; empty (no start state) if the text has no lines
     */
    public VectorFst read(Reader reader, String sourceName) throws IOException {
        VectorFst fst = new VectorFst(inputSymbols, outputSymbols);
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        boolean startSet = false;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            int source = parseState(fields[0], sourceName, lineNumber);
            ensureState(fst, source);
            if (!startSet) {
                fst.setStart(source);
                startSet = true;
            }

            switch (fields.length) {
                case 1, 2 -> {
                    double weight = fields.length == 2
                            ? parseWeight(fields[1], sourceName, lineNumber)
                            : TropicalWeight.ONE;
                    fst.setFinal(source, weight);
                }
                case 4, 5 -> {
                    int target = parseState(fields[1], sourceName, lineNumber);
                    ensureState(fst, target);
                    long ilabel = resolve(fields[2], inputSymbols, sourceName, lineNumber);
                    long olabel = resolve(fields[3], outputSymbols, sourceName, lineNumber);
                    double weight = fields.length == 5
                            ? parseWeight(fields[4], sourceName, lineNumber)
                            : TropicalWeight.ONE;
                    fst.addArc(source, new Arc(ilabel, olabel, weight, target));
                }
                default -> throw new GrammarFormatException(sourceName, lineNumber,
                        "Expected 1, 2, 4 or 5 fields, got " + fields.length);
            }
        }
        return fst;
    }

    private long resolve(String token, SymbolTable table, String sourceName, int lineNumber) {
        long label = table.find(token);
        if (label != SymbolTable.NO_LABEL) {
            return label;
        }
        if (extendSymbols) {
            return table.add(token);
        }
        if (isNumeric(token)) {
            long id = Long.parseLong(token);
            if (table.contains(id)) {
                return id;
            }
        }
        throw new GrammarFormatException(sourceName, lineNumber,
                "Symbol '" + token + "' not in symbol table '" + table.name() + "'");
    }

    private static boolean isNumeric(String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static void ensureState(VectorFst fst, int state) {
        while (fst.numStates() <= state) {
            fst.addState();
        }
    }

    private static int parseState(String token, String sourceName, int lineNumber) {
        try {
            int state = Integer.parseInt(token);
            if (state < 0) {
                throw new GrammarFormatException(sourceName, lineNumber, "Negative state id " + state);
            }
            return state;
        } catch (NumberFormatException e) {
            throw new GrammarFormatException(sourceName, lineNumber, "Invalid state id '" + token + "'");
        }
    }

    private static double parseWeight(String token, String sourceName, int lineNumber) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new GrammarFormatException(sourceName, lineNumber, "Invalid weight '" + token + "'");
        }
    }
}
