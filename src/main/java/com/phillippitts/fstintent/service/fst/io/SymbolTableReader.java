package com.phillippitts.fstintent.service.fst.io;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.exception.GrammarNotFoundException;
import com.phillippitts.fstintent.service.fst.SymbolTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads OpenFst text symbol tables: one {@code symbol<whitespace>label} pair per line.
 * Blank lines and lines starting with {@code #} are ignored.
 */
public final class SymbolTableReader {

    private SymbolTableReader() {
        // Utility class - prevent instantiation
    }

    public static SymbolTable read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.getFileName().toString());
        } catch (NoSuchFileException e) {
            throw new GrammarNotFoundException(path.toString(), e);
        } catch (IOException e) {
            throw new GrammarFormatException("Failed to read symbol table " + path, e);
        }
    }

    /**
     * @param reader source of the table; not closed by this method
     * @param name   table name, also used in error messages
     */
    public static SymbolTable read(Reader reader, String name) throws IOException {
        SymbolTable table = new SymbolTable(name);
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            if (fields.length != 2) {
                throw new GrammarFormatException(name, lineNumber,
                        "Expected 'symbol label', got " + fields.length + " fields");
            }
            long label;
            try {
                label = Long.parseLong(fields[1]);
            } catch (NumberFormatException e) {
                throw new GrammarFormatException(name, lineNumber, "Invalid label '" + fields[1] + "'");
            }
            if (label == SymbolTable.EPSILON_LABEL && !SymbolTable.EPSILON.equals(fields[0])) {
                throw new GrammarFormatException(name, lineNumber,
                        "Label 0 is reserved for " + SymbolTable.EPSILON + ", got '" + fields[0] + "'");
            }
            try {
                table.add(fields[0], label);
            } catch (GrammarFormatException e) {
                throw new GrammarFormatException(name, lineNumber, e.getMessage());
            }
        }
        return table;
    }
}
