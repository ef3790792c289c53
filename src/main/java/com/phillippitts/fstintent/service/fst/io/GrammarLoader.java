package com.phillippitts.fstintent.service.fst.io;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.exception.GrammarNotFoundException;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.service.fst.SymbolTable;
import com.phillippitts.fstintent.service.fst.VectorFst;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a grammar from an AT&T text FST and its symbol tables.
 *
 * <p>Symbol table resolution when no explicit paths are given, relative to the FST file with its
 * FST extensions removed ({@code grammars/light_on.fst.txt} → {@code grammars/light_on}):
 * <ol>
 *   <li>{@code light_on.isyms} and {@code light_on.osyms}</li>
 *   <li>{@code light_on.syms}, shared by both sides</li>
 *   <li>none: tables are built from the symbols in the FST text</li>
 * </ol>
 *
 * <p>The grammar name is the file name without its FST extensions; it becomes the default
 * intent name.
 */
public final class GrammarLoader {

    private static final Logger LOG = LogManager.getLogger(GrammarLoader.class);

    private static final List<String> FST_EXTENSIONS = List.of(".txt", ".att", ".fst");

    /**
     * Loads a grammar, locating symbol tables next to the FST file.
     */
    public Grammar load(Path fstFile) {
        return load(fstFile, null, null);
    }

    /**
     * @param fstFile       AT&T text FST
     * @param inputSymbols  input symbol table, or null to locate automatically
     * @param outputSymbols output symbol table, or null to use the input table / locate automatically
     * @throws GrammarNotFoundException if a file is missing
     * @throws GrammarFormatException   if a file cannot be parsed
     */
    public Grammar load(Path fstFile, Path inputSymbols, Path outputSymbols) {
        if (!Files.isRegularFile(fstFile)) {
            throw new GrammarNotFoundException(fstFile.toString());
        }

        Path base = fstFile.resolveSibling(grammarName(fstFile));
        SymbolTable isyms;
        SymbolTable osyms;
        boolean extend = false;

        if (inputSymbols != null) {
            isyms = SymbolTableReader.read(inputSymbols);
            osyms = outputSymbols != null ? SymbolTableReader.read(outputSymbols) : isyms;
        } else if (Files.isRegularFile(sibling(base, ".isyms")) && Files.isRegularFile(sibling(base, ".osyms"))) {
            isyms = SymbolTableReader.read(sibling(base, ".isyms"));
            osyms = SymbolTableReader.read(sibling(base, ".osyms"));
        } else if (Files.isRegularFile(sibling(base, ".syms"))) {
            isyms = SymbolTableReader.read(sibling(base, ".syms"));
            osyms = isyms;
        } else {
            LOG.debug("No symbol tables next to {}; deriving symbols from FST text", fstFile);
            isyms = new SymbolTable("isyms");
            osyms = isyms;
            extend = true;
        }

        VectorFst fst;
        try (BufferedReader reader = Files.newBufferedReader(fstFile, StandardCharsets.UTF_8)) {
            fst = new AttFstReader(isyms, osyms, extend).read(reader, fstFile.getFileName().toString());
        } catch (IOException e) {
            throw new GrammarFormatException("Failed to read grammar " + fstFile, e);
        }

        String name = grammarName(fstFile);
        LOG.info("Loaded grammar '{}' from {} (states={}, arcs={}, isyms={}, osyms={})",
                name, fstFile, fst.numStates(), fst.totalArcs(), isyms.size(), osyms.size());
        return new Grammar(name, fst);
    }

    /**
     * Derives the grammar name from a file name by stripping trailing FST extensions.
     */
    public static String grammarName(Path fstFile) {
        String name = fstFile.getFileName().toString();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String ext : FST_EXTENSIONS) {
                if (name.length() > ext.length() && name.endsWith(ext)) {
                    name = name.substring(0, name.length() - ext.length());
                    stripped = true;
                }
            }
        }
        return name;
    }

    private static Path sibling(Path base, String extension) {
        return base.resolveSibling(base.getFileName() + extension);
    }
}
