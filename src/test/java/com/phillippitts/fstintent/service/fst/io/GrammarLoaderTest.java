package com.phillippitts.fstintent.service.fst.io;

import com.phillippitts.fstintent.exception.GrammarFormatException;
import com.phillippitts.fstintent.exception.GrammarNotFoundException;
import com.phillippitts.fstintent.service.fst.Grammar;
import com.phillippitts.fstintent.testutil.GrammarFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarLoaderTest {

    private final GrammarLoader loader = new GrammarLoader();

    @Test
    void loadsGrammarWithSharedSymbolFile() {
        Grammar grammar = GrammarFixtures.home();

        assertThat(grammar.name()).isEqualTo("home");
        assertThat(grammar.fst().start()).isZero();
        assertThat(grammar.fst().inputSymbols().find("__label__LightOn")).isEqualTo(12L);
        assertThat(grammar.fst().outputSymbols()).isSameAs(grammar.fst().inputSymbols());
    }

    @Test
    void derivesSymbolsWhenNoTableIsPresent() {
        Grammar grammar = GrammarFixtures.lightOn();

        assertThat(grammar.name()).isEqualTo("light_on");
        assertThat(grammar.fst().numStates()).isEqualTo(5);
        assertThat(grammar.fst().inputSymbols().contains("light")).isTrue();
    }

    @Test
    void prefersSeparateInputAndOutputTables(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("color.fst.txt"), "0 1 red RED\n1\n");
        Files.writeString(dir.resolve("color.isyms"), "<eps> 0\nred 3\n");
        Files.writeString(dir.resolve("color.osyms"), "<eps> 0\nRED 8\n");
        Files.writeString(dir.resolve("color.syms"), "<eps> 0\nred 1\nRED 2\n");

        Grammar grammar = loader.load(dir.resolve("color.fst.txt"));

        assertThat(grammar.fst().arcs(0).get(0).ilabel()).isEqualTo(3L);
        assertThat(grammar.fst().arcs(0).get(0).olabel()).isEqualTo(8L);
        assertThat(grammar.fst().inputSymbols().name()).isEqualTo("color.isyms");
    }

    @Test
    void usesExplicitSymbolPaths(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("g.att"), "0 1 red RED\n1\n");
        Files.writeString(dir.resolve("in.txt"), "<eps> 0\nred 4\n");
        Files.writeString(dir.resolve("out.txt"), "<eps> 0\nRED 6\n");

        Grammar grammar = loader.load(dir.resolve("g.att"), dir.resolve("in.txt"), dir.resolve("out.txt"));

        assertThat(grammar.name()).isEqualTo("g");
        assertThat(grammar.fst().arcs(0).get(0).ilabel()).isEqualTo(4L);
        assertThat(grammar.fst().arcs(0).get(0).olabel()).isEqualTo(6L);
    }

    @Test
    void keepsDigitWordsDistinctWithoutSymbolFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("timer.fst.txt"),
                "0 1 <eps> __label__Timer\n1 2 set set\n2 3 1 1\n3 4 minute minute\n4\n");

        Grammar grammar = loader.load(dir.resolve("timer.fst.txt"));

        long digit = grammar.fst().arcs(2).get(0).ilabel();
        assertThat(grammar.fst().inputSymbols().find(digit)).isEqualTo("1");
        assertThat(grammar.fst().arcs(2).get(0).olabel()).isEqualTo(digit);
    }

    @Test
    void missingGrammarFileThrowsNotFound(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("nope.fst.txt")))
                .isInstanceOf(GrammarNotFoundException.class)
                .hasMessageContaining("nope.fst.txt");
    }

    @Test
    void grammarSymbolMissingFromTableIsFormatError(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("g.fst.txt"), "0 1 blue blue\n1\n");
        Files.writeString(dir.resolve("g.syms"), "<eps> 0\nred 1\n");

        assertThatThrownBy(() -> loader.load(dir.resolve("g.fst.txt")))
                .isInstanceOf(GrammarFormatException.class)
                .hasMessageContaining("blue");
    }

    @Test
    void grammarNameStripsFstExtensions() {
        assertThat(GrammarLoader.grammarName(Paths.get("grammars/light_on.fst.txt"))).isEqualTo("light_on");
        assertThat(GrammarLoader.grammarName(Paths.get("ChangeLightColor.fst"))).isEqualTo("ChangeLightColor");
        assertThat(GrammarLoader.grammarName(Paths.get("weather.att"))).isEqualTo("weather");
        assertThat(GrammarLoader.grammarName(Paths.get(".fst"))).isEqualTo(".fst");
    }
}
