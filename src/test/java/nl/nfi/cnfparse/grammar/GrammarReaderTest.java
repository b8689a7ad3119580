package nl.nfi.cnfparse.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarReaderTest {

    @Test
    void readsPlainRules() {
        final Grammar grammar = GrammarReader.read("""
                # a comment
                S -> A B | a

                A --> a |
                B -> b
                """);

        assertThat(grammar.isProbabilistic()).isFalse();
        assertThat(grammar.startSymbol()).isEqualTo('S');
        assertThat(grammar.productions('S')).containsExactly("AB", "a");
        assertThat(grammar.productions('A')).containsExactly("a", Symbols.EPSILON_STRING);
    }

    @Test
    void repeatedLeftHandSidesAreMerged() {
        final Grammar grammar = GrammarReader.read("""
                S -> AB
                S -> ε
                A -> a
                B -> b
                """);

        assertThat(grammar.productions('S')).containsExactly("AB", Symbols.EPSILON_STRING);
    }

    @Test
    void readsProbabilities() {
        final Grammar grammar = GrammarReader.read("""
                S -> AB [0.6] | a [0.4]
                A -> a [1]
                B -> b [0.5] | [0.5]
                """);

        assertThat(grammar.isProbabilistic()).isTrue();
        assertThat(grammar.probability('S', "AB")).isEqualTo(0.6);
        assertThat(grammar.probability('B', Symbols.EPSILON_STRING)).isEqualTo(0.5);
    }

    @Test
    void explicitStartSymbol() {
        final Grammar grammar = GrammarReader.read("""
                S -> aS | b
                """, 'S');

        assertThat(grammar.startSymbol()).isEqualTo('S');
    }

    @ParameterizedTest(name = "\"{0}\" is rejected")
    @CsvSource(delimiter = ';', value = {
            "S a",
            "SA -> a",
            "-> a",
            "S -> a [0.5",
            "S -> a [half]",
    })
    void malformedLines(final String line) {
        assertThatThrownBy(() -> GrammarReader.read(line))
                .isInstanceOf(GrammarFormatException.class)
                .hasMessageContaining("Line 1");
    }

    @Test
    void weightsMustBeGivenForAllOrNone() {
        assertThatThrownBy(() -> GrammarReader.read("""
                S -> A [1.0]
                A -> a
                """))
                .isInstanceOf(GrammarFormatException.class)
                .hasMessageContaining("1 of 2");
    }

    @Test
    void emptyTextHasNoRules() {
        assertThatThrownBy(() -> GrammarReader.read("# nothing here\n\n"))
                .isInstanceOf(GrammarFormatException.class);
    }

    @Test
    void validationErrorsPassThrough() {
        assertThatThrownBy(() -> GrammarReader.read("S -> a [0.3] | b [0.3]"))
                .isInstanceOf(ProbabilityException.class);
    }
}
