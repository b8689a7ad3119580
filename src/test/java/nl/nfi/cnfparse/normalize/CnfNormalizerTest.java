package nl.nfi.cnfparse.normalize;

import nl.nfi.cnfparse.generate.GeneratedWord;
import nl.nfi.cnfparse.generate.WordGenerator;
import nl.nfi.cnfparse.grammar.ExhaustedAlphabetException;
import nl.nfi.cnfparse.grammar.Grammar;
import nl.nfi.cnfparse.grammar.GrammarReader;
import nl.nfi.cnfparse.grammar.ProbabilityException;
import nl.nfi.cnfparse.grammar.Rule;
import nl.nfi.cnfparse.grammar.Symbols;
import nl.nfi.cnfparse.parse.CykParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.summingDouble;
import static java.util.stream.Collectors.toCollection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class CnfNormalizerTest {

    private static final int MAX_LENGTH = 6;

    // epsilon-free, so the generator enumerates them exactly
    static Stream<Arguments> epsilonFreeGrammars() {
        return Stream.of(
                arguments("balanced", GrammarReader.read("S -> aSb | ab", 'S')),
                arguments("choice", GrammarReader.read("""
                        S -> AB | BA | c
                        A -> aA | a
                        B -> b
                        """)),
                arguments("unit chain", GrammarReader.read("""
                        S -> A
                        A -> B | a
                        B -> C | b
                        C -> c | aS
                        """, 'S')),
                arguments("long productions", GrammarReader.read("""
                        S -> abcA | 1
                        A -> d | dA
                        """)),
                arguments("shared terminals", GrammarReader.read("""
                        S -> aXa | bXb
                        X -> a | b | XX
                        """)),
                arguments("already cnf", GrammarReader.read("""
                        S -> AB
                        A -> a
                        B -> b
                        """))
        );
    }

    static Stream<Arguments> grammarsWithEpsilon() {
        return Stream.of(
                arguments("nullable chain", GrammarReader.read("""
                        S -> AB |
                        A -> a |
                        B -> b |
                        """), Set.of("", "a", "b", "ab")),
                arguments("nested", GrammarReader.read("S -> aSb |", 'S'), Set.of("", "ab", "aabb", "aaabbb")),
                arguments("triple", GrammarReader.read("""
                        S -> AAA
                        A -> a |
                        """), Set.of("", "a", "aa", "aaa")),
                arguments("only empty", GrammarReader.read("""
                        S -> aE | b
                        E -> EE |
                        """), Set.of("a", "b")),
                arguments("start on right-hand side", GrammarReader.read("""
                        S -> SS | a |
                        """, 'S'), Set.of("", "a", "aa", "aaa", "aaaa", "aaaaa", "aaaaaa"))
        );
    }

    @Nested
    class Structure {

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#epsilonFreeGrammars")
        void resultIsCnf(final String name, final Grammar grammar) {
            CnfNormalizer.normalize(grammar);
            assertCnf(grammar);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#grammarsWithEpsilon")
        void resultIsCnfWithEpsilon(final String name, final Grammar grammar, final Set<String> language) {
            CnfNormalizer.normalize(grammar);
            assertCnf(grammar);
        }

        @Test
        void startSymbolIsFreshAndNotProduced() {
            final Grammar grammar = GrammarReader.read("S -> SS | a |", 'S');
            CnfNormalizer.normalize(grammar);

            assertThat(grammar.startSymbol()).isNotEqualTo('S');
            assertThat(grammar.producesEpsilon(grammar.startSymbol())).isTrue();
            assertThat(grammar.rules())
                    .extracting(Rule::rhs)
                    .noneMatch(rhs -> rhs.indexOf(grammar.startSymbol()) >= 0);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#grammarsWithEpsilon")
        void everyNonterminalIsReachable(final String name, final Grammar grammar, final Set<String> language) {
            CnfNormalizer.normalize(grammar);
            assertThat(grammar.newRuleSet().reachableFrom(grammar.startSymbol())).isEqualTo(grammar.nonterminals());
        }

        @Test
        void exhaustedAlphabetLeavesGrammarUntouched() {
            // 1 start + 36 terminals + 34 pairs exceeds the 65 spare names left next to S
            final Grammar grammar = GrammarReader.read("S -> abcdefghijklmnopqrstuvwxyz0123456789");
            final String before = grammar.toString();

            assertThatThrownBy(() -> CnfNormalizer.normalize(grammar))
                    .isInstanceOf(ExhaustedAlphabetException.class);
            assertThat(grammar.toString()).isEqualTo(before);
        }
    }

    @Nested
    class Language {

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#epsilonFreeGrammars")
        void normalizedGrammarAcceptsExactlyTheGeneratedWords(final String name, final Grammar grammar) {
            final Set<String> expected = words(WordGenerator.forGrammar(grammar).generate(MAX_LENGTH));
            final Set<Character> alphabet = new TreeSet<>(grammar.terminals());

            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertThat(acceptedWords(parser, alphabet)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#grammarsWithEpsilon")
        void epsilonProductionsKeepTheLanguage(final String name, final Grammar grammar, final Set<String> language) {
            final Set<Character> alphabet = new TreeSet<>(grammar.terminals());
            alphabet.remove(Symbols.EPSILON);

            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertThat(acceptedWords(parser, alphabet)).isEqualTo(language);
        }

        @Test
        void nullableChain() {
            final Grammar grammar = GrammarReader.read("""
                    S -> AB |
                    A -> a |
                    B -> b |
                    """);
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertThat(parser.parse("").accepted()).isTrue();
            assertThat(parser.parse("a").accepted()).isTrue();
            assertThat(parser.parse("b").accepted()).isTrue();
            assertThat(parser.parse("ab").accepted()).isTrue();
            assertThat(parser.parse("aa").accepted()).isFalse();
            assertThat(parser.parse("ba").accepted()).isFalse();
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("nl.nfi.cnfparse.normalize.CnfNormalizerTest#epsilonFreeGrammars")
        void normalizingTwiceKeepsTheLanguage(final String name, final Grammar grammar) {
            CnfNormalizer.normalize(grammar);
            final Set<String> once = words(WordGenerator.forGrammar(grammar).generate(MAX_LENGTH));

            CnfNormalizer.normalize(grammar);

            assertThat(grammar.isCnf()).isTrue();
            assertThat(words(WordGenerator.forGrammar(grammar).generate(MAX_LENGTH))).isEqualTo(once);
        }
    }

    @Nested
    class Probabilities {

        @Test
        void everyLeftHandSideSumsToOne() {
            final Grammar grammar = GrammarReader.read("""
                    S -> aSb [0.3] | AB [0.5] | [0.2]
                    A -> a [0.25] | AA [0.25] | [0.5]
                    B -> A [0.5] | b [0.5]
                    """, 'S');
            CnfNormalizer.normalize(grammar);

            assertThat(grammar.isCnf()).isTrue();
            final Map<Character, Double> sums = grammar.rules().stream()
                    .collect(groupingBy(Rule::lhs, summingDouble(Rule::probability)));
            assertThat(sums.keySet()).isEqualTo(grammar.nonterminals());
            sums.values().forEach(sum -> assertThat(sum).isCloseTo(1.0, within(1e-9)));
        }

        @Test
        void wordProbabilitiesArePreserved() {
            final Grammar original = GrammarReader.read("""
                    S -> aA [0.3] | B [0.7]
                    A -> a [0.5] | b [0.5]
                    B -> b [0.8] | bB [0.2]
                    """);
            final List<GeneratedWord> expected = WordGenerator.forGrammar(original).generate(4);

            final CykParser parser = CykParser.forGrammar(original, true);

            assertThat(expected).extracting(GeneratedWord::word).containsExactly("b", "aa", "ab", "bb", "bbb", "bbbb");
            for (final GeneratedWord word : expected) {
                assertThat(parser.parse(word.word()).probability().getAsDouble())
                        .as(word.word())
                        .isCloseTo(word.probability().getAsDouble(), within(1e-12));
            }
        }

        @Test
        void epsilonMassMovesToTheStartSymbol() {
            final Grammar grammar = GrammarReader.read("S -> aSb [0.4] | [0.6]", 'S');
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertThat(parser.parse("").probability().getAsDouble()).isCloseTo(0.6, within(1e-12));
            assertThat(parser.parse("ab").probability().getAsDouble()).isCloseTo(0.24, within(1e-12));
            assertThat(parser.parse("aabb").probability().getAsDouble()).isCloseTo(0.096, within(1e-12));
            assertThat(parser.parse("aab").accepted()).isFalse();
        }

        @Test
        void unitSelfLoopCloseToOne() {
            // W(A, A) = 1 / (1 - 0.9995) = 2000, so A reaches a with probability 2000 * 0.0005 = 1
            final Grammar grammar = GrammarReader.read("""
                    S -> A [1.0]
                    A -> A [0.9995] | a [0.0005]
                    """);
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertSumsToOne(grammar);
            assertThat(parser.parse("a").probability().getAsDouble()).isCloseTo(1.0, within(1e-9));
        }

        @Test
        void unitCycleSharingMassWithWords() {
            // A = 0.9 B + 0.1 a, B = 0.9 A + 0.1 b, so P(a) = 0.1 / (1 - 0.81)
            final Grammar grammar = GrammarReader.read("""
                    S -> A [1.0]
                    A -> B [0.9] | a [0.1]
                    B -> A [0.9] | b [0.1]
                    """);
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertSumsToOne(grammar);
            assertThat(parser.parse("a").probability().getAsDouble()).isCloseTo(0.1 / 0.19, within(1e-12));
            assertThat(parser.parse("b").probability().getAsDouble()).isCloseTo(0.09 / 0.19, within(1e-12));
        }

        @Test
        void criticalNullableSymbolDerivesEmptyWithCertainty() {
            // e(E) = 0.5 e(E)^2 + 0.5 has the least solution 1, so aE only ever yields a
            final Grammar grammar = GrammarReader.read("""
                    S -> aE [0.5] | b [0.5]
                    E -> EE [0.5] | [0.5]
                    """);
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertSumsToOne(grammar);
            assertThat(parser.parse("a").probability().getAsDouble()).isCloseTo(0.5, within(1e-12));
            assertThat(parser.parse("b").probability().getAsDouble()).isCloseTo(0.5, within(1e-12));
            assertThat(parser.parse("aa").accepted()).isFalse();
        }

        @Test
        void subcriticalNullableSymbol() {
            // e(E) = 0.3 e(E)^2 + 0.4 has the least solution (1 - sqrt(0.52)) / 0.6
            final Grammar grammar = GrammarReader.read("""
                    S -> aE [1.0]
                    E -> EE [0.3] | c [0.3] | [0.4]
                    """);
            final CykParser parser = CykParser.forGrammar(grammar, true);

            assertSumsToOne(grammar);
            assertThat(parser.parse("a").probability().getAsDouble()).isCloseTo((1.0 - Math.sqrt(0.52)) / 0.6, within(1e-12));
            assertThat(parser.parse("ac").accepted()).isTrue();
        }

        @Test
        void unitCycleWithoutEscapeIsRejected() {
            final Grammar grammar = GrammarReader.read("""
                    S -> A [0.5] | a [0.5]
                    A -> A [1.0]
                    """);
            final String before = grammar.toString();

            assertThatThrownBy(() -> CnfNormalizer.normalize(grammar))
                    .isInstanceOf(ProbabilityException.class)
                    .hasMessageContaining("{A}");
            assertThat(grammar.toString()).isEqualTo(before);
        }
    }

    @Test
    void solvesLinearSystems() {
        final double[][] matrix = {{0.0, 2.0}, {1.0, 1.0}};
        final double[][] rhs = {{4.0, 2.0}, {3.0, 1.0}};

        CnfNormalizer.solveInPlace(matrix, rhs);

        assertThat(rhs[0]).containsExactly(new double[]{1.0, 0.0}, within(1e-12));
        assertThat(rhs[1]).containsExactly(new double[]{2.0, 1.0}, within(1e-12));
        assertThatThrownBy(() -> CnfNormalizer.solveInPlace(new double[][]{{1.0, 1.0}, {2.0, 2.0}}, new double[][]{{1.0}, {2.0}}))
                .isInstanceOf(ArithmeticException.class);
    }

    private static void assertSumsToOne(final Grammar grammar) {
        assertThat(grammar.isCnf()).isTrue();
        final Map<Character, Double> sums = grammar.rules().stream()
                .collect(groupingBy(Rule::lhs, summingDouble(Rule::probability)));
        assertThat(sums.keySet()).isEqualTo(grammar.nonterminals());
        sums.values().forEach(sum -> assertThat(sum).isCloseTo(1.0, within(1e-9)));
    }

    private static void assertCnf(final Grammar grammar) {
        assertThat(grammar.isCnf()).isTrue();
        for (final Rule rule : grammar.rules()) {
            if (rule.isEpsilon()) {
                assertThat(rule.lhs()).isEqualTo(grammar.startSymbol());
            } else if (rule.isLexical()) {
                assertThat(grammar.isTerminal(rule.left())).isTrue();
            } else {
                assertThat(rule.rhs()).hasSize(2);
                assertThat(grammar.isNonterminal(rule.left()) && grammar.isNonterminal(rule.right())).isTrue();
            }
        }
    }

    private static Set<String> words(final List<GeneratedWord> generated) {
        return generated.stream().map(GeneratedWord::word).collect(toCollection(TreeSet::new));
    }

    private static Set<String> acceptedWords(final CykParser parser, final Set<Character> alphabet) {
        final Set<String> accepted = new TreeSet<>();
        List<String> current = List.of("");
        for (int length = 0; length <= MAX_LENGTH; length++) {
            final List<String> next = new ArrayList<>();
            for (final String word : current) {
                if (parser.parse(word).accepted()) {
                    accepted.add(word);
                }
                for (final char symbol : alphabet) {
                    next.add(word + symbol);
                }
            }
            current = next;
        }
        return accepted;
    }
}
