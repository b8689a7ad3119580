package nl.nfi.cnfparse.grammar;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

// lexical conventions shared by all grammars:
//  nonterminal    uppercase letter, e.g. S, A, Ñ
//  terminal       lowercase letter or digit, e.g. a, 7
//  epsilon        reserved terminal for the empty string
public final class Symbols {

    public static final char EPSILON = 'ε';
    public static final String EPSILON_STRING = String.valueOf(EPSILON);

    // spare names handed out during normalization, Latin first
    private static final String LATIN = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String EXTENDED = "ÀÁÂÃÄÅÆÇÈÉÊËÌÍÎÏÐÑÒÓÔÕÖØÙÚÛÜÝÞΓΔΘΛΞΠΣΦΨΩ";

    private Symbols() {
    }

    public static boolean isNonterminalName(final char symbol) {
        return Character.isUpperCase(symbol);
    }

    public static boolean isTerminalName(final char symbol) {
        return symbol == EPSILON
                || (Character.isLetter(symbol) && Character.isLowerCase(symbol))
                || Character.isDigit(symbol);
    }

    public static boolean isEpsilon(final String production) {
        return production.length() == 1 && production.charAt(0) == EPSILON;
    }

    // all names that may ever be allocated as fresh nonterminals
    public static Set<Character> spareAlphabet() {
        final Set<Character> alphabet = new TreeSet<>();
        for (final char symbol : (LATIN + EXTENDED).toCharArray()) {
            alphabet.add(symbol);
        }
        return alphabet;
    }

    public static String render(final Collection<Character> symbols) {
        final StringBuilder builder = new StringBuilder();
        for (final char symbol : symbols) {
            if (!builder.isEmpty()) {
                builder.append(", ");
            }
            builder.append(symbol);
        }
        return "{" + builder + "}";
    }
}
