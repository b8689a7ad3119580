package nl.nfi.cnfparse.grammar;

import java.util.Comparator;

import static java.util.Comparator.comparingInt;

// a single rewrite rule of a grammar, e.g.:
//      A -> BC [0.25]
//  plain grammars report probability 1.0 for every rule
public record Rule(char lhs, String rhs, double probability) {

    public static final Comparator<Rule> ORDER = comparingInt(Rule::lhs).thenComparing(Rule::rhs);

    public boolean isEpsilon() {
        return Symbols.isEpsilon(rhs);
    }

    public boolean isBinary() {
        return rhs.length() == 2;
    }

    public boolean isLexical() {
        return rhs.length() == 1 && !isEpsilon();
    }

    public char left() {
        return rhs.charAt(0);
    }

    public char right() {
        return rhs.charAt(1);
    }

    @Override
    public String toString() {
        return "%s -> %s [%s]".formatted(lhs, rhs, probability);
    }
}
