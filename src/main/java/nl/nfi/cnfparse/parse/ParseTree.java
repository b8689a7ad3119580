package nl.nfi.cnfparse.parse;

import nl.nfi.cnfparse.grammar.Symbols;

import java.util.List;

import static java.util.stream.Collectors.joining;

// derivation of a word, e.g. S(A(a), B(b)):
//  leaves are single input characters (or epsilon for the empty word),
//  inner nodes have two nonterminal children, or one leaf for a lexical rule
public record ParseTree(char symbol, List<ParseTree> children) {

    public ParseTree {
        children = List.copyOf(children);
    }

    public static ParseTree leaf(final char symbol) {
        return new ParseTree(symbol, List.of());
    }

    public static ParseTree epsilon() {
        return leaf(Symbols.EPSILON);
    }

    public static ParseTree node(final char symbol, final ParseTree... children) {
        return new ParseTree(symbol, List.of(children));
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    // the word spelled by the leaves, epsilon leaves excluded
    public String yield() {
        if (isLeaf()) {
            return symbol == Symbols.EPSILON ? "" : String.valueOf(symbol);
        }
        return children.stream().map(ParseTree::yield).collect(joining());
    }

    public int depth() {
        return 1 + children.stream().mapToInt(ParseTree::depth).max().orElse(0);
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return String.valueOf(symbol);
        }
        return children.stream().map(ParseTree::toString).collect(joining(", ", symbol + "(", ")"));
    }
}
