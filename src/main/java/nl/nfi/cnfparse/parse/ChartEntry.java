package nl.nfi.cnfparse.parse;

import nl.nfi.cnfparse.grammar.Rule;

// best derivation found so far of a span by one nonterminal:
//      rule    the rule applied at the top, e.g. A -> BC
//      split   length of the left child's span, 0 for lexical rules (A -> a)
record ChartEntry(char symbol, double probability, Rule rule, int split) {

    boolean isLexical() {
        return split == 0;
    }
}
