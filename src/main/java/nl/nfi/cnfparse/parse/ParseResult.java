package nl.nfi.cnfparse.parse;

import java.util.Optional;
import java.util.OptionalDouble;

// outcome of parsing one word; probability is only present for probabilistic grammars
// (0.0 for rejected words), tree only for accepted words
public record ParseResult(boolean accepted, OptionalDouble probability, Optional<ParseTree> tree) {

    static ParseResult rejected(final boolean probabilistic) {
        return new ParseResult(false, probabilistic ? OptionalDouble.of(0.0) : OptionalDouble.empty(), Optional.empty());
    }

    static ParseResult accepted(final ParseTree tree) {
        return new ParseResult(true, OptionalDouble.empty(), Optional.of(tree));
    }

    static ParseResult accepted(final ParseTree tree, final double probability) {
        return new ParseResult(true, OptionalDouble.of(probability), Optional.of(tree));
    }
}
