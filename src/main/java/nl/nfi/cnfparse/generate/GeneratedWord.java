package nl.nfi.cnfparse.generate;

import java.util.OptionalDouble;

// probability is present only for words of a probabilistic grammar, and is the best derivation found
public record GeneratedWord(String word, OptionalDouble probability) {

    public static GeneratedWord of(final String word) {
        return new GeneratedWord(word, OptionalDouble.empty());
    }

    public static GeneratedWord of(final String word, final double probability) {
        return new GeneratedWord(word, OptionalDouble.of(probability));
    }

    @Override
    public String toString() {
        if (probability.isEmpty()) {
            return word;
        }
        return "%s [%s]".formatted(word, probability.getAsDouble());
    }
}
