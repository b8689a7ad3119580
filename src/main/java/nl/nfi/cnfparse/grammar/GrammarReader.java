package nl.nfi.cnfparse.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads grammars written one rule per line:
 * <pre>
 *     # comment
 *     S -> AB | a | ε
 *     A --> a [0.25] | [0.75]
 * </pre>
 * An empty alternative is epsilon. A grammar is probabilistic when its alternatives carry a
 * bracketed probability, in which case all of them must.
 */
public final class GrammarReader {

    private static final Pattern ARROW = Pattern.compile("-+>");
    private static final Pattern WEIGHTED = Pattern.compile("^(.*)\\[([^\\]]*)]$");

    private GrammarReader() {
    }

    public static Grammar read(final String text) {
        return read(text, null);
    }

    public static Grammar read(final String text, final Character startSymbol) {
        final List<ParsedLine> lines = new ArrayList<>();
        int lineNumber = 0;
        for (final String line : text.lines().toList()) {
            lineNumber++;
            final String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            lines.add(parseLine(trimmed, lineNumber));
        }
        if (lines.isEmpty()) {
            throw new GrammarFormatException("The grammar does not contain any rules");
        }

        final long weightedCount = lines.stream()
                .flatMap(line -> line.alternatives().stream())
                .filter(alternative -> alternative.probability() != null)
                .count();
        final long totalCount = lines.stream().mapToLong(line -> line.alternatives().size()).sum();

        if (weightedCount == 0) {
            final Map<String, List<String>> rules = new LinkedHashMap<>();
            for (final ParsedLine line : lines) {
                final List<String> productions = rules.computeIfAbsent(line.lhs(), key -> new ArrayList<>());
                line.alternatives().forEach(alternative -> productions.add(alternative.symbols()));
            }
            return Grammar.create(rules, startSymbol);
        }

        if (weightedCount != totalCount) {
            throw new GrammarFormatException("Either all or none of the productions must carry a probability (%d of %d do)".formatted(weightedCount, totalCount));
        }
        final Map<String, List<Production>> rules = new LinkedHashMap<>();
        for (final ParsedLine line : lines) {
            final List<Production> productions = rules.computeIfAbsent(line.lhs(), key -> new ArrayList<>());
            line.alternatives().forEach(alternative -> productions.add(Production.of(alternative.symbols(), alternative.probability())));
        }
        return Grammar.createProbabilistic(rules, startSymbol);
    }

    private static ParsedLine parseLine(final String line, final int lineNumber) {
        final Matcher arrow = ARROW.matcher(line);
        if (!arrow.find()) {
            throw new GrammarFormatException("Line %d is not a rule (missing '->'): %s".formatted(lineNumber, line));
        }
        final String lhs = line.substring(0, arrow.start()).strip();
        if (lhs.length() != 1) {
            throw new GrammarFormatException("Line %d: left-hand side must be a single symbol, got '%s'".formatted(lineNumber, lhs));
        }

        final List<Alternative> alternatives = new ArrayList<>();
        // -1 keeps trailing empty alternatives (epsilon)
        for (final String part : line.substring(arrow.end()).split("\\|", -1)) {
            alternatives.add(parseAlternative(part.strip(), lineNumber));
        }
        return new ParsedLine(lhs, alternatives);
    }

    private static Alternative parseAlternative(final String part, final int lineNumber) {
        final Matcher weighted = WEIGHTED.matcher(part);
        if (!weighted.matches()) {
            if (part.indexOf('[') >= 0 || part.indexOf(']') >= 0) {
                throw new GrammarFormatException("Line %d: malformed probability in '%s'".formatted(lineNumber, part));
            }
            return new Alternative(removeWhitespace(part), null);
        }
        final String probability = weighted.group(2).strip();
        try {
            return new Alternative(removeWhitespace(weighted.group(1)), Double.parseDouble(probability));
        } catch (final NumberFormatException e) {
            throw new GrammarFormatException("Line %d: '%s' is not a probability".formatted(lineNumber, probability));
        }
    }

    private static String removeWhitespace(final String symbols) {
        return symbols.replaceAll("\\s+", "");
    }

    private record ParsedLine(String lhs, List<Alternative> alternatives) {
    }

    private record Alternative(String symbols, Double probability) {
    }
}
