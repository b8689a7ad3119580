package nl.nfi.cnfparse.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

// sections of "key = value" lines, list values are written as JSON arrays, e.g.:
//      [INPUT]
//      extensions = [".txt", ".cfg"]
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public int getInt(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI value is not an integer: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public int getInt(final String section, final String key, final int defaultValue) {
        return hasKey(section, key) ? getInt(section, key) : defaultValue;
    }

    public List<String> getList(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return new JSONArray(value).toList().stream()
                    .map(String::valueOf)
                    .toList();
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a list: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public List<String> getList(final String section, final String key, final List<String> defaultValue) {
        return hasKey(section, key) ? getList(section, key) : defaultValue;
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path));
    }

    static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : lines) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), title -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI key outside of any section: %s".formatted(line));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        }
        return new IniConfig(sections);
    }
}
