package nl.nfi.yacc2ebnf.common.ini;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

// minimal INI format: [SECTION] headers and "key = value" lines, ';' and '#' start a comment line
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniConfig empty() {
        return new IniConfig(Map.of());
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public boolean getBoolean(final String section, final String key) {
        return Boolean.parseBoolean(getString(section, key));
    }

    public int getInt(final String section, final String key) {
        try {
            return Integer.parseInt(getString(section, key));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI config value is not a number: %s -> %s".formatted(section, key), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : readAllLines(path)) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), title -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI config entry outside of a section in %s: %s".formatted(path, line));
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
