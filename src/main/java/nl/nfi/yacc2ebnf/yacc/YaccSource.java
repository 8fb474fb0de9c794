package nl.nfi.yacc2ebnf.yacc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.Files.exists;
import static java.nio.file.Files.readString;

// extracts the rules section of a YACC file: the lines between the first and the second %% line
public final class YaccSource {

    private static final Logger LOG = LoggerFactory.getLogger(YaccSource.class);

    private static final String SEPARATOR = "%%";

    private YaccSource() {
    }

    public static String readRules(final Path path) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("YACC grammar file does not exist: %s".formatted(path));
        }
        return rulesSection(path.toString(), readString(path));
    }

    public static String rulesSection(final String sourceName, final String content) {
        final List<String> lines = content.lines().toList();

        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (isSeparator(lines.get(i))) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            LOG.warn("No '{}' line found in {}, reading the whole file as rules", SEPARATOR, sourceName);
            return content;
        }

        int end = start + 1;
        while (end < lines.size() && !isSeparator(lines.get(end))) {
            end++;
        }

        // blank lines in place of the declarations, so positions in errors match the file
        return "\n".repeat(start + 1) + String.join("\n", lines.subList(start + 1, end));
    }

    private static boolean isSeparator(final String line) {
        return line.strip().equals(SEPARATOR);
    }
}
