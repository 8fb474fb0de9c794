package nl.nfi.yacc2ebnf.convert;

import nl.nfi.yacc2ebnf.common.ini.IniConfig;

import java.io.IOException;
import java.nio.file.Path;

// width: maximum width of the printed grammar
// optimize: whether trivial productions are inlined and groups flattened
public record ConverterSettings(int width, boolean optimize) {

    public static final int DEFAULT_WIDTH = 80;
    public static final ConverterSettings DEFAULT = new ConverterSettings(DEFAULT_WIDTH, true);

    private static final String OUTPUT_SECTION = "OUTPUT";
    private static final String OPTIMIZER_SECTION = "OPTIMIZER";

    public ConverterSettings {
        if (width < 1) {
            throw new IllegalArgumentException("Output width must be positive: %d".formatted(width));
        }
    }

    public static ConverterSettings loadFrom(final Path path) throws IOException {
        return fromConfig(IniConfig.loadFrom(path));
    }

    //  [OUTPUT]
    //  width = 100
    //  [OPTIMIZER]
    //  enabled = false
    public static ConverterSettings fromConfig(final IniConfig config) {
        final int width = config.hasKey(OUTPUT_SECTION, "width")
                ? config.getInt(OUTPUT_SECTION, "width")
                : DEFAULT_WIDTH;
        if (width < 1) {
            throw new IllegalArgumentException("INI config value must be positive: %s -> width".formatted(OUTPUT_SECTION));
        }
        final boolean optimize = !config.hasKey(OPTIMIZER_SECTION, "enabled") || config.getBoolean(OPTIMIZER_SECTION, "enabled");
        return new ConverterSettings(width, optimize);
    }

    public ConverterSettings width(final int width) {
        return new ConverterSettings(width, optimize);
    }

    public ConverterSettings optimize(final boolean optimize) {
        return new ConverterSettings(width, optimize);
    }
}
