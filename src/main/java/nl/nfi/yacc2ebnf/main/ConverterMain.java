package nl.nfi.yacc2ebnf.main;

import nl.nfi.yacc2ebnf.convert.Yacc2EbnfCli;
import picocli.CommandLine;

public final class ConverterMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new Yacc2EbnfCli()).execute(args);
        System.exit(exitCode);
    }
}
