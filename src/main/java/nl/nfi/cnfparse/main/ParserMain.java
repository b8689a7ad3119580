package nl.nfi.cnfparse.main;

import nl.nfi.cnfparse.batch.CnfParserCli;
import picocli.CommandLine;

public final class ParserMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CnfParserCli()).execute(args);
        System.exit(exitCode);
    }
}
