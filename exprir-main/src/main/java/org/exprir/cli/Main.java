package org.exprir.cli;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.exprir.ExpressionLexException;
import org.exprir.ExpressionParseException;
import org.exprir.IrTranslator;
import org.exprir.codegen.IrProgram;
import org.exprir.parser.LiteralConversion;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line driver. With {@code -e} it translates a single expression, otherwise it
 * reads expressions line by line and prints the IR for each one. A bad line is
 * reported and the loop moves on to the next.
 */
public class Main {

    static final String PROMPT = ">>> ";
    static final String LOGGING_CONFIG = "/exprir-logging.properties";

    private static final Logger ROOT_LOGGER = Logger.getLogger("org.exprir");

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public Main(InputStream in, PrintStream out, PrintStream err) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        int status = new Main(System.in, System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("e").longOpt("expression").hasArg().argName("text")
                .desc("translate a single expression and exit").build());
        options.addOption(Option.builder("t").longOpt("truncate-literals")
                .desc("keep only the 32-bit integer part of numeric literals").build());
        options.addOption(Option.builder("v").longOpt("verbose")
                .desc("log each pipeline stage").build());
        options.addOption(Option.builder("h").longOpt("help")
                .desc("print this help").build());
        return options;
    }

    public int run(String[] args) throws IOException {
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(options);
            return 2;
        }

        if (cmd.hasOption("h")) {
            printHelp(options);
            return 0;
        }
        if (cmd.hasOption("v")) {
            ROOT_LOGGER.setLevel(Level.FINE);
        }

        IrTranslator.Builder builder = IrTranslator.builder();
        if (cmd.hasOption("t")) {
            builder.literalConversion(LiteralConversion.TRUNCATE_TO_INT);
        }
        IrTranslator translator = builder.build();

        if (cmd.hasOption("e")) {
            return translateLine(translator, cmd.getOptionValue("e")) ? 0 : 1;
        }
        repl(translator);
        return 0;
    }

    void repl(IrTranslator translator) throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            if (!line.isBlank()) {
                translateLine(translator, line);
            }
        }
        out.println();
    }

    /**
     * @return true if IR was printed, false if a diagnostic was reported instead
     */
    boolean translateLine(IrTranslator translator, String line) {
        try {
            IrProgram program = translator.translate(line);
            out.print(program.render());
            out.flush();
            return true;
        } catch (ExpressionLexException | ExpressionParseException e) {
            err.println(e.getMessage());
        }
        return false;
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "exprir [-e <text>] [-t] [-v]",
                null, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    static void configureLogging() throws IOException {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        }
    }
}
