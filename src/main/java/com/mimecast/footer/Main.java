package com.mimecast.footer;

import com.mimecast.footer.config.FooterConfig;
import com.mimecast.footer.filter.FooterFilter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Pipe mode filter reading one message on standard input and writing it on standard output.
 * <p>Any failure is logged and the message is written out as received.
 * <br>Logging, usage and version go to standard error.
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "html-footer.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Plain text signature to HTML footer filter";

    private final String[] args;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args, System.in, System.out, System.err).run();
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     * @param in   Message input.
     * @param out  Message output.
     * @param err  Usage and version output.
     */
    Main(String[] args, InputStream in, OutputStream out, OutputStream err) {
        this.args = args;
        this.in = in;
        this.out = printStream(out);
        this.err = printStream(err);
    }

    /**
     * Wraps output stream.
     *
     * @param stream OutputStream instance.
     * @return PrintStream instance.
     */
    private static PrintStream printStream(OutputStream stream) {
        return stream instanceof PrintStream ? (PrintStream) stream : new PrintStream(stream, true, StandardCharsets.UTF_8);
    }

    /**
     * Runs the filter.
     *
     * @return Self.
     */
    Main run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return this;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options());
            return this;
        }

        if (cmd.hasOption("version")) {
            log(NAME + " " + FooterConfig.VERSION);
            return this;
        }

        if (cmd.hasOption("debuglevel")) {
            Level level = Level.getLevel(cmd.getOptionValue("debuglevel").toUpperCase(Locale.ROOT));
            if (level == null) {
                log("Unknown debuglevel " + cmd.getOptionValue("debuglevel"));
                log("");
                optionsUsage(options());
                return this;
            }
            Configurator.setRootLevel(level);
        }

        byte[] input = new byte[0];
        try {
            input = IOUtils.toByteArray(in);
            FooterConfig config = cmd.hasOption("config") ? new FooterConfig(cmd.getOptionValue("config")) : new FooterConfig();
            if (cmd.hasOption("imagepath")) {
                config.setImagePath(cmd.getOptionValue("imagepath"));
            }

            write(new FooterFilter(config).filter(input));

        } catch (Exception e) {
            log.error("Forwarding message unaltered: {}", e.getMessage());
            write(input);
        }

        return this;
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "config", true, "Configuration file path");
        options.addOption("i", "imagepath", true, "Image directory path");
        options.addOption("d", "debuglevel", true, "Log level: error, warn, info, debug, trace");
        options.addOption("h", "help", false, "Show usage");
        options.addOption("V", "version", false, "Show version");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        log(USAGE + " [options] < message.eml > filtered.eml");
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Writes message bytes to output.
     *
     * @param bytes Message bytes.
     */
    private void write(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        out.flush();
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        err.println(string);
    }
}
