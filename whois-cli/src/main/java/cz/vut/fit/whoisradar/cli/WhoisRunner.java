package cz.vut.fit.whoisradar.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.whoisradar.Common;
import cz.vut.fit.whoisradar.WhoisConfig;
import cz.vut.fit.whoisradar.client.WhoisClient;
import cz.vut.fit.whoisradar.client.WhoisOptions;
import cz.vut.fit.whoisradar.client.transport.TransportException;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * The command line entry point. Looks up a single query and prints the result as JSON, or the raw response
 * of a single server with {@code --raw}.
 * <p>
 * Exit codes: 0 on success, 1 on invalid usage, 2 when the properties file cannot be read and 3 when a server
 * cannot be reached with {@code --rethrow}.
 *
 * @author WhoisRadar contributors
 */
public class WhoisRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(WhoisRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PROPERTIES = 2;
    public static final int EXIT_TRANSPORT = 3;

    private static final String USAGE = "whoisradar [options] <query>";

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the lookup described by the command line arguments.
     *
     * @param args The command line arguments.
     * @param out  The stream the result is printed to.
     * @return The exit code.
     */
    public static int run(String[] args, PrintStream out) {
        final var options = makeOptions();

        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(options, System.err);
            return EXIT_USAGE;
        }

        if (cmd.hasOption("h")) {
            printHelp(options, out);
            return EXIT_OK;
        }

        final var query = cmd.getArgList().size() == 1 ? cmd.getArgList().get(0).trim() : null;
        if (query == null || query.isEmpty()) {
            System.err.println("Exactly one query is required");
            printHelp(options, System.err);
            return EXIT_USAGE;
        }

        final Properties properties = initProperties(cmd);
        if (properties == null)
            return EXIT_PROPERTIES;

        final WhoisOptions whoisOptions;
        try {
            whoisOptions = WhoisOptions.fromProperties(properties);
        } catch (IllegalArgumentException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }

        try (var client = WhoisClient.blocking(properties)) {
            if (cmd.hasOption("raw")) {
                out.print(client.rawQuery(query, whoisOptions));
            } else {
                final ObjectMapper mapper = Common.makeMapper().build();
                final var result = client.resolve(query, whoisOptions);
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            }
            out.flush();
            return EXIT_OK;
        } catch (TransportException e) {
            Logger.error("Lookup failed: {}", e.getMessage());
            return EXIT_TRANSPORT;
        } catch (JsonProcessingException e) {
            // The result model is always serializable
            throw new UncheckedIOException(e);
        } catch (IllegalArgumentException e) {
            Logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * Creates the command line options.
     */
    @NotNull
    private static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");
        options.addOption(Option.builder("s")
                .longOpt("server")
                .desc("The bootstrap WHOIS server (default " + WhoisConfig.SERVER_DEFAULT + ")")
                .argName("host")
                .hasArg()
                .build());
        options.addOption(Option.builder("P")
                .longOpt("port")
                .desc("The port of the bootstrap server (default " + WhoisConfig.PORT_DEFAULT + ")")
                .argName("port")
                .hasArg()
                .build());
        options.addOption(Option.builder("e")
                .longOpt("encoding")
                .desc("The charset of the queries and responses (default " + WhoisConfig.ENCODING_DEFAULT + ")")
                .argName("charset")
                .hasArg()
                .build());
        options.addOption(Option.builder("t")
                .longOpt("timeout")
                .desc(WhoisConfig.TIMEOUT_S_DOC)
                .argName("seconds")
                .hasArg()
                .build());
        options.addOption(Option.builder("r")
                .longOpt("retries")
                .desc(WhoisConfig.RETRIES_DOC)
                .argName("n")
                .hasArg()
                .build());
        options.addOption("x", "rethrow", false,
                "Fail when a server cannot be reached instead of using an empty response");
        options.addOption("R", "raw", false, "Query the server only, without following referrals, " +
                "and print the raw response");
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    /**
     * Initializes the properties from the file, the --option values and the dedicated options, in this order.
     *
     * @param cmd The parsed command line arguments.
     * @return The initialized Properties instance, or null if the file cannot be loaded.
     */
    @Nullable
    private static Properties initProperties(CommandLine cmd) {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException | IllegalArgumentException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                return null;
            }
        }

        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        putIfPresent(cmd, "server", WhoisConfig.SERVER_CONFIG, props);
        putIfPresent(cmd, "port", WhoisConfig.PORT_CONFIG, props);
        putIfPresent(cmd, "encoding", WhoisConfig.ENCODING_CONFIG, props);
        putIfPresent(cmd, "timeout", WhoisConfig.TIMEOUT_S_CONFIG, props);
        putIfPresent(cmd, "retries", WhoisConfig.RETRIES_CONFIG, props);
        if (cmd.hasOption("rethrow"))
            props.put(WhoisConfig.RETHROW_CONFIG, "true");

        return props;
    }

    private static void putIfPresent(CommandLine cmd, String option, String key, Properties props) {
        final var value = cmd.getOptionValue(option);
        if (value != null)
            props.put(key, value);
    }

    private static void printHelp(Options options, PrintStream stream) {
        final var writer = new PrintWriter(stream);
        final var formatter = new HelpFormatter();
        formatter.printHelp(writer, formatter.getWidth(), USAGE, null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null);
        writer.flush();
    }
}
