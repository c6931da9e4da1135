package com.mimecast.warden;

import com.mimecast.warden.config.ProxyConfig;
import com.mimecast.warden.config.RuleTableLoader;
import com.mimecast.warden.config.SmtpConfig;
import com.mimecast.warden.config.WardenConfig;
import com.mimecast.warden.exception.TransportException;
import com.mimecast.warden.exception.UnsupportedCapabilityException;
import com.mimecast.warden.handlers.HandlerFactory;
import com.mimecast.warden.http.OkHttpFetcher;
import com.mimecast.warden.loop.ShutdownSignal;
import com.mimecast.warden.mailbox.ImapSessionFactory;
import com.mimecast.warden.main.CredentialProvider;
import com.mimecast.warden.main.Warden;
import com.mimecast.warden.rules.RuleTable;
import com.mimecast.warden.smtp.Credentials;
import com.mimecast.warden.smtp.SmtpMailSender;
import com.mimecast.warden.transform.HtmlContentTransformer;
import com.mimecast.warden.transform.ImageInliner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Loads {@code warden.json5} and {@code rules.json5} from the configuration directory and runs
 * <br>the warden in daemon mode, or for a single pass with {@code --once}.
 *
 * @see Warden
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "warden.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "IMAP mailbox warden";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        int status = new Main(args).run();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;
    }

    /**
     * Parses options and runs.
     *
     * @return Exit status.
     */
    int run() {
        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isEmpty()) {
            return 2;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            optionsUsage(options());
            return 0;
        }

        if (cmd.hasOption("quiet")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.WARN);
        }

        Path dir = Paths.get(cmd.getOptionValue("conf", "cfg"));
        try {
            WardenConfig config = new WardenConfig(dir.resolve("warden.json5"));
            RuleTable ruleTable = new RuleTableLoader(handlerFactory(config)).load(dir.resolve("rules.json5"));

            String password = new CredentialProvider().getPassword(cmd.getOptionValue("password"));
            if (password == null) {
                log.error("No password available, set {} or use --password", CredentialProvider.ENV_PASSWORD);
                return 2;
            }

            ShutdownSignal shutdown = new ShutdownSignal();
            Warden warden = new Warden(new ImapSessionFactory(config.getImap(), password), config.getImap().getIdleTimeout(), shutdown);
            registerShutdownHook(warden);

            warden.run(ruleTable, credentials(config, password), cmd.hasOption("once"), config.getInitialDelay(), config.getMaxDelay());
            return 0;

        } catch (UnsupportedCapabilityException e) {
            log.fatal("Unsupported mailbox: {}", e.getMessage());
            return 3;
        } catch (ConfigurationException e) {
            log.fatal("Configuration error: {}", e.getMessage());
            return 2;
        } catch (TransportException e) {
            log.error("Run failed: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.fatal("Unable to read configuration: {}", e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            log.fatal("Invalid configuration: {}", e.getMessage());
            return 2;
        }
    }

    /**
     * Builds the content handlers for a configuration.
     *
     * @param config Configuration.
     * @return HandlerFactory instance.
     */
    static HandlerFactory handlerFactory(WardenConfig config) {
        ProxyConfig proxy = config.getFetchProxy();
        OkHttpFetcher httpFetcher = new OkHttpFetcher(proxy.getUserAgent());
        ImageInliner imageInliner = new ImageInliner(httpFetcher, proxy.getImageTimeout(), proxy.getMaxImages(), proxy.getMaxImageSize());
        return new HandlerFactory(config,
                new SmtpMailSender(),
                httpFetcher,
                new HtmlContentTransformer(proxy.getSiteTransforms(), imageInliner));
    }

    /**
     * Builds SMTP credentials, reusing the IMAP login when no SMTP user is set.
     *
     * @param config   Configuration.
     * @param password Password.
     * @return Credentials instance.
     */
    static Credentials credentials(WardenConfig config, String password) {
        SmtpConfig smtp = config.getSmtp();
        String user = StringUtils.defaultIfEmpty(smtp.getUser(), config.getImap().getUser());
        return new Credentials(smtp.getHost(), smtp.getPort(), user, password, smtp.isSsl());
    }

    /**
     * Lets the current step finish before the JVM exits.
     *
     * @param warden Warden instance.
     */
    private static void registerShutdownHook(Warden warden) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Service is shutting down.");
            warden.shutdown();
            try {
                if (!warden.awaitTermination(Duration.ofSeconds(10))) {
                    log.warn("Still busy, exiting anyway");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Configuration directory (default: cfg)");
        options.addOption("h", "help", false, "Show usage help");
        options.addOption(null, "once", false, "Run a single pass and exit");
        options.addOption("p", "password", true, "Account password, if " + CredentialProvider.ENV_PASSWORD + " is not set");
        options.addOption("q", "quiet", false, "Only log warnings and errors");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        log(USAGE);
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
            log("Unable to print usage: " + e.getMessage());
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
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        System.out.println(string);
    }
}
