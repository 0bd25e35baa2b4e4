package com.mimecast.smime;

import com.mimecast.smime.config.SecurityConfig;
import com.mimecast.smime.config.SmimeConfig;
import com.mimecast.smime.db.SchemaInitializer;
import com.mimecast.smime.db.SharedDataSource;
import com.mimecast.smime.domain.OutgoingMail;
import com.mimecast.smime.domain.SmimeCertificate;
import com.mimecast.smime.exception.SmimeException;
import com.mimecast.smime.repository.SmimeCertificateRepository;
import com.mimecast.smime.service.CertificateChainBuilder;
import com.mimecast.smime.service.CertificateImportService;
import com.mimecast.smime.service.CertificateResolver;
import com.mimecast.smime.service.SmimeOutgoingService;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Main runnable.
 *
 * <p>Imports certificates and private keys into the store and signs or encrypts RFC 5322 messages.
 * <p>The configuration file can be given with --config or a system property called <i>smime.config</i>.
 * <br><b>Example:</b>
 * <pre>java -jar smime-vault.jar --config cfg/smime.json5 --sign message.eml --out signed.eml</pre>
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "smime-vault.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "S/MIME certificate store and message protection";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        System.exit(new Main(args).run());
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
     * Runs the requested action.
     *
     * @return Exit code.
     */
    int run() {
        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            return 2;
        }

        CommandLine cmd = opt.get();
        if (!cmd.hasOption("import-certs") && !cmd.hasOption("import-keys") && !cmd.hasOption("sign")
                && !cmd.hasOption("encrypt") && !cmd.hasOption("init-schema")) {
            optionsUsage(options);
            return 2;
        }

        try {
            SmimeConfig config = loadConfig(cmd.getOptionValue("config", System.getProperty("smime.config")));
            DataSource dataSource = SharedDataSource.getDataSource(config.getStore());
            SmimeCertificateRepository repository = new SmimeCertificateRepository(dataSource, config.getStore().getBatchSize());

            if (cmd.hasOption("init-schema")) {
                SchemaInitializer.apply(dataSource);
            }

            CertificateImportService importService = new CertificateImportService(repository);
            if (cmd.hasOption("import-certs")) {
                List<SmimeCertificate> created = importService.importCertificates(readString(cmd.getOptionValue("import-certs")));
                log("Imported " + created.size() + " certificate(s)");
            }
            if (cmd.hasOption("import-keys")) {
                importService.importPrivateKeys(readString(cmd.getOptionValue("import-keys")), cmd.getOptionValue("secret"));
                log("Imported private key(s)");
            }

            if (cmd.hasOption("sign") || cmd.hasOption("encrypt")) {
                SecurityConfig security = config.getSecurity();
                SmimeOutgoingService service = new SmimeOutgoingService(
                        new CertificateResolver(repository),
                        new CertificateChainBuilder(repository, security.getMaxChainLength()),
                        security);

                byte[] result = cmd.hasOption("sign")
                        ? service.sign(readMail(cmd.getOptionValue("sign")))
                        : service.encrypt(readMail(cmd.getOptionValue("encrypt")));
                write(result, cmd.getOptionValue("out"));
            }
            return 0;
        } catch (IOException | MessagingException | SmimeException | IllegalStateException | IllegalArgumentException e) {
            log.error("Command failed: {}", e.getMessage());
            log("Error: " + e.getMessage());
            return 1;
        } finally {
            SharedDataSource.close();
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "config", true, "Configuration file (JSON5)");
        options.addOption(null, "init-schema", false, "Create the certificate table if missing");
        options.addOption(null, "import-certs", true, "Import PEM certificates from file");
        options.addOption(null, "import-keys", true, "Import PEM private keys from file");
        options.addOption(null, "secret", true, "Private key secret");
        options.addOption(null, "sign", true, "Sign RFC 5322 message file");
        options.addOption(null, "encrypt", true, "Encrypt RFC 5322 message file");
        options.addOption(null, "out", true, "Output file (default: stdout)");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
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
            // Should not happen with ByteArrayOutputStream.
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    private static SmimeConfig loadConfig(String path) throws IOException {
        return StringUtils.isBlank(path) ? SmimeConfig.load() : SmimeConfig.load(Path.of(path));
    }

    private static String readString(String path) throws IOException {
        return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    }

    /**
     * Reads a message file and takes From, To and Cc from its headers.
     *
     * @param path Message file path.
     * @return OutgoingMail instance.
     */
    static OutgoingMail readMail(String path) throws IOException, MessagingException {
        byte[] content = Files.readAllBytes(Path.of(path));
        MimeMessage message = new MimeMessage(Session.getInstance(new Properties()), new ByteArrayInputStream(content));

        Address[] from = message.getFrom();
        String sender = from != null && from.length > 0 ? ((InternetAddress) from[0]).getAddress() : null;
        return new OutgoingMail(sender,
                addresses(message.getRecipients(Message.RecipientType.TO)),
                addresses(message.getRecipients(Message.RecipientType.CC)),
                content);
    }

    private static List<String> addresses(Address[] addresses) {
        List<String> list = new ArrayList<>();
        if (addresses != null) {
            for (Address address : addresses) {
                if (address instanceof InternetAddress internetAddress) {
                    list.add(internetAddress.getAddress());
                }
            }
        }
        return list;
    }

    private static void write(byte[] data, String path) throws IOException {
        if (StringUtils.isBlank(path)) {
            System.out.write(data);
            System.out.flush();
        } else {
            Files.write(Path.of(path), data);
            log("Wrote " + path);
        }
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    private static void log(String string) {
        System.out.println(string);
    }
}
