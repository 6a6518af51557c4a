package dev.ossaudit.cli;

import dev.ossaudit.audit.AuditOutcome;
import dev.ossaudit.audit.LicenseAuditor;
import dev.ossaudit.config.AuditSettings;
import dev.ossaudit.exec.BoundedTaskScheduler;
import dev.ossaudit.license.GitHubSourceHost;
import dev.ossaudit.license.LicenseTextResolver;
import dev.ossaudit.manifest.DependencyEntry;
import dev.ossaudit.manifest.ManifestException;
import dev.ossaudit.manifest.ManifestReader;
import dev.ossaudit.policy.PolicyEvaluator;
import dev.ossaudit.registry.CratesIoClient;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "oss-audit",
        mixinStandardHelpOptions = true,
        version = "oss-audit 0.1.0",
        description = "Checks that every dependency in a Cargo lock file declares an approved open-source license.")
public final class OssAuditCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(OssAuditCli.class);

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "<lockfile-path>",
            description = "Path to the Cargo.lock to audit.")
    @Nullable
    private Path lockFile;

    @CommandLine.Option(
            names = "--ossreadme",
            description = "Print the attribution report (OSS readme JSON) to standard output.")
    private boolean ossReadme = false;

    @CommandLine.Option(
            names = "--self-package",
            description = "Package to exclude as the audited project itself. Defaults to [package].name of the "
                    + "Cargo.toml next to the lock file.")
    @Nullable
    private String selfPackage;

    @CommandLine.Option(names = "--concurrency", description = "Maximum number of dependencies audited at once.")
    @Nullable
    private Integer concurrency;

    @CommandLine.Option(names = "--registry-url", description = "Base URL of the crates registry.")
    @Nullable
    private String registryUrl;

    @CommandLine.Option(names = "--github-api-url", description = "Base URL of the GitHub REST API.")
    @Nullable
    private String githubApiUrl;

    @CommandLine.Option(names = "--github-raw-url", description = "Base URL for raw GitHub file downloads.")
    @Nullable
    private String githubRawUrl;

    @CommandLine.Option(names = "--verbose", description = "Log debug output to standard error.")
    private boolean verbose = false;

    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> env;

    public OssAuditCli() {
        this(utf8(new FileOutputStream(FileDescriptor.out)), utf8(new FileOutputStream(FileDescriptor.err)),
                System.getenv());
    }

    public OssAuditCli(PrintStream out, PrintStream err, Map<String, String> env) {
        this.out = out;
        this.err = err;
        this.env = env;
    }

    public static void main(String[] args) {
        int exitCode = run(
                args,
                new FileOutputStream(FileDescriptor.out),
                new FileOutputStream(FileDescriptor.err),
                System.getenv());
        System.exit(exitCode);
    }

    /** Runs against raw byte streams; glyphs and the JSON report are always written as UTF-8. */
    public static int run(String[] args, OutputStream out, OutputStream err, Map<String, String> env) {
        return run(args, utf8(out), utf8(err), env);
    }

    static PrintStream utf8(OutputStream raw) {
        return new PrintStream(raw, true, StandardCharsets.UTF_8);
    }

    /** Parses {@code args}, runs the audit and returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err, Map<String, String> env) {
        var commandLine = new CommandLine(new OssAuditCli(out, err, env));
        commandLine.setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true));
        commandLine.setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        commandLine.setParameterExceptionHandler((ex, badArgs) -> {
            var cmd = ex.getCommandLine();
            cmd.getErr().println(ex.getMessage());
            cmd.usage(cmd.getErr());
            return AuditOutcome.EXIT_FAILURE;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            logger.error("Audit failed unexpectedly", ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            return AuditOutcome.EXIT_FAILURE;
        });
        return commandLine.execute(args);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        if (lockFile == null) {
            err.println("Usage: oss-audit [--ossreadme] <lockfile-path>");
            return AuditOutcome.EXIT_FAILURE;
        }

        AuditSettings settings;
        try {
            settings = resolveSettings();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return AuditOutcome.EXIT_FAILURE;
        }
        logger.debug("Settings: {}", settings);

        var reader = ManifestReader.forLockFile(lockFile, selfPackage);
        List<DependencyEntry> entries;
        try {
            entries = reader.read(lockFile);
        } catch (ManifestException e) {
            err.println("Error: " + e.getMessage());
            return AuditOutcome.EXIT_FAILURE;
        }

        var httpClient = new OkHttpClient.Builder()
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .build();
        try {
            var outcome = newAuditor(settings, httpClient).audit(entries, ossReadme);
            return report(outcome);
        } finally {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    AuditSettings resolveSettings() {
        var settings = AuditSettings.load(env);
        if (registryUrl != null) {
            settings = settings.withRegistryUrl(registryUrl);
        }
        if (githubApiUrl != null) {
            settings = settings.withGithubApiUrl(githubApiUrl);
        }
        if (githubRawUrl != null) {
            settings = settings.withGithubRawUrl(githubRawUrl);
        }
        if (concurrency != null) {
            settings = settings.withConcurrency(concurrency);
        }
        return settings;
    }

    private LicenseAuditor newAuditor(AuditSettings settings, OkHttpClient httpClient) {
        var registry = new CratesIoClient(httpClient, settings.registryUrl(), settings.userAgent());
        var sourceHost = new GitHubSourceHost(
                httpClient,
                settings.githubApiUrl(),
                settings.githubRawUrl(),
                settings.userAgent(),
                settings.githubToken());
        return new LicenseAuditor(
                registry,
                LicenseTextResolver.forHost(sourceHost),
                new PolicyEvaluator(settings.approvedMarker(), err),
                new BoundedTaskScheduler(settings.concurrency()),
                settings.sourceHost(),
                err);
    }

    private int report(AuditOutcome outcome) {
        if (outcome instanceof AuditOutcome.Completed completed) {
            completed.reportText().ifPresent(out::println);
        } else if (outcome instanceof AuditOutcome.Aborted aborted) {
            err.println("Error: " + aborted.message());
        }
        return outcome.exitCode();
    }
}
