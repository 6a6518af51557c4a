package dev.ossaudit.audit;

import dev.ossaudit.AuditException;
import dev.ossaudit.exec.BoundedTaskScheduler;
import dev.ossaudit.license.LicenseTextResolver;
import dev.ossaudit.license.RepositoryId;
import dev.ossaudit.manifest.DependencyEntry;
import dev.ossaudit.policy.PolicyEvaluator;
import dev.ossaudit.registry.RegistryClient;
import dev.ossaudit.report.AttributionRecord;
import dev.ossaudit.report.OssReadmeAssembler;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Audits a list of dependencies: looks each one up in the registry, checks it against the license policy and, when an
 * attribution report is requested, resolves its license text.
 *
 * <p>Lookup and resolution failures abort the whole run. A dependency whose license cannot be determined is never
 * reported as passing or failing the policy.
 */
public class LicenseAuditor {
    private static final Logger logger = LogManager.getLogger(LicenseAuditor.class);

    private final RegistryClient registry;
    private final @Nullable LicenseTextResolver resolver;
    private final PolicyEvaluator policy;
    private final BoundedTaskScheduler scheduler;
    private final OssReadmeAssembler assembler;
    private final String sourceHost;
    private final PrintStream diagnostics;

    public LicenseAuditor(
            RegistryClient registry,
            @Nullable LicenseTextResolver resolver,
            PolicyEvaluator policy,
            BoundedTaskScheduler scheduler,
            String sourceHost,
            PrintStream diagnostics) {
        this.registry = registry;
        this.resolver = resolver;
        this.policy = policy;
        this.scheduler = scheduler;
        this.assembler = new OssReadmeAssembler();
        this.sourceHost = sourceHost;
        this.diagnostics = diagnostics;
    }

    /**
     * @param ossReadme also build the attribution report; requires a resolver
     */
    public AuditOutcome audit(List<DependencyEntry> entries, boolean ossReadme) {
        if (ossReadme && resolver == null) {
            throw new IllegalStateException("attribution report requested without a license text resolver");
        }

        diagnostics.println("Checking OSS dependencies for " + policy.marker() + " license...");
        logger.debug("Auditing {} dependencies with concurrency {}", entries.size(), scheduler.limit());

        List<DependencyAudit> audits;
        try {
            audits = scheduler.runAll(entries, entry -> auditOne(entry, ossReadme));
        } catch (AuditException e) {
            logger.debug("Audit aborted ({})", e.kind(), e);
            return new AuditOutcome.Aborted(e.kind(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while auditing dependencies", e);
        }

        boolean approved = PolicyEvaluator.verdict(audits.stream().map(DependencyAudit::approved).toList());
        if (!approved) {
            diagnostics.println("Some dependencies are not " + policy.marker() + "!");
        }

        String report = null;
        if (ossReadme) {
            report = assembler.render(audits.stream()
                    .map(DependencyAudit::attribution)
                    .filter(Objects::nonNull)
                    .toList());
        }
        return new AuditOutcome.Completed(audits, approved, report);
    }

    DependencyAudit auditOne(DependencyEntry entry, boolean ossReadme) throws AuditException {
        var info = registry.fetchLicense(entry.name(), entry.version());
        boolean approved = policy.evaluate(info);
        if (!ossReadme) {
            return new DependencyAudit(entry, info, approved, null);
        }

        var repository = RepositoryId.parse(info.repositoryUrl(), sourceHost);
        var document = Objects.requireNonNull(resolver).resolve(repository);
        logger.debug("{}: license text from {} ({})", entry, repository, document.source());
        return new DependencyAudit(entry, info, approved, AttributionRecord.of(repository, info, document));
    }
}
