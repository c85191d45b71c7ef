package com.delta.siteaudit.job.service;

import com.delta.siteaudit.config.AuditProperties;
import com.delta.siteaudit.crawl.util.SiteOrigin;
import com.delta.siteaudit.job.model.AuditJob;
import com.delta.siteaudit.job.model.CreateJobRequest;
import com.delta.siteaudit.job.model.JobStatusView;
import com.delta.siteaudit.job.model.NewAuditJob;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Service
public class AuditJobService {
    private static final Logger log = LoggerFactory.getLogger(AuditJobService.class);
    private static final String DEFAULT_LOCALE = "en-US";
    private static final Pattern HOST_NAME = Pattern.compile(
        "^(?=.{4,253}$)([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z][a-z0-9-]{0,61}[a-z0-9]$"
    );
    private static final Pattern LOCALE = Pattern.compile("^[A-Za-z]{2,3}([-_][A-Za-z0-9]{2,8})*$");

    private final AuditJobRepository repository;
    private final AuditProperties properties;

    public AuditJobService(AuditJobRepository repository, AuditProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public String createJob(CreateJobRequest request) {
        String target = normalizeDomain(request.targetDomain(), "target_domain");

        Set<String> comparisons = new LinkedHashSet<>();
        if (request.comparisonDomains() != null) {
            for (String candidate : request.comparisonDomains()) {
                String domain = normalizeDomain(candidate, "comparison_domains");
                if (!domain.equals(target)) {
                    comparisons.add(domain);
                }
            }
        }
        int maxComparisons = properties.getJobs().getMaxComparisonDomains();
        if (comparisons.size() > maxComparisons) {
            throw new InvalidJobRequestException("at most " + maxComparisons + " comparison domains are allowed");
        }

        String locale = request.locale() == null || request.locale().isBlank() ? DEFAULT_LOCALE : request.locale().trim();
        if (!LOCALE.matcher(locale).matches()) {
            throw new InvalidJobRequestException("locale is not a valid language tag");
        }
        String context = request.context() == null || request.context().isBlank() ? null : request.context().trim();

        String jobId = repository.insert(new NewAuditJob(target, new ArrayList<>(comparisons), locale, context));
        log.info("Created audit job {} for {} with {} comparison domain(s)", jobId, target, comparisons.size());
        return jobId;
    }

    public AuditJob getJob(String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public JobStatusView getStatus(String jobId) {
        return JobStatusView.of(getJob(jobId));
    }

    /**
     * Requeues a finished job as a new run. Calling it on a job that is already queued or
     * running changes nothing and returns the current status.
     */
    public JobStatusView retry(String jobId) {
        AuditJob job = getJob(jobId);
        if (repository.resetForRetry(jobId)) {
            log.info("Requeued audit job {} (previous run {} ended {})", jobId, job.runNumber(), job.status());
        } else {
            log.debug("Retry of audit job {} ignored in status {}", jobId, job.status());
        }
        return getStatus(jobId);
    }

    static String normalizeDomain(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidJobRequestException(field + " must not be blank");
        }
        SiteOrigin origin;
        try {
            origin = SiteOrigin.parse(raw.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidJobRequestException(field + " is not a valid domain: " + raw);
        }
        if (!"http".equals(origin.scheme()) && !"https".equals(origin.scheme())) {
            throw new InvalidJobRequestException(field + " must be an http or https site");
        }
        if (!HOST_NAME.matcher(origin.host()).matches()) {
            throw new InvalidJobRequestException(field + " is not a valid domain: " + raw);
        }
        // https is the default when parsing, so only a plain-http site keeps its scheme
        return "http".equals(origin.scheme()) ? "http://" + origin.displayName() : origin.displayName();
    }
}
