package tech.noetzold.verification_api.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import tech.noetzold.verification_api.certificate.Certificate;
import tech.noetzold.verification_api.certificate.CertificateBuilder;
import tech.noetzold.verification_api.certificate.CertificateSigner;
import tech.noetzold.verification_api.decision.DecisionEngine;
import tech.noetzold.verification_api.decision.DecisionReport;
import tech.noetzold.verification_api.extraction.ExtractionEngine;
import tech.noetzold.verification_api.extraction.ExtractionResult;
import tech.noetzold.verification_api.extraction.ExtractionWarning;
import tech.noetzold.verification_api.model.*;
import tech.noetzold.verification_api.ontology.OntologyCache;
import tech.noetzold.verification_api.util.CanonicalJson;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one request through load, extract, decide and certify. Each call is independent; the shared
 * state is the ontology cache and the cache of results for identical requests.
 */
@Slf4j
@Service
public class VerificationService {

    private final OntologyCache ontologyCache;
    private final ExtractionEngine extractionEngine;
    private final DecisionEngine decisionEngine;
    private final CertificateBuilder certificateBuilder;
    private final VerificationResultCache resultCache;
    private final AuditService auditService;

    public VerificationService(OntologyCache ontologyCache,
                               ExtractionEngine extractionEngine,
                               DecisionEngine decisionEngine,
                               CertificateBuilder certificateBuilder,
                               VerificationResultCache resultCache,
                               AuditService auditService) {
        this.ontologyCache = ontologyCache;
        this.extractionEngine = extractionEngine;
        this.decisionEngine = decisionEngine;
        this.certificateBuilder = certificateBuilder;
        this.resultCache = resultCache;
        this.auditService = auditService;
    }

    public VerifyResponse verify(VerifyRequest req) {
        long start = System.currentTimeMillis();
        String verificationId = UUID.randomUUID().toString();
        MDC.put("verification_id", verificationId);
        try {
            return process(verificationId, start, req);
        } finally {
            MDC.remove("verification_id");
        }
    }

    private VerifyResponse process(String verificationId, long start, VerifyRequest req) {
        Ontology ontology = ontologyCache.get(req.ontology_name(), req.ontology_version());
        List<Constraint> selected = select(ontology, req.rules());
        String cacheKey = VerificationResultCache.key(ontology, req.text(), selected);
        Optional<VerificationResult> cached = resultCache.get(cacheKey);
        VerificationResult result = cached.orElseGet(() -> evaluate(ontology, req.text(), selected));
        if (cached.isEmpty()) {
            resultCache.put(cacheKey, result);
        }

        long elapsed = System.currentTimeMillis() - start;
        Instant now = Instant.now();

        submitAudit(new AuditEntry(verificationId, ontology.name(), ontology.version(), result.verified(),
                result.violations(), result.inputDigest(), result.certificateDigest(),
                result.certificateSignature(), elapsed, now));

        log.info("Verification {} against {}@{}: verified={} violations={} warnings={} cached={} in {}ms",
                verificationId, ontology.name(), ontology.version(), result.verified(),
                result.violations().size(), result.warnings().size(), cached.isPresent(), elapsed);

        return new VerifyResponse(
                verificationId,
                result.verified(),
                result.violations(),
                result.warnings(),
                result.assignment().toRawMap(),
                List.copyOf(result.assignment().defaulted()),
                new OntologyInfo(ontology.name(), ontology.version(), ontology.digest(), selected.size()),
                result.certificateDigest(),
                result.certificateSignature(),
                CertificateSigner.ALGORITHM,
                result.certificate(),
                result.inputDigest(),
                cached.isPresent(),
                elapsed,
                now.toString()
        );
    }

    /** The pure pipeline: no ids, no clocks, no audit. */
    public VerificationResult evaluate(Ontology ontology, String text, List<Constraint> constraints) {
        ExtractionResult extraction = extractionEngine.extract(text, ontology);
        DecisionReport report = decisionEngine.check(constraints, extraction.assignment());
        Certificate certificate = certificateBuilder.build(ontology, text, report.outcomes());

        List<String> warnings = new ArrayList<>();
        for (ExtractionWarning w : extraction.warnings()) {
            warnings.add(w.message());
        }
        warnings.addAll(report.warnings());

        return new VerificationResult(
                report.allSatisfied(),
                report.violations(),
                report.outcomes(),
                extraction.assignment(),
                warnings,
                certificate.digest(),
                certificate.inputDigest(),
                certificate.canonical(),
                certificate.signature()
        );
    }

    public CertificateCheckResponse checkCertificate(CertificateCheckRequest req) {
        boolean valid = certificateBuilder.isAuthentic(req.certificate(), req.certificate_signature());
        if (!valid) {
            log.warn("Certificate signature check failed");
        }
        return new CertificateCheckResponse(valid, CanonicalJson.sha256Hex(req.certificate()),
                CertificateSigner.ALGORITHM);
    }

    public Ontology describe(String name, String version) {
        return ontologyCache.get(name, version);
    }

    List<Constraint> select(Ontology ontology, List<String> rules) {
        if (rules == null || rules.isEmpty()) {
            return ontology.constraints();
        }
        Set<String> wanted = new LinkedHashSet<>(rules);
        List<Constraint> selected = ontology.constraints().stream()
                .filter(c -> wanted.contains(c.id()))
                .toList();
        if (selected.size() < wanted.size()) {
            Set<String> known = selected.stream().map(Constraint::id).collect(Collectors.toSet());
            List<String> unknown = wanted.stream().filter(r -> !known.contains(r)).toList();
            throw new UnknownConstraintException(ontology.name(), unknown);
        }
        return selected;
    }

    private void submitAudit(AuditEntry entry) {
        try {
            auditService.record(entry);
        } catch (RuntimeException e) {
            log.warn("Audit submission rejected for verification {}: {}", entry.verificationId(), e.getMessage());
        }
    }
}
