package tech.noetzold.verification_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.task.TaskRejectedException;
import tech.noetzold.verification_api.certificate.CertificateBuilder;
import tech.noetzold.verification_api.certificate.CertificateSigner;
import tech.noetzold.verification_api.decision.DecisionEngine;
import tech.noetzold.verification_api.decision.GroundEvaluationProcedure;
import tech.noetzold.verification_api.extraction.ExtractionEngine;
import tech.noetzold.verification_api.formula.FormulaCompiler;
import tech.noetzold.verification_api.model.*;
import tech.noetzold.verification_api.ontology.OntologyCache;
import tech.noetzold.verification_api.ontology.OntologyLoadException;
import tech.noetzold.verification_api.ontology.OntologyParser;
import tech.noetzold.verification_api.ontology.ResourceOntologySource;
import tech.noetzold.verification_api.TestOntologies;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class VerificationServiceTest {

    private AuditService auditService;
    private VerificationResultCache resultCache;
    private VerificationService service;

    @BeforeEach
    void setUp() {
        OntologyCache cache = new OntologyCache(
                new ResourceOntologySource(new DefaultResourceLoader(), "classpath:ontologies/"),
                new OntologyParser(new ObjectMapper()),
                Runnable::run,
                2000);
        auditService = mock(AuditService.class);
        resultCache = new VerificationResultCache(true, 100, 300);
        service = new VerificationService(cache, new ExtractionEngine(),
                new DecisionEngine(new FormulaCompiler(), new GroundEvaluationProcedure(), 1000),
                new CertificateBuilder(new CertificateSigner("test-signing-key")), resultCache, auditService);
    }

    private VerifyResponse run(String text, String ontology) {
        return service.verify(new VerifyRequest(text, ontology, null, null));
    }

    private static List<String> ids(VerifyResponse r) {
        return r.violations().stream().map(Violation::constraint_id).toList();
    }

    @Test
    void highDtiWithoutCompensatingFactorsViolatesAtr() {
        VerifyResponse r = run("Approved with dti: 55 percent.", "mortgage-compliance-v1");

        assertFalse(r.verified());
        assertEquals(List.of("ATR_QM_DTI"), ids(r));
        assertEquals("critical", r.violations().get(0).severity());
        assertEquals(55L, r.parsed_data().get("dti"));
        assertEquals(0L, r.parsed_data().get("compensating_factors"));
        assertTrue(r.defaulted_variables().contains("compensating_factors"));
        assertTrue(r.warnings().stream().anyMatch(w -> w.contains("compensating_factors")));
        assertEquals(5, r.ontology().constraints_checked());
        assertEquals("1.0.0", r.ontology().version());
    }

    @Test
    void compensatingFactorsSatisfyAtr() {
        VerifyResponse r = run("Approved with a DTI of 47% and 2 compensating factors.", "mortgage-compliance-v1");

        assertTrue(r.verified());
        assertTrue(r.violations().isEmpty());
        assertEquals(2L, r.parsed_data().get("compensating_factors"));
    }

    @Test
    void guaranteedApprovalViolatesUdaap() {
        VerifyResponse r = run("You are guaranteed approval for this loan.", "mortgage-compliance-v1");

        assertFalse(r.verified());
        assertEquals(List.of("UDAAP_NO_GUARANTEES"), ids(r));
        assertEquals(true, r.parsed_data().get("has_guarantee"));
    }

    @Test
    void guaranteeNextToUnrelatedNegationStillViolates() {
        VerifyResponse r = run("No worries, you are guaranteed to be approved.", "mortgage-compliance-v1");

        assertFalse(r.verified());
        assertTrue(ids(r).contains("UDAAP_NO_GUARANTEES"));
    }

    @Test
    void disclaimedGuaranteeIsNotAViolation() {
        VerifyResponse r = run("Approval is not guaranteed and depends on underwriting.", "mortgage-compliance-v1");

        assertFalse(ids(r).contains("UDAAP_NO_GUARANTEES"));
        assertEquals(false, r.parsed_data().get("has_guarantee"));
    }

    @Test
    void highCostLoanNeedsCounseling() {
        VerifyResponse r = run("Loan amount: $100,000 with fees of $9,000. Approved.", "mortgage-compliance-v1");

        assertEquals(List.of("HOEPA_HIGH_COST"), ids(r));

        VerifyResponse disclosed = run("Loan amount: $100,000 with fees of $9,000. Approved. "
                + "Please review the homeownership counseling notice.", "mortgage-compliance-v1");
        assertTrue(disclosed.verified());
    }

    @Test
    void metforminWithLowEgfrViolatesBothRenalRules() {
        VerifyResponse r = run("Start metformin 2000 mg daily; eGFR is 40.", "medical-safety-v1");

        assertEquals(List.of("EGFR_METFORMIN", "EGFR_DOSE_LIMIT"), ids(r));
        assertEquals(40L, r.parsed_data().get("egfr"));
    }

    @Test
    void negatedMetforminIsNotARecommendation() {
        VerifyResponse r = run("Metformin is contraindicated here; eGFR is 40.", "medical-safety-v1");

        assertTrue(r.verified());
        assertEquals(false, r.parsed_data().get("recommends_metformin"));
    }

    @Test
    void customerServiceDiscountLimit() {
        VerifyResponse r = run("I can offer you 25% off your next order.", "customer-service-v1");

        assertEquals(List.of("DISCOUNT_LIMIT"), ids(r));
    }

    @Test
    void identicalRequestsGetIdenticalCertificates() {
        Ontology o = service.describe("mortgage-compliance-v1", null);
        VerificationResult a = service.evaluate(o, "Approved with dti: 55 percent.", o.constraints());
        VerificationResult b = service.evaluate(o, "Approved with dti: 55 percent.", o.constraints());

        assertEquals(a.certificateDigest(), b.certificateDigest());
        assertEquals(a.certificateSignature(), b.certificateSignature());
        assertEquals(a.inputDigest(), b.inputDigest());
    }

    @Test
    void freeVariableWitnessSatisfiesConstraint() {
        VerifyResponse r = run("The price is 30.", "pricing-fixture");

        assertTrue(r.verified());
    }

    @Test
    void undecidableConstraintIsReportedAsViolation() {
        VerifyResponse r = run("The price is 150.", "pricing-fixture");

        assertEquals(List.of("PRICE_CAP", "HEADROOM"), ids(r));
        assertTrue(r.warnings().stream().anyMatch(w -> w.contains("HEADROOM") && w.contains("could not be decided")));
    }

    @Test
    void rulesRestrictCheckedConstraints() {
        VerifyResponse r = service.verify(new VerifyRequest("Approved with dti: 55 percent.",
                "mortgage-compliance-v1", null, List.of("UDAAP_NO_GUARANTEES")));

        assertTrue(r.verified());
        assertEquals(1, r.ontology().constraints_checked());
    }

    @Test
    void unknownRuleIsRejected() {
        UnknownConstraintException ex = assertThrows(UnknownConstraintException.class,
                () -> service.verify(new VerifyRequest("x", "mortgage-compliance-v1", null, List.of("NOPE"))));
        assertEquals(List.of("NOPE"), ex.getConstraintIds());
        verifyNoInteractions(auditService);
    }

    @Test
    void pinnedVersionIsUsed() {
        VerifyResponse r = service.verify(new VerifyRequest("price 10", "pricing-fixture", "0.9.0", null));

        assertEquals("0.9.0", r.ontology().version());
    }

    @Test
    void unknownOntologyFails() {
        OntologyLoadException ex = assertThrows(OntologyLoadException.class,
                () -> run("anything", "no-such-ontology"));
        assertEquals(OntologyLoadException.Reason.NOT_FOUND, ex.getReason());
    }

    @Test
    void auditEntryDescribesTheResult() {
        VerifyResponse r = run("Approved with dti: 55 percent.", "mortgage-compliance-v1");

        verify(auditService).record(argThat(e -> e.verificationId().equals(r.verification_id())
                && !e.verified()
                && e.violations().size() == 1
                && e.certificateDigest().equals(r.certificate_digest())
                && e.certificateSignature().equals(r.certificate_signature())));
    }

    @Test
    void repeatedRequestIsServedFromResultCache() {
        VerifyResponse first = run("Approved with dti: 55 percent.", "mortgage-compliance-v1");
        VerifyResponse second = run("Approved with dti: 55 percent.", "mortgage-compliance-v1");

        assertFalse(first.cached());
        assertTrue(second.cached());
        assertNotEquals(first.verification_id(), second.verification_id());
        assertEquals(first.violations(), second.violations());
        assertEquals(first.certificate_digest(), second.certificate_digest());
        assertEquals(1, resultCache.size());
        verify(auditService, times(2)).record(any());
    }

    @Test
    void differentRulesDoNotShareCachedResult() {
        run("You are guaranteed approval.", "mortgage-compliance-v1");
        VerifyResponse narrowed = service.verify(new VerifyRequest("You are guaranteed approval.",
                "mortgage-compliance-v1", null, List.of("ATR_QM_DTI")));

        assertFalse(narrowed.cached());
        assertTrue(narrowed.verified());
        assertEquals(2, resultCache.size());
    }

    @Test
    void disabledResultCacheAlwaysEvaluates() {
        VerificationResultCache disabled = new VerificationResultCache(false, 100, 300);
        Ontology o = service.describe("pricing-fixture", null);
        String key = VerificationResultCache.key(o, "price 10", o.constraints());
        disabled.put(key, service.evaluate(o, "price 10", o.constraints()));

        assertTrue(disabled.get(key).isEmpty());
        assertEquals(0, disabled.size());
    }

    @Test
    void issuedCertificateSignatureChecksOut() {
        VerifyResponse r = run("Approved with dti: 55 percent.", "mortgage-compliance-v1");

        assertEquals(CertificateSigner.ALGORITHM, r.signature_algorithm());
        CertificateCheckResponse ok = service.checkCertificate(
                new CertificateCheckRequest(r.certificate(), r.certificate_signature()));
        assertTrue(ok.valid());
        assertEquals(r.certificate_digest(), ok.certificate_digest());

        String forged = r.certificate().replace("\"verified\":false", "\"verified\":true");
        assertFalse(service.checkCertificate(new CertificateCheckRequest(forged, r.certificate_signature())).valid());
    }

    @Test
    void rejectedAuditDoesNotFailVerification() {
        when(auditService.record(any())).thenThrow(new TaskRejectedException("queue full"));

        VerifyResponse r = run("Approved with dti: 30%.", "mortgage-compliance-v1");

        assertTrue(r.verified());
    }

    @Test
    void evaluateIsPure() {
        Ontology o = service.describe("mortgage-compliance-v1", null);
        VerificationResult a = service.evaluate(o, "Approved with dti: 55 percent.", o.constraints());
        VerificationResult b = service.evaluate(o, "Approved with dti: 55 percent.", o.constraints());

        assertEquals(a, b);
        verifyNoInteractions(auditService);
    }

    @Test
    void addingADefaultDoesNotChangeExtractedOutcome() {
        Ontology plain = TestOntologies.bundled("mortgage-compliance-v1");
        Ontology withDefault = new OntologyParser(new ObjectMapper()).parse(
                TestOntologies.document("mortgage-compliance-v1")
                        .replace("\"format\": \"percentage\",", "\"format\": \"percentage\",\n      \"default\": 10,"));
        String text = "Approved with dti: 55 percent.";

        VerificationResult a = service.evaluate(plain, text, plain.constraints());
        VerificationResult b = service.evaluate(withDefault, text, withDefault.constraints());

        assertEquals(a.verified(), b.verified());
        assertEquals(a.violations(), b.violations());
    }
}
