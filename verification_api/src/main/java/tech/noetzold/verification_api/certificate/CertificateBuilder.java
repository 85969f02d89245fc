package tech.noetzold.verification_api.certificate;

import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.ConstraintOutcome;
import tech.noetzold.verification_api.model.Ontology;
import tech.noetzold.verification_api.util.CanonicalJson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds ontology identity, input digest and per-constraint outcomes into one SHA-256 digest and
 * signs the same canonical body. Ids and timestamps stay out of it, so the same request always
 * produces the same certificate.
 */
@Component
public class CertificateBuilder {

    public static final String SCHEMA = "verification-certificate/1";
    public static final String METHOD = "deterministic-evaluation";

    private final CertificateSigner signer;

    public CertificateBuilder(CertificateSigner signer) {
        this.signer = signer;
    }

    public Certificate build(Ontology ontology, String text, List<ConstraintOutcome> outcomes) {
        String inputDigest = CanonicalJson.sha256Hex(text == null ? "" : text);

        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("name", ontology.name());
        identity.put("version", ontology.version());
        identity.put("digest", ontology.digest());

        List<Map<String, Object>> checked = new ArrayList<>();
        for (ConstraintOutcome o : outcomes) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("constraint_id", o.constraintId());
            entry.put("outcome", o.verdict().name().toLowerCase(Locale.ROOT));
            checked.add(entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("schema", SCHEMA);
        body.put("method", METHOD);
        body.put("ontology", identity);
        body.put("input_digest", inputDigest);
        body.put("verified", outcomes.stream().allMatch(ConstraintOutcome::satisfied));
        body.put("outcomes", checked);

        String canonical = CanonicalJson.write(body);
        return new Certificate(CanonicalJson.sha256Hex(canonical), inputDigest, canonical, signer.sign(canonical));
    }

    /** Recomputes the certificate and compares it in constant time. */
    public boolean matches(String digest, Ontology ontology, String text, List<ConstraintOutcome> outcomes) {
        if (digest == null) return false;
        String expected = build(ontology, text, outcomes).digest();
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                digest.getBytes(StandardCharsets.US_ASCII));
    }

    /** True when {@code signature} was issued by this service for exactly {@code canonical}. */
    public boolean isAuthentic(String canonical, String signature) {
        return signer.verify(canonical, signature);
    }
}
