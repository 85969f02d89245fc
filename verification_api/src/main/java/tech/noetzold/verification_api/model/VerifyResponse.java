package tech.noetzold.verification_api.model;

import java.util.List;
import java.util.Map;

public record VerifyResponse(
        String verification_id,
        boolean verified,
        List<Violation> violations,
        List<String> warnings,
        Map<String, Object> parsed_data,
        List<String> defaulted_variables,
        OntologyInfo ontology,
        String certificate_digest,
        String certificate_signature,
        String signature_algorithm,
        String certificate,
        String input_digest,
        boolean cached,
        long execution_time_ms,
        String timestamp
) {}
