package tech.noetzold.verification_api.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a loaded ontology: constraint metadata and variable types, no formulas.
 */
public record OntologyResponse(
        String name,
        String version,
        String description,
        String digest,
        List<ConstraintSummary> constraints,
        Map<String, String> variables,
        List<String> extracted_variables
) {
    public record ConstraintSummary(String id, String category, String description,
                                    String severity, String error_message, String citation) {}

    public static OntologyResponse from(Ontology o) {
        List<ConstraintSummary> cs = new ArrayList<>();
        for (Constraint c : o.constraints()) {
            cs.add(new ConstraintSummary(c.id(), c.category(), c.description(),
                    c.severity(), c.errorMessage(), c.citation()));
        }
        Map<String, String> vars = new LinkedHashMap<>();
        o.declaredVariables().forEach((name, v) -> vars.put(name, v.kind().label()));
        return new OntologyResponse(o.name(), o.version(), o.description(), o.digest(),
                cs, vars, List.copyOf(o.extractors().keySet()));
    }
}
