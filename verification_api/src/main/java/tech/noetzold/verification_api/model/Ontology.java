package tech.noetzold.verification_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated, immutable rule set. Identified by {@code (name, version)}; {@code digest} is the
 * SHA-256 of the canonical source document.
 */
public record Ontology(
        String name,
        String version,
        String description,
        String digest,
        List<Constraint> constraints,
        Map<String, ExtractionRule> extractors,
        List<String> negationCues
) {
    public Ontology {
        constraints = List.copyOf(constraints);
        // declaration order matters for extraction
        extractors = Collections.unmodifiableMap(new LinkedHashMap<>(extractors));
        negationCues = List.copyOf(negationCues);
    }

    /** Every variable declared by any constraint, first declaration wins, in order. */
    public Map<String, Variable> declaredVariables() {
        Map<String, Variable> vars = new LinkedHashMap<>();
        for (Constraint c : constraints) {
            for (Variable v : c.variables()) {
                vars.putIfAbsent(v.name(), v);
            }
        }
        return vars;
    }
}
