package tech.noetzold.verification_api.ontology;

import lombok.Getter;

/**
 * An ontology could not be produced for a request: missing, malformed, or its store did not
 * answer in time. Fatal to the request, not to the process.
 */
@Getter
public class OntologyLoadException extends RuntimeException {

    public enum Reason { NOT_FOUND, INVALID, UNAVAILABLE, TIMEOUT }

    private final Reason reason;
    private final String ontologyName;
    private final String constraintId;

    public OntologyLoadException(Reason reason, String ontologyName, String constraintId, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.ontologyName = ontologyName;
        this.constraintId = constraintId;
    }

    public static OntologyLoadException invalid(String constraintId, String message) {
        String prefix = constraintId != null ? "Constraint '" + constraintId + "': " : "";
        return new OntologyLoadException(Reason.INVALID, null, constraintId, prefix + message, null);
    }

    public static OntologyLoadException notFound(String name, String version) {
        return new OntologyLoadException(Reason.NOT_FOUND, name, null,
                "Ontology '" + name + "' not found" + (version != null ? " (version " + version + ")" : ""), null);
    }

    /** Copy with the ontology name filled in, for errors raised before the name was known. */
    public OntologyLoadException forOntology(String name) {
        if (ontologyName != null) return this;
        return new OntologyLoadException(reason, name, constraintId, getMessage(), getCause());
    }
}
