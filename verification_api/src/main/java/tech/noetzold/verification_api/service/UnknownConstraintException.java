package tech.noetzold.verification_api.service;

import lombok.Getter;

import java.util.List;

/**
 * The request asked for constraint ids the ontology does not define.
 */
@Getter
public class UnknownConstraintException extends RuntimeException {

    private final String ontologyName;
    private final List<String> constraintIds;

    public UnknownConstraintException(String ontologyName, List<String> constraintIds) {
        super("Unknown constraint id(s) for ontology '" + ontologyName + "': " + String.join(", ", constraintIds));
        this.ontologyName = ontologyName;
        this.constraintIds = List.copyOf(constraintIds);
    }
}
