package tech.noetzold.verification_api.model;

import java.util.List;
import java.util.Optional;

public record Constraint(
        String id,
        String category,
        String description,
        List<Variable> variables,
        Expr formula,
        String severity,
        String errorMessage,
        String citation
) {
    public Constraint {
        variables = List.copyOf(variables);
    }

    public Optional<Variable> variable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }
}
