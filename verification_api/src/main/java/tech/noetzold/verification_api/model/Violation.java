package tech.noetzold.verification_api.model;

/**
 * One unsatisfied (or undecidable) constraint. Descriptive fields are copied from the constraint
 * verbatim.
 */
public record Violation(
        String constraint_id,
        String category,
        String description,
        String error_message,
        String citation,
        String severity
) {
    public static Violation of(Constraint c) {
        return new Violation(c.id(), c.category(), c.description(), c.errorMessage(), c.citation(), c.severity());
    }

    public static Violation internalError(Constraint c, String detail) {
        return new Violation(c.id(), c.category(), c.description(),
                "Internal formula error: " + detail, c.citation(), c.severity());
    }
}
