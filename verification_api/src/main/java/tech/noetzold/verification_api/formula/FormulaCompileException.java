package tech.noetzold.verification_api.formula;

import lombok.Getter;

/**
 * A formula that passed load-time checks still could not be compiled against an assignment.
 * Degrades to a violation of that one constraint.
 */
@Getter
public class FormulaCompileException extends RuntimeException {

    private final String constraintId;

    public FormulaCompileException(String constraintId, String message) {
        super(message);
        this.constraintId = constraintId;
    }
}
