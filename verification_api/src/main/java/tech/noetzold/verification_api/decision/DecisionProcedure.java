package tech.noetzold.verification_api.decision;

import tech.noetzold.verification_api.formula.CompiledFormula;
import tech.noetzold.verification_api.model.Verdict;

/**
 * Decides whether a compiled formula holds. Implementations must be stateless between calls;
 * a full SMT backend can replace the default one behind this interface.
 *
 * @throws DecisionTimeoutException when {@code budget} runs out
 */
public interface DecisionProcedure {

    Verdict decide(CompiledFormula formula, TimeBudget budget);
}
