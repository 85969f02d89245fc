package tech.noetzold.verification_api.decision;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.formula.CompiledFormula;
import tech.noetzold.verification_api.formula.FormulaCompileException;
import tech.noetzold.verification_api.formula.FormulaCompiler;
import tech.noetzold.verification_api.model.Assignment;
import tech.noetzold.verification_api.model.Constraint;
import tech.noetzold.verification_api.model.ConstraintOutcome;
import tech.noetzold.verification_api.model.Verdict;
import tech.noetzold.verification_api.model.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks every constraint independently against one assignment. All constraints are checked;
 * anything not proven satisfied is reported as a violation.
 */
@Slf4j
@Component
public class DecisionEngine {

    private final FormulaCompiler compiler;
    private final DecisionProcedure procedure;
    private final long budgetMs;

    public DecisionEngine(FormulaCompiler compiler,
                          DecisionProcedure procedure,
                          @Value("${verification.decision.timeout-ms:1000}") long budgetMs) {
        this.compiler = compiler;
        this.procedure = procedure;
        this.budgetMs = budgetMs;
    }

    public DecisionReport check(List<Constraint> constraints, Assignment assignment) {
        List<ConstraintOutcome> outcomes = new ArrayList<>();
        List<Violation> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Constraint constraint : constraints) {
            Verdict verdict;
            try {
                CompiledFormula formula = compiler.compile(constraint, assignment);
                verdict = procedure.decide(formula, new TimeBudget(budgetMs));
            } catch (FormulaCompileException e) {
                log.error("Formula of constraint {} failed to compile: {}", constraint.id(), e.getMessage());
                outcomes.add(new ConstraintOutcome(constraint.id(), Verdict.UNDETERMINED));
                violations.add(Violation.internalError(constraint, e.getMessage()));
                warnings.add("Constraint '" + constraint.id() + "' could not be evaluated and is reported as violated");
                continue;
            } catch (DecisionTimeoutException e) {
                log.warn(e.getMessage());
                verdict = Verdict.UNDETERMINED;
            }

            outcomes.add(new ConstraintOutcome(constraint.id(), verdict));
            switch (verdict) {
                case SATISFIED -> { }
                case VIOLATED -> {
                    log.debug("Constraint violated: {}", constraint.id());
                    violations.add(Violation.of(constraint));
                }
                case UNDETERMINED -> {
                    violations.add(Violation.of(constraint));
                    warnings.add("Constraint '" + constraint.id() + "' could not be decided and is reported as violated");
                }
            }
        }
        return new DecisionReport(outcomes, violations, warnings);
    }
}
