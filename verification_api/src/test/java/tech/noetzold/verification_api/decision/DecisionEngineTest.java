package tech.noetzold.verification_api.decision;

import org.junit.jupiter.api.Test;
import tech.noetzold.verification_api.formula.FormulaCompiler;
import tech.noetzold.verification_api.model.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private final DecisionEngine engine =
            new DecisionEngine(new FormulaCompiler(), new GroundEvaluationProcedure(), 1000);

    private static Constraint atMost(String id, String var, long limit) {
        return new Constraint(id, "Limits", var + " at most " + limit,
                List.of(new Variable(var, VariableKind.INTEGER, false)),
                new Expr.Compare(Expr.CompareOp.LE, new Expr.VarRef(var), new Expr.Literal(Value.integer(limit))),
                "error", var + " too high", "Policy " + id);
    }

    private static Assignment values(Map<String, Value> values) {
        return new Assignment(values, Set.of(), Set.of());
    }

    @Test
    void everyConstraintIsCheckedAndViolationsKeepOrder() {
        List<Constraint> constraints = List.of(atMost("A", "a", 1), atMost("B", "b", 10), atMost("C", "c", 1));

        DecisionReport report = engine.check(constraints,
                values(Map.of("a", Value.integer(5), "b", Value.integer(5), "c", Value.integer(5))));

        assertFalse(report.allSatisfied());
        assertEquals(3, report.outcomes().size());
        assertEquals(List.of("A", "C"), report.violations().stream().map(Violation::constraint_id).toList());
        assertEquals(Verdict.SATISFIED, report.outcomes().get(1).verdict());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void violationCopiesConstraintMetadata() {
        Violation v = engine.check(List.of(atMost("A", "a", 1)), values(Map.of("a", Value.integer(2))))
                .violations().get(0);

        assertEquals("Limits", v.category());
        assertEquals("a too high", v.error_message());
        assertEquals("Policy A", v.citation());
        assertEquals("error", v.severity());
    }

    @Test
    void compileFailureIsReportedAsInternalViolation() {
        DecisionReport report = engine.check(List.of(atMost("A", "a", 1), atMost("B", "b", 1)),
                values(Map.of("b", Value.integer(0))));

        assertEquals(Verdict.UNDETERMINED, report.outcomes().get(0).verdict());
        assertEquals(Verdict.SATISFIED, report.outcomes().get(1).verdict());
        assertEquals(1, report.violations().size());
        assertTrue(report.violations().get(0).error_message().startsWith("Internal formula error: "));
        assertEquals(1, report.warnings().size());
    }

    @Test
    void undeterminedCountsAsViolationWithWarning() {
        DecisionEngine undecided = new DecisionEngine(new FormulaCompiler(), (f, b) -> Verdict.UNDETERMINED, 1000);

        DecisionReport report = undecided.check(List.of(atMost("A", "a", 1)), values(Map.of("a", Value.integer(0))));

        assertFalse(report.allSatisfied());
        assertEquals("A", report.violations().get(0).constraint_id());
        assertTrue(report.warnings().get(0).contains("could not be decided"));
    }

    @Test
    void timeoutIsUndetermined() {
        DecisionEngine slow = new DecisionEngine(new FormulaCompiler(), (f, b) -> {
            throw new DecisionTimeoutException(f.constraintId());
        }, 1000);

        DecisionReport report = slow.check(List.of(atMost("A", "a", 1)), values(Map.of("a", Value.integer(0))));

        assertEquals(Verdict.UNDETERMINED, report.outcomes().get(0).verdict());
        assertEquals(1, report.violations().size());
    }

    @Test
    void emptyConstraintListIsSatisfied() {
        DecisionReport report = engine.check(List.of(), values(Map.of()));
        assertTrue(report.allSatisfied());
        assertTrue(report.violations().isEmpty());
    }
}
