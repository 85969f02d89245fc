package tech.noetzold.verification_api.decision;

import tech.noetzold.verification_api.formula.Term;
import tech.noetzold.verification_api.model.Expr;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.VariableKind;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Map;

/**
 * Exact evaluation of a {@link Term} under bindings for its symbols. Division uses 34 significant
 * digits; division by zero raises {@link ArithmeticException}.
 */
final class TermEvaluator {

    private final Map<String, Value> symbols;

    TermEvaluator(Map<String, Value> symbols) {
        this.symbols = symbols;
    }

    boolean holds(Term term) {
        return ((Value.Bool) eval(term)).value();
    }

    Value eval(Term term) {
        if (term instanceof Term.Const c) {
            return c.value();
        }
        if (term instanceof Term.Symbol s) {
            Value v = symbols.get(s.name());
            if (v == null) {
                throw new IllegalStateException("Unbound symbol " + s.name());
            }
            return v;
        }
        if (term instanceof Term.Cmp cmp) {
            return Value.of(compare(cmp, eval(cmp.left()), eval(cmp.right())));
        }
        if (term instanceof Term.Logic logic) {
            return Value.of(logic(logic));
        }
        if (term instanceof Term.Cond cond) {
            return holds(cond.condition()) ? eval(cond.then()) : eval(cond.otherwise());
        }
        if (term instanceof Term.Arith ar) {
            return arith(ar);
        }
        throw new IllegalStateException("Unknown term " + term);
    }

    private boolean compare(Term.Cmp cmp, Value l, Value r) {
        if (l instanceof Value.Num ln && r instanceof Value.Num rn) {
            int c = ln.value().compareTo(rn.value());
            return switch (cmp.op()) {
                case LE -> c <= 0;
                case LT -> c < 0;
                case GE -> c >= 0;
                case GT -> c > 0;
                case EQ -> c == 0;
                case NE -> c != 0;
            };
        }
        boolean equal = l.raw().equals(r.raw());
        return switch (cmp.op()) {
            case EQ -> equal;
            case NE -> !equal;
            default -> throw new IllegalStateException("Ordering over " + l.kind().label());
        };
    }

    private boolean logic(Term.Logic logic) {
        List<Term> ops = logic.operands();
        return switch (logic.op()) {
            case AND -> ops.stream().allMatch(this::holds);
            case OR -> ops.stream().anyMatch(this::holds);
            case NOT -> !holds(ops.get(0));
            case IMPLIES -> !holds(ops.get(0)) || holds(ops.get(1));
        };
    }

    private Value arith(Term.Arith ar) {
        List<Term> ops = ar.operands();
        BigDecimal acc = number(ops.get(0));
        if (ar.op() == Expr.ArithOp.SUB && ops.size() == 1) {
            acc = acc.negate();
        }
        for (int i = 1; i < ops.size(); i++) {
            BigDecimal next = number(ops.get(i));
            acc = switch (ar.op()) {
                case ADD -> acc.add(next);
                case SUB -> acc.subtract(next);
                case MUL -> acc.multiply(next);
                case DIV -> acc.divide(next, MathContext.DECIMAL128);
                case MIN -> acc.min(next);
                case MAX -> acc.max(next);
            };
        }
        return new Value.Num(acc, ar.kind() == VariableKind.INTEGER);
    }

    private BigDecimal number(Term term) {
        return ((Value.Num) eval(term)).value();
    }
}
