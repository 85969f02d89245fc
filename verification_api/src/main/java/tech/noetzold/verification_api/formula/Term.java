package tech.noetzold.verification_api.formula;

import tech.noetzold.verification_api.model.Expr;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.VariableKind;

import java.util.List;

/**
 * Solver-ready proposition: the constraint's expression tree with bound variables replaced by
 * constants and free variables left as symbols. Every node knows its kind.
 */
public sealed interface Term permits Term.Const, Term.Symbol, Term.Cmp, Term.Logic, Term.Cond, Term.Arith {

    VariableKind kind();

    record Const(Value value) implements Term {
        @Override
        public VariableKind kind() {
            return value.kind();
        }
    }

    record Symbol(String name, VariableKind kind) implements Term {}

    record Cmp(Expr.CompareOp op, Term left, Term right) implements Term {
        @Override
        public VariableKind kind() {
            return VariableKind.BOOLEAN;
        }
    }

    record Logic(Expr.BoolOp op, List<Term> operands) implements Term {
        public Logic {
            operands = List.copyOf(operands);
        }

        @Override
        public VariableKind kind() {
            return VariableKind.BOOLEAN;
        }
    }

    record Cond(Term condition, Term then, Term otherwise, VariableKind kind) implements Term {}

    record Arith(Expr.ArithOp op, List<Term> operands, VariableKind kind) implements Term {
        public Arith {
            operands = List.copyOf(operands);
        }
    }
}
