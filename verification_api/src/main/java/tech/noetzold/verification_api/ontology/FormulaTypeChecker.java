package tech.noetzold.verification_api.ontology;

import tech.noetzold.verification_api.model.Expr;
import tech.noetzold.verification_api.model.Variable;
import tech.noetzold.verification_api.model.VariableKind;

import java.util.List;
import java.util.Map;

/**
 * Load-time kind inference over a formula tree. Any mismatch is reported against the owning
 * constraint.
 */
class FormulaTypeChecker {

    private final String constraintId;
    private final Map<String, Variable> scope;

    FormulaTypeChecker(String constraintId, Map<String, Variable> scope) {
        this.constraintId = constraintId;
        this.scope = scope;
    }

    void checkRoot(Expr formula) {
        VariableKind kind = infer(formula);
        if (kind != VariableKind.BOOLEAN) {
            throw fail("formula must be boolean but is " + kind.label());
        }
    }

    VariableKind infer(Expr expr) {
        if (expr instanceof Expr.Literal lit) {
            return lit.value().kind();
        }
        if (expr instanceof Expr.VarRef ref) {
            Variable v = scope.get(ref.name());
            if (v == null) {
                throw fail("references undeclared variable '" + ref.name() + "'");
            }
            return v.kind();
        }
        if (expr instanceof Expr.Compare cmp) {
            VariableKind l = infer(cmp.left());
            VariableKind r = infer(cmp.right());
            if (cmp.op().isOrdering()) {
                if (!l.isNumeric() || !r.isNumeric()) {
                    throw fail("'" + cmp.op().symbol() + "' needs numeric operands, got "
                            + l.label() + " and " + r.label());
                }
            } else if (!sameFamily(l, r)) {
                throw fail("'" + cmp.op().symbol() + "' compares " + l.label() + " with " + r.label());
            }
            return VariableKind.BOOLEAN;
        }
        if (expr instanceof Expr.Connective con) {
            checkArity(con.op().symbol(), con.operands(), switch (con.op()) {
                case AND, OR -> new int[]{1, Integer.MAX_VALUE};
                case NOT -> new int[]{1, 1};
                case IMPLIES -> new int[]{2, 2};
            });
            for (Expr operand : con.operands()) {
                VariableKind k = infer(operand);
                if (k != VariableKind.BOOLEAN) {
                    throw fail("'" + con.op().symbol() + "' operand must be boolean, got " + k.label());
                }
            }
            return VariableKind.BOOLEAN;
        }
        if (expr instanceof Expr.Ite ite) {
            VariableKind c = infer(ite.condition());
            if (c != VariableKind.BOOLEAN) {
                throw fail("'ite' condition must be boolean, got " + c.label());
            }
            VariableKind t = infer(ite.then());
            VariableKind e = infer(ite.otherwise());
            if (!sameFamily(t, e)) {
                throw fail("'ite' branches differ: " + t.label() + " and " + e.label());
            }
            return t.isNumeric() ? widen(t, e) : t;
        }
        if (expr instanceof Expr.Arith ar) {
            checkArity(ar.op().symbol(), ar.operands(), switch (ar.op()) {
                case ADD, MUL, MIN, MAX -> new int[]{2, Integer.MAX_VALUE};
                case SUB -> new int[]{1, 2};
                case DIV -> new int[]{2, 2};
            });
            VariableKind result = VariableKind.INTEGER;
            for (Expr operand : ar.operands()) {
                VariableKind k = infer(operand);
                if (!k.isNumeric()) {
                    throw fail("'" + ar.op().symbol() + "' operand must be numeric, got " + k.label());
                }
                result = widen(result, k);
            }
            return ar.op() == Expr.ArithOp.DIV ? VariableKind.REAL : result;
        }
        throw fail("unsupported expression node " + expr);
    }

    private void checkArity(String op, List<Expr> operands, int[] bounds) {
        int n = operands.size();
        if (n < bounds[0] || n > bounds[1]) {
            throw fail("'" + op + "' takes " + (bounds[0] == bounds[1] ? String.valueOf(bounds[0])
                    : bounds[1] == Integer.MAX_VALUE ? "at least " + bounds[0] : bounds[0] + " to " + bounds[1])
                    + " operand(s), got " + n);
        }
    }

    private static boolean sameFamily(VariableKind a, VariableKind b) {
        return a == b || (a.isNumeric() && b.isNumeric());
    }

    private static VariableKind widen(VariableKind a, VariableKind b) {
        return (a == VariableKind.REAL || b == VariableKind.REAL) ? VariableKind.REAL : VariableKind.INTEGER;
    }

    private OntologyLoadException fail(String message) {
        return OntologyLoadException.invalid(constraintId, message);
    }
}
