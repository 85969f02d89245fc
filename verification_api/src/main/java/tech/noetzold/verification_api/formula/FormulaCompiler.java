package tech.noetzold.verification_api.formula;

import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.Assignment;
import tech.noetzold.verification_api.model.Constraint;
import tech.noetzold.verification_api.model.Expr;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.Variable;
import tech.noetzold.verification_api.model.VariableKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural recursion from {@link Expr} to {@link Term}. Never evaluates anything; it binds
 * values and re-checks kinds, since an assignment may not match what the loader validated.
 */
@Component
public class FormulaCompiler {

    public CompiledFormula compile(Constraint constraint, Assignment assignment) {
        Map<String, Term.Symbol> symbols = new LinkedHashMap<>();
        Term root = new Pass(constraint, assignment, symbols).compile(constraint.formula());
        if (root.kind() != VariableKind.BOOLEAN) {
            throw new FormulaCompileException(constraint.id(), "formula evaluates to " + root.kind().label() + ", not boolean");
        }
        return new CompiledFormula(constraint.id(), root, new ArrayList<>(symbols.values()));
    }

    private static final class Pass {
        private final Constraint constraint;
        private final Assignment assignment;
        private final Map<String, Term.Symbol> symbols;

        Pass(Constraint constraint, Assignment assignment, Map<String, Term.Symbol> symbols) {
            this.constraint = constraint;
            this.assignment = assignment;
            this.symbols = symbols;
        }

        Term compile(Expr expr) {
            if (expr instanceof Expr.Literal lit) {
                return new Term.Const(lit.value());
            }
            if (expr instanceof Expr.VarRef ref) {
                return variable(ref.name());
            }
            if (expr instanceof Expr.Compare cmp) {
                Term l = compile(cmp.left());
                Term r = compile(cmp.right());
                boolean ok = cmp.op().isOrdering()
                        ? l.kind().isNumeric() && r.kind().isNumeric()
                        : sameFamily(l.kind(), r.kind());
                if (!ok) {
                    throw fail("cannot apply '" + cmp.op().symbol() + "' to " + l.kind().label() + " and " + r.kind().label());
                }
                return new Term.Cmp(cmp.op(), l, r);
            }
            if (expr instanceof Expr.Connective con) {
                List<Term> operands = compileAll(con.operands());
                int n = operands.size();
                boolean arityOk = switch (con.op()) {
                    case AND, OR -> n >= 1;
                    case NOT -> n == 1;
                    case IMPLIES -> n == 2;
                };
                if (!arityOk) {
                    throw fail("'" + con.op().symbol() + "' with " + n + " operand(s)");
                }
                for (Term t : operands) {
                    if (t.kind() != VariableKind.BOOLEAN) {
                        throw fail("'" + con.op().symbol() + "' over " + t.kind().label() + " operand");
                    }
                }
                return new Term.Logic(con.op(), operands);
            }
            if (expr instanceof Expr.Ite ite) {
                Term c = compile(ite.condition());
                Term t = compile(ite.then());
                Term e = compile(ite.otherwise());
                if (c.kind() != VariableKind.BOOLEAN || !sameFamily(t.kind(), e.kind())) {
                    throw fail("ill-typed 'ite' (" + c.kind().label() + ", " + t.kind().label() + ", " + e.kind().label() + ")");
                }
                VariableKind kind = t.kind().isNumeric() ? widen(t.kind(), e.kind()) : t.kind();
                return new Term.Cond(c, t, e, kind);
            }
            if (expr instanceof Expr.Arith ar) {
                List<Term> operands = compileAll(ar.operands());
                if (operands.isEmpty() || (ar.op() == Expr.ArithOp.DIV && operands.size() != 2)) {
                    throw fail("'" + ar.op().symbol() + "' with " + operands.size() + " operand(s)");
                }
                VariableKind kind = VariableKind.INTEGER;
                for (Term t : operands) {
                    if (!t.kind().isNumeric()) {
                        throw fail("'" + ar.op().symbol() + "' over " + t.kind().label() + " operand");
                    }
                    kind = widen(kind, t.kind());
                }
                return new Term.Arith(ar.op(), operands, ar.op() == Expr.ArithOp.DIV ? VariableKind.REAL : kind);
            }
            throw fail("unsupported expression " + expr);
        }

        private Term variable(String name) {
            Variable declared = constraint.variable(name)
                    .orElseThrow(() -> fail("undeclared variable '" + name + "'"));
            if (declared.free()) {
                return symbols.computeIfAbsent(name, n -> new Term.Symbol(n, declared.kind()));
            }
            Value value = assignment.get(name);
            if (value == null) {
                throw fail("no value bound for '" + name + "'");
            }
            if (!sameFamily(value.kind(), declared.kind())) {
                throw fail("'" + name + "' is declared " + declared.kind().label() + " but bound to " + value.kind().label());
            }
            return new Term.Const(value);
        }

        private List<Term> compileAll(List<Expr> exprs) {
            List<Term> out = new ArrayList<>(exprs.size());
            for (Expr e : exprs) {
                out.add(compile(e));
            }
            return out;
        }

        private FormulaCompileException fail(String message) {
            return new FormulaCompileException(constraint.id(), message);
        }
    }

    private static boolean sameFamily(VariableKind a, VariableKind b) {
        return a == b || (a.isNumeric() && b.isNumeric());
    }

    private static VariableKind widen(VariableKind a, VariableKind b) {
        return (a == VariableKind.REAL || b == VariableKind.REAL) ? VariableKind.REAL : VariableKind.INTEGER;
    }
}
