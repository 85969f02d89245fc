package tech.noetzold.verification_api.decision;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.formula.CompiledFormula;
import tech.noetzold.verification_api.formula.Term;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.VariableKind;
import tech.noetzold.verification_api.model.Verdict;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Default decision procedure. Ground formulas are evaluated directly. Formulas with free symbols
 * get a bounded existential search over candidate values taken from the formula's own constants:
 * a witness proves satisfaction, but an exhausted search proves nothing and yields
 * {@link Verdict#UNDETERMINED}.
 */
@Slf4j
@Component
public class GroundEvaluationProcedure implements DecisionProcedure {

    static final int MAX_CANDIDATES = 10_000;
    private static final BigDecimal HALF = new BigDecimal("0.5");

    @Override
    public Verdict decide(CompiledFormula formula, TimeBudget budget) {
        if (formula.isGround()) {
            try {
                return new TermEvaluator(Map.of()).holds(formula.root()) ? Verdict.SATISFIED : Verdict.VIOLATED;
            } catch (ArithmeticException e) {
                log.warn("Arithmetic fault in constraint {}: {}", formula.constraintId(), e.getMessage());
                return Verdict.UNDETERMINED;
            }
        }
        return searchWitness(formula, budget);
    }

    private Verdict searchWitness(CompiledFormula formula, TimeBudget budget) {
        List<Term.Symbol> symbols = formula.symbols();
        List<List<Value>> domains = new ArrayList<>();
        long combinations = 1;
        for (Term.Symbol s : symbols) {
            List<Value> domain = candidates(s.kind(), formula.root());
            domains.add(domain);
            combinations *= domain.size();
            if (combinations > MAX_CANDIDATES) {
                log.info("Constraint {} has too many candidate bindings; left undetermined", formula.constraintId());
                return Verdict.UNDETERMINED;
            }
        }

        int[] cursor = new int[symbols.size()];
        Map<String, Value> binding = new HashMap<>();
        TermEvaluator evaluator = new TermEvaluator(binding);
        for (long step = 0; step < combinations; step++) {
            if (budget.exhausted()) {
                throw new DecisionTimeoutException(formula.constraintId());
            }
            for (int i = 0; i < symbols.size(); i++) {
                binding.put(symbols.get(i).name(), domains.get(i).get(cursor[i]));
            }
            try {
                if (evaluator.holds(formula.root())) {
                    log.debug("Constraint {} satisfied by witness {}", formula.constraintId(), binding);
                    return Verdict.SATISFIED;
                }
            } catch (ArithmeticException e) {
                log.trace("Candidate {} faults in constraint {}: {}", binding, formula.constraintId(), e.getMessage());
            }
            advance(cursor, domains);
        }
        return Verdict.UNDETERMINED;
    }

    private static void advance(int[] cursor, List<List<Value>> domains) {
        for (int i = cursor.length - 1; i >= 0; i--) {
            if (++cursor[i] < domains.get(i).size()) return;
            cursor[i] = 0;
        }
    }

    private List<Value> candidates(VariableKind kind, Term root) {
        if (kind == VariableKind.BOOLEAN) {
            return List.of(Value.Bool.FALSE, Value.Bool.TRUE);
        }
        Set<Value> out = new LinkedHashSet<>();
        if (kind == VariableKind.STRING) {
            out.add(new Value.Str(""));
            collect(root, c -> {
                if (c instanceof Value.Str) out.add(c);
            });
            return new ArrayList<>(out);
        }
        boolean integral = kind == VariableKind.INTEGER;
        out.add(new Value.Num(BigDecimal.ZERO, integral));
        collect(root, c -> {
            if (c instanceof Value.Num n) {
                for (BigDecimal offset : List.of(BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ONE.negate(), HALF, HALF.negate())) {
                    BigDecimal v = n.value().add(offset);
                    if (!integral || v.stripTrailingZeros().scale() <= 0) {
                        out.add(new Value.Num(v, integral));
                    }
                }
            }
        });
        return new ArrayList<>(out);
    }

    private static void collect(Term term, Consumer<Value> sink) {
        if (term instanceof Term.Const c) {
            sink.accept(c.value());
        } else if (term instanceof Term.Cmp cmp) {
            collect(cmp.left(), sink);
            collect(cmp.right(), sink);
        } else if (term instanceof Term.Logic logic) {
            logic.operands().forEach(t -> collect(t, sink));
        } else if (term instanceof Term.Cond cond) {
            collect(cond.condition(), sink);
            collect(cond.then(), sink);
            collect(cond.otherwise(), sink);
        } else if (term instanceof Term.Arith ar) {
            ar.operands().forEach(t -> collect(t, sink));
        }
    }
}
