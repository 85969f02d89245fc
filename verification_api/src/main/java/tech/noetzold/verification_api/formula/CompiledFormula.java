package tech.noetzold.verification_api.formula;

import java.util.List;

/**
 * @param symbols free variables left open in {@code root}, in first-occurrence order
 */
public record CompiledFormula(String constraintId, Term root, List<Term.Symbol> symbols) {

    public CompiledFormula {
        symbols = List.copyOf(symbols);
    }

    public boolean isGround() {
        return symbols.isEmpty();
    }
}
