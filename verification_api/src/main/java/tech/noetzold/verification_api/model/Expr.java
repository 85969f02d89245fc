package tech.noetzold.verification_api.model;

import java.util.List;

/**
 * Declarative expression tree of a constraint formula, as written in the ontology document.
 */
public sealed interface Expr
        permits Expr.Literal, Expr.VarRef, Expr.Compare, Expr.Connective, Expr.Ite, Expr.Arith {

    record Literal(Value value) implements Expr {}

    record VarRef(String name) implements Expr {}

    record Compare(CompareOp op, Expr left, Expr right) implements Expr {}

    record Connective(BoolOp op, List<Expr> operands) implements Expr {
        public Connective {
            operands = List.copyOf(operands);
        }
    }

    record Ite(Expr condition, Expr then, Expr otherwise) implements Expr {}

    record Arith(ArithOp op, List<Expr> operands) implements Expr {
        public Arith {
            operands = List.copyOf(operands);
        }
    }

    enum CompareOp {
        LE("<="), LT("<"), GE(">="), GT(">"), EQ("=="), NE("!=");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isOrdering() {
            return this != EQ && this != NE;
        }

        public static CompareOp fromSymbol(String s) {
            for (CompareOp op : values()) {
                if (op.symbol.equals(s)) return op;
            }
            return null;
        }
    }

    enum BoolOp {
        AND("and"), OR("or"), NOT("not"), IMPLIES("implies");

        private final String symbol;

        BoolOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static BoolOp fromSymbol(String s) {
            for (BoolOp op : values()) {
                if (op.symbol.equals(s)) return op;
            }
            return null;
        }
    }

    enum ArithOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MIN("min"), MAX("max");

        private final String symbol;

        ArithOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static ArithOp fromSymbol(String s) {
            for (ArithOp op : values()) {
                if (op.symbol.equals(s)) return op;
            }
            return null;
        }
    }
}
