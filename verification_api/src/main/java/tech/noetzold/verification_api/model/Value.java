package tech.noetzold.verification_api.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A concrete typed value bound to a variable or produced by evaluation.
 */
public sealed interface Value permits Value.Num, Value.Bool, Value.Str {

    VariableKind kind();

    /** Plain Java representation used for JSON output. */
    Object raw();

    static Value neutral(VariableKind kind) {
        return switch (kind) {
            case REAL -> new Num(BigDecimal.ZERO, false);
            case INTEGER -> new Num(BigDecimal.ZERO, true);
            case BOOLEAN -> Bool.FALSE;
            case STRING -> new Str("");
        };
    }

    static Num integer(long v) {
        return new Num(BigDecimal.valueOf(v), true);
    }

    static Num real(BigDecimal v) {
        return new Num(v, false);
    }

    static Bool of(boolean b) {
        return b ? Bool.TRUE : Bool.FALSE;
    }

    record Num(BigDecimal value, boolean integral) implements Value {
        public Num {
            Objects.requireNonNull(value, "value");
            // scale-insensitive equality: 55 and 55.0 are the same number
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        @Override
        public VariableKind kind() {
            return integral ? VariableKind.INTEGER : VariableKind.REAL;
        }

        @Override
        public Object raw() {
            if (integral || value.scale() <= 0) {
                try {
                    return value.longValueExact();
                } catch (ArithmeticException e) {
                    return value;
                }
            }
            return value;
        }

        @Override
        public String toString() {
            return value.toPlainString();
        }
    }

    record Bool(boolean value) implements Value {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override
        public VariableKind kind() {
            return VariableKind.BOOLEAN;
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public VariableKind kind() {
            return VariableKind.STRING;
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
}
