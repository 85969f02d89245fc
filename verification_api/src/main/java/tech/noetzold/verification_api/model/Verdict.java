package tech.noetzold.verification_api.model;

public enum Verdict {
    SATISFIED,
    VIOLATED,
    // timed out, unresolved free variable, arithmetic fault or compile error
    UNDETERMINED
}
