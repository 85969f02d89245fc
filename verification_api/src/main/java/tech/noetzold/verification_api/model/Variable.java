package tech.noetzold.verification_api.model;

/**
 * A typed variable declared in a constraint's variable list. Free variables are never bound
 * by extraction and are decided existentially.
 */
public record Variable(String name, VariableKind kind, boolean free) {
}
