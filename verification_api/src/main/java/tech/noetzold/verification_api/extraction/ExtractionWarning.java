package tech.noetzold.verification_api.extraction;

/**
 * Non-fatal extraction note. Always surfaced to the caller so that a pass never rests on an
 * unstated assumption.
 */
public record ExtractionWarning(String variable, String message) {

    @Override
    public String toString() {
        return message;
    }
}
