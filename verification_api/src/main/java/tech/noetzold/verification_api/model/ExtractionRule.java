package tech.noetzold.verification_api.model;

import java.util.List;

/**
 * How one variable is pulled out of free text. Keyword lists, patterns and negation phrases
 * are ontology data; the extraction engine only knows these three strategies.
 */
public sealed interface ExtractionRule
        permits ExtractionRule.PatternRule, ExtractionRule.KeywordRule, ExtractionRule.PhraseRule {

    String variable();

    VariableKind kind();

    /** Ontology supplied fallback, or {@code null}. */
    Value defaultValue();

    enum NumberFormat { PLAIN, MONEY, PERCENTAGE }

    record PatternRule(String variable,
                       VariableKind kind,
                       String pattern,
                       NumberFormat format,
                       Value defaultValue) implements ExtractionRule {}

    record KeywordRule(String variable,
                       VariableKind kind,
                       List<String> keywords,
                       List<String> negations,
                       boolean checkNegation,
                       Value defaultValue) implements ExtractionRule {
        public KeywordRule {
            keywords = List.copyOf(keywords);
            negations = List.copyOf(negations);
        }
    }

    record PhraseRule(String variable,
                      VariableKind kind,
                      List<String> patterns,
                      Value defaultValue) implements ExtractionRule {
        public PhraseRule {
            patterns = List.copyOf(patterns);
        }
    }
}
