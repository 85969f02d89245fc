package tech.noetzold.verification_api.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.Assignment;
import tech.noetzold.verification_api.model.Constraint;
import tech.noetzold.verification_api.model.ExtractionRule;
import tech.noetzold.verification_api.model.Ontology;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.Variable;
import tech.noetzold.verification_api.model.VariableKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds an {@link Assignment} from free text using the ontology's extraction rules, applied in
 * declaration order. A pure function of (text, ontology): the only state is a cache of compiled
 * patterns.
 */
@Slf4j
@Component
public class ExtractionEngine {

    private static final Pattern MAGNITUDE = Pattern.compile(
            "^\\s*(k|thousand|mm|m|million|bn|b|billion)\\b", Pattern.CASE_INSENSITIVE);

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public ExtractionResult extract(String text, Ontology ontology) {
        String source = text == null ? "" : text;
        String lower = source.toLowerCase(Locale.ROOT);

        Map<String, Value> values = new LinkedHashMap<>();
        Set<String> defaulted = new LinkedHashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        List<ExtractionWarning> warnings = new ArrayList<>();

        for (ExtractionRule rule : ontology.extractors().values()) {
            Optional<Value> found = apply(rule, source, lower, ontology.negationCues(), warnings);
            if (found.isPresent()) {
                values.put(rule.variable(), found.get());
            } else {
                fallback(rule.variable(), rule.kind(), rule.defaultValue(), values, defaulted, missing, warnings);
            }
        }

        // constraint variables nobody extracts still need a value to keep evaluation total
        for (Constraint c : ontology.constraints()) {
            for (Variable v : c.variables()) {
                if (!v.free() && !values.containsKey(v.name())) {
                    fallback(v.name(), v.kind(), null, values, defaulted, missing, warnings);
                }
            }
        }

        log.debug("Extracted {} variables ({} defaulted) for ontology {}", values.size(), defaulted.size(), ontology.name());
        return new ExtractionResult(new Assignment(values, defaulted, missing), warnings);
    }

    private Optional<Value> apply(ExtractionRule rule, String text, String lower,
                                  List<String> negationCues, List<ExtractionWarning> warnings) {
        if (rule instanceof ExtractionRule.PatternRule p) {
            return matchPattern(p, text, warnings);
        }
        if (rule instanceof ExtractionRule.KeywordRule k) {
            return Optional.of(Value.of(keywordPresent(k, lower, negationCues)));
        }
        if (rule instanceof ExtractionRule.PhraseRule ph) {
            for (String regex : ph.patterns()) {
                if (compiled(regex).matcher(text).find()) {
                    return Optional.of(Value.Bool.TRUE);
                }
            }
            return Optional.of(Value.Bool.FALSE);
        }
        throw new IllegalStateException("Unknown extraction rule " + rule);
    }

    private Optional<Value> matchPattern(ExtractionRule.PatternRule rule, String text, List<ExtractionWarning> warnings) {
        Matcher m = compiled(rule.pattern()).matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        if (rule.kind() == VariableKind.BOOLEAN) {
            return Optional.of(Value.Bool.TRUE);
        }
        boolean grouped = m.groupCount() >= 1 && m.group(1) != null;
        String captured = grouped ? m.group(1) : m.group();
        int capturedEnd = grouped ? m.end(1) : m.end();

        if (rule.kind() == VariableKind.STRING) {
            return Optional.of(new Value.Str(captured.trim()));
        }

        BigDecimal number;
        try {
            number = new BigDecimal(captured.replaceAll("[,$%\\s]", ""));
        } catch (NumberFormatException e) {
            warnings.add(new ExtractionWarning(rule.variable(),
                    "Could not read a number for '" + rule.variable() + "' from '" + captured.trim() + "'"));
            return Optional.empty();
        }
        if (rule.format() == ExtractionRule.NumberFormat.MONEY) {
            number = number.multiply(magnitude(text.substring(capturedEnd)));
        }
        if (rule.kind() == VariableKind.INTEGER) {
            BigDecimal stripped = number.stripTrailingZeros();
            if (stripped.scale() > 0) {
                warnings.add(new ExtractionWarning(rule.variable(),
                        "Value " + number.toPlainString() + " for '" + rule.variable() + "' is not a whole number"));
                return Optional.empty();
            }
            return Optional.of(new Value.Num(stripped, true));
        }
        return Optional.of(Value.real(number));
    }

    private BigDecimal magnitude(String after) {
        Matcher m = MAGNITUDE.matcher(after);
        if (!m.find()) return BigDecimal.ONE;
        return switch (m.group(1).toLowerCase(Locale.ROOT)) {
            case "k", "thousand" -> BigDecimal.valueOf(1_000L);
            case "m", "mm", "million" -> BigDecimal.valueOf(1_000_000L);
            default -> BigDecimal.valueOf(1_000_000_000L);
        };
    }

    /**
     * True when at least one keyword occurrence is not negated. An occurrence is negated when a
     * negation phrase appears in its sentence, other than wholly inside the keyword itself, so
     * "not guaranteed" negates "guaranteed" while the cue "no " does not negate "no fault".
     */
    boolean keywordPresent(ExtractionRule.KeywordRule rule, String lower, List<String> negationCues) {
        List<String> negations = new ArrayList<>();
        if (rule.checkNegation()) {
            negationCues.forEach(n -> negations.add(n.toLowerCase(Locale.ROOT)));
        }
        // rule-level negations are targeted phrases and always apply
        rule.negations().forEach(n -> negations.add(n.toLowerCase(Locale.ROOT)));
        for (String keyword : rule.keywords()) {
            String kw = keyword.toLowerCase(Locale.ROOT);
            if (kw.isEmpty()) continue;
            int from = 0;
            int idx;
            while ((idx = lower.indexOf(kw, from)) >= 0) {
                int end = idx + kw.length();
                if (negations.isEmpty() || !negated(lower, idx, end, negations)) {
                    return true;
                }
                log.debug("Keyword '{}' for {} negated at offset {}", kw, rule.variable(), idx);
                from = idx + 1;
            }
        }
        return false;
    }

    private static boolean negated(String lower, int start, int end, List<String> negations) {
        int sStart = sentenceStart(lower, start);
        int sEnd = Math.max(end, sentenceEnd(lower, end));
        for (String neg : negations) {
            if (neg.isEmpty()) continue;
            int at = lower.indexOf(neg, sStart);
            while (at >= 0 && at + neg.length() <= sEnd) {
                boolean insideKeyword = at >= start && at + neg.length() <= end;
                if (!insideKeyword) {
                    return true;
                }
                at = lower.indexOf(neg, at + 1);
            }
        }
        return false;
    }

    static int sentenceStart(String s, int pos) {
        for (int i = pos - 1; i >= 0; i--) {
            if (isBoundary(s, i)) return i + 1;
        }
        return 0;
    }

    static int sentenceEnd(String s, int pos) {
        for (int i = pos; i < s.length(); i++) {
            if (isBoundary(s, i)) return i;
        }
        return s.length();
    }

    private static boolean isBoundary(String s, int i) {
        char c = s.charAt(i);
        if (c == '!' || c == '?' || c == ';' || c == '\n') return true;
        // "55.5" is not a sentence end
        return c == '.' && (i + 1 >= s.length() || Character.isWhitespace(s.charAt(i + 1)));
    }

    private void fallback(String variable, VariableKind kind, Value defaultValue,
                          Map<String, Value> values, Set<String> defaulted, Set<String> missing,
                          List<ExtractionWarning> warnings) {
        defaulted.add(variable);
        if (defaultValue != null) {
            values.put(variable, defaultValue);
            warnings.add(new ExtractionWarning(variable,
                    "Variable '" + variable + "' not found in text; using ontology default " + defaultValue));
        } else {
            Value neutral = Value.neutral(kind);
            values.put(variable, neutral);
            missing.add(variable);
            warnings.add(new ExtractionWarning(variable,
                    "Variable '" + variable + "' not found in text; assumed " + neutral + " for evaluation"));
        }
    }

    private Pattern compiled(String regex) {
        return patterns.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }
}
