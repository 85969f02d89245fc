package tech.noetzold.verification_api.ontology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.Constraint;
import tech.noetzold.verification_api.model.Expr;
import tech.noetzold.verification_api.model.ExtractionRule;
import tech.noetzold.verification_api.model.Ontology;
import tech.noetzold.verification_api.model.Value;
import tech.noetzold.verification_api.model.Variable;
import tech.noetzold.verification_api.model.VariableKind;
import tech.noetzold.verification_api.util.CanonicalJson;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a JSON rule document into a validated {@link Ontology}. Stops at the first structural or
 * type error. Does not touch its input and holds no state between calls.
 */
@Component
public class OntologyParser {

    private final ObjectMapper objectMapper;

    public OntologyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Ontology parse(String document) {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw OntologyLoadException.invalid(null, "document is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw OntologyLoadException.invalid(null, "document must be a JSON object");
        }

        String name = requiredText(root, "name", null);
        String version = requiredText(root, "version", null);
        String description = root.path("description").asText("");
        List<String> negationCues = stringList(root.get("negation_cues"), "negation_cues", null);

        JsonNode constraintsNode = root.get("constraints");
        if (constraintsNode == null || !constraintsNode.isArray()) {
            throw OntologyLoadException.invalid(null, "'constraints' must be an array");
        }

        List<Constraint> constraints = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        Map<String, VariableKind> kinds = new HashMap<>();
        for (JsonNode node : constraintsNode) {
            Constraint c = parseConstraint(node, kinds);
            if (!ids.add(c.id())) {
                throw OntologyLoadException.invalid(c.id(), "duplicate constraint id");
            }
            constraints.add(c);
        }

        Map<String, ExtractionRule> extractors = new LinkedHashMap<>();
        JsonNode extractorsNode = root.get("extractors");
        if (extractorsNode != null && !extractorsNode.isNull()) {
            if (!extractorsNode.isObject()) {
                throw OntologyLoadException.invalid(null, "'extractors' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = extractorsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                ExtractionRule rule = parseExtractor(e.getKey(), e.getValue());
                VariableKind declared = kinds.get(rule.variable());
                if (declared != null && declared != rule.kind()) {
                    throw OntologyLoadException.invalid(null, "extractor '" + rule.variable() + "' yields "
                            + rule.kind().label() + " but constraints declare it " + declared.label());
                }
                extractors.put(rule.variable(), rule);
            }
        }

        return new Ontology(name, version, description, CanonicalJson.digest(root),
                constraints, extractors, negationCues);
    }

    private Constraint parseConstraint(JsonNode node, Map<String, VariableKind> kinds) {
        if (!node.isObject()) {
            throw OntologyLoadException.invalid(null, "every constraint must be a JSON object");
        }
        String id = requiredText(node, "id", null);
        String description = requiredText(node, "description", id);

        JsonNode varsNode = node.get("variables");
        if (varsNode == null || !varsNode.isArray()) {
            throw OntologyLoadException.invalid(id, "'variables' must be an array");
        }
        Map<String, Variable> scope = new LinkedHashMap<>();
        for (JsonNode v : varsNode) {
            String varName = requiredText(v, "name", id);
            String rawKind = requiredText(v, "type", id);
            VariableKind kind = VariableKind.parse(rawKind)
                    .orElseThrow(() -> OntologyLoadException.invalid(id, "variable '" + varName
                            + "' has unknown type '" + rawKind + "'"));
            if (scope.containsKey(varName)) {
                throw OntologyLoadException.invalid(id, "variable '" + varName + "' declared twice");
            }
            VariableKind previous = kinds.putIfAbsent(varName, kind);
            if (previous != null && previous != kind) {
                throw OntologyLoadException.invalid(id, "variable '" + varName + "' is " + kind.label()
                        + " here but " + previous.label() + " elsewhere");
            }
            scope.put(varName, new Variable(varName, kind, v.path("free").asBoolean(false)));
        }

        JsonNode formulaNode = node.get("formula");
        if (formulaNode == null || formulaNode.isNull()) {
            throw OntologyLoadException.invalid(id, "missing 'formula'");
        }
        Expr formula = parseExpr(formulaNode, id);
        new FormulaTypeChecker(id, scope).checkRoot(formula);

        return new Constraint(
                id,
                node.path("category").asText("General"),
                description,
                List.copyOf(scope.values()),
                formula,
                node.path("severity").asText("error"),
                node.path("error_message").asText("Constraint violated"),
                node.path("citation").asText("")
        );
    }

    Expr parseExpr(JsonNode node, String constraintId) {
        if (node.isNumber()) {
            return new Expr.Literal(new Value.Num(node.decimalValue(), node.isIntegralNumber()));
        }
        if (node.isBoolean()) {
            return new Expr.Literal(Value.of(node.booleanValue()));
        }
        if (node.isTextual()) {
            return new Expr.Literal(new Value.Str(node.textValue()));
        }
        if (!node.isObject() || node.size() != 1) {
            throw OntologyLoadException.invalid(constraintId, "expression node must be a literal or a single-key object: " + node);
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String op = entry.getKey();
        JsonNode arg = entry.getValue();

        if ("var".equals(op)) {
            if (!arg.isTextual() || arg.textValue().isBlank()) {
                throw OntologyLoadException.invalid(constraintId, "'var' needs a variable name");
            }
            return new Expr.VarRef(arg.textValue());
        }

        List<Expr> operands = new ArrayList<>();
        if (arg.isArray()) {
            for (JsonNode child : arg) {
                operands.add(parseExpr(child, constraintId));
            }
        } else {
            operands.add(parseExpr(arg, constraintId));
        }

        Expr.CompareOp cmp = Expr.CompareOp.fromSymbol(op);
        if (cmp != null) {
            if (operands.size() != 2) {
                throw OntologyLoadException.invalid(constraintId, "'" + op + "' takes 2 operands, got " + operands.size());
            }
            return new Expr.Compare(cmp, operands.get(0), operands.get(1));
        }
        Expr.BoolOp bool = Expr.BoolOp.fromSymbol(op);
        if (bool != null) {
            return new Expr.Connective(bool, operands);
        }
        Expr.ArithOp arith = Expr.ArithOp.fromSymbol(op);
        if (arith != null) {
            return new Expr.Arith(arith, operands);
        }
        if ("ite".equals(op)) {
            if (operands.size() != 3) {
                throw OntologyLoadException.invalid(constraintId, "'ite' takes 3 operands, got " + operands.size());
            }
            return new Expr.Ite(operands.get(0), operands.get(1), operands.get(2));
        }
        throw OntologyLoadException.invalid(constraintId, "unknown operator '" + op + "'");
    }

    private ExtractionRule parseExtractor(String variable, JsonNode node) {
        String where = "extractor '" + variable + "'";
        if (!node.isObject()) {
            throw OntologyLoadException.invalid(null, where + " must be an object");
        }
        String rawKind = node.path("type").asText(null);
        VariableKind kind = VariableKind.parse(rawKind)
                .orElseThrow(() -> OntologyLoadException.invalid(null, where + " has unknown type '" + rawKind + "'"));
        Value defaultValue = parseDefault(node.get("default"), kind, where);
        String strategy = node.path("kind").asText(node.has("keywords") ? "keyword" : "pattern")
                .toLowerCase(Locale.ROOT);

        return switch (strategy) {
            case "pattern" -> {
                String pattern = node.path("pattern").asText(null);
                if (pattern == null || pattern.isBlank()) {
                    throw OntologyLoadException.invalid(null, where + " needs a 'pattern'");
                }
                checkRegex(pattern, where);
                ExtractionRule.NumberFormat format = switch (node.path("format").asText("plain").toLowerCase(Locale.ROOT)) {
                    case "money" -> ExtractionRule.NumberFormat.MONEY;
                    case "percentage", "percent" -> ExtractionRule.NumberFormat.PERCENTAGE;
                    case "plain" -> ExtractionRule.NumberFormat.PLAIN;
                    default -> throw OntologyLoadException.invalid(null, where + " has unknown format '"
                            + node.path("format").asText() + "'");
                };
                yield new ExtractionRule.PatternRule(variable, kind, pattern, format, defaultValue);
            }
            case "keyword" -> {
                requireBoolean(kind, where);
                List<String> keywords = stringList(node.get("keywords"), where + " keywords", null);
                if (keywords.isEmpty()) {
                    throw OntologyLoadException.invalid(null, where + " needs at least one keyword");
                }
                List<String> negations = stringList(node.has("negations") ? node.get("negations")
                        : node.get("negation_words"), where + " negations", null);
                yield new ExtractionRule.KeywordRule(variable, kind, keywords, negations,
                        node.path("check_negation").asBoolean(true), defaultValue);
            }
            case "phrase" -> {
                requireBoolean(kind, where);
                List<String> patterns = stringList(node.get("patterns"), where + " patterns", null);
                if (patterns.isEmpty()) {
                    throw OntologyLoadException.invalid(null, where + " needs at least one pattern");
                }
                patterns.forEach(p -> checkRegex(p, where));
                yield new ExtractionRule.PhraseRule(variable, kind, patterns, defaultValue);
            }
            default -> throw OntologyLoadException.invalid(null, where + " has unknown kind '" + strategy + "'");
        };
    }

    private Value parseDefault(JsonNode node, VariableKind kind, String where) {
        if (node == null || node.isNull()) return null;
        boolean ok = switch (kind) {
            case REAL -> node.isNumber();
            case INTEGER -> node.isIntegralNumber();
            case BOOLEAN -> node.isBoolean();
            case STRING -> node.isTextual();
        };
        if (!ok) {
            throw OntologyLoadException.invalid(null, where + " default " + node + " is not a " + kind.label());
        }
        return switch (kind) {
            case REAL -> Value.real(node.decimalValue());
            case INTEGER -> new Value.Num(node.decimalValue(), true);
            case BOOLEAN -> Value.of(node.booleanValue());
            case STRING -> new Value.Str(node.textValue());
        };
    }

    private void requireBoolean(VariableKind kind, String where) {
        if (kind != VariableKind.BOOLEAN) {
            throw OntologyLoadException.invalid(null, where + " is a presence test and must be boolean");
        }
    }

    private void checkRegex(String pattern, String where) {
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw OntologyLoadException.invalid(null, where + " has an invalid pattern: " + e.getDescription());
        }
    }

    private String requiredText(JsonNode node, String field, String constraintId) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw OntologyLoadException.invalid(constraintId, "missing required field '" + field + "'");
        }
        return value.asText();
    }

    private List<String> stringList(JsonNode node, String what, String constraintId) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (!node.isArray()) {
            throw OntologyLoadException.invalid(constraintId, "'" + what + "' must be an array of strings");
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw OntologyLoadException.invalid(constraintId, "'" + what + "' must be an array of strings");
            }
            out.add(item.textValue());
        }
        return out;
    }
}
