package tech.noetzold.verification_api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Values for every bound variable. {@code defaulted} lists the variables not found in the text;
 * {@code missing} is the subset that had no ontology default and got a neutral value.
 */
public record Assignment(Map<String, Value> values, Set<String> defaulted, Set<String> missing) {

    public Assignment {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        defaulted = Collections.unmodifiableSet(new LinkedHashSet<>(defaulted));
        missing = Collections.unmodifiableSet(new LinkedHashSet<>(missing));
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    public Value get(String name) {
        return values.get(name);
    }

    public Map<String, Object> toRawMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.raw()));
        return out;
    }
}
