package io.gridmesh.authz;

import io.gridmesh.security.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record MethodPolicy(Set<Property> required, Combinator combinator) {
    private static final String AUTHENTICATED = "authenticated";
    private static final String ALL_PREFIX = "ALL:";

    public MethodPolicy {
        required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
        combinator = combinator == null ? Combinator.ANY : combinator;
    }

    public static MethodPolicy authenticated() {
        return new MethodPolicy(Set.of(), Combinator.ANY);
    }

    public static MethodPolicy anyOf(Property... properties) {
        return new MethodPolicy(new LinkedHashSet<>(List.of(properties)), Combinator.ANY);
    }

    public static MethodPolicy allOf(Property... properties) {
        return new MethodPolicy(new LinkedHashSet<>(List.of(properties)), Combinator.ALL);
    }

    /**
     * Reads the configuration form: a list of property names, optionally starting with
     * {@code ALL:}; the single token {@code authenticated} means identity only. Tokens that name
     * no property at all (a bare {@code ALL:}, blanks) are rejected with IllegalArgumentException.
     */
    public static MethodPolicy parse(List<String> tokens) {
        List<String> cleaned = new ArrayList<>();
        Combinator combinator = Combinator.ANY;
        for (String raw : tokens) {
            String token = raw == null ? "" : raw.trim();
            if (cleaned.isEmpty() && combinator == Combinator.ANY
                    && token.toUpperCase(Locale.ROOT).startsWith(ALL_PREFIX)) {
                combinator = Combinator.ALL;
                token = token.substring(ALL_PREFIX.length()).trim();
            }
            if (!token.isEmpty()) {
                cleaned.add(token);
            }
        }
        if (cleaned.size() == 1 && AUTHENTICATED.equalsIgnoreCase(cleaned.get(0))) {
            return authenticated();
        }
        cleaned.removeIf(AUTHENTICATED::equalsIgnoreCase);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("policy names no property: " + tokens);
        }
        return new MethodPolicy(Property.setOf(cleaned), combinator);
    }

    public boolean identityOnly() {
        return required.isEmpty();
    }

    public boolean admits(Set<Property> held) {
        if (required.isEmpty()) {
            return true;
        }
        if (combinator == Combinator.ALL) {
            return held.containsAll(required);
        }
        for (Property property : required) {
            if (held.contains(property)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (required.isEmpty()) {
            return AUTHENTICATED;
        }
        StringBuilder sb = new StringBuilder(combinator == Combinator.ALL ? ALL_PREFIX : "");
        boolean first = true;
        for (Property property : required) {
            if (!first) {
                sb.append(',');
            }
            sb.append(property.name());
            first = false;
        }
        return sb.toString();
    }
}
