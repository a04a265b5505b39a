package io.gridmesh.security;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public record Property(String name) {
    public static final Property NORMAL_USER = new Property("NormalUser");
    public static final Property GENERIC_PILOT = new Property("GenericPilot");
    public static final Property JOB_ADMINISTRATOR = new Property("JobAdministrator");
    public static final Property OPERATOR = new Property("Operator");

    public Property {
        Objects.requireNonNull(name, "name");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("property name is empty");
        }
    }

    public static Set<Property> setOf(Iterable<String> names) {
        LinkedHashSet<Property> out = new LinkedHashSet<>();
        if (names == null) {
            return out;
        }
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                out.add(new Property(name));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return name;
    }
}
