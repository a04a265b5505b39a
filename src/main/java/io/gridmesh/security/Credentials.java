package io.gridmesh.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public final class Credentials {
    private Credentials() {
    }

    public static Set<Property> properties(Credential credential, Map<String, ? extends Collection<Property>> groupToProperties) {
        return properties(credential.groups(), groupToProperties);
    }

    public static Set<Property> properties(Collection<String> groups, Map<String, ? extends Collection<Property>> groupToProperties) {
        LinkedHashSet<Property> granted = new LinkedHashSet<>();
        if (groups == null || groupToProperties == null) {
            return granted;
        }
        for (String group : groups) {
            Collection<Property> properties = groupToProperties.get(group);
            if (properties != null) {
                granted.addAll(properties);
            }
        }
        return granted;
    }
}
