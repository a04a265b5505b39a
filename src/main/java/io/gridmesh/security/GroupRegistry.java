package io.gridmesh.security;

import io.gridmesh.config.ConfigurationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.security.auth.x500.X500Principal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class GroupRegistry {
    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final ConfigurationSource config;

    public GroupRegistry(ConfigurationSource config) {
        this.config = config;
    }

    public Optional<String> userForSubject(String subjectDn) {
        X500Principal wanted = principal(subjectDn);
        if (wanted == null) {
            return Optional.empty();
        }
        for (String user : config.children("/Registry/Users")) {
            for (String dn : config.getList("/Registry/Users/" + user + "/DN")) {
                if (wanted.equals(principal(dn))) {
                    return Optional.of(user);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> groupsOf(String user) {
        List<String> groups = new ArrayList<>();
        for (String group : config.children("/Registry/Groups")) {
            if (config.getList("/Registry/Groups/" + group + "/Users").contains(user)) {
                groups.add(group);
            }
        }
        return groups;
    }

    public Map<String, Set<Property>> groupProperties() {
        Map<String, Set<Property>> out = new LinkedHashMap<>();
        for (String group : config.children("/Registry/Groups")) {
            out.put(group, Property.setOf(config.getList("/Registry/Groups/" + group + "/Properties")));
        }
        return out;
    }

    /**
     * Groups requested by the chain are honoured only where the user belongs to them; a chain
     * requesting nothing acts with all of the user's groups. An unregistered subject keeps its
     * identity with no groups and no properties.
     */
    public Credential resolve(Credential credential) {
        Optional<String> user = userForSubject(credential.subject());
        if (user.isEmpty()) {
            log.debug("Subject {} is not registered", credential.subject());
            return credential.withGroupsAndProperties(List.of(), Set.of());
        }
        List<String> memberOf = groupsOf(user.get());
        List<String> effective;
        if (credential.groups().isEmpty()) {
            effective = memberOf;
        } else {
            LinkedHashSet<String> granted = new LinkedHashSet<>(credential.groups());
            granted.retainAll(memberOf);
            if (granted.size() < credential.groups().size()) {
                log.warn("Subject {} requested groups {} but belongs to {}", credential.subject(), credential.groups(), memberOf);
            }
            effective = new ArrayList<>(granted);
        }
        return credential.withGroupsAndProperties(effective, Credentials.properties(effective, groupProperties()));
    }

    // Accepts RFC 2253 names and the slash form "/O=GridMesh/OU=Users/CN=alice".
    static X500Principal principal(String dn) {
        if (dn == null || dn.isBlank()) {
            return null;
        }
        String value = dn.trim();
        if (value.startsWith("/")) {
            List<String> parts = new ArrayList<>();
            for (String part : value.substring(1).split("/")) {
                if (!part.isBlank()) {
                    parts.add(0, part.trim());
                }
            }
            value = String.join(",", parts);
        }
        try {
            return new X500Principal(value);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unparseable DN '{}': {}", dn, e.getMessage());
            return null;
        }
    }
}
