package io.gridmesh.security;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A delegated identity as presented on one connection.
 *
 * <p>{@code links} are leaf first: the delegated proxy (if any) comes before the end-entity
 * certificate that signed it. {@code subject} is the end-entity name, so a proxy and the
 * certificate it was derived from identify the same user. Instances are immutable; the
 * group/property resolution step returns a new instance.
 */
public record Credential(
        String subject,
        List<DelegationLink> links,
        List<String> groups,
        Set<Property> properties,
        Instant expiresAt
) {
    public Credential {
        links = List.copyOf(links);
        groups = List.copyOf(groups);
        properties = Collections.unmodifiableSet(new LinkedHashSet<>(properties));
    }

    public static Credential fromLinks(List<DelegationLink> links) {
        if (links == null || links.isEmpty()) {
            throw new IllegalArgumentException("credential needs at least one link");
        }
        Instant expiry = Instant.MAX;
        LinkedHashSet<String> requestedGroups = new LinkedHashSet<>();
        for (DelegationLink link : links) {
            if (link.notAfter().isBefore(expiry)) {
                expiry = link.notAfter();
            }
            link.groupAttribute().ifPresent(requestedGroups::add);
        }
        return new Credential(identityLink(links).subject(), links, List.copyOf(requestedGroups), Set.of(), expiry);
    }

    // The end entity is the last link that is not a self-signed root sent along with the chain.
    private static DelegationLink identityLink(List<DelegationLink> links) {
        for (int i = links.size() - 1; i >= 0; i--) {
            DelegationLink link = links.get(i);
            if (!link.selfIssued()) {
                return link;
            }
        }
        return links.get(0);
    }

    public DelegationLink leaf() {
        return links.get(0);
    }

    public String primaryGroup() {
        return groups.isEmpty() ? null : groups.get(0);
    }

    public boolean hasProperty(Property property) {
        return properties.contains(property);
    }

    public Credential withGroupsAndProperties(List<String> resolvedGroups, Set<Property> granted) {
        return new Credential(subject, links, resolvedGroups, granted, expiresAt);
    }

    // Log form used in request lines: [group:subject]
    public String formatted() {
        String group = primaryGroup() == null ? "nogroup" : primaryGroup();
        return "[" + group + ":" + subject + "]";
    }

    @Override
    public String toString() {
        return "Credential" + formatted();
    }
}
