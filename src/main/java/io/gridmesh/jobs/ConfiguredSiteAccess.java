package io.gridmesh.jobs;

import io.gridmesh.config.ConfigurationSource;

import java.util.List;

public final class ConfiguredSiteAccess implements SiteAccessPolicy {
    private final ConfigurationSource config;

    public ConfiguredSiteAccess(ConfigurationSource config) {
        this.config = config;
    }

    @Override
    public boolean permits(String site, String group) {
        if (site == null) {
            return true;
        }
        String base = "/Resources/Sites/" + site;
        List<String> banned = config.getList(base + "/BannedGroups");
        if (group != null && banned.contains(group)) {
            return false;
        }
        List<String> allowed = config.getList(base + "/AllowedGroups");
        return allowed.isEmpty() || (group != null && allowed.contains(group));
    }
}
