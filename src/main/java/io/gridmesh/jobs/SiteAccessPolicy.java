package io.gridmesh.jobs;

@FunctionalInterface
public interface SiteAccessPolicy {
    SiteAccessPolicy OPEN = (site, group) -> true;

    boolean permits(String site, String group);
}
