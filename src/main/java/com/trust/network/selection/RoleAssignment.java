package com.trust.network.selection;

import com.trust.network.core.model.NodeRole;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Write-once node roles, derived after both selectors have finished.
 * Nodes that are in neither selection have {@link NodeRole#NONE} and are not stored.
 */
public final class RoleAssignment {

    private final Map<Long, NodeRole> roles;

    private RoleAssignment(Map<Long, NodeRole> roles) {
        this.roles = Collections.unmodifiableMap(roles);
    }

    /**
     * Combines the production sentinel selection with the production maintenance selection.
     */
    public static RoleAssignment of(SelectionResult sentinels, SelectionResult maintenance) {
        Set<Long> sentinelIds = new HashSet<>(sentinels.selected());
        Set<Long> maintenanceIds = new HashSet<>(maintenance.selected());
        Map<Long, NodeRole> roles = new TreeMap<>();
        for (Long id : sentinelIds) {
            roles.put(id, NodeRole.of(true, maintenanceIds.contains(id)));
        }
        for (Long id : maintenanceIds) {
            roles.putIfAbsent(id, NodeRole.MAINTENANCE);
        }
        return new RoleAssignment(roles);
    }

    public NodeRole roleOf(long nodeId) {
        return roles.getOrDefault(nodeId, NodeRole.NONE);
    }

    /**
     * Nodes with a role other than {@link NodeRole#NONE}, by ascending id.
     */
    public Set<Long> assignedNodes() {
        return roles.keySet();
    }

    public Map<Long, NodeRole> asMap() {
        return roles;
    }
}
