package com.trust.network.selection;

import com.trust.network.core.model.NodeRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleAssignmentTest {

    @Test
    @DisplayName("Nodes in both selections should get the combined role")
    void combinedRoles() {
        SelectionResult sentinels = SelectionResult.exact(List.of(1L, 2L), 6, 2, Duration.ZERO);
        SelectionResult maintenance = SelectionResult.exact(List.of(2L, 3L), 18, 10, Duration.ZERO);

        RoleAssignment roles = RoleAssignment.of(sentinels, maintenance);

        assertEquals(NodeRole.SENTINEL, roles.roleOf(1));
        assertEquals(NodeRole.SENTINEL_MAINTENANCE, roles.roleOf(2));
        assertEquals(NodeRole.MAINTENANCE, roles.roleOf(3));
        assertEquals(NodeRole.NONE, roles.roleOf(4));
        assertEquals(List.of(1L, 2L, 3L), List.copyOf(roles.assignedNodes()));
    }

    @Test
    @DisplayName("Assignment should be read-only")
    void readOnly() {
        RoleAssignment roles = RoleAssignment.of(
                SelectionResult.exact(List.of(1L), 1, 1, Duration.ZERO),
                SelectionResult.exact(List.of(), 0, 0, Duration.ZERO));

        assertThrows(UnsupportedOperationException.class, () -> roles.asMap().put(9L, NodeRole.SENTINEL));
        assertTrue(NodeRole.SENTINEL_MAINTENANCE.isSentinel());
        assertTrue(NodeRole.SENTINEL_MAINTENANCE.isMaintenance());
        assertFalse(NodeRole.NONE.isSentinel());
    }
}
