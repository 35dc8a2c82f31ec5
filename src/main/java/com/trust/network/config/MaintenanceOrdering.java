package com.trust.network.config;

/**
 * Ordering of the exported maintenance selection.
 */
public enum MaintenanceOrdering {
    DAYS_DORMANT_DESC,
    VALUE_DESC
}
