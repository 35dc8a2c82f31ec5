package com.trust.network.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.trust.network.core.model.IdentityMetadata;

/**
 * Display metadata as exported. Absent identities export the defaults.
 */
@JsonPropertyOrder({"name", "job", "email", "phone"})
public record NodeMetadata(String name, String job, String email, String phone) {

    static NodeMetadata from(IdentityMetadata identity) {
        return new NodeMetadata(identity.name(), identity.job(), identity.email(), identity.phone());
    }
}
