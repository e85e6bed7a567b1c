package com.threatlens.core.service;

import com.threatlens.core.model.FailOn;
import com.threatlens.core.policy.PolicyPack;

/**
 * Public view of a registered pack.
 *
 * @param id pack id
 * @param name display name
 * @param description what the pack is for
 * @param defaultFailOn threshold used when a request names none
 */
public record PolicyPackListing(String id, String name, String description, FailOn defaultFailOn) {

    public static PolicyPackListing of(PolicyPack pack) {
        return new PolicyPackListing(pack.id(), pack.name(), pack.description(), pack.defaultFailOn());
    }
}
