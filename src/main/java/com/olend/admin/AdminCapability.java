package com.olend.admin;

/**
 * Unforgeable admin token. Instances are only minted by {@link AdminCapabilityAuthority};
 * every configuration mutation takes one as an explicit argument.
 */
public final class AdminCapability {

    private final String id;
    private final String token;

    AdminCapability(String id, String token) {
        this.id = id;
        this.token = token;
    }

    /** Non-secret identifier, recorded in the audit trail. */
    public String getId() {
        return id;
    }

    String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "AdminCapability[" + id + "]";
    }
}
