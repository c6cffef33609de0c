package com.vendorhub.marketplace.modules.auth;

import java.util.UUID;

/**
 * Caller identity resolved from a verified bearer token.
 */
public record AuthenticatedUser(UUID userId, String role) {

    public static final String ROLE_VENDOR = "vendor";

    /** Case-insensitive, matching the upper-cased {@code ROLE_} authority. */
    public boolean isVendor() {
        return ROLE_VENDOR.equalsIgnoreCase(role);
    }
}
