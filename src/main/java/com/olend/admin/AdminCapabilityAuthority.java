package com.olend.admin;

import com.olend.exception.InvalidConfigException;
import com.olend.exception.UnauthorizedException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints, resolves and revokes {@link AdminCapability} tokens.
 *
 * <p>A single bootstrap capability is minted from the configured secret at start-up.
 * Holders of a valid capability may issue further capabilities and revoke any
 * capability except the bootstrap one. There is no ambient admin identity: callers
 * must present a capability on every mutating call.
 */
public class AdminCapabilityAuthority {

    private static final Logger log = LoggerFactory.getLogger(AdminCapabilityAuthority.class);

    static final String BOOTSTRAP_ID = "bootstrap";

    private final Map<String, AdminCapability> issuedByToken = new ConcurrentHashMap<>();
    private final AdminCapability bootstrap;

    public AdminCapabilityAuthority(String bootstrapToken) {
        if (bootstrapToken == null || bootstrapToken.isBlank()) {
            throw new InvalidConfigException("olend.risk.admin.bootstrap-token", "<blank>", "must be set");
        }
        this.bootstrap = new AdminCapability(BOOTSTRAP_ID, bootstrapToken);
        issuedByToken.put(bootstrapToken, bootstrap);
    }

    /**
     * Resolves a presented token (e.g. from an HTTP header) to its capability.
     *
     * @throws UnauthorizedException if the token is missing, unknown or revoked
     */
    public AdminCapability resolve(String token) {
        if (token == null || token.isBlank()) {
            throw UnauthorizedException.missingCapability();
        }
        AdminCapability capability = issuedByToken.get(token);
        if (capability == null) {
            throw UnauthorizedException.unknownToken();
        }
        return capability;
    }

    /**
     * Verifies that a capability is one this authority issued and has not revoked.
     */
    public void verify(AdminCapability capability) {
        if (capability == null) {
            throw UnauthorizedException.missingCapability();
        }
        if (issuedByToken.get(capability.getToken()) != capability) {
            throw UnauthorizedException.capabilityNotValid(capability.getId());
        }
    }

    /**
     * Issues a new capability. The returned token must be handed to the new holder out of band.
     */
    public IssuedCapability issue(AdminCapability issuer, String label) {
        verify(issuer);
        String token = UUID.randomUUID().toString();
        String id = (label == null || label.isBlank() ? "admin" : label) + "-" + token.substring(0, 8);
        AdminCapability capability = new AdminCapability(id, token);
        issuedByToken.put(token, capability);
        log.info("Admin capability {} issued by {}", id, issuer.getId());
        return new IssuedCapability(capability, token);
    }

    public void revoke(AdminCapability issuer, String capabilityId) {
        verify(issuer);
        if (BOOTSTRAP_ID.equals(capabilityId)) {
            throw new InvalidConfigException("capabilityId", capabilityId, "bootstrap capability cannot be revoked");
        }
        boolean removed = issuedByToken.values().removeIf(c -> c.getId().equals(capabilityId));
        if (removed) {
            log.info("Admin capability {} revoked by {}", capabilityId, issuer.getId());
        }
    }

    public Set<String> issuedIds() {
        Set<String> ids = ConcurrentHashMap.newKeySet();
        issuedByToken.values().forEach(c -> ids.add(c.getId()));
        return Collections.unmodifiableSet(ids);
    }

    /** A freshly issued capability together with its secret token. */
    public record IssuedCapability(AdminCapability capability, String token) {}
}
