package com.phillippitts.grillstats.service.auth;

import com.phillippitts.grillstats.exception.UnauthorizedStreamException;
import com.phillippitts.grillstats.service.cache.CacheNamespace;
import com.phillippitts.grillstats.service.cache.TieredCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Bearer tokens of dashboard clients, held in {@link CacheNamespace#SESSION_TOKENS}.
 *
 * <p>A token lives for the namespace TTL from issue and is removed at once on logout.
 */
@Component
public class SessionTokenStore {

    private static final Logger LOG = LogManager.getLogger(SessionTokenStore.class);
    private static final int TOKEN_BYTES = 32;

    private final TieredCache cache;
    private final SecureRandom random = new SecureRandom();

    public SessionTokenStore(TieredCache cache) {
        this.cache = cache;
    }

    /** Issues a new token for a client. */
    public String issue(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client id must not be blank");
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        cache.set(CacheNamespace.SESSION_TOKENS, token, clientId);
        LOG.info("Issued session token for client {}", clientId);
        return token;
    }

    /** Client id of a live token. */
    public Optional<String> clientFor(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return cache.get(CacheNamespace.SESSION_TOKENS, token, String.class);
    }

    /**
     * @throws UnauthorizedStreamException if the token is missing, expired or revoked
     */
    public String requireClient(String token) {
        return clientFor(token).orElseThrow(() -> new UnauthorizedStreamException("Missing or expired session token"));
    }

    /**
     * Revokes a token. Revoking an unknown token is a no-op.
     *
     * @return true if a live token was revoked
     */
    public boolean revoke(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        boolean revoked = cache.invalidate(CacheNamespace.SESSION_TOKENS, token);
        if (revoked) {
            LOG.info("Session token revoked");
        }
        return revoked;
    }
}
