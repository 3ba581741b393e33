package com.herzen.skillgap.graph;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.function.Function;

/**
 * OAuth2 access tokens keyed by client. A token is dropped five minutes before the lifetime the
 * server declared, or after 55 minutes when it declared none.
 */
public class AccessTokenCache {
    static final Duration EXPIRY_SKEW = Duration.ofSeconds(300);
    static final Duration DEFAULT_LIFETIME = Duration.ofSeconds(3600);

    private final Cache<String, CachedToken> cache;

    public AccessTokenCache(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumSize(16)
                .expireAfter(new Expiry<String, CachedToken>() {
                    @Override
                    public long expireAfterCreate(String key, CachedToken token, long currentTime) {
                        return token.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, CachedToken token, long currentTime, long currentDuration) {
                        return token.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, CachedToken token, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public String get(String key, Function<String, TokenGrant> issuer) {
        return cache.get(key, k -> CachedToken.of(issuer.apply(k))).value();
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    /**
     * @param expiresInSeconds lifetime declared by the token endpoint, null when absent
     */
    public record TokenGrant(String accessToken, Long expiresInSeconds) {}

    private record CachedToken(String value, Duration ttl) {
        static CachedToken of(TokenGrant grant) {
            if (grant == null || grant.accessToken() == null || grant.accessToken().isBlank()) {
                throw new IllegalStateException("Token endpoint returned no access token");
            }
            Duration lifetime = grant.expiresInSeconds() == null ? DEFAULT_LIFETIME : Duration.ofSeconds(grant.expiresInSeconds());
            Duration ttl = lifetime.minus(EXPIRY_SKEW);
            return new CachedToken(grant.accessToken(), ttl.isNegative() ? Duration.ZERO : ttl);
        }
    }
}
