// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands out access tokens for one set of credentials, reusing the token cached in a shared {@link TokenStore} while
 * it is fresh and fetching a new one from the {@link AuthProvider} otherwise.
 * <p>
 * A cached token is reused while at least {@link #DEFAULT_REFRESH_MARGIN} of its lifetime remains. A newly issued
 * token whose not-before time lies slightly in the future is waited for, up to {@link #DEFAULT_MAX_NOT_BEFORE_WAIT};
 * tokens that start later than that are rejected.
 */
public final class AccessTokenCache {
    public static final Duration DEFAULT_REFRESH_MARGIN = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MAX_NOT_BEFORE_WAIT = Duration.ofSeconds(10);

    private static final Logger logger = Logger.getLogger(AccessTokenCache.class.getPackage().getName());

    private final TokenStore tokenStore;
    private final AuthProvider authProvider;
    private final CredentialFingerprint fingerprint;
    private final Clock clock;
    private final Sleeper sleeper;

    /**
     * Creates a new instance of the AccessTokenCache that uses the system clock.
     *
     * @param tokenStore The process-wide token store.
     * @param authProvider The provider used for obtaining new tokens.
     * @param credentials The credentials whose token is cached.
     */
    public AccessTokenCache(TokenStore tokenStore, AuthProvider authProvider, Credentials credentials) {
        this(tokenStore, authProvider, credentials, Clock.systemUTC());
    }

    /**
     * Creates a new instance of the AccessTokenCache.
     *
     * @param tokenStore The process-wide token store.
     * @param authProvider The provider used for obtaining new tokens.
     * @param credentials The credentials whose token is cached.
     * @param clock The clock that token lifetimes are compared against.
     */
    public AccessTokenCache(TokenStore tokenStore, AuthProvider authProvider, Credentials credentials, Clock clock) {
        this(tokenStore, authProvider, credentials, clock, duration -> Thread.sleep(duration.toMillis()));
    }

    AccessTokenCache(TokenStore tokenStore, AuthProvider authProvider, Credentials credentials, Clock clock, Sleeper sleeper) {
        this.tokenStore = Helpers.throwIfArgumentNull(tokenStore, "tokenStore");
        this.authProvider = Helpers.throwIfArgumentNull(authProvider, "authProvider");
        this.fingerprint = Helpers.throwIfArgumentNull(credentials, "credentials").getFingerprint();
        this.clock = Helpers.throwIfArgumentNull(clock, "clock");
        this.sleeper = Helpers.throwIfArgumentNull(sleeper, "sleeper");

        if (credentials.getAuthMode() != authProvider.getAuthMode()) {
            throw new IllegalArgumentException(String.format(
                    "The %s provider can't authenticate %s credentials.", authProvider.getAuthMode(), credentials.getAuthMode()));
        }
    }

    /**
     * Gets a valid access token, refreshing it if the cached one is missing or about to expire.
     *
     * @return A valid access token.
     * @throws AuthenticationException if a new token is needed and can't be obtained
     */
    public AuthToken getToken() {
        Optional<AuthToken> cachedToken = this.tokenStore.get(this.fingerprint);
        if (cachedToken.isPresent() && cachedToken.get().isUsable(this.clock.instant(), DEFAULT_REFRESH_MARGIN)) {
            return cachedToken.get();
        }

        return refreshToken();
    }

    /**
     * Fetches a new access token regardless of the cached one and stores it for other callers.
     * <p>
     * Use this after the service itself has rejected the cached token.
     *
     * @return The new access token.
     * @throws AuthenticationException if the token can't be obtained or only becomes valid too far in the future
     */
    public AuthToken refreshToken() {
        AuthToken newToken = this.authProvider.fetchToken();
        awaitNotBefore(newToken);

        this.tokenStore.put(this.fingerprint, newToken);
        logger.fine(() -> String.format(
                "Token for %s has been refreshed, expires on %d.",
                this.authProvider.getAuthMode(),
                newToken.getExpiresOn()));
        return newToken;
    }

    private void awaitNotBefore(AuthToken token) {
        Instant now = this.clock.instant();
        long waitSeconds = token.getNotBefore() - now.getEpochSecond();
        if (waitSeconds <= 0) {
            return;
        }

        if (waitSeconds > DEFAULT_MAX_NOT_BEFORE_WAIT.getSeconds()) {
            throw new AuthenticationException(String.format(
                    "Error getting access token. Details: token not yet valid, skew too large. It starts in %d seconds.",
                    waitSeconds));
        }

        Duration delay = Duration.ofSeconds(waitSeconds + 1);
        logger.log(Level.FINE, "Access token is not valid yet, waiting {0} seconds.", delay.getSeconds());
        try {
            this.sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException(
                    "Interrupted while waiting for the access token to become valid.", 0, null, e);
        }
    }

    /**
     * Blocks the calling thread. Replaced in tests.
     */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
