// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.loganalytics.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * An access token issued by Azure Active Directory or the instance metadata service.
 * <p>
 * Both endpoints transmit the numeric fields as JSON strings; they are coerced to numbers while decoding. Tokens are
 * never modified after they are created. A refresh replaces the cached instance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AuthToken {
    private final String accessToken;
    private final String tokenType;
    private final long expiresIn;
    private final long extExpiresIn;
    private final long expiresOn;
    private final long notBefore;
    private final String resource;

    @JsonCreator
    public AuthToken(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("token_type") String tokenType,
            @JsonProperty("expires_in") long expiresIn,
            @JsonProperty("ext_expires_in") long extExpiresIn,
            @JsonProperty("expires_on") long expiresOn,
            @JsonProperty("not_before") long notBefore,
            @JsonProperty("resource") String resource) {
        this.accessToken = accessToken;
        this.tokenType = tokenType;
        this.expiresIn = expiresIn;
        this.extExpiresIn = extExpiresIn;
        this.expiresOn = expiresOn;
        this.notBefore = notBefore;
        this.resource = resource;
    }

    public String getAccessToken() {
        return this.accessToken;
    }

    public String getTokenType() {
        return this.tokenType;
    }

    public long getExpiresIn() {
        return this.expiresIn;
    }

    public long getExtExpiresIn() {
        return this.extExpiresIn;
    }

    /**
     * Gets the expiry time of the token.
     *
     * @return the expiry time in seconds since the epoch
     */
    public long getExpiresOn() {
        return this.expiresOn;
    }

    /**
     * Gets the time from which the token is accepted.
     *
     * @return the start of the validity window in seconds since the epoch
     */
    public long getNotBefore() {
        return this.notBefore;
    }

    public String getResource() {
        return this.resource;
    }

    /**
     * Checks whether the token stays valid for at least {@code margin} from {@code now}.
     *
     * @param now the current time
     * @param margin the minimum remaining lifetime
     * @return {@code true} if {@code now + margin <= expiresOn}
     */
    public boolean isUsable(Instant now, Duration margin) {
        return this.accessToken != null
                && !this.accessToken.isEmpty()
                && now.getEpochSecond() + margin.getSeconds() <= this.expiresOn;
    }

    @Override
    public String toString() {
        return "AuthToken{tokenType=" + this.tokenType
                + ", expiresOn=" + this.expiresOn
                + ", notBefore=" + this.notBefore
                + ", resource=" + this.resource + "}";
    }
}
