// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.AccessToken;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Thread-safe {@link TokenCache} shared by all access token providers in the process.
 * <p>
 * Tokens are cached per retriever instance and per set of scopes. A cached token is served until it is within the
 * expiry margin of its expiration time. When a token is missing or about to expire, exactly one acquisition runs
 * for that key and every concurrent caller receives its result. Acquisitions for different keys run independently.
 * <p>
 * Failed acquisitions are not cached and an expired token is never returned in place of a failed refresh.
 * Entries are never evicted, only replaced.
 */
public final class ConcurrentTokenCache implements TokenCache {
    static final Duration DEFAULT_EXPIRY_MARGIN = Duration.ofMinutes(5);

    private static final Logger logger = Logger.getLogger(ConcurrentTokenCache.class.getPackage().getName());
    private static final ConcurrentTokenCache SHARED_INSTANCE = new ConcurrentTokenCache();

    private final ConcurrentHashMap<CacheKey, AccessToken> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CacheKey, CompletableFuture<AccessToken>> pendingAcquisitions = new ConcurrentHashMap<>();
    private final Duration expiryMargin;
    private final Clock clock;

    /**
     * Creates a new cache that refreshes tokens five minutes before they expire.
     */
    public ConcurrentTokenCache() {
        this(DEFAULT_EXPIRY_MARGIN);
    }

    /**
     * Creates a new cache.
     *
     * @param expiryMargin how long before its expiration a cached token stops being served
     */
    public ConcurrentTokenCache(Duration expiryMargin) {
        this(expiryMargin, Clock.systemUTC());
    }

    ConcurrentTokenCache(Duration expiryMargin, Clock clock) {
        Objects.requireNonNull(expiryMargin, "expiryMargin must not be null");
        if (expiryMargin.isNegative()) {
            throw new IllegalArgumentException("expiryMargin must not be negative");
        }
        this.expiryMargin = expiryMargin;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Gets the cache shared by every {@link AzureAccessTokenProvider} that is not given its own.
     *
     * @return the process-wide token cache
     */
    public static ConcurrentTokenCache getSharedInstance() {
        return SHARED_INSTANCE;
    }

    @Override
    public CompletableFuture<String> getAccessTokenAsync(TokenRetriever retriever, List<String> scopes) {
        Objects.requireNonNull(retriever, "retriever must not be null");
        CacheKey key = new CacheKey(retriever, normalizeScopes(scopes));

        AccessToken cachedToken = this.entries.get(key);
        if (isValid(cachedToken)) {
            return CompletableFuture.completedFuture(cachedToken.getToken());
        }

        // Dependent future per caller so that canceling it leaves the shared acquisition running
        return acquire(key).thenApply(AccessToken::getToken);
    }

    /**
     * Drops all cached tokens. Acquisitions already in progress are not affected.
     */
    public void clear() {
        this.entries.clear();
    }

    private CompletableFuture<AccessToken> acquire(CacheKey key) {
        CompletableFuture<AccessToken> acquisition = new CompletableFuture<>();
        CompletableFuture<AccessToken> pending = this.pendingAcquisitions.putIfAbsent(key, acquisition);
        if (pending != null) {
            return pending;
        }

        // A previous acquisition may have completed after the caller's lookup
        AccessToken cachedToken = this.entries.get(key);
        if (isValid(cachedToken)) {
            this.pendingAcquisitions.remove(key, acquisition);
            acquisition.complete(cachedToken);
            return acquisition;
        }

        startAcquisition(key, acquisition);
        return acquisition;
    }

    private void startAcquisition(CacheKey key, CompletableFuture<AccessToken> acquisition) {
        TokenRetriever retriever = key.retriever;
        logger.log(Level.FINE, "Acquiring access token for {0} with scopes {1}.",
                new Object[] { retriever.getCacheKey(), key.scopes });

        Mono<AccessToken> request;
        try {
            request = Objects.requireNonNull(retriever.getAccessToken(key.scopes), "retriever returned no request");
        } catch (RuntimeException e) {
            onAcquisitionFailed(key, acquisition, e);
            return;
        }

        // Never subscribed on the caller's thread
        request.subscribeOn(Schedulers.boundedElastic()).subscribe(
                token -> onAcquired(key, acquisition, token),
                error -> onAcquisitionFailed(key, acquisition, error),
                () -> {
                    if (!acquisition.isDone()) {
                        onAcquisitionFailed(key, acquisition, null);
                    }
                });
    }

    private void onAcquired(CacheKey key, CompletableFuture<AccessToken> acquisition, AccessToken token) {
        // The entry must be visible before the pending marker goes away
        this.entries.put(key, token);
        this.pendingAcquisitions.remove(key, acquisition);

        logger.log(Level.FINE, "Acquired access token for {0}, expires at {1}.",
                new Object[] { key.retriever.getCacheKey(), token.getExpiresAt() });
        acquisition.complete(token);
    }

    private void onAcquisitionFailed(CacheKey key, CompletableFuture<AccessToken> acquisition, @Nullable Throwable error) {
        this.pendingAcquisitions.remove(key, acquisition);

        String retrieverKey = key.retriever.getCacheKey();
        TokenAcquisitionException exception;
        if (error instanceof TokenAcquisitionException) {
            exception = (TokenAcquisitionException) error;
        } else if (error == null) {
            exception = new TokenAcquisitionException(
                    String.format("The identity provider returned no access token for %s.", retrieverKey),
                    retrieverKey,
                    null);
        } else {
            exception = new TokenAcquisitionException(
                    String.format("Failed to acquire an access token for %s: %s", retrieverKey, error.getMessage()),
                    retrieverKey,
                    error);
        }

        logger.log(Level.WARNING, "Failed to acquire access token for " + retrieverKey + ".", exception);
        acquisition.completeExceptionally(exception);
    }

    private boolean isValid(@Nullable AccessToken token) {
        if (token == null || token.getExpiresAt() == null) {
            return false;
        }
        Instant nowWithMargin = this.clock.instant().plus(this.expiryMargin);
        return token.getExpiresAt().toInstant().isAfter(nowWithMargin);
    }

    static List<String> normalizeScopes(List<String> scopes) {
        Objects.requireNonNull(scopes, "scopes must not be null");
        TreeSet<String> normalized = new TreeSet<>();
        for (String scope : scopes) {
            if (scope == null || scope.trim().isEmpty()) {
                throw new IllegalArgumentException("scopes must not contain null or empty values");
            }
            normalized.add(scope.trim());
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("scopes must not be empty");
        }
        return Collections.unmodifiableList(new ArrayList<>(normalized));
    }

    /**
     * Identifies a cache entry by retriever instance and normalized scopes. Retrievers are compared by identity.
     */
    private static final class CacheKey {
        private final TokenRetriever retriever;
        private final List<String> scopes;

        CacheKey(TokenRetriever retriever, List<String> scopes) {
            this.retriever = retriever;
            this.scopes = scopes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CacheKey)) {
                return false;
            }
            CacheKey other = (CacheKey) o;
            return this.retriever == other.retriever && this.scopes.equals(other.scopes);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(this.retriever) + this.scopes.hashCode();
        }
    }
}
