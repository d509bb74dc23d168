// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Serves access tokens for (retriever, scopes) pairs, requesting new ones from the retriever only when needed.
 */
public interface TokenCache {
    /**
     * Gets an access token without blocking.
     * <p>
     * Each call returns its own future. Canceling it stops this caller from waiting but does not cancel an
     * acquisition that other callers share.
     *
     * @param retriever the retriever that obtains tokens on a cache miss
     * @param scopes the scopes the token is requested for
     * @return a future that completes with the token, or exceptionally with a {@link TokenAcquisitionException}
     */
    CompletableFuture<String> getAccessTokenAsync(TokenRetriever retriever, List<String> scopes);

    /**
     * Gets an access token, waiting as long as it takes to acquire one.
     *
     * @param retriever the retriever that obtains tokens on a cache miss
     * @param scopes the scopes the token is requested for
     * @return the access token
     * @throws TokenAcquisitionException if the token could not be acquired
     * @throws TokenCancellationException if the calling thread is interrupted while waiting
     */
    default String getAccessToken(TokenRetriever retriever, List<String> scopes) {
        return AccessTokenFutures.await(getAccessTokenAsync(retriever, scopes), null);
    }

    /**
     * Gets an access token, waiting at most {@code timeout} for it.
     *
     * @param retriever the retriever that obtains tokens on a cache miss
     * @param scopes the scopes the token is requested for
     * @param timeout the maximum time to wait
     * @return the access token
     * @throws TokenAcquisitionException if the token could not be acquired
     * @throws TokenCancellationException if the timeout elapses or the calling thread is interrupted while waiting
     */
    default String getAccessToken(TokenRetriever retriever, List<String> scopes, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return AccessTokenFutures.await(getAccessTokenAsync(retriever, scopes), timeout);
    }
}
