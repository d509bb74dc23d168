// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.microsoft.aztokenprovider.credentials.AzureCredentials;
import com.microsoft.aztokenprovider.settings.AzureSettings;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Supplies bearer tokens for one Azure credential.
 * <p>
 * The credential is resolved into a {@link TokenRetriever} once, when the provider is created, so configuration
 * errors surface immediately. Token requests are served by a {@link TokenCache}, by default the process-wide
 * {@link ConcurrentTokenCache#getSharedInstance() shared cache}.
 * <p>
 * Example:
 * <pre>{@code
 * AzureSettings settings = new AzureSettings().setManagedIdentityEnabled(true);
 * AzureAccessTokenProvider provider = new AzureAccessTokenProvider(settings, new AzureManagedIdentityCredentials());
 * String token = provider.getAccessToken(Collections.singletonList("https://management.azure.com/.default"));
 * }</pre>
 */
public final class AzureAccessTokenProvider {
    private static final Logger logger = Logger.getLogger(AzureAccessTokenProvider.class.getPackage().getName());

    private final TokenRetriever retriever;
    private final TokenCache tokenCache;

    /**
     * Creates a provider that uses the shared token cache.
     *
     * @param settings the process-wide Azure settings
     * @param credentials the credential to authenticate with
     * @throws AzureConfigurationException if the credential cannot be used with these settings
     * @throws NullPointerException if settings is null
     */
    public AzureAccessTokenProvider(AzureSettings settings, AzureCredentials credentials) {
        this(settings, credentials, ConcurrentTokenCache.getSharedInstance());
    }

    /**
     * Creates a provider that uses the given token cache.
     *
     * @param settings the process-wide Azure settings
     * @param credentials the credential to authenticate with
     * @param tokenCache the cache to serve tokens from
     * @throws AzureConfigurationException if the credential cannot be used with these settings
     * @throws NullPointerException if settings or tokenCache is null
     */
    public AzureAccessTokenProvider(AzureSettings settings, AzureCredentials credentials, TokenCache tokenCache) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache must not be null");
        this.retriever = TokenRetrieverResolver.resolve(settings, credentials);

        logger.log(Level.INFO, "Resolved {0} token retriever for {1}.",
                new Object[] { this.retriever.getType(), this.retriever.getCacheKey() });
    }

    /**
     * Gets an access token for the given scopes, blocking until one is available.
     *
     * @param scopes the scopes the token is requested for
     * @return the access token
     * @throws TokenAcquisitionException if the token could not be acquired
     * @throws TokenCancellationException if the calling thread is interrupted while waiting
     */
    public String getAccessToken(List<String> scopes) {
        return this.tokenCache.getAccessToken(this.retriever, scopes);
    }

    /**
     * Gets an access token for the given scopes, waiting at most {@code timeout}.
     *
     * @param scopes the scopes the token is requested for
     * @param timeout the maximum time to wait
     * @return the access token
     * @throws TokenAcquisitionException if the token could not be acquired
     * @throws TokenCancellationException if the timeout elapses or the calling thread is interrupted
     */
    public String getAccessToken(List<String> scopes, Duration timeout) {
        return this.tokenCache.getAccessToken(this.retriever, scopes, timeout);
    }

    /**
     * Gets an access token for the given scopes without blocking.
     *
     * @param scopes the scopes the token is requested for
     * @return a future that completes with the access token
     */
    public CompletableFuture<String> getAccessTokenAsync(List<String> scopes) {
        return this.tokenCache.getAccessTokenAsync(this.retriever, scopes);
    }

    /**
     * Gets the kind of token retriever the credential was resolved into.
     *
     * @return the retriever type
     */
    public TokenRetrieverType getRetrieverType() {
        return this.retriever.getType();
    }

    TokenRetriever getRetriever() {
        return this.retriever;
    }
}
