// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Base class for retrievers that delegate to an Azure Identity {@link TokenCredential}.
 * <p>
 * The credential is built on the first token request, not when the retriever is created.
 */
abstract class AbstractTokenRetriever implements TokenRetriever {
    private final Object credentialLock = new Object();
    private volatile TokenCredential credential;

    AbstractTokenRetriever(@Nullable TokenCredential credential) {
        this.credential = credential;
    }

    /**
     * Builds the Azure Identity credential for this retriever.
     *
     * @return a new token credential
     */
    protected abstract TokenCredential createCredential();

    @Override
    public Mono<AccessToken> getAccessToken(List<String> scopes) {
        Objects.requireNonNull(scopes, "scopes must not be null");
        TokenRequestContext context = new TokenRequestContext().setScopes(new ArrayList<>(scopes));

        return Mono.defer(() -> getCredential().getToken(context))
                .onErrorMap(
                        e -> !(e instanceof TokenAcquisitionException),
                        e -> new TokenAcquisitionException(
                                String.format("Failed to acquire an access token for %s: %s", getCacheKey(), e.getMessage()),
                                getCacheKey(),
                                e));
    }

    TokenCredential getCredential() {
        TokenCredential current = this.credential;
        if (current == null) {
            synchronized (this.credentialLock) {
                current = this.credential;
                if (current == null) {
                    current = createCredential();
                    this.credential = current;
                }
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return getType() + "[" + getCacheKey() + "]";
    }
}
