// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.AccessToken;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Obtains fresh access tokens for one resolved Azure credential.
 * <p>
 * Retrievers do not cache or retry. Callers are expected to go through a {@link TokenCache}.
 */
public interface TokenRetriever {
    /**
     * Gets the kind of this retriever.
     *
     * @return the retriever type
     */
    TokenRetrieverType getType();

    /**
     * Gets a string that describes the credential behind this retriever. The key never contains secrets.
     *
     * @return the retriever key
     */
    String getCacheKey();

    /**
     * Requests a new access token from Microsoft Entra ID.
     * <p>
     * The request is sent when the returned {@link Mono} is subscribed to. Failures are signaled as
     * {@link TokenAcquisitionException}.
     *
     * @param scopes the scopes the token is requested for
     * @return a {@link Mono} that emits the access token and its expiry
     */
    Mono<AccessToken> getAccessToken(List<String> scopes);
}
