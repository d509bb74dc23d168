// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import javax.annotation.Nullable;

/**
 * Exception that gets thrown when an access token could not be obtained from Microsoft Entra ID.
 * <p>
 * Failed acquisitions are never cached. The caller decides whether to retry.
 */
public class TokenAcquisitionException extends RuntimeException {
    private final String retrieverKey;

    TokenAcquisitionException(String message, @Nullable String retrieverKey, @Nullable Throwable cause) {
        super(message, cause);
        this.retrieverKey = retrieverKey;
    }

    /**
     * Gets the cache key of the token retriever whose acquisition failed.
     *
     * @return the retriever key, or null if the failure did not come from a known retriever
     */
    @Nullable
    public String getRetrieverKey() {
        return this.retrieverKey;
    }
}
