// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ManagedIdentityCredentialBuilder;

import javax.annotation.Nullable;

/**
 * Retrieves tokens for the managed identity of the Azure resource this process runs on.
 */
public final class ManagedIdentityTokenRetriever extends AbstractTokenRetriever {
    private final String clientId;

    ManagedIdentityTokenRetriever(@Nullable String clientId) {
        this(clientId, null);
    }

    ManagedIdentityTokenRetriever(@Nullable String clientId, @Nullable TokenCredential credential) {
        super(credential);
        this.clientId = clientId;
    }

    @Override
    public TokenRetrieverType getType() {
        return TokenRetrieverType.MANAGED_IDENTITY;
    }

    @Override
    public String getCacheKey() {
        return "azure|msi|" + (this.clientId != null ? this.clientId : "default");
    }

    /**
     * Gets the client ID of the user-assigned managed identity.
     *
     * @return the client ID, or null for the system-assigned identity
     */
    @Nullable
    public String getClientId() {
        return this.clientId;
    }

    @Override
    protected TokenCredential createCredential() {
        ManagedIdentityCredentialBuilder builder = new ManagedIdentityCredentialBuilder();
        if (this.clientId != null) {
            builder.clientId(this.clientId);
        }
        return builder.build();
    }
}
