// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

import javax.annotation.Nullable;

/**
 * Credentials that authenticate as the managed identity of the Azure resource the process runs on.
 */
public final class AzureManagedIdentityCredentials extends AzureCredentials {
    private final String clientId;

    /**
     * Creates credentials for the system-assigned managed identity, or for the user-assigned identity
     * configured in the settings.
     */
    public AzureManagedIdentityCredentials() {
        this(null);
    }

    /**
     * Creates credentials for a user-assigned managed identity.
     *
     * @param clientId the client ID of the user-assigned identity, or null for the default identity
     */
    public AzureManagedIdentityCredentials(@Nullable String clientId) {
        this.clientId = clientId;
    }

    @Override
    public AzureAuthType getAzureAuthType() {
        return AzureAuthType.MANAGED_IDENTITY;
    }

    /**
     * Gets the client ID of the user-assigned managed identity.
     *
     * @return the client ID, or null if not specified
     */
    @Nullable
    public String getClientId() {
        return this.clientId;
    }

    @Override
    public String toString() {
        return "AzureManagedIdentityCredentials{clientId=" + this.clientId + "}";
    }
}
