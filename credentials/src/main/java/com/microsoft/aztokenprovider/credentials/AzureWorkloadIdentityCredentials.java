// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

import javax.annotation.Nullable;

/**
 * Credentials that exchange a projected service account token for a Microsoft Entra ID token.
 * <p>
 * Any value left unset is taken from the workload identity settings.
 */
public final class AzureWorkloadIdentityCredentials extends AzureCredentials {
    private final String tenantId;
    private final String clientId;
    private final String tokenFile;

    /**
     * Creates workload identity credentials that rely entirely on the workload identity settings.
     */
    public AzureWorkloadIdentityCredentials() {
        this(null, null, null);
    }

    /**
     * Creates workload identity credentials.
     *
     * @param tenantId the directory (tenant) ID, or null
     * @param clientId the application (client) ID, or null
     * @param tokenFile the path of the federated token file, or null
     */
    public AzureWorkloadIdentityCredentials(
            @Nullable String tenantId,
            @Nullable String clientId,
            @Nullable String tokenFile) {
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.tokenFile = tokenFile;
    }

    @Override
    public AzureAuthType getAzureAuthType() {
        return AzureAuthType.WORKLOAD_IDENTITY;
    }

    @Nullable
    public String getTenantId() {
        return this.tenantId;
    }

    @Nullable
    public String getClientId() {
        return this.clientId;
    }

    @Nullable
    public String getTokenFile() {
        return this.tokenFile;
    }

    @Override
    public String toString() {
        return "AzureWorkloadIdentityCredentials{tenantId=" + this.tenantId
                + ", clientId=" + this.clientId
                + ", tokenFile=" + this.tokenFile
                + "}";
    }
}
