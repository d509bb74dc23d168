// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

import javax.annotation.Nullable;

/**
 * Credentials of an app registration that authenticates with a client secret.
 * <p>
 * The authority host is taken from {@link #getAuthority()} when set, otherwise it is derived from
 * {@link #getAzureCloud()}.
 */
public final class AzureClientSecretCredentials extends AzureCredentials {
    private final String azureCloud;
    private final String authority;
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;

    /**
     * Creates client secret credentials whose authority host is derived from the Azure cloud.
     *
     * @param azureCloud the Azure cloud name, or null to use the cloud from the settings
     * @param tenantId the directory (tenant) ID
     * @param clientId the application (client) ID
     * @param clientSecret the client secret
     */
    public AzureClientSecretCredentials(
            @Nullable String azureCloud,
            String tenantId,
            String clientId,
            String clientSecret) {
        this(azureCloud, null, tenantId, clientId, clientSecret);
    }

    /**
     * Creates client secret credentials.
     *
     * @param azureCloud the Azure cloud name, or null to use the cloud from the settings
     * @param authority an explicit authority host that takes priority over the cloud, or null
     * @param tenantId the directory (tenant) ID
     * @param clientId the application (client) ID
     * @param clientSecret the client secret
     */
    public AzureClientSecretCredentials(
            @Nullable String azureCloud,
            @Nullable String authority,
            String tenantId,
            String clientId,
            String clientSecret) {
        this.azureCloud = azureCloud;
        this.authority = authority;
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public AzureAuthType getAzureAuthType() {
        return AzureAuthType.CLIENT_SECRET;
    }

    /**
     * Gets the name of the Azure cloud, such as {@link com.microsoft.aztokenprovider.settings.AzureClouds#AZURE_PUBLIC}.
     *
     * @return the cloud name, or null if not specified
     */
    @Nullable
    public String getAzureCloud() {
        return this.azureCloud;
    }

    /**
     * Gets the explicitly configured authority host.
     *
     * @return the authority host, or null if not specified
     */
    @Nullable
    public String getAuthority() {
        return this.authority;
    }

    public String getTenantId() {
        return this.tenantId;
    }

    public String getClientId() {
        return this.clientId;
    }

    public String getClientSecret() {
        return this.clientSecret;
    }

    @Override
    public String toString() {
        return "AzureClientSecretCredentials{azureCloud=" + this.azureCloud
                + ", authority=" + this.authority
                + ", tenantId=" + this.tenantId
                + ", clientId=" + this.clientId
                + "}";
    }
}
