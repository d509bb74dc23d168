// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.microsoft.aztokenprovider.credentials.AzureClientSecretCredentials;
import com.microsoft.aztokenprovider.credentials.AzureCredentials;
import com.microsoft.aztokenprovider.credentials.AzureManagedIdentityCredentials;
import com.microsoft.aztokenprovider.credentials.AzureWorkloadIdentityCredentials;
import com.microsoft.aztokenprovider.settings.AzureClouds;
import com.microsoft.aztokenprovider.settings.AzureSettings;
import com.microsoft.aztokenprovider.settings.WorkloadIdentitySettings;

import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Resolves credential descriptors into the {@link TokenRetriever} that can serve them.
 * <p>
 * Resolution only constructs objects. No credential is built and no request is sent until a token is requested.
 */
public final class TokenRetrieverResolver {
    private TokenRetrieverResolver() {}

    /**
     * Creates the token retriever for a credential.
     *
     * @param settings the process-wide Azure settings
     * @param credentials the credential to resolve
     * @return a new token retriever bound to the credential
     * @throws AzureConfigurationException if the credential type is unsupported or disabled, or its cloud is unknown
     * @throws NullPointerException if settings is null
     */
    public static TokenRetriever resolve(AzureSettings settings, @Nullable AzureCredentials credentials) {
        Objects.requireNonNull(settings, "settings must not be null");
        if (credentials == null || credentials.getAzureAuthType() == null) {
            throw new AzureConfigurationException("unsupported credential type");
        }

        switch (credentials.getAzureAuthType()) {
            case MANAGED_IDENTITY:
                return getManagedIdentityTokenRetriever(settings, (AzureManagedIdentityCredentials) credentials);
            case CLIENT_SECRET:
                return getClientSecretTokenRetriever(settings, (AzureClientSecretCredentials) credentials);
            case WORKLOAD_IDENTITY:
                return getWorkloadIdentityTokenRetriever(settings, (AzureWorkloadIdentityCredentials) credentials);
            default:
                throw new AzureConfigurationException("unsupported credential type");
        }
    }

    static ManagedIdentityTokenRetriever getManagedIdentityTokenRetriever(
            AzureSettings settings,
            AzureManagedIdentityCredentials credentials) {
        if (!settings.isManagedIdentityEnabled()) {
            throw new AzureConfigurationException("managed identity authentication is not enabled");
        }

        String clientId = firstNonEmpty(credentials.getClientId(), settings.getManagedIdentityClientId());
        return new ManagedIdentityTokenRetriever(clientId);
    }

    static ClientSecretTokenRetriever getClientSecretTokenRetriever(
            AzureSettings settings,
            AzureClientSecretCredentials credentials) {
        String authorityHost = credentials.getAuthority();
        if (isNullOrEmpty(authorityHost)) {
            String cloud = firstNonEmpty(credentials.getAzureCloud(), settings.getAzureCloud());
            authorityHost = getAuthorityHost(cloud);
        }

        return new ClientSecretTokenRetriever(
                credentials.getTenantId(),
                credentials.getClientId(),
                credentials.getClientSecret(),
                authorityHost);
    }

    static WorkloadIdentityTokenRetriever getWorkloadIdentityTokenRetriever(
            AzureSettings settings,
            AzureWorkloadIdentityCredentials credentials) {
        if (!settings.isWorkloadIdentityEnabled()) {
            throw new AzureConfigurationException("workload identity authentication is not enabled");
        }

        WorkloadIdentitySettings defaults = settings.getWorkloadIdentitySettings();
        return new WorkloadIdentityTokenRetriever(
                firstNonEmpty(credentials.getTenantId(), defaults.getTenantId()),
                firstNonEmpty(credentials.getClientId(), defaults.getClientId()),
                firstNonEmpty(credentials.getTokenFile(), defaults.getTokenFile()),
                getAuthorityHost(settings.getAzureCloud()));
    }

    private static String getAuthorityHost(@Nullable String cloud) {
        String authorityHost = AzureClouds.getAuthorityHost(cloud);
        if (authorityHost == null) {
            throw new AzureConfigurationException(String.format("unsupported cloud: %s", cloud));
        }
        return authorityHost;
    }

    @Nullable
    private static String firstNonEmpty(@Nullable String value, @Nullable String fallback) {
        return isNullOrEmpty(value) ? (isNullOrEmpty(fallback) ? null : fallback) : value;
    }

    private static boolean isNullOrEmpty(@Nullable String value) {
        return value == null || value.trim().isEmpty();
    }
}
