// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;

import javax.annotation.Nullable;

/**
 * Retrieves tokens for an app registration through the OAuth2 client credentials flow.
 */
public final class ClientSecretTokenRetriever extends AbstractTokenRetriever {
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;
    private final String authorityHost;

    ClientSecretTokenRetriever(String tenantId, String clientId, String clientSecret, String authorityHost) {
        this(tenantId, clientId, clientSecret, authorityHost, null);
    }

    ClientSecretTokenRetriever(
            String tenantId,
            String clientId,
            String clientSecret,
            String authorityHost,
            @Nullable TokenCredential credential) {
        super(credential);
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.authorityHost = authorityHost;
    }

    @Override
    public TokenRetrieverType getType() {
        return TokenRetrieverType.CLIENT_SECRET;
    }

    @Override
    public String getCacheKey() {
        return "azure|clientsecret|" + this.authorityHost + "|" + this.tenantId + "|" + this.clientId;
    }

    public String getTenantId() {
        return this.tenantId;
    }

    public String getClientId() {
        return this.clientId;
    }

    String getClientSecret() {
        return this.clientSecret;
    }

    /**
     * Gets the Microsoft Entra ID authority host the token requests are sent to.
     *
     * @return the authority host URL
     */
    public String getAuthorityHost() {
        return this.authorityHost;
    }

    @Override
    protected TokenCredential createCredential() {
        return new ClientSecretCredentialBuilder()
                .authorityHost(this.authorityHost)
                .tenantId(this.tenantId)
                .clientId(this.clientId)
                .clientSecret(this.clientSecret)
                .build();
    }
}
