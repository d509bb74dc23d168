// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.WorkloadIdentityCredentialBuilder;

import javax.annotation.Nullable;

/**
 * Retrieves tokens by exchanging a projected service account token for a Microsoft Entra ID token.
 * <p>
 * Values left null are read by Azure Identity from the {@code AZURE_TENANT_ID}, {@code AZURE_CLIENT_ID} and
 * {@code AZURE_FEDERATED_TOKEN_FILE} environment variables.
 */
public final class WorkloadIdentityTokenRetriever extends AbstractTokenRetriever {
    private final String tenantId;
    private final String clientId;
    private final String tokenFile;
    private final String authorityHost;

    WorkloadIdentityTokenRetriever(
            @Nullable String tenantId,
            @Nullable String clientId,
            @Nullable String tokenFile,
            String authorityHost) {
        this(tenantId, clientId, tokenFile, authorityHost, null);
    }

    WorkloadIdentityTokenRetriever(
            @Nullable String tenantId,
            @Nullable String clientId,
            @Nullable String tokenFile,
            String authorityHost,
            @Nullable TokenCredential credential) {
        super(credential);
        this.tenantId = tenantId;
        this.clientId = clientId;
        this.tokenFile = tokenFile;
        this.authorityHost = authorityHost;
    }

    @Override
    public TokenRetrieverType getType() {
        return TokenRetrieverType.WORKLOAD_IDENTITY;
    }

    @Override
    public String getCacheKey() {
        return "azure|wi|" + this.authorityHost + "|" + this.tenantId + "|" + this.clientId;
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

    public String getAuthorityHost() {
        return this.authorityHost;
    }

    @Override
    protected TokenCredential createCredential() {
        WorkloadIdentityCredentialBuilder builder = new WorkloadIdentityCredentialBuilder()
                .authorityHost(this.authorityHost);
        if (this.tenantId != null) {
            builder.tenantId(this.tenantId);
        }
        if (this.clientId != null) {
            builder.clientId(this.clientId);
        }
        if (this.tokenFile != null) {
            builder.tokenFilePath(this.tokenFile);
        }
        return builder.build();
    }
}
