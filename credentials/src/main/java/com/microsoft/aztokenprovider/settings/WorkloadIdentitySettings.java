// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.settings;

import javax.annotation.Nullable;

/**
 * Process-wide defaults for workload identity authentication.
 */
public class WorkloadIdentitySettings {
    private String tenantId;
    private String clientId;
    private String tokenFile;

    @Nullable
    public String getTenantId() {
        return tenantId;
    }

    public WorkloadIdentitySettings setTenantId(@Nullable String tenantId) {
        this.tenantId = tenantId;
        return this;
    }

    @Nullable
    public String getClientId() {
        return clientId;
    }

    public WorkloadIdentitySettings setClientId(@Nullable String clientId) {
        this.clientId = clientId;
        return this;
    }

    /**
     * Gets the path of the projected service account token.
     *
     * @return the token file path, or null if not specified
     */
    @Nullable
    public String getTokenFile() {
        return tokenFile;
    }

    public WorkloadIdentitySettings setTokenFile(@Nullable String tokenFile) {
        this.tokenFile = tokenFile;
        return this;
    }
}
