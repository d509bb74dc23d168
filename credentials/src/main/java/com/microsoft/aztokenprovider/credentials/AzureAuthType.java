// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

/**
 * The kinds of Azure credentials that can be resolved into a token retriever.
 */
public enum AzureAuthType {
    /**
     * System-assigned or user-assigned managed identity of the hosting Azure resource.
     */
    MANAGED_IDENTITY,

    /**
     * App registration authenticating with a client secret.
     */
    CLIENT_SECRET,

    /**
     * Federated identity backed by a projected service account token file.
     */
    WORKLOAD_IDENTITY,
}
