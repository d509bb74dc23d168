// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

/**
 * Describes how to authenticate with Microsoft Entra ID, without performing any authentication itself.
 * <p>
 * The set of credential kinds is closed: every subclass lives in this package and reports one of the
 * {@link AzureAuthType} values. Instances are immutable.
 */
public abstract class AzureCredentials {
    // Only intended to be subclassed within this package
    AzureCredentials() {
    }

    /**
     * Gets the kind of this credential.
     *
     * @return the authentication type
     */
    public abstract AzureAuthType getAzureAuthType();
}
