// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

/**
 * The kinds of {@link TokenRetriever} that a credential can be resolved into.
 */
public enum TokenRetrieverType {
    MANAGED_IDENTITY,
    CLIENT_SECRET,
    WORKLOAD_IDENTITY,
}
