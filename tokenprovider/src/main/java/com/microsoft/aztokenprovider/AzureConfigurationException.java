// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

/**
 * Exception that gets thrown when a credential cannot be resolved into a token retriever, for example because its
 * authentication type is disabled or its Azure cloud is not known.
 * <p>
 * These failures are permanent for a given configuration and should not be retried.
 */
public class AzureConfigurationException extends RuntimeException {
    AzureConfigurationException(String message) {
        super(message);
    }
}
