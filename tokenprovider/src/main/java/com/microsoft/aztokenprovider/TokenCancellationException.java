// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

/**
 * Exception that gets thrown when a caller stops waiting for an access token, because its thread was interrupted,
 * its timeout elapsed, or its future was canceled.
 * <p>
 * Only the waiting caller is affected. An acquisition that other callers share keeps running.
 */
public final class TokenCancellationException extends RuntimeException {
    TokenCancellationException(String message, Throwable cause) {
        super(message, cause);
    }
}
