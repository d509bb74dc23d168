// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.Nullable;

final class AccessTokenFutures {
    private AccessTokenFutures() {}

    /**
     * Blocks until {@code future} completes, translating the ways waiting can end into this library's exceptions.
     */
    static String await(CompletableFuture<String> future, @Nullable Duration timeout) {
        try {
            if (timeout == null) {
                return future.get();
            }
            // Saturates instead of overflowing for very long timeouts
            return future.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new TokenCancellationException("Interrupted while waiting for an access token.", e);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new TokenCancellationException(
                    String.format("Timed out after %s while waiting for an access token.", timeout), e);
        } catch (CancellationException e) {
            throw new TokenCancellationException("The access token request was canceled.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TokenAcquisitionException("Failed to acquire an access token: " + cause, null, cause);
        }
    }
}
