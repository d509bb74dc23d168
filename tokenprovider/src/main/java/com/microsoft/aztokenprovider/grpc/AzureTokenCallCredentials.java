// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.aztokenprovider.grpc;

import com.microsoft.aztokenprovider.AzureAccessTokenProvider;

import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.Status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * gRPC call credentials that add an {@code Authorization: Bearer} header obtained from an
 * {@link AzureAccessTokenProvider} to every call.
 * <p>
 * If no token can be obtained the call fails with {@link Status#UNAUTHENTICATED}.
 */
public final class AzureTokenCallCredentials extends CallCredentials {
    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("Authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final AzureAccessTokenProvider tokenProvider;
    private final List<String> scopes;

    /**
     * Creates call credentials for the given scopes.
     *
     * @param tokenProvider the provider to obtain tokens from
     * @param scopes the scopes the tokens are requested for
     */
    public AzureTokenCallCredentials(AzureAccessTokenProvider tokenProvider, List<String> scopes) {
        this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider must not be null");
        Objects.requireNonNull(scopes, "scopes must not be null");
        this.scopes = Collections.unmodifiableList(new ArrayList<>(scopes));
    }

    /**
     * Creates call credentials for the {@code .default} scope of a resource, for example
     * {@code https://management.azure.com}.
     *
     * @param tokenProvider the provider to obtain tokens from
     * @param resourceId the resource ID
     * @return the call credentials
     */
    public static AzureTokenCallCredentials forResource(AzureAccessTokenProvider tokenProvider, String resourceId) {
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        String resource = resourceId.endsWith("/") ? resourceId.substring(0, resourceId.length() - 1) : resourceId;
        return new AzureTokenCallCredentials(tokenProvider, Collections.singletonList(resource + "/.default"));
    }

    List<String> getScopes() {
        return this.scopes;
    }

    @Override
    public void applyRequestMetadata(RequestInfo requestInfo, Executor appExecutor, MetadataApplier applier) {
        CompletableFuture<String> tokenFuture;
        try {
            tokenFuture = this.tokenProvider.getAccessTokenAsync(this.scopes);
        } catch (RuntimeException e) {
            applier.fail(Status.UNAUTHENTICATED.withDescription("Failed to acquire an access token.").withCause(e));
            return;
        }

        tokenFuture.whenCompleteAsync((token, throwable) -> {
            if (throwable != null) {
                Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause()
                        : throwable;
                applier.fail(Status.UNAUTHENTICATED.withDescription(cause.getMessage()).withCause(cause));
            } else {
                Metadata headers = new Metadata();
                headers.put(AUTHORIZATION, "Bearer " + token);
                applier.apply(headers);
            }
        }, appExecutor);
    }

    @Override
    public void thisUsesUnstableApi() {
        // no-op
    }
}
