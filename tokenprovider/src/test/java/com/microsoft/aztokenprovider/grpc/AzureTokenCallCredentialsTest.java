package com.microsoft.aztokenprovider.grpc;

import com.microsoft.aztokenprovider.AzureAccessTokenProvider;
import com.microsoft.aztokenprovider.TokenCache;
import com.microsoft.aztokenprovider.credentials.AzureManagedIdentityCredentials;
import com.microsoft.aztokenprovider.settings.AzureSettings;
import io.grpc.CallCredentials;
import io.grpc.Metadata;
import io.grpc.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link AzureTokenCallCredentials}.
 */
@ExtendWith(MockitoExtension.class)
public class AzureTokenCallCredentialsTest {

    private static final List<String> SCOPES = Collections.singletonList("https://durabletask.io/.default");

    @Mock
    private CallCredentials.MetadataApplier mockApplier;

    private static AzureAccessTokenProvider providerWithCache(TokenCache tokenCache) {
        AzureSettings settings = new AzureSettings().setManagedIdentityEnabled(true);
        return new AzureAccessTokenProvider(settings, new AzureManagedIdentityCredentials(), tokenCache);
    }

    @Test
    @DisplayName("applyRequestMetadata should add the bearer token header")
    public void applyRequestMetadata_AddsAuthorizationHeader() {
        // Arrange
        AtomicReference<List<String>> requestedScopes = new AtomicReference<>();
        AzureAccessTokenProvider provider = providerWithCache((retriever, scopes) -> {
            requestedScopes.set(scopes);
            return CompletableFuture.completedFuture("token1");
        });
        AzureTokenCallCredentials credentials = new AzureTokenCallCredentials(provider, SCOPES);

        // Act
        credentials.applyRequestMetadata(null, Runnable::run, mockApplier);

        // Assert
        ArgumentCaptor<Metadata> headers = ArgumentCaptor.forClass(Metadata.class);
        verify(mockApplier).apply(headers.capture());
        assertEquals("Bearer token1", headers.getValue().get(AzureTokenCallCredentials.AUTHORIZATION));
        assertEquals(SCOPES, requestedScopes.get());
        verify(mockApplier, never()).fail(any());
    }

    @Test
    @DisplayName("applyRequestMetadata should fail the call as unauthenticated when no token is available")
    public void applyRequestMetadata_AcquisitionFails_FailsUnauthenticated() {
        // Arrange
        CompletableFuture<String> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("identity provider unavailable"));
        AzureAccessTokenProvider provider = providerWithCache((retriever, scopes) -> failed);
        AzureTokenCallCredentials credentials = new AzureTokenCallCredentials(provider, SCOPES);

        // Act
        credentials.applyRequestMetadata(null, Runnable::run, mockApplier);

        // Assert
        ArgumentCaptor<Status> status = ArgumentCaptor.forClass(Status.class);
        verify(mockApplier).fail(status.capture());
        assertEquals(Status.Code.UNAUTHENTICATED, status.getValue().getCode());
        assertInstanceOf(IllegalStateException.class, status.getValue().getCause());
        verify(mockApplier, never()).apply(any());
    }

    @Test
    @DisplayName("applyRequestMetadata should fail the call when the request is rejected synchronously")
    public void applyRequestMetadata_RequestRejected_FailsUnauthenticated() {
        // Arrange
        AzureAccessTokenProvider provider = providerWithCache((retriever, scopes) -> {
            throw new IllegalArgumentException("scopes must not be empty");
        });
        AzureTokenCallCredentials credentials = new AzureTokenCallCredentials(provider, SCOPES);

        // Act
        credentials.applyRequestMetadata(null, Runnable::run, mockApplier);

        // Assert
        ArgumentCaptor<Status> status = ArgumentCaptor.forClass(Status.class);
        verify(mockApplier).fail(status.capture());
        assertEquals(Status.Code.UNAUTHENTICATED, status.getValue().getCode());
    }

    @Test
    @DisplayName("forResource should request the .default scope of the resource")
    public void forResource_UsesDefaultScope() {
        // Arrange
        AzureAccessTokenProvider provider =
            providerWithCache((retriever, scopes) -> CompletableFuture.completedFuture("token1"));

        // Act
        AzureTokenCallCredentials credentials =
            AzureTokenCallCredentials.forResource(provider, "https://management.azure.com/");

        // Assert
        assertEquals(Collections.singletonList("https://management.azure.com/.default"), credentials.getScopes());
    }
}
