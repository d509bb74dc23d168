// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.credentials;

import java.util.HashMap;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * Represents the constituent parts of a credential string, such as
 * {@code Authentication=ClientSecret;AzureCloud=AzureCloud;TenantId=...;ClientId=...;ClientSecret=...}.
 */
public final class AzureCredentialsString {
    private final Map<String, String> properties;

    /**
     * Initializes a new instance of the AzureCredentialsString class.
     *
     * @param credentialsString a semicolon-delimited list of {@code Key=Value} pairs
     * @throws IllegalArgumentException if the string is empty or has no Authentication property
     */
    public AzureCredentialsString(String credentialsString) {
        if (credentialsString == null || credentialsString.trim().isEmpty()) {
            throw new IllegalArgumentException("credentialsString must not be null or empty");
        }
        this.properties = parseCredentialsString(credentialsString);

        // Validate required properties
        this.getAuthentication();
    }

    /**
     * Parses a credential string into a credential descriptor.
     *
     * @param credentialsString the credential string
     * @return the credential descriptor
     * @throws IllegalArgumentException if the string is malformed or names an unsupported authentication type
     */
    public static AzureCredentials parse(String credentialsString) {
        return new AzureCredentialsString(credentialsString).getCredentials();
    }

    /**
     * Gets the authentication method specified in the credential string.
     *
     * @return the authentication method
     */
    public String getAuthentication() {
        return getRequiredValue("Authentication");
    }

    @Nullable
    public String getAzureCloud() {
        return getValue("AzureCloud");
    }

    @Nullable
    public String getAuthority() {
        return getValue("Authority");
    }

    @Nullable
    public String getTenantId() {
        return getValue("TenantId");
    }

    @Nullable
    public String getClientId() {
        return getValue("ClientId");
    }

    @Nullable
    public String getTokenFile() {
        return getValue("TokenFile");
    }

    /**
     * Builds the credential descriptor for the authentication type in the credential string.
     *
     * @return the credential descriptor
     * @throws IllegalArgumentException if the authentication type is unsupported or a required property is missing
     */
    public AzureCredentials getCredentials() {
        String authType = getAuthentication();

        // Parse the supported auth types in a case-insensitive way
        switch (authType.toLowerCase().trim()) {
            case "managedidentity":
                return new AzureManagedIdentityCredentials(getClientId());
            case "clientsecret":
                return new AzureClientSecretCredentials(
                        getAzureCloud(),
                        getAuthority(),
                        getRequiredValue("TenantId"),
                        getRequiredValue("ClientId"),
                        getRequiredValue("ClientSecret"));
            case "workloadidentity":
                return new AzureWorkloadIdentityCredentials(getTenantId(), getClientId(), getTokenFile());
            default:
                throw new IllegalArgumentException(
                        String.format("The credentials string contains an unsupported authentication type '%s'.", authType));
        }
    }

    @Nullable
    private String getValue(String name) {
        String value = this.properties.get(name);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value;
    }

    private String getRequiredValue(String name) {
        String value = getValue(name);
        if (value == null) {
            throw new IllegalArgumentException("The credentials string must contain a " + name + " property");
        }
        return value;
    }

    private static Map<String, String> parseCredentialsString(String credentialsString) {
        Map<String, String> properties = new HashMap<>();

        String[] pairs = credentialsString.split(";");
        for (String pair : pairs) {
            int equalsIndex = pair.indexOf('=');
            if (equalsIndex > 0) {
                String key = pair.substring(0, equalsIndex).trim();
                String value = pair.substring(equalsIndex + 1).trim();
                properties.put(key, value);
            }
        }

        return properties;
    }
}
