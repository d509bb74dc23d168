// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.settings;

import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Process-wide settings that control which Azure credentials may be used and how they are resolved.
 */
public class AzureSettings {
    static final String AZURE_CLOUD = "AZURE_CLOUD";
    static final String MANAGED_IDENTITY_ENABLED = "AZURE_MANAGED_IDENTITY_ENABLED";
    static final String MANAGED_IDENTITY_CLIENT_ID = "AZURE_MANAGED_IDENTITY_CLIENT_ID";
    static final String WORKLOAD_IDENTITY_ENABLED = "AZURE_WORKLOAD_IDENTITY_ENABLED";
    static final String WORKLOAD_IDENTITY_TENANT_ID = "AZURE_WORKLOAD_IDENTITY_TENANT_ID";
    static final String WORKLOAD_IDENTITY_CLIENT_ID = "AZURE_WORKLOAD_IDENTITY_CLIENT_ID";
    static final String WORKLOAD_IDENTITY_TOKEN_FILE = "AZURE_WORKLOAD_IDENTITY_TOKEN_FILE";

    private String azureCloud = AzureClouds.AZURE_PUBLIC;
    private boolean managedIdentityEnabled = false;
    private String managedIdentityClientId;
    private boolean workloadIdentityEnabled = false;
    private WorkloadIdentitySettings workloadIdentitySettings = new WorkloadIdentitySettings();

    /**
     * Creates a new instance of AzureSettings with all identity-based authentication disabled.
     */
    public AzureSettings() {
    }

    /**
     * Creates a new instance of AzureSettings from the environment variables of the current process.
     *
     * @return a new AzureSettings object
     * @throws IllegalArgumentException if a variable has an invalid value
     */
    public static AzureSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Creates a new instance of AzureSettings from a map of environment variables.
     * <p>
     * Unset variables keep their defaults.
     *
     * @param environment the environment variables
     * @return a new AzureSettings object
     * @throws IllegalArgumentException if a variable has an invalid value
     */
    public static AzureSettings fromEnvironment(Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment must not be null");

        AzureSettings settings = new AzureSettings();
        String cloud = getValue(environment, AZURE_CLOUD);
        if (cloud != null) {
            settings.setAzureCloud(cloud);
        }
        settings.setManagedIdentityEnabled(getBoolean(environment, MANAGED_IDENTITY_ENABLED));
        settings.setManagedIdentityClientId(getValue(environment, MANAGED_IDENTITY_CLIENT_ID));
        settings.setWorkloadIdentityEnabled(getBoolean(environment, WORKLOAD_IDENTITY_ENABLED));
        settings.setWorkloadIdentitySettings(new WorkloadIdentitySettings()
                .setTenantId(getValue(environment, WORKLOAD_IDENTITY_TENANT_ID))
                .setClientId(getValue(environment, WORKLOAD_IDENTITY_CLIENT_ID))
                .setTokenFile(getValue(environment, WORKLOAD_IDENTITY_TOKEN_FILE)));
        return settings;
    }

    /**
     * Gets the default Azure cloud, used when a credential does not name one.
     *
     * @return the cloud name
     */
    public String getAzureCloud() {
        return azureCloud;
    }

    public AzureSettings setAzureCloud(String azureCloud) {
        this.azureCloud = azureCloud;
        return this;
    }

    public boolean isManagedIdentityEnabled() {
        return managedIdentityEnabled;
    }

    public AzureSettings setManagedIdentityEnabled(boolean managedIdentityEnabled) {
        this.managedIdentityEnabled = managedIdentityEnabled;
        return this;
    }

    /**
     * Gets the client ID of the user-assigned managed identity used when a credential does not specify one.
     *
     * @return the client ID, or null to use the system-assigned identity
     */
    @Nullable
    public String getManagedIdentityClientId() {
        return managedIdentityClientId;
    }

    public AzureSettings setManagedIdentityClientId(@Nullable String managedIdentityClientId) {
        this.managedIdentityClientId = managedIdentityClientId;
        return this;
    }

    public boolean isWorkloadIdentityEnabled() {
        return workloadIdentityEnabled;
    }

    public AzureSettings setWorkloadIdentityEnabled(boolean workloadIdentityEnabled) {
        this.workloadIdentityEnabled = workloadIdentityEnabled;
        return this;
    }

    public WorkloadIdentitySettings getWorkloadIdentitySettings() {
        return workloadIdentitySettings;
    }

    public AzureSettings setWorkloadIdentitySettings(WorkloadIdentitySettings workloadIdentitySettings) {
        this.workloadIdentitySettings = Objects.requireNonNull(
                workloadIdentitySettings, "workloadIdentitySettings must not be null");
        return this;
    }

    @Nullable
    private static String getValue(Map<String, String> environment, String name) {
        String value = environment.get(name);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static boolean getBoolean(Map<String, String> environment, String name) {
        String value = getValue(environment, name);
        if (value == null) {
            return false;
        }
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(
                String.format("The environment variable %s must be 'true' or 'false' but was '%s'.", name, value));
    }
}
