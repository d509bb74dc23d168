// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.aztokenprovider.settings;

import com.azure.identity.AzureAuthorityHosts;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * Names of the supported Azure clouds and the Microsoft Entra ID authority host of each.
 */
public final class AzureClouds {
    public static final String AZURE_PUBLIC = "AzureCloud";
    public static final String AZURE_CHINA = "AzureChinaCloud";
    public static final String AZURE_US_GOVERNMENT = "AzureUSGovernment";

    private static final Map<String, String> AUTHORITY_HOSTS = initAuthorityHosts();

    private AzureClouds() {}

    private static Map<String, String> initAuthorityHosts() {
        Map<String, String> hosts = new HashMap<>();
        hosts.put(AZURE_PUBLIC, AzureAuthorityHosts.AZURE_PUBLIC_CLOUD);
        hosts.put(AZURE_CHINA, AzureAuthorityHosts.AZURE_CHINA);
        hosts.put(AZURE_US_GOVERNMENT, AzureAuthorityHosts.AZURE_GOVERNMENT);
        return Collections.unmodifiableMap(hosts);
    }

    /**
     * Gets the authority host of an Azure cloud.
     *
     * @param azureCloud the cloud name
     * @return the authority host URL, or null if the cloud is not known
     */
    @Nullable
    public static String getAuthorityHost(@Nullable String azureCloud) {
        if (azureCloud == null) {
            return null;
        }
        return AUTHORITY_HOSTS.get(azureCloud);
    }

    /**
     * Gets the names of all known clouds.
     *
     * @return an unmodifiable set of cloud names
     */
    public static Set<String> getCloudNames() {
        return AUTHORITY_HOSTS.keySet();
    }
}
