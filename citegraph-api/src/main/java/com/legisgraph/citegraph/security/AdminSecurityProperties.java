package com.legisgraph.citegraph.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "citegraph.security")
public class AdminSecurityProperties {

    /**
     * Bearer token required on {@code /admin/**}. Admin endpoints reject every request while it is unset.
     */
    private String adminToken;

    public String getAdminToken() {
        return adminToken;
    }

    public void setAdminToken(String adminToken) {
        this.adminToken = adminToken;
    }

    public boolean hasAdminToken() {
        return adminToken != null && !adminToken.isBlank();
    }
}
