package org.smileyface.newscrawler.elasticsearch;

/**
 * Simple context describing how to connect to an Elasticsearch cluster for a given tenant.
 * Contains a logical tenant id, the HTTP address/port of the Elasticsearch node and optional
 * basic-auth credentials.
 */
public final class ElasticContext {

    private final String tenantId;
    private final String address;
    private final int port;
    private final String username;
    private final String password;

    public ElasticContext(String tenantId, String address, int port) {
        this(tenantId, address, port, null, null);
    }

    public ElasticContext(String tenantId, String address, int port, String username, String password) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be null/blank");
        }
        this.tenantId = (tenantId == null || tenantId.isBlank()) ? "default" : tenantId;
        this.address = address.trim();
        this.port = port;
        this.username = (username == null || username.isBlank()) ? null : username;
        this.password = password;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean hasCredentials() {
        return username != null;
    }

    @Override
    public String toString() {
        return "ElasticContext{" +
                "tenantId='" + tenantId + '\'' +
                ", address='" + address + '\'' +
                ", port=" + port +
                ", auth=" + hasCredentials() +
                '}';
    }
}
