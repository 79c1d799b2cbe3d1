package org.funnelbuddy.config;

import io.airlift.configuration.Config;

import javax.validation.constraints.NotNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

public class JDBCConfig {
    private String url;
    private String username;
    private String password = "";
    private Integer maxConnection;
    private Long connectionIdleTimeout;
    private boolean connectionDisablePool;

    @NotNull
    public String getUrl() {
        return url;
    }

    @Config("url")
    public JDBCConfig setUrl(String url)
            throws URISyntaxException {
        if (url.startsWith("jdbc:")) {
            url = url.substring(5);
        }

        URI dbUri = new URI(url);
        String userInfo = dbUri.getUserInfo();
        if (userInfo != null) {
            String[] split = userInfo.split(":");
            this.username = split[0];
            if (split.length > 1) {
                this.password = split[1];
            }
        }

        String query = Optional.ofNullable(dbUri.getQuery()).orElse("");

        this.url = "jdbc:" + convertScheme(dbUri.getScheme()) + ":" +
                (dbUri.getHost() != null ? "//" + dbUri.getHost() : "") +
                ((dbUri.getHost() != null && dbUri.getPort() > -1) ? (":" + dbUri.getPort()) : "")
                + dbUri.getPath()
                + (query.isEmpty() ? "" : ("?" + query));

        return this;
    }

    public String getUsername() {
        return username;
    }

    @Config("username")
    public JDBCConfig setUsername(String username) {
        this.username = username;
        return this;
    }

    public Integer getMaxConnection() {
        return maxConnection;
    }

    @Config("max-connection")
    public JDBCConfig setMaxConnection(Integer maxConnection) {
        this.maxConnection = maxConnection;
        return this;
    }

    public String getPassword() {
        return password;
    }

    @Config("password")
    public JDBCConfig setPassword(String password) {
        this.password = password;
        return this;
    }

    public boolean getConnectionDisablePool() {
        return connectionDisablePool;
    }

    @Config("connection.disable-pool")
    public JDBCConfig setConnectionDisablePool(boolean connectionDisablePool) {
        this.connectionDisablePool = connectionDisablePool;
        return this;
    }

    public Long getConnectionIdleTimeout() {
        return connectionIdleTimeout;
    }

    @Config("connection.max-idle-timeout")
    public JDBCConfig setConnectionIdleTimeout(Long connectionIdleTimeout) {
        this.connectionIdleTimeout = connectionIdleTimeout;
        return this;
    }

    public String convertScheme(String scheme) {
        switch (scheme) {
            case "postgres":
                return "postgresql";
            default:
                return scheme;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JDBCConfig)) {
            return false;
        }

        JDBCConfig that = (JDBCConfig) o;
        return Objects.equals(url, that.url)
                && Objects.equals(username, that.username)
                && Objects.equals(password, that.password)
                && Objects.equals(maxConnection, that.maxConnection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, username, password, maxConnection);
    }

    @Override
    public String toString() {
        return username + "@" + url;
    }
}
