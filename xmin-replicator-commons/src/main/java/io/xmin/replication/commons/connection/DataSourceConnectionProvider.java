package io.xmin.replication.commons.connection;

import io.xmin.replication.commons.checkpoint.Fingerprint;

import org.apache.commons.dbcp2.BasicDataSource;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

public class DataSourceConnectionProvider implements ConnectionProvider {
    public interface Configuration {
        String JDBC_URL = "jdbc.url";
        String JDBC_USERNAME = "jdbc.username";
        String JDBC_PASSWORD = "jdbc.password";
        String JDBC_DRIVER_CLASS = "jdbc.driver.class";
    }

    private static final String DEFAULT_DRIVER_CLASS = "org.postgresql.Driver";

    private final String url;
    private final BasicDataSource dataSource;

    public DataSourceConnectionProvider(String prefix, Map<String, Object> configuration, int poolSize) {
        Object url = configuration.get(String.format("%s.%s", prefix, Configuration.JDBC_URL));
        Object username = configuration.get(String.format("%s.%s", prefix, Configuration.JDBC_USERNAME));
        Object password = configuration.get(String.format("%s.%s", prefix, Configuration.JDBC_PASSWORD));
        Object driverClass = configuration.getOrDefault(
                String.format("%s.%s", prefix, Configuration.JDBC_DRIVER_CLASS),
                DataSourceConnectionProvider.DEFAULT_DRIVER_CLASS
        );

        Objects.requireNonNull(url, String.format("Configuration required: %s.%s", prefix, Configuration.JDBC_URL));

        this.url = url.toString();
        this.dataSource = new BasicDataSource();

        this.dataSource.setDriverClassName(driverClass.toString());
        this.dataSource.setUrl(this.url);

        if (username != null) {
            this.dataSource.setUsername(username.toString());
        }

        if (password != null) {
            this.dataSource.setPassword(password.toString());
        }

        this.dataSource.setMaxTotal(poolSize);
        this.dataSource.setMaxIdle(poolSize);
        this.dataSource.setTestOnBorrow(true);
    }

    public String getUrl() {
        return this.url;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return this.dataSource.getConnection();
    }

    @Override
    public String describe() {
        return Fingerprint.sanitize(this.url);
    }

    @Override
    public void close() throws IOException {
        try {
            this.dataSource.close();
        } catch (SQLException exception) {
            throw new IOException(String.format("error closing data source %s", this.describe()), exception);
        }
    }
}
