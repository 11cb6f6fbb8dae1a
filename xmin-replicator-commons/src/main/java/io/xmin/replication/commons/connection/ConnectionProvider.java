package io.xmin.replication.commons.connection;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.SQLException;

public interface ConnectionProvider extends Closeable {
    Connection getConnection() throws SQLException;

    String describe();
}
