package io.intellixity.polydb.jdbc.connect;

import java.sql.Connection;
import java.sql.SQLException;

/** Opens a connection for one operation. The caller closes it. */
@FunctionalInterface
public interface JdbcConnector {
  Connection open(JdbcTarget target) throws SQLException;
}
