package io.intellixity.polydb.jdbc.connect;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/** Unpooled connector: a fresh driver connection per call. */
public final class DriverManagerConnector implements JdbcConnector {
  public static final DriverManagerConnector INSTANCE = new DriverManagerConnector();

  private DriverManagerConnector() {}

  @Override
  public Connection open(JdbcTarget target) throws SQLException {
    return DriverManager.getConnection(target.url(), target.toProperties());
  }
}
