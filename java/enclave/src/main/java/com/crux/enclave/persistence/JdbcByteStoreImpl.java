package com.crux.enclave.persistence;

import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Optional;

import javax.sql.DataSource;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.utils.MetricsUtil;

/**
 * Provides a JDBC based implementation of {@link ByteStore}. By default it uses the table "encrypted_payload":
 * <pre>
 * CREATE TABLE encrypted_payload (
 *   digest  VARBINARY(64) NOT NULL PRIMARY KEY,
 *   payload BLOB          NOT NULL
 * );
 * </pre>
 */
public class JdbcByteStoreImpl implements ByteStore {
  private static final Logger logger = LoggerFactory.getLogger(JdbcByteStoreImpl.class);

  static final String DEFAULT_TABLE_NAME = "encrypted_payload";
  static final String PAYLOAD = "payload";

  private final Timer getTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".bytestore.jdbc.get");
  private final Timer putTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".bytestore.jdbc.put");
  private final Timer deleteTimer = Metrics.timer(MetricsUtil.ENCLAVE_METRICS_PREFIX + ".bytestore.jdbc.delete");

  private final DataSource dataSource;
  private final String getQuery;
  private final String insertQuery;
  private final String updateQuery;
  private final String deleteQuery;

  /**
   * Initialize a {@code JdbcByteStoreImpl} builder using the provided parameter.
   *
   * @param dataSource The {@link javax.sql.DataSource} object used to connect to the database.
   * @return The current {@link Builder} step.
   */
  public static Builder newBuilder(final DataSource dataSource) {
    return new Builder(dataSource);
  }

  JdbcByteStoreImpl(final DataSource dataSource, final String tableName) {
    this.dataSource = dataSource;
    this.getQuery = "SELECT payload FROM " + tableName + " WHERE digest = ?";
    this.insertQuery = "INSERT INTO " + tableName + " (digest, payload) VALUES (?, ?)";
    this.updateQuery = "UPDATE " + tableName + " SET payload = ? WHERE digest = ?";
    this.deleteQuery = "DELETE FROM " + tableName + " WHERE digest = ?";
  }

  Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  String getGetQuery() {
    return getQuery;
  }

  String getInsertQuery() {
    return insertQuery;
  }

  String getUpdateQuery() {
    return updateQuery;
  }

  String getDeleteQuery() {
    return deleteQuery;
  }

  @Override
  public Optional<byte[]> get(final byte[] key) {
    return getTimer.record(() -> {
      try (Connection connection = getConnection();
           PreparedStatement preparedStatement = connection.prepareStatement(getQuery)) {
        preparedStatement.setBytes(1, key);

        try (ResultSet resultSet = preparedStatement.executeQuery()) {
          if (resultSet.next()) {
            return Optional.of(resultSet.getBytes(PAYLOAD));
          }
        }
        return Optional.<byte[]>empty();
      }
      catch (SQLException se) {
        logger.error("Byte store error during get", se);
        throw new EnclaveException("Byte store error", se);
      }
    });
  }

  @Override
  public void put(final byte[] key, final byte[] value) {
    putTimer.record(() -> {
      try (Connection connection = getConnection()) {
        try (PreparedStatement update = connection.prepareStatement(updateQuery)) {
          update.setBytes(1, value);
          update.setBytes(2, key);
          if (update.executeUpdate() > 0) {
            return;
          }
        }

        try (PreparedStatement insert = connection.prepareStatement(insertQuery)) {
          insert.setBytes(1, key);
          insert.setBytes(2, value);
          insert.executeUpdate();
        }
        catch (SQLIntegrityConstraintViolationException iv) {
          // Inserted concurrently, and equal digests mean equal content
          logger.info("Payload already stored by a concurrent writer");
        }
      }
      catch (SQLException se) {
        logger.error("Byte store error during put", se);
        throw new EnclaveException("Byte store error", se);
      }
    });
  }

  @Override
  public boolean delete(final byte[] key) {
    return deleteTimer.record(() -> {
      try (Connection connection = getConnection();
           PreparedStatement preparedStatement = connection.prepareStatement(deleteQuery)) {
        preparedStatement.setBytes(1, key);

        return preparedStatement.executeUpdate() > 0;
      }
      catch (SQLException se) {
        logger.error("Byte store error during delete", se);
        throw new EnclaveException("Byte store error", se);
      }
    });
  }

  /**
   * Closes the data source if it is {@link Closeable}, as a connection pool is.
   */
  @Override
  public void close() {
    if (dataSource instanceof Closeable) {
      try {
        ((Closeable) dataSource).close();
      }
      catch (IOException e) {
        logger.error("unable to close data source", e);
      }
    }
  }

  public static final class Builder {
    private final DataSource dataSource;
    private String tableName = DEFAULT_TABLE_NAME;

    private Builder(final DataSource dataSource) {
      this.dataSource = dataSource;
    }

    /**
     * Specifies the name of the table that stores payloads.
     *
     * @param table The table name. Must be a plain SQL identifier.
     * @return The current {@code Builder} step.
     */
    public Builder withTableName(final String table) {
      if (table == null || !table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
        throw new IllegalArgumentException("invalid table name: " + table);
      }
      this.tableName = table;
      return this;
    }

    /**
     * Builds the {@code JdbcByteStoreImpl} object.
     *
     * @return The fully instantiated {@code JdbcByteStoreImpl} object.
     */
    public JdbcByteStoreImpl build() {
      return new JdbcByteStoreImpl(dataSource, tableName);
    }
  }
}
