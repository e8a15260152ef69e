package io.intellixity.vellum.persistence.jdbc;

import io.intellixity.vellum.persistence.exec.StorageException;
import io.intellixity.vellum.persistence.mapping.RowAdapter;

import java.sql.*;
import java.util.*;

/** {@link RowAdapter} over the current row of a {@link ResultSet}; labels match case-insensitively. */
public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  @Override
  public boolean has(String column) {
    try {
      return index().containsKey(column);
    } catch (SQLException e) {
      throw new StorageException("Failed to read result metadata", e);
    }
  }

  @Override
  public Object raw(String column) {
    try {
      Integer idx = index().get(column);
      if (idx == null) throw new IllegalArgumentException("Unknown column label: " + column);
      return rs.getObject(idx);
    } catch (SQLException e) {
      throw new StorageException("Failed to read column " + column, e);
    }
  }

  private Map<String, Integer> index() throws SQLException {
    if (colIndex == null) {
      Map<String, Integer> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      ResultSetMetaData md = rs.getMetaData();
      for (int i = 1; i <= md.getColumnCount(); i++) m.putIfAbsent(md.getColumnLabel(i), i);
      colIndex = m;
    }
    return colIndex;
  }
}
