package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.type.ColumnType;

import java.util.List;

/**
 * Placeholder returned for an unresolved reference under the create policy. Holds no values.
 */
public class MissingColumn extends Column {

  public MissingColumn(String name) {
    super(name);
  }

  @Override
  public ColumnKind kind() {
    return ColumnKind.VALUE;
  }

  @Override
  public ColumnType type() {
    return ColumnType.ANY.withNullable(true);
  }

  @Override
  public int size() {
    return 0;
  }

  @Override
  public Object get(int rowno) {
    throw new IndexOutOfBoundsException("get(): missing column has no values: " + name);
  }

  @Override
  public MissingColumn rename(String newName) {
    return new MissingColumn(newName);
  }

  @Override
  public Column slice(List<Integer> rownos) {
    throw new UnsupportedOperationException("slice(): missing column: " + name);
  }
}
