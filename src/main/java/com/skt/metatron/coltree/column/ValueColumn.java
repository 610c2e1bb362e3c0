package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leaf column holding scalar (or list) values of a declared element type.
 */
public class ValueColumn extends Column {
  private final List<Object> values;
  private final ColumnType type;

  public ValueColumn(String name, List<?> values, ColumnType type) {
    super(name);
    if (type == null) {
      throw new IllegalArgumentException("ValueColumn(): type is null: " + name);
    }
    this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
    this.type = type;
  }

  @Override
  public ColumnKind kind() {
    return ColumnKind.VALUE;
  }

  @Override
  public ColumnType type() {
    return type;
  }

  @Override
  public int size() {
    return values.size();
  }

  @Override
  public Object get(int rowno) {
    return values.get(rowno);
  }

  @Override
  public List<Object> values() {
    return values;
  }

  @Override
  public ValueColumn rename(String newName) {
    return new ValueColumn(newName, values, type);
  }

  public ValueColumn withType(ColumnType newType) {
    return new ValueColumn(name, values, newType);
  }

  @Override
  public ValueColumn slice(List<Integer> rownos) {
    List<Object> newValues = new ArrayList<>(rownos.size());
    for (int rowno : rownos) {
      newValues.add(values.get(rowno));
    }
    return new ValueColumn(name, newValues, type);
  }
}
