package com.skt.metatron.coltree;

import com.skt.metatron.coltree.column.ColumnPath;

import java.util.ArrayList;
import java.util.List;

/**
 * View of one row of a frame. Nested groups appear as nested rows.
 */
public class Row {
  private final DataFrame owner;
  private final int index;

  Row(DataFrame owner, int index) {
    this.owner = owner;
    this.index = index;
  }

  public DataFrame owner() {
    return owner;
  }

  public int index() {
    return index;
  }

  public int size() {
    return owner.ncol();
  }

  public Object get(int colno) {
    return owner.column(colno).get(index);
  }

  public Object get(String colName) throws ColumnResolutionException {
    return owner.column(colName).get(index);
  }

  public Object get(ColumnPath path) throws ColumnResolutionException {
    return owner.column(path).get(index);
  }

  public List<String> names() {
    return owner.columnNames();
  }

  public List<Object> values() {
    List<Object> values = new ArrayList<>(owner.ncol());
    for (int colno = 0; colno < owner.ncol(); colno++) {
      values.add(get(colno));
    }
    return values;
  }

  public DataFrame toDataFrame() {
    return owner.getRows(index, index + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row that = (Row) o;
    return names().equals(that.names()) && values().equals(that.values());
  }

  @Override
  public int hashCode() {
    return values().hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    List<String> names = names();
    for (int colno = 0; colno < names.size(); colno++) {
      if (colno > 0) {
        sb.append(", ");
      }
      sb.append(names.get(colno)).append("=").append(get(colno));
    }
    return sb.append("}").toString();
  }
}
