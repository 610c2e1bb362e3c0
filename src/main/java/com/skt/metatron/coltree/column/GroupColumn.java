package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.Row;
import com.skt.metatron.coltree.type.ColumnType;

import java.util.List;

/**
 * Named column whose cells are the rows of a nested frame of the same row count.
 */
public class GroupColumn extends Column {
  private final DataFrame df;

  public GroupColumn(String name, DataFrame df) {
    super(name);
    if (df == null) {
      throw new IllegalArgumentException("GroupColumn(): df is null: " + name);
    }
    this.df = df;
  }

  public static GroupColumn create(String name, DataFrame df) {
    return new GroupColumn(name, df);
  }

  public DataFrame df() {
    return df;
  }

  public GroupColumn withDf(DataFrame newDf) {
    return new GroupColumn(name, newDf);
  }

  @Override
  public ColumnKind kind() {
    return ColumnKind.GROUP;
  }

  @Override
  public ColumnType type() {
    return ColumnType.ROW;
  }

  @Override
  public int size() {
    return df.nrow();
  }

  @Override
  public Row get(int rowno) {
    return df.row(rowno);
  }

  @Override
  public GroupColumn rename(String newName) {
    return new GroupColumn(newName, df);
  }

  @Override
  public GroupColumn slice(List<Integer> rownos) {
    return new GroupColumn(name, df.getRows(rownos));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupColumn)) {
      return false;
    }
    GroupColumn that = (GroupColumn) o;
    return name.equals(that.name) && df.equals(that.df);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + df.hashCode();
  }

  @Override
  public String toString() {
    return name + ": " + df.columnNames();
  }
}
