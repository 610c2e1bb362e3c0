package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.DataFrame;

/**
 * A resolved column together with its path from the root of {@link #df()}.
 */
public class ColumnWithPath {
  private final Column column;
  private final ColumnPath path;
  private final DataFrame df;

  public ColumnWithPath(Column column, ColumnPath path, DataFrame df) {
    this.column = column;
    this.path = path;
    this.df = df;
  }

  public Column column() {
    return column;
  }

  public ColumnPath path() {
    return path;
  }

  // the root frame the path is relative to
  public DataFrame df() {
    return df;
  }

  public String name() {
    return column.name();
  }

  public int depth() {
    return path.size() - 1;
  }

  public boolean isMissing() {
    return column instanceof MissingColumn;
  }

  public ColumnWithPath changePath(ColumnPath newPath) {
    return new ColumnWithPath(column, newPath, df);
  }

  @Override
  public String toString() {
    return path + " (" + column.kind() + ")";
  }
}
