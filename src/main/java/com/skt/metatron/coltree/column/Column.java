package com.skt.metatron.coltree.column;

import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, immutable sequence of values. Every column of a frame has the frame's row count.
 */
public abstract class Column {
  protected final String name;

  protected Column(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Column(): name is null");
    }
    this.name = name;
  }

  public String name() {
    return name;
  }

  public abstract ColumnKind kind();

  public abstract ColumnType type();

  public abstract int size();

  public abstract Object get(int rowno);

  public abstract Column rename(String newName);

  /**
   * Gathers the given rows, in the given order. The declared type is kept.
   */
  public abstract Column slice(List<Integer> rownos);

  public Column slice(int from, int to) {
    List<Integer> rownos = new ArrayList<>();
    for (int rowno = from; rowno < to; rowno++) {
      rownos.add(rowno);
    }
    return slice(rownos);
  }

  public List<Object> values() {
    List<Object> values = new ArrayList<>(size());
    for (int rowno = 0; rowno < size(); rowno++) {
      values.add(get(rowno));
    }
    return values;
  }

  public boolean hasNulls() {
    for (int rowno = 0; rowno < size(); rowno++) {
      if (get(rowno) == null) {
        return true;
      }
    }
    return false;
  }

  public boolean isGroup() {
    return kind() == ColumnKind.GROUP;
  }

  public boolean isFrame() {
    return kind() == ColumnKind.FRAME;
  }

  public GroupColumn asGroup() {
    if (!(this instanceof GroupColumn)) {
      throw new IllegalStateException("asGroup(): not a group column: " + name);
    }
    return (GroupColumn) this;
  }

  public FrameColumn asFrame() {
    if (!(this instanceof FrameColumn)) {
      throw new IllegalStateException("asFrame(): not a frame column: " + name);
    }
    return (FrameColumn) this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Column that = (Column) o;
    return name.equals(that.name) && type().equals(that.type()) && values().equals(that.values());
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + values().hashCode();
  }

  @Override
  public String toString() {
    return name + ": " + type() + " " + values();
  }
}
