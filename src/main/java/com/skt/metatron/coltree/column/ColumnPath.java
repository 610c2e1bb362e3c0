package com.skt.metatron.coltree.column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered list of column names from the root of a frame down to a column. Immutable.
 */
public final class ColumnPath implements Iterable<String> {
  private static final ColumnPath EMPTY = new ColumnPath(Collections.<String>emptyList());

  private final List<String> names;

  private ColumnPath(List<String> names) {
    this.names = names;
  }

  public static ColumnPath empty() {
    return EMPTY;
  }

  public static ColumnPath of(String... names) {
    return of(Arrays.asList(names));
  }

  public static ColumnPath of(List<String> names) {
    if (names.isEmpty()) {
      return EMPTY;
    }
    for (String name : names) {
      if (name == null) {
        throw new IllegalArgumentException("ColumnPath(): null name in " + names);
      }
    }
    return new ColumnPath(Collections.unmodifiableList(new ArrayList<>(names)));
  }

  public int size() {
    return names.size();
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  public String get(int index) {
    return names.get(index);
  }

  public List<String> names() {
    return names;
  }

  public String last() {
    if (names.isEmpty()) {
      throw new IllegalStateException("last(): empty path");
    }
    return names.get(names.size() - 1);
  }

  public ColumnPath last(int count) {
    if (count >= names.size()) {
      return this;
    }
    return new ColumnPath(names.subList(names.size() - count, names.size()));
  }

  public ColumnPath dropLast() {
    return dropLast(1);
  }

  public ColumnPath dropLast(int count) {
    if (count >= names.size()) {
      return EMPTY;
    }
    return new ColumnPath(names.subList(0, names.size() - count));
  }

  public ColumnPath dropFirst() {
    if (names.size() <= 1) {
      return EMPTY;
    }
    return new ColumnPath(names.subList(1, names.size()));
  }

  public ColumnPath take(int count) {
    if (count >= names.size()) {
      return this;
    }
    return of(names.subList(0, count));
  }

  public ColumnPath plus(String name) {
    List<String> newNames = new ArrayList<>(names);
    newNames.add(name);
    return of(newNames);
  }

  public ColumnPath plus(ColumnPath path) {
    if (path.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return path;
    }
    List<String> newNames = new ArrayList<>(names);
    newNames.addAll(path.names);
    return of(newNames);
  }

  public ColumnPath replaceLast(String name) {
    if (names.isEmpty()) {
      return of(name);
    }
    return dropLast().plus(name);
  }

  // true for equal paths too
  public boolean startsWith(ColumnPath prefix) {
    if (prefix.size() > names.size()) {
      return false;
    }
    return names.subList(0, prefix.size()).equals(prefix.names);
  }

  @Override
  public Iterator<String> iterator() {
    return names.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnPath)) {
      return false;
    }
    return names.equals(((ColumnPath) o).names);
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public String toString() {
    return String.join(".", names);
  }
}
