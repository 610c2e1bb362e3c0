package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.type.ColumnType;

/**
 * One yielded value with its target path and typing hints.
 */
public final class NamedValue {
  private final ColumnPath path;
  private final Object value;
  private final ColumnType type;
  private final Object defaultValue;
  private final boolean guessType;

  private NamedValue(ColumnPath path, Object value, ColumnType type, Object defaultValue, boolean guessType) {
    this.path = path;
    this.value = value;
    this.type = type;
    this.defaultValue = defaultValue;
    this.guessType = guessType;
  }

  /**
   * Unwraps {@link YieldValue}s: a named value replaces the last name of the path, a defaulted value
   * overrides the default.
   */
  public static NamedValue create(ColumnPath path, Object value, ColumnType type, Object defaultValue, boolean guessType) {
    if (value instanceof YieldValue.Plain) {
      return create(path, ((YieldValue.Plain) value).getValue(), type, defaultValue, guessType);
    }
    if (value instanceof YieldValue.Named) {
      YieldValue.Named named = (YieldValue.Named) value;
      return create(path.replaceLast(named.getName()), named.getValue(), type, defaultValue, guessType);
    }
    if (value instanceof YieldValue.Defaulted) {
      YieldValue.Defaulted defaulted = (YieldValue.Defaulted) value;
      return create(path, defaulted.getValue(), type, defaulted.getDefaultValue(), guessType);
    }
    return new NamedValue(path, value, type, defaultValue, guessType);
  }

  public ColumnPath getPath() {
    return path;
  }

  public Object getValue() {
    return value;
  }

  public ColumnType getType() {
    return type;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  public boolean isGuessType() {
    return guessType;
  }

  public NamedValue withPath(ColumnPath newPath) {
    return new NamedValue(newPath, value, type, defaultValue, guessType);
  }

  @Override
  public String toString() {
    return path + "=" + value;
  }
}
