package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.type.ColumnType;

/**
 * Receives the values an aggregation body produces for one group.
 */
public interface ValueSink {

  /**
   * Records {@code value} for the column at {@code path}.
   *
   * @param type         declared type, or null to take the runtime type of the value
   * @param defaultValue value for groups that yield nothing at this path
   * @param guessType    take the runtime type even if a type is declared
   */
  NamedValue yieldValue(ColumnPath path, Object value, ColumnType type, Object defaultValue, boolean guessType);
}
