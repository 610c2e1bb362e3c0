package com.skt.metatron.coltree.type;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.DataFrames;
import com.skt.metatron.coltree.Row;
import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.column.ValueColumn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds columns from raw values.
 */
public class ColumnFactory {

  private ColumnFactory() {
  }

  /**
   * Picks the column kind from the values: all frames (or null) make a frame column, all rows
   * (or null) make a group column, anything else a value column of the common runtime type.
   */
  public static Column guessColumnType(String name, List<?> values) throws StructuralException {
    boolean anyNonNull = false;
    boolean allFrames = true;
    boolean allRows = true;
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      anyNonNull = true;
      allFrames &= value instanceof DataFrame;
      allRows &= value instanceof Row;
    }

    if (anyNonNull && allFrames) {
      return new FrameColumn(name, (List<DataFrame>) values);
    }
    if (anyNonNull && allRows) {
      List<DataFrame> rowFrames = new ArrayList<>(values.size());
      for (Object value : values) {
        rowFrames.add(value == null ? DataFrame.empty(1) : ((Row) value).toDataFrame());
      }
      return GroupColumn.create(name, DataFrames.concat(rowFrames));
    }
    return createValueColumn(name, values, guessValueType(values));
  }

  public static ColumnType guessValueType(List<?> values) {
    List<ColumnType> types = new ArrayList<>();
    boolean hasNulls = false;
    for (Object value : values) {
      if (value == null) {
        hasNulls = true;
      } else {
        types.add(ColumnType.ofValue(value));
      }
    }
    if (types.isEmpty()) {
      return ColumnType.ANY.withNullable(true);
    }
    ColumnType type = TypeLattice.commonSupertype(types);
    return type.withNullable(type.isNullable() || hasNulls);
  }

  /**
   * Creates a value column of {@code type}, widening numbers to the column's numeric class and
   * wrapping scalars when the column is a list column.
   */
  public static ValueColumn createValueColumn(String name, List<?> values, ColumnType type) {
    Class<?> javaClass = type.getDataType().javaClass();
    boolean widen = type.getDataType().isNumeric() && javaClass != null;

    List<Object> normalized = new ArrayList<>(values.size());
    for (Object value : values) {
      if (value == null) {
        normalized.add(null);
      } else if (type.isList() && !(value instanceof List)) {
        normalized.add(Collections.singletonList(value));
      } else if (widen && value instanceof Number && value.getClass() != javaClass) {
        normalized.add(Numbers.convert((Number) value, type.getDataType()));
      } else {
        normalized.add(value);
      }
    }
    return new ValueColumn(name, normalized, type);
  }
}
