package com.skt.metatron.coltree;

import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.type.ColumnFactory;
import com.skt.metatron.coltree.type.ColumnType;
import com.skt.metatron.coltree.type.TypeLattice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builders for frames: concatenation, records and string grids.
 */
public class DataFrames {
  private static Logger LOGGER = LoggerFactory.getLogger(DataFrames.class);

  private DataFrames() {
  }

  /**
   * Stacks frames vertically. Columns are matched by name, in first-appearance order. A column
   * missing from some frame is filled with nulls for that frame's rows.
   */
  public static DataFrame concat(List<DataFrame> frames) throws StructuralException {
    if (frames.isEmpty()) {
      return DataFrame.empty();
    }
    if (frames.size() == 1) {
      return frames.get(0);
    }

    int totalRows = 0;
    Set<String> names = new LinkedHashSet<>();
    for (DataFrame df : frames) {
      totalRows += df.nrow();
      names.addAll(df.columnNames());
    }

    List<Column> newColumns = new ArrayList<>();
    for (String name : names) {
      newColumns.add(concatColumn(name, frames));
    }
    if (newColumns.isEmpty()) {
      return DataFrame.empty(totalRows);
    }
    return new DataFrame(newColumns);
  }

  private static Column concatColumn(String name, List<DataFrame> frames) throws StructuralException {
    boolean allGroups = true;
    boolean allFrames = true;
    boolean allValues = true;
    boolean absent = false;
    List<ColumnType> types = new ArrayList<>();
    for (DataFrame df : frames) {
      Column column = df.tryGetColumn(name);
      if (column == null) {
        absent |= df.nrow() > 0;
        continue;
      }
      allGroups &= column.isGroup();
      allFrames &= column.isFrame();
      allValues &= column instanceof ValueColumn;
      types.add(column.type());
    }
    if (absent) {
      LOGGER.warn("concat(): column {} is missing in some frames", name);
    }

    if (allGroups) {
      List<DataFrame> children = new ArrayList<>();
      for (DataFrame df : frames) {
        Column column = df.tryGetColumn(name);
        children.add(column == null ? DataFrame.empty(df.nrow()) : column.asGroup().df());
      }
      return GroupColumn.create(name, concat(children));
    }

    List<Object> values = new ArrayList<>();
    for (DataFrame df : frames) {
      Column column = df.tryGetColumn(name);
      for (int rowno = 0; rowno < df.nrow(); rowno++) {
        values.add(column == null ? null : column.get(rowno));
      }
    }

    if (allFrames) {
      List<DataFrame> cells = new ArrayList<>();
      for (Object value : values) {
        cells.add((DataFrame) value);
      }
      return new FrameColumn(name, cells);
    }
    if (allValues) {
      ColumnType type = TypeLattice.commonSupertype(types);
      return ColumnFactory.createValueColumn(name, values, type.withNullable(type.isNullable() || absent));
    }
    LOGGER.warn("concat(): column {} has mixed kinds, guessing its type", name);
    return ColumnFactory.guessColumnType(name, values);
  }

  /**
   * Builds a frame from records. Nested maps become group columns, lists of maps become frame
   * columns. Keys are collected in first-appearance order; a key absent from a record is null.
   */
  public static DataFrame fromRecords(List<? extends Map<String, ?>> records) throws StructuralException {
    Set<String> keys = new LinkedHashSet<>();
    for (Map<String, ?> record : records) {
      keys.addAll(record.keySet());
    }

    List<Column> columns = new ArrayList<>();
    for (String key : keys) {
      List<Object> values = new ArrayList<>(records.size());
      boolean anyNonNull = false;
      boolean allMaps = true;
      boolean allRecordLists = true;
      for (Map<String, ?> record : records) {
        Object value = record.get(key);
        values.add(value);
        if (value == null) {
          continue;
        }
        anyNonNull = true;
        allMaps &= value instanceof Map;
        allRecordLists &= isRecordList(value);
      }

      if (anyNonNull && allMaps) {
        List<Map<String, ?>> nested = new ArrayList<>();
        for (Object value : values) {
          nested.add(value == null ? new LinkedHashMap<String, Object>() : (Map<String, ?>) value);
        }
        DataFrame df = fromRecords(nested);
        columns.add(GroupColumn.create(key, df.ncol() == 0 ? DataFrame.empty(records.size()) : df));
      } else if (anyNonNull && allRecordLists) {
        List<DataFrame> frames = new ArrayList<>();
        for (Object value : values) {
          frames.add(value == null ? null : fromRecords((List<Map<String, ?>>) value));
        }
        columns.add(new FrameColumn(key, frames));
      } else {
        columns.add(ColumnFactory.guessColumnType(key, values));
      }
    }
    if (columns.isEmpty()) {
      return DataFrame.empty(records.size());
    }
    return new DataFrame(columns);
  }

  private static boolean isRecordList(Object value) {
    if (!(value instanceof List)) {
      return false;
    }
    for (Object element : (List<?>) value) {
      if (!(element instanceof Map)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Builds a frame of nullable string columns from a grid. Without a header row the columns are
   * named column1, column2, ...
   */
  public static DataFrame fromGrid(List<String[]> grid, boolean header) throws StructuralException {
    if (grid == null) {
      LOGGER.warn("fromGrid(): null grid");
      return DataFrame.empty();
    }
    if (grid.size() == 0) {
      LOGGER.warn("fromGrid(): empty grid");
      return DataFrame.empty();
    }

    int colCnt = grid.get(0).length;
    List<String> colNames = new ArrayList<>();
    for (int colno = 1; colno <= colCnt; colno++) {
      colNames.add(header ? grid.get(0)[colno - 1].trim() : "column" + colno);
    }

    List<List<Object>> values = new ArrayList<>();
    for (int colno = 0; colno < colCnt; colno++) {
      values.add(new ArrayList<>());
    }
    for (int rowno = header ? 1 : 0; rowno < grid.size(); rowno++) {
      String[] strRow = grid.get(rowno);
      for (int colno = 0; colno < colCnt; colno++) {
        // short rows are padded with nulls
        values.get(colno).add(colno < strRow.length ? strRow[colno] : null);
      }
    }

    List<Column> columns = new ArrayList<>();
    for (int colno = 0; colno < colCnt; colno++) {
      boolean hasNulls = values.get(colno).contains(null);
      columns.add(new ValueColumn(colNames.get(colno), values.get(colno), ColumnType.STRING.withNullable(hasNulls)));
    }
    return new DataFrame(columns);
  }
}
