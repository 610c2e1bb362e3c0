package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.Row;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.tree.ColumnInserter;
import com.skt.metatron.coltree.tree.ColumnToInsert;
import com.skt.metatron.coltree.type.ColumnFactory;
import com.skt.metatron.coltree.type.ColumnType;
import com.skt.metatron.coltree.type.DataType;
import com.skt.metatron.coltree.type.TypeLattice;
import org.apache.commons.collections.map.ListOrderedMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Merges the values yielded by every group into one frame, one row per group.
 *
 * Columns appear in the order their paths were first yielded. A group that yielded nothing at a path
 * gets the first default declared for it, or null. Several values at one path in one group become a
 * list, and a column mixing lists and single values becomes a list column.
 */
public class AggregationResult {

  private AggregationResult() {
  }

  public static DataFrame build(List<List<NamedValue>> rows) throws ColTreeException {
    ListOrderedMap registry = new ListOrderedMap();
    for (int rowno = 0; rowno < rows.size(); rowno++) {
      for (NamedValue value : rows.get(rowno)) {
        ColumnPath path = value.getPath().isEmpty() ? ColumnPath.of("") : value.getPath();
        PathValues pathValues = (PathValues) registry.get(path);
        if (pathValues == null) {
          pathValues = new PathValues(path, rows.size());
          registry.put(path, pathValues);
        }
        pathValues.add(rowno, value);
      }
    }

    if (registry.isEmpty()) {
      return DataFrame.empty(rows.size());
    }

    List<ColumnToInsert> toInsert = new ArrayList<>();
    for (int i = 0; i < registry.size(); i++) {
      PathValues pathValues = (PathValues) registry.getValue(i);
      toInsert.add(new ColumnToInsert(pathValues.path, null, pathValues.toColumn()));
    }
    return ColumnInserter.insert(null, toInsert);
  }

  private static class PathValues {
    private final ColumnPath path;
    private final List<List<NamedValue>> cells;
    private Object defaultValue;
    private ColumnType declaredType;

    PathValues(ColumnPath path, int nrow) {
      this.path = path;
      this.cells = new ArrayList<>(nrow);
      for (int rowno = 0; rowno < nrow; rowno++) {
        cells.add(new ArrayList<NamedValue>());
      }
    }

    void add(int rowno, NamedValue value) {
      cells.get(rowno).add(value);
      if (defaultValue == null && value.getDefaultValue() != null) {
        defaultValue = value.getDefaultValue();
      }
      if (declaredType == null && value.getType() != null) {
        declaredType = value.getType();
      }
    }

    Column toColumn() throws ColTreeException {
      List<Object> values = new ArrayList<>(cells.size());
      List<ColumnType> types = new ArrayList<>();
      boolean hasNulls = false;
      boolean allDerivedKinds = true;

      for (List<NamedValue> cell : cells) {
        Object value;
        ColumnType type;
        if (cell.isEmpty()) {
          value = defaultValue;
          type = value == null ? null : ColumnType.ofValue(value);
        } else if (cell.size() == 1) {
          NamedValue namedValue = cell.get(0);
          value = namedValue.getValue();
          type = value == null ? null : typeOf(namedValue);
        } else {
          List<Object> list = new ArrayList<>();
          List<ColumnType> elementTypes = new ArrayList<>();
          for (NamedValue namedValue : cell) {
            list.add(namedValue.getValue());
            elementTypes.add(namedValue.getValue() == null ? ColumnType.ANY.withNullable(true) : typeOf(namedValue));
          }
          value = Collections.unmodifiableList(list);
          type = ColumnType.listOf(joinIgnoringNulls(elementTypes, list.contains(null)));
        }

        values.add(value);
        if (value == null) {
          hasNulls = true;
        } else {
          types.add(type);
          allDerivedKinds &= value instanceof DataFrame || value instanceof Row;
        }
      }

      String name = path.last();
      if (!types.isEmpty() && allDerivedKinds) {
        return ColumnFactory.guessColumnType(name, values);
      }

      ColumnType type;
      if (types.isEmpty()) {
        type = declaredType != null ? declaredType : ColumnType.ANY;
      } else {
        type = TypeLattice.commonSupertype(types);
      }
      return ColumnFactory.createValueColumn(name, values, type.withNullable(type.isNullable() || hasNulls));
    }

    private static ColumnType typeOf(NamedValue value) {
      if (value.getType() != null && !value.isGuessType()) {
        return value.getType();
      }
      return ColumnType.ofValue(value.getValue());
    }

    // nulls only add nullability
    private static ColumnType joinIgnoringNulls(List<ColumnType> types, boolean hasNulls) {
      List<ColumnType> nonNull = new ArrayList<>();
      for (ColumnType type : types) {
        if (!(type.getDataType() == DataType.ANY && type.isNullable())) {
          nonNull.add(type);
        }
      }
      ColumnType type = nonNull.isEmpty() ? ColumnType.ANY : TypeLattice.commonSupertype(nonNull);
      return type.withNullable(type.isNullable() || hasNulls);
    }
  }
}
