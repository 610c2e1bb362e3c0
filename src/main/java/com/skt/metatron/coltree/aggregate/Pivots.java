package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.group.GroupBy;
import com.skt.metatron.coltree.group.GroupedDataFrame;
import com.skt.metatron.coltree.select.ColumnSelector;

import java.util.List;

/**
 * Pivot step run inside one outer group: sub-groups the rows by the pivot columns and yields the
 * result of the body for each sub-group under the path named after its key values.
 */
public class Pivots {

  public static final int MAX_PIVOT_COLUMNS = 1000;

  private Pivots() {
  }

  /**
   * A body that yields one unnamed value puts it at the pivot path itself. A body that yields nothing
   * has its return value put there. Otherwise every yielded path is placed below the pivot path, or
   * above it when {@code groupValues} is set.
   */
  public static void aggregatePivot(ValueSink sink, DataFrame group, ColumnSelector columns, boolean groupValues,
                                    ColumnPath groupPath, Object defaultValue, PivotNames names, AggregateBody body)
          throws ColTreeException {
    GroupedDataFrame pivotGroups = GroupBy.groupBy(group, columns);
    DataFrame keys = pivotGroups.keys();
    FrameColumn frames = pivotGroups.groups();

    for (int i = 0; i < pivotGroups.size(); i++) {
      ColumnPath pivotPath = names.pathFor(groupPath, keys.row(i).values());

      AggregateReceiver receiver = new AggregateReceiver(frames.get(i));
      Object result = body.aggregate(receiver);
      List<NamedValue> values = receiver.values();

      if (values.size() == 1 && values.get(0).getPath().isEmpty()) {
        NamedValue value = values.get(0);
        sink.yieldValue(groupPath.plus(pivotPath), value.getValue(), value.getType(),
                defaultOf(value, defaultValue), value.isGuessType());
      } else if (values.isEmpty()) {
        sink.yieldValue(groupPath.plus(pivotPath), result, null, defaultValue, true);
      } else {
        for (NamedValue value : values) {
          ColumnPath path = groupValues ? value.getPath().plus(pivotPath) : pivotPath.plus(value.getPath());
          sink.yieldValue(groupPath.plus(path), value.getValue(), value.getType(), defaultOf(value, defaultValue), value.isGuessType());
        }
      }
    }
  }

  private static Object defaultOf(NamedValue value, Object defaultValue) {
    return value.getDefaultValue() != null ? value.getDefaultValue() : defaultValue;
  }
}
