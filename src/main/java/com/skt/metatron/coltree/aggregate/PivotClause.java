package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.group.GroupBy;
import com.skt.metatron.coltree.group.GroupedDataFrame;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.type.ColumnType;

/**
 * Turns the values of the pivot columns into column names.
 *
 * <pre>
 *   df.pivot("key").groupBy("id").value("value")
 *   df.groupBy("id").pivot("key").withDefault(0).count()
 * </pre>
 *
 * A pivot started from a plain frame aggregates the whole frame into one row unless grouped with
 * {@link #groupBy(String...)}. A pivot started from an {@link AggregateReceiver} yields into that receiver.
 */
public class PivotClause {
  private final DataFrame df;
  private final GroupedDataFrame grouped;
  private final AggregateReceiver receiver;
  private final ColumnSelector columns;
  private final boolean groupValues;
  private final Object defaultValue;
  private final ColumnPath groupPath;

  private PivotClause(DataFrame df, GroupedDataFrame grouped, AggregateReceiver receiver, ColumnSelector columns,
                      boolean groupValues, Object defaultValue, ColumnPath groupPath) {
    this.df = df;
    this.grouped = grouped;
    this.receiver = receiver;
    this.columns = columns;
    this.groupValues = groupValues;
    this.defaultValue = defaultValue;
    this.groupPath = groupPath;
  }

  public static PivotClause of(DataFrame df, ColumnSelector columns) {
    return new PivotClause(df, null, null, columns, false, null, ColumnPath.empty());
  }

  public static PivotClause of(GroupedDataFrame grouped, ColumnSelector columns) {
    return new PivotClause(null, grouped, null, columns, false, null, ColumnPath.empty());
  }

  public static PivotClause of(AggregateReceiver receiver, ColumnSelector columns) {
    return new PivotClause(null, null, receiver, columns, false, null, ColumnPath.empty());
  }

  public PivotClause groupBy(String... colNames) throws ColTreeException {
    return groupBy(ColumnSelector.cols(colNames));
  }

  public PivotClause groupBy(ColumnSelector keys) throws ColTreeException {
    if (df == null) {
      throw new IllegalStateException("groupBy(): pivot is already grouped");
    }
    return new PivotClause(null, GroupBy.groupBy(df, keys), null, columns, groupValues, defaultValue, groupPath);
  }

  /**
   * Puts value names above the pivot key names instead of below them.
   */
  public PivotClause groupByValue() {
    return groupByValue(true);
  }

  public PivotClause groupByValue(boolean flag) {
    return new PivotClause(df, grouped, receiver, columns, flag, defaultValue, groupPath);
  }

  public PivotClause withDefault(Object newDefault) {
    return new PivotClause(df, grouped, receiver, columns, groupValues, newDefault, groupPath);
  }

  // all pivot columns go under this group
  public PivotClause withGrouping(String... path) {
    return withGrouping(ColumnPath.of(path));
  }

  public PivotClause withGrouping(ColumnPath path) {
    return new PivotClause(df, grouped, receiver, columns, groupValues, defaultValue, path);
  }

  /**
   * @return the result frame; for a pivot inside an aggregate body, the frame of the enclosing group
   */
  public DataFrame aggregate(final AggregateBody body) throws ColTreeException {
    if (receiver != null) {
      Pivots.aggregatePivot(receiver, receiver.df(), columns, groupValues, groupPath, defaultValue, new PivotNames(), body);
      return receiver.df();
    }

    GroupedDataFrame groups = grouped != null ? grouped : GroupBy.groupBy(df, ColumnSelector.none());
    final PivotNames names = new PivotNames(groups.keys().columnNames());
    return groups.aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver groupReceiver) throws ColTreeException {
        Pivots.aggregatePivot(groupReceiver, groupReceiver.df(), columns, groupValues, groupPath, defaultValue, names, body);
        return null;
      }
    });
  }

  public DataFrame count() throws ColTreeException {
    return withDefault(defaultValue == null ? 0 : defaultValue).aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) {
        return r.yieldValue(ColumnPath.empty(), r.nrow(), ColumnType.INT, null, false);
      }
    });
  }

  /**
   * Values of {@code colName} per pivot cell: the value itself if there is one, a list otherwise.
   */
  public DataFrame value(final String colName) throws ColTreeException {
    return aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        Column column = r.column(colName);
        return r.yieldOneOrMany(ColumnPath.empty(), column.values(), column.type(), null);
      }
    });
  }

  public DataFrame values(final String... colNames) throws ColTreeException {
    return aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        for (String colName : colNames) {
          Column column = r.column(colName);
          r.yieldOneOrMany(ColumnPath.of(colName), column.values(), column.type(), null);
        }
        return null;
      }
    });
  }

  public DataFrame with(final Aggregator aggregator, final String colName) throws ColTreeException {
    return aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        return aggregator.aggregate(r.column(colName));
      }
    });
  }
}
