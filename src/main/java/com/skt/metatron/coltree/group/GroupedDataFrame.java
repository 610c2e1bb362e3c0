package com.skt.metatron.coltree.group;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.DataFrames;
import com.skt.metatron.coltree.Row;
import com.skt.metatron.coltree.aggregate.AggregateBody;
import com.skt.metatron.coltree.aggregate.AggregateReceiver;
import com.skt.metatron.coltree.aggregate.Aggregations;
import com.skt.metatron.coltree.aggregate.PivotClause;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.sort.RowSorter;
import com.skt.metatron.coltree.sort.SortKey;
import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of a groupBy: the key columns plus one frame column holding each group's rows.
 */
public class GroupedDataFrame {
  private final DataFrame df;
  private final String groupsColumn;
  // key column paths in the key table, in key order
  private final List<ColumnPath> keyPaths;

  public interface GroupTransform {
    DataFrame transform(DataFrame group) throws ColTreeException;
  }

  public interface GroupPredicate {
    boolean test(Row key, DataFrame group) throws ColTreeException;
  }

  public GroupedDataFrame(DataFrame df, String groupsColumn, List<ColumnPath> keyPaths) {
    this.df = df;
    this.groupsColumn = groupsColumn;
    this.keyPaths = Collections.unmodifiableList(new ArrayList<>(keyPaths));
  }

  /**
   * Keys and groups side by side, one row per group.
   */
  public DataFrame plain() {
    return df;
  }

  public DataFrame keys() throws ColTreeException {
    return df.remove(ColumnSelector.cols(groupsColumn));
  }

  public FrameColumn groups() throws ColTreeException {
    return df.column(groupsColumn).asFrame();
  }

  public String groupsColumnName() {
    return groupsColumn;
  }

  public List<ColumnPath> keyPaths() {
    return keyPaths;
  }

  public int size() {
    return df.nrow();
  }

  /**
   * Rows of all groups, in group order.
   */
  public DataFrame ungroup() throws ColTreeException {
    List<DataFrame> frames = new ArrayList<>();
    for (DataFrame frame : groups().frames()) {
      if (frame != null) {
        frames.add(frame);
      }
    }
    return DataFrames.concat(frames);
  }

  /**
   * Rows of the groups whose leading key values equal {@code key}. Key values are matched in key
   * order, nested keys included.
   */
  public DataFrame get(Object... key) throws ColTreeException {
    if (key.length > keyPaths.size()) {
      throw new IllegalArgumentException(String.format("get(): %d key values for %d key columns", key.length, keyPaths.size()));
    }
    List<Column> keyCols = new ArrayList<>();
    for (int k = 0; k < key.length; k++) {
      keyCols.add(df.column(keyPaths.get(k)));
    }

    List<DataFrame> frames = new ArrayList<>();
    FrameColumn groups = groups();
    for (int i = 0; i < df.nrow(); i++) {
      if (groups.get(i) == null) {
        continue;
      }
      boolean match = true;
      for (int k = 0; k < key.length && match; k++) {
        match = Objects.equals(keyCols.get(k).get(i), key[k]);
      }
      if (match) {
        frames.add(groups.get(i));
      }
    }
    return DataFrames.concat(frames);
  }

  public GroupedDataFrame mapGroups(GroupTransform transform) throws ColTreeException {
    List<DataFrame> newFrames = new ArrayList<>();
    for (DataFrame frame : groups().frames()) {
      newFrames.add(frame == null ? null : transform.transform(frame));
    }
    return new GroupedDataFrame(df.replace(ColumnPath.of(groupsColumn), groups().withFrames(newFrames)), groupsColumn, keyPaths);
  }

  public GroupedDataFrame filter(GroupPredicate predicate) throws ColTreeException {
    DataFrame keysDf = keys();
    FrameColumn groups = groups();
    List<Integer> rownos = new ArrayList<>();
    for (int i = 0; i < df.nrow(); i++) {
      if (predicate.test(keysDf.row(i), groups.get(i))) {
        rownos.add(i);
      }
    }
    return new GroupedDataFrame(df.getRows(rownos), groupsColumn, keyPaths);
  }

  /**
   * Reorders the groups by columns of {@link #plain()}, usually the keys.
   */
  public GroupedDataFrame sortBy(String... colNames) throws ColTreeException {
    return sortBy(SortKey.asc(colNames));
  }

  public GroupedDataFrame sortBy(SortKey... keys) throws ColTreeException {
    return new GroupedDataFrame(RowSorter.sort(df, Arrays.asList(keys)), groupsColumn, keyPaths);
  }

  public GroupedDataFrame sortByCount() throws ColTreeException {
    return sortByGroupSize(SortKey.asc(groupsColumn));
  }

  public GroupedDataFrame sortByCountDesc() throws ColTreeException {
    return sortByGroupSize(SortKey.desc(groupsColumn));
  }

  // a missing group counts as empty
  private GroupedDataFrame sortByGroupSize(SortKey direction) throws ColTreeException {
    List<Integer> sizes = new ArrayList<>();
    for (DataFrame frame : groups().frames()) {
      sizes.add(frame == null ? 0 : frame.nrow());
    }
    Column sizeCol = new ValueColumn("count", sizes, ColumnType.INT);
    List<Integer> rownos = RowSorter.permutation(df.nrow(), Collections.singletonList(sizeCol), Collections.singletonList(direction));
    return new GroupedDataFrame(df.getRows(rownos), groupsColumn, keyPaths);
  }

  /**
   * Runs {@code body} once per group. The keys stay in place of the groups column, followed by the
   * yielded columns.
   */
  public DataFrame aggregate(AggregateBody body) throws ColTreeException {
    return Aggregations.aggregateGroupBy(df, groupsColumn, body);
  }

  public DataFrame count() throws ColTreeException {
    return count("count");
  }

  public DataFrame count(final String resultName) throws ColTreeException {
    return aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver receiver) {
        return receiver.count(resultName);
      }
    });
  }

  /**
   * Collects the values of each column into one list per group.
   */
  public DataFrame values(final String... colNames) throws ColTreeException {
    return aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver receiver) throws ColTreeException {
        for (String colName : colNames) {
          Column column = receiver.df().column(colName);
          receiver.yieldValue(ColumnPath.of(colName), column.values(), ColumnType.listOf(column.type()), null, false);
        }
        return null;
      }
    });
  }

  public PivotClause pivot(String... colNames) {
    return pivot(ColumnSelector.cols(colNames));
  }

  public PivotClause pivot(ColumnSelector selector) {
    return PivotClause.of(this, selector);
  }

  @Override
  public String toString() {
    return df.toString();
  }
}
