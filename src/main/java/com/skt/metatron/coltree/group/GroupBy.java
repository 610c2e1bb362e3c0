package com.skt.metatron.coltree.group;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;
import com.skt.metatron.coltree.tree.ColumnInserter;
import com.skt.metatron.coltree.tree.ColumnToInsert;
import com.skt.metatron.coltree.tree.PathShortener;
import org.apache.commons.collections.map.ListOrderedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions rows by the values of key columns. Groups come out in the order their keys first occur,
 * and rows keep their original order inside each group.
 */
public class GroupBy {
  private static Logger LOGGER = LoggerFactory.getLogger(GroupBy.class);

  public static final String GROUPS_COLUMN = "groups";

  private GroupBy() {
  }

  public static GroupedDataFrame groupBy(DataFrame df, ColumnSelector keySelector) throws ColTreeException {
    List<ColumnWithPath> keyColumns = PathShortener.shortenPaths(
            ColumnResolver.top(ColumnResolver.resolve(keySelector, df, UnresolvedColumnsPolicy.FAIL)));

    // key tuple -> row numbers, in first-occurrence order
    ListOrderedMap partition = new ListOrderedMap();
    for (int rowno = 0; rowno < df.nrow(); rowno++) {
      List<Object> key = new ArrayList<>(keyColumns.size());
      for (ColumnWithPath col : keyColumns) {
        key.add(col.column().get(rowno));
      }
      List<Integer> rownos = (List<Integer>) partition.get(key);
      if (rownos == null) {
        rownos = new ArrayList<>();
        partition.put(key, rownos);
      }
      rownos.add(rowno);
    }

    List<Integer> keyIndices = new ArrayList<>();
    List<Integer> permutation = new ArrayList<>();
    List<Integer> startIndices = new ArrayList<>();
    for (int i = 0; i < partition.size(); i++) {
      List<Integer> rownos = (List<Integer>) partition.getValue(i);
      keyIndices.add(rownos.get(0));
      startIndices.add(permutation.size());
      permutation.addAll(rownos);
    }

    DataFrame keysDf;
    if (keyColumns.isEmpty()) {
      keysDf = DataFrame.empty(partition.size());
    } else {
      List<ColumnToInsert> toInsert = new ArrayList<>();
      for (ColumnWithPath col : keyColumns) {
        toInsert.add(new ColumnToInsert(col.path(), null, col.column().slice(keyIndices)));
      }
      keysDf = ColumnInserter.insert(null, toInsert);
    }

    FrameColumn groups = FrameColumn.create(GROUPS_COLUMN, df.getRows(permutation), startIndices);
    LOGGER.debug("groupBy(): {} rows into {} groups", df.nrow(), partition.size());
    List<ColumnPath> keyPaths = new ArrayList<>();
    for (ColumnWithPath col : keyColumns) {
      keyPaths.add(col.path());
    }
    return new GroupedDataFrame(keysDf.plus(groups), GROUPS_COLUMN, keyPaths);
  }
}
