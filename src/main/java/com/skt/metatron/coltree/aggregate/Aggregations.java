package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.FrameColumn;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.tree.ColumnInserter;
import com.skt.metatron.coltree.tree.ColumnPosition;
import com.skt.metatron.coltree.tree.ColumnRemover;
import com.skt.metatron.coltree.tree.ColumnToInsert;
import com.skt.metatron.coltree.tree.RemoveResult;
import com.skt.metatron.coltree.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Aggregations {
  private static Logger LOGGER = LoggerFactory.getLogger(Aggregations.class);

  private Aggregations() {
  }

  /**
   * One row with the values {@code body} yields over the whole frame. A frame of one row and no
   * columns when nothing is yielded.
   */
  public static DataFrame aggregate(DataFrame df, AggregateBody body) throws ColTreeException {
    AggregateReceiver receiver = new AggregateReceiver(df);
    body.aggregate(receiver);
    return AggregationResult.build(Collections.singletonList(receiver.values()));
  }

  /**
   * Runs {@code body} over every frame of the groups column and puts the merged result where the
   * groups column was.
   */
  public static DataFrame aggregateGroupBy(DataFrame df, String groupsColumn, AggregateBody body) throws ColTreeException {
    FrameColumn groups = df.column(groupsColumn).asFrame();

    List<List<NamedValue>> rows = new ArrayList<>(groups.size());
    for (DataFrame group : groups.frames()) {
      if (group == null) {
        rows.add(Collections.<NamedValue>emptyList());
        continue;
      }
      AggregateReceiver receiver = new AggregateReceiver(group);
      body.aggregate(receiver);
      rows.add(receiver.values());
    }
    DataFrame aggregated = AggregationResult.build(rows);

    RemoveResult removed = ColumnRemover.remove(df, ColumnSelector.cols(groupsColumn));
    TreeNode<ColumnPosition> groupsNode = removed.removedColumns().get(0);
    ColumnPath parentPath = groupsNode.pathFromRoot().dropLast();

    List<ColumnToInsert> toInsert = new ArrayList<>();
    for (Column column : aggregated.columns()) {
      toInsert.add(new ColumnToInsert(parentPath.plus(column.name()), groupsNode, column));
    }
    LOGGER.debug("aggregateGroupBy(): {} groups, {} columns", groups.size(), toInsert.size());
    return ColumnInserter.insert(removed.df(), toInsert);
  }
}
