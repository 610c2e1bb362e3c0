package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Removes selected columns from a frame, recording where each came from.
 *
 * Every visited column gets a node holding its original index. A column removed as a whole carries
 * itself; a group that only loses some children is marked as not removed, and a group that loses all
 * of its children disappears.
 */
public class ColumnRemover {
  private static Logger LOGGER = LoggerFactory.getLogger(ColumnRemover.class);

  private ColumnRemover() {
  }

  public static RemoveResult remove(DataFrame df, ColumnSelector selector) throws ColTreeException {
    List<ColumnPath> colPaths = ColumnResolver.getColumnPaths(df, selector);
    final Map<ColumnPath, Integer> originalOrder = new HashMap<>();
    for (int i = 0; i < colPaths.size(); i++) {
      if (!originalOrder.containsKey(colPaths.get(i))) {
        originalOrder.put(colPaths.get(i), i);
      }
    }

    TreeNode<ColumnPosition> root = TreeNode.createRoot(new ColumnPosition(-1, false, null));
    if (colPaths.isEmpty()) {
      return new RemoveResult(df, Collections.<TreeNode<ColumnPosition>>emptyList());
    }

    DataFrame newDf = removeColumns(df.columns(), colPaths, root);
    if (newDf == null) {
      newDf = DataFrame.empty(df.nrow());
    }

    List<TreeNode<ColumnPosition>> removed = root.dfs(new Predicate<TreeNode<ColumnPosition>>() {
      @Override
      public boolean test(TreeNode<ColumnPosition> node) {
        return node.data().wasRemoved() && node.data().getColumn() != null;
      }
    });
    Collections.sort(removed, new Comparator<TreeNode<ColumnPosition>>() {
      @Override
      public int compare(TreeNode<ColumnPosition> a, TreeNode<ColumnPosition> b) {
        return Integer.compare(orderOf(a), orderOf(b));
      }

      private int orderOf(TreeNode<ColumnPosition> node) {
        Integer order = originalOrder.get(node.pathFromRoot());
        return order == null ? Integer.MAX_VALUE : order;
      }
    });
    LOGGER.debug("remove(): removed {} columns", removed.size());
    return new RemoveResult(newDf, removed);
  }

  /**
   * @return remaining columns as a frame, or null when none remain
   */
  private static DataFrame removeColumns(List<Column> columns, List<ColumnPath> paths, TreeNode<ColumnPosition> node)
          throws ColTreeException {
    if (paths.isEmpty()) {
      return null;
    }
    int depth = node.depth();
    Map<String, List<ColumnPath>> children = new LinkedHashMap<>();
    for (ColumnPath path : paths) {
      List<ColumnPath> list = children.get(path.get(depth));
      if (list == null) {
        list = new ArrayList<>();
        children.put(path.get(depth), list);
      }
      list.add(path);
    }

    List<Column> newColumns = new ArrayList<>();
    for (int colno = 0; colno < columns.size(); colno++) {
      Column column = columns.get(colno);
      List<ColumnPath> childPaths = children.get(column.name());
      if (childPaths == null) {
        newColumns.add(column);
        continue;
      }

      TreeNode<ColumnPosition> child = node.addChild(column.name(), new ColumnPosition(colno, true, null));
      boolean wholeColumn = false;
      for (ColumnPath path : childPaths) {
        wholeColumn |= path.size() == depth + 1;
      }

      if (wholeColumn) {
        child.data().setColumn(column);
      } else {
        if (!column.isGroup()) {
          String msg = "remove(): not a group column: " + child.pathFromRoot();
          LOGGER.error(msg);
          throw new ColumnResolutionException(msg);
        }
        GroupColumn group = column.asGroup();
        DataFrame newDf = removeColumns(group.df().columns(), childPaths, child);
        if (newDf != null) {
          newColumns.add(group.withDf(newDf));
          child.data().setWasRemoved(false);
        }
      }
    }

    if (newColumns.isEmpty()) {
      return null;
    }
    return new DataFrame(newColumns);
  }
}
