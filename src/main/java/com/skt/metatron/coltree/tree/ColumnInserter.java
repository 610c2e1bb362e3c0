package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.GroupColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inserts columns into a frame at arbitrary paths, creating intermediate groups on the way.
 *
 * A column whose reference node belongs to the removal tree is placed at the position it, or its
 * ancestor at the current level, had before the removal: right at the original index if that column
 * was removed, right after it if it stayed. Columns without a usable reference are appended. The
 * running offset accounts for removed siblings before the index and for columns already inserted.
 */
public class ColumnInserter {
  private static Logger LOGGER = LoggerFactory.getLogger(ColumnInserter.class);

  private ColumnInserter() {
  }

  public static DataFrame insert(DataFrame df, List<ColumnToInsert> columns) throws ColTreeException {
    TreeNode<ColumnPosition> root = null;
    for (ColumnToInsert column : columns) {
      if (column.getReferenceNode() != null) {
        root = column.getReferenceNode().getRoot();
        break;
      }
    }
    return insertColumns(df, columns, root, 0);
  }

  private static DataFrame insertColumns(DataFrame df, List<ColumnToInsert> columns, TreeNode<ColumnPosition> treeNode, int depth)
          throws ColTreeException {
    if (columns.isEmpty()) {
      return df != null ? df : DataFrame.empty();
    }

    int childDepth = depth + 1;
    Map<String, List<ColumnToInsert>> columnsMap = new LinkedHashMap<>();
    for (ColumnToInsert column : columns) {
      String name = column.getInsertionPath().get(depth);
      List<ColumnToInsert> list = columnsMap.get(name);
      if (list == null) {
        list = new ArrayList<>();
        columnsMap.put(name, list);
      }
      list.add(column);
    }

    // descend into existing groups
    List<Column> newColumns = new ArrayList<>();
    if (df != null) {
      for (Column column : df.columns()) {
        List<ColumnToInsert> subTree = columnsMap.get(column.name());
        if (subTree == null) {
          newColumns.add(column);
          continue;
        }
        for (ColumnToInsert toInsert : subTree) {
          if (toInsert.getInsertionPath().size() == childDepth) {
            String msg = String.format("insert(): cannot insert column %s, a column with this path already exists", toInsert.getInsertionPath());
            LOGGER.error(msg);
            throw new StructuralException(msg);
          }
        }
        if (!column.isGroup()) {
          String msg = String.format("insert(): cannot insert columns under %s, it is not a group column", column.name());
          LOGGER.error(msg);
          throw new StructuralException(msg);
        }
        GroupColumn group = column.asGroup();
        DataFrame newDf = insertColumns(group.df(), subTree, childOf(treeNode, column.name()), childDepth);
        newColumns.add(group.withDf(newDf));
        columnsMap.remove(column.name());
      }
    }

    // the rest are new at this level
    List<PendingColumn> pending = new ArrayList<>();
    for (ColumnToInsert column : columns) {
      String name = column.getInsertionPath().get(depth);
      List<ColumnToInsert> subTree = columnsMap.remove(name);
      if (subTree == null) {
        continue;
      }
      int insertionIndex = Integer.MAX_VALUE;
      for (ColumnToInsert toInsert : subTree) {
        TreeNode<ColumnPosition> ref = toInsert.getReferenceNode();
        if (ref == null) {
          continue;
        }
        TreeNode<ColumnPosition> node = ref.depth() > childDepth ? ref.getAncestor(childDepth) : ref;
        if (treeNode != null && node.parent() == treeNode) {
          int index = node.data().wasRemoved() ? node.data().getOriginalIndex() : node.data().getOriginalIndex() + 1;
          insertionIndex = Math.min(insertionIndex, index);
        }
      }
      pending.add(new PendingColumn(name, insertionIndex, subTree));
    }
    Collections.sort(pending, new Comparator<PendingColumn>() {
      @Override
      public int compare(PendingColumn a, PendingColumn b) {
        return Integer.compare(a.insertionIndex, b.insertionIndex);
      }
    });

    List<TreeNode<ColumnPosition>> siblings = null;
    if (treeNode != null) {
      siblings = new ArrayList<>(treeNode.children());
      Collections.sort(siblings, new Comparator<TreeNode<ColumnPosition>>() {
        @Override
        public int compare(TreeNode<ColumnPosition> a, TreeNode<ColumnPosition> b) {
          return Integer.compare(a.data().getOriginalIndex(), b.data().getOriginalIndex());
        }
      });
    }

    int k = 0;
    int offset = 0;
    for (PendingColumn column : pending) {
      if (siblings != null) {
        while (k < siblings.size() && siblings.get(k).data().getOriginalIndex() < column.insertionIndex) {
          if (siblings.get(k).data().wasRemoved()) {
            offset--;
          }
          k++;
        }
      }

      Column newColumn = buildColumn(column, treeNode, childDepth);
      if (column.insertionIndex == Integer.MAX_VALUE) {
        newColumns.add(newColumn);
      } else {
        int index = Math.max(0, Math.min(column.insertionIndex + offset, newColumns.size()));
        newColumns.add(index, newColumn);
        offset++;
      }
    }

    if (newColumns.isEmpty()) {
      return DataFrame.empty(df == null ? 0 : df.nrow());
    }
    return new DataFrame(newColumns);
  }

  private static Column buildColumn(PendingColumn pending, TreeNode<ColumnPosition> treeNode, int childDepth) throws ColTreeException {
    ColumnToInsert leaf = null;
    List<ColumnToInsert> deeper = new ArrayList<>();
    for (ColumnToInsert toInsert : pending.subTree) {
      if (toInsert.getInsertionPath().size() == childDepth) {
        if (leaf != null) {
          String msg = String.format("insert(): cannot insert more than one column into the path %s", toInsert.getInsertionPath());
          LOGGER.error(msg);
          throw new StructuralException(msg);
        }
        leaf = toInsert;
      } else {
        deeper.add(toInsert);
      }
    }

    if (leaf == null) {
      DataFrame newDf = insertColumns(null, deeper, childOf(treeNode, pending.name), childDepth);
      return GroupColumn.create(pending.name, newDf);
    }
    if (deeper.isEmpty()) {
      return leaf.getColumn().rename(pending.name);
    }
    if (!leaf.getColumn().isGroup()) {
      String msg = String.format("insert(): cannot insert columns under %s, it is not a group column", leaf.getInsertionPath());
      LOGGER.error(msg);
      throw new StructuralException(msg);
    }
    GroupColumn group = leaf.getColumn().asGroup();
    DataFrame newDf = insertColumns(group.df(), deeper, childOf(treeNode, pending.name), childDepth);
    return group.withDf(newDf).rename(pending.name);
  }

  private static TreeNode<ColumnPosition> childOf(TreeNode<ColumnPosition> treeNode, String name) {
    return treeNode == null ? null : treeNode.get(name);
  }

  private static class PendingColumn {
    private final String name;
    private final int insertionIndex;
    private final List<ColumnToInsert> subTree;

    PendingColumn(String name, int insertionIndex, List<ColumnToInsert> subTree) {
      this.name = name;
      this.insertionIndex = insertionIndex;
      this.subTree = subTree;
    }
  }
}
