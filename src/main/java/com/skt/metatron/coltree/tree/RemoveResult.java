package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnWithPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Frame left after a removal plus the removed columns as nodes of the removal tree.
 */
public class RemoveResult {
  private final DataFrame df;
  private final List<TreeNode<ColumnPosition>> removedColumns;

  public RemoveResult(DataFrame df, List<TreeNode<ColumnPosition>> removedColumns) {
    this.df = df;
    this.removedColumns = Collections.unmodifiableList(new ArrayList<>(removedColumns));
  }

  public DataFrame df() {
    return df;
  }

  public List<TreeNode<ColumnPosition>> removedColumns() {
    return removedColumns;
  }

  public boolean removedNothing() {
    return removedColumns.isEmpty();
  }

  public TreeNode<ColumnPosition> removeRoot() {
    return removedColumns.isEmpty() ? null : removedColumns.get(0).getRoot();
  }

  /**
   * Re-inserting these puts every removed column back where it was.
   */
  public List<ColumnToInsert> toInsertable() {
    List<ColumnToInsert> result = new ArrayList<>();
    for (TreeNode<ColumnPosition> node : removedColumns) {
      result.add(new ColumnToInsert(node.pathFromRoot(), node, node.data().getColumn()));
    }
    return result;
  }

  public List<ColumnWithPath> toColumnsWithPath(DataFrame originalDf) {
    List<ColumnWithPath> result = new ArrayList<>();
    for (TreeNode<ColumnPosition> node : removedColumns) {
      result.add(new ColumnWithPath(node.data().getColumn(), node.pathFromRoot(), originalDf));
    }
    return result;
  }
}
