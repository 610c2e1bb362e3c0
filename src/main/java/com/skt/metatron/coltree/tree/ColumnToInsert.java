package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;

/**
 * A column to place at {@code insertionPath}. A non-null reference node places it relative to a
 * column of the removal tree; without one it is appended.
 */
public class ColumnToInsert {
  private final ColumnPath insertionPath;
  private final TreeNode<ColumnPosition> referenceNode;
  private final Column column;

  public ColumnToInsert(ColumnPath insertionPath, TreeNode<ColumnPosition> referenceNode, Column column) {
    if (insertionPath.isEmpty()) {
      throw new IllegalArgumentException("ColumnToInsert(): empty insertion path for column " + column.name());
    }
    this.insertionPath = insertionPath;
    this.referenceNode = referenceNode;
    this.column = column;
  }

  public ColumnPath getInsertionPath() {
    return insertionPath;
  }

  public TreeNode<ColumnPosition> getReferenceNode() {
    return referenceNode;
  }

  public Column getColumn() {
    return column;
  }

  @Override
  public String toString() {
    return insertionPath + " <- " + column.name();
  }
}
