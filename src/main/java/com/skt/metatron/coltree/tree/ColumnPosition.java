package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;

/**
 * Payload of a removal tree node: where the column sat in its original parent, whether it left, and
 * the column itself when it was removed as a whole.
 */
public class ColumnPosition {
  private final int originalIndex;
  private boolean wasRemoved;
  private Column column;

  public ColumnPosition(int originalIndex, boolean wasRemoved, Column column) {
    this.originalIndex = originalIndex;
    this.wasRemoved = wasRemoved;
    this.column = column;
  }

  /**
   * Position of the column at {@code path} within its parent in {@code df}. Nothing is removed.
   */
  public static ColumnPosition of(DataFrame df, ColumnPath path) throws ColTreeException {
    DataFrame parent = path.size() == 1 ? df : ColumnResolver.resolvePath(df, path.dropLast(), UnresolvedColumnsPolicy.FAIL).column().asGroup().df();
    int index = parent.getColumnIndex(path.last());
    return new ColumnPosition(index, false, parent.column(path.last()));
  }

  public static TreeNode.DataFactory<ColumnPosition> factory(final DataFrame df) {
    return new TreeNode.DataFactory<ColumnPosition>() {
      @Override
      public ColumnPosition create(ColumnPath path) throws ColTreeException {
        return ColumnPosition.of(df, path);
      }
    };
  }

  public int getOriginalIndex() {
    return originalIndex;
  }

  public boolean wasRemoved() {
    return wasRemoved;
  }

  public void setWasRemoved(boolean wasRemoved) {
    this.wasRemoved = wasRemoved;
  }

  public Column getColumn() {
    return column;
  }

  public void setColumn(Column column) {
    this.column = column;
  }

  @Override
  public String toString() {
    return String.format("ColumnPosition{originalIndex=%d, wasRemoved=%s, column=%s}",
            originalIndex, wasRemoved, column == null ? null : column.name());
  }
}
