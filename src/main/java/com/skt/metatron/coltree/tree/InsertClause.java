package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code df.insert(column)}: places a new column into the tree.
 */
public class InsertClause {
  private final DataFrame df;
  private final Column column;

  public InsertClause(DataFrame df, Column column) {
    this.df = df;
    this.column = column;
  }

  // missing groups on the way are created
  public DataFrame under(ColumnPath parentPath) throws ColTreeException {
    return into(parentPath.plus(column.name()));
  }

  public DataFrame under(String... parentPath) throws ColTreeException {
    return under(ColumnPath.of(parentPath));
  }

  public DataFrame into(ColumnPath path) throws ColTreeException {
    return ColumnInserter.insert(df, Collections.singletonList(new ColumnToInsert(path, null, column)));
  }

  public DataFrame at(int columnIndex) throws ColTreeException {
    if (columnIndex < 0 || columnIndex > df.ncol()) {
      throw new IllegalArgumentException(String.format("at(): column index %d out of range, ncol=%d", columnIndex, df.ncol()));
    }
    List<Column> newColumns = new ArrayList<>(df.columns());
    newColumns.add(columnIndex, column);
    return new DataFrame(newColumns);
  }

  public DataFrame after(ColumnSelector selector) throws ColTreeException {
    ColumnPath refPath = ColumnResolver.resolveSingle(selector, df, UnresolvedColumnsPolicy.FAIL).path();
    TreeNode<ColumnPosition> root = TreeNode.createRoot(new ColumnPosition(-1, false, null));
    TreeNode<ColumnPosition> refNode = root.getOrPut(refPath, ColumnPosition.factory(df));
    ColumnToInsert toInsert = new ColumnToInsert(refPath.dropLast().plus(column.name()), refNode, column);
    return ColumnInserter.insert(df, Collections.singletonList(toInsert));
  }

  public DataFrame after(String... columnPath) throws ColTreeException {
    return after(ColumnSelector.path(columnPath));
  }
}
