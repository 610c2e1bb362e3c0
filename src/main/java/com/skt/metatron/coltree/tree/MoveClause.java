package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code df.move(selector)}: removes the selected columns, then inserts them at new paths.
 */
public class MoveClause {
  private final DataFrame originalDf;
  private final RemoveResult removeResult;

  public interface PathFunction {
    ColumnPath apply(ColumnWithPath col) throws ColTreeException;
  }

  public MoveClause(DataFrame originalDf, ColumnSelector selector) throws ColTreeException {
    this.originalDf = originalDf;
    this.removeResult = ColumnRemover.remove(originalDf, selector);
  }

  public DataFrame into(final ColumnPath path) throws ColTreeException {
    return into(new PathFunction() {
      @Override
      public ColumnPath apply(ColumnWithPath col) {
        return path;
      }
    });
  }

  public DataFrame into(String... path) throws ColTreeException {
    return into(ColumnPath.of(path));
  }

  /**
   * Inserts each moved column at the path computed from its original path. A column that lands in its
   * original parent keeps its position there.
   */
  public DataFrame into(PathFunction newPath) throws ColTreeException {
    List<ColumnToInsert> toInsert = new ArrayList<>();
    for (TreeNode<ColumnPosition> node : removeResult.removedColumns()) {
      Column column = node.data().getColumn();
      ColumnPath path = newPath.apply(new ColumnWithPath(column, node.pathFromRoot(), originalDf));
      toInsert.add(new ColumnToInsert(path, node, column));
    }
    return ColumnInserter.insert(removeResult.df(), toInsert);
  }

  public DataFrame under(String... parentPath) throws ColTreeException {
    return under(ColumnPath.of(parentPath));
  }

  public DataFrame under(final ColumnPath parentPath) throws ColTreeException {
    return into(new PathFunction() {
      @Override
      public ColumnPath apply(ColumnWithPath col) {
        return parentPath.plus(col.name());
      }
    });
  }

  public DataFrame under(final PathFunction parentPath) throws ColTreeException {
    return into(new PathFunction() {
      @Override
      public ColumnPath apply(ColumnWithPath col) throws ColTreeException {
        return parentPath.apply(col).plus(col.name());
      }
    });
  }

  public DataFrame toTop() throws ColTreeException {
    return into(new PathFunction() {
      @Override
      public ColumnPath apply(ColumnWithPath col) {
        return ColumnPath.of(col.name());
      }
    });
  }

  /**
   * Places the moved columns at the top level, starting at {@code columnIndex} of the remaining columns.
   */
  public DataFrame to(int columnIndex) throws ColTreeException {
    DataFrame df = removeResult.df();
    if (columnIndex < 0 || columnIndex > df.ncol()) {
      throw new IllegalArgumentException(String.format("to(): column index %d out of range, ncol=%d", columnIndex, df.ncol()));
    }
    List<Column> newColumns = new ArrayList<>(df.columns().subList(0, columnIndex));
    for (TreeNode<ColumnPosition> node : removeResult.removedColumns()) {
      newColumns.add(node.data().getColumn());
    }
    newColumns.addAll(df.columns().subList(columnIndex, df.ncol()));
    if (newColumns.isEmpty()) {
      return df;
    }
    return new DataFrame(newColumns);
  }

  public DataFrame toLeft() throws ColTreeException {
    return to(0);
  }

  public DataFrame toRight() throws ColTreeException {
    return to(removeResult.df().ncol());
  }

  /**
   * Places the moved columns right after {@code column}, as its siblings.
   */
  public DataFrame after(ColumnSelector column) throws ColTreeException {
    ColumnPath refPath = ColumnResolver.resolveSingle(column, originalDf, UnresolvedColumnsPolicy.FAIL).path();
    if (removeResult.removedNothing()) {
      return removeResult.df();
    }
    TreeNode<ColumnPosition> refNode = removeResult.removeRoot().getOrPut(refPath, ColumnPosition.factory(originalDf));
    ColumnPath parentPath = refPath.dropLast();

    List<ColumnToInsert> toInsert = new ArrayList<>();
    for (TreeNode<ColumnPosition> node : removeResult.removedColumns()) {
      Column moved = node.data().getColumn();
      toInsert.add(new ColumnToInsert(parentPath.plus(moved.name()), refNode, moved));
    }
    return ColumnInserter.insert(removeResult.df(), toInsert);
  }

  public DataFrame after(String... columnPath) throws ColTreeException {
    return after(ColumnSelector.path(columnPath));
  }
}
