package com.skt.metatron.coltree.select;

import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.column.MissingColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates {@link ColumnSelector}s against a frame. Results keep selector order and hold no duplicate paths.
 */
public class ColumnResolver {
  private static Logger LOGGER = LoggerFactory.getLogger(ColumnResolver.class);

  private ColumnResolver() {
  }

  public static List<ColumnWithPath> resolve(ColumnSelector selector, DataFrame df, UnresolvedColumnsPolicy policy)
          throws ColumnResolutionException {
    return dedup(eval(selector, df, policy));
  }

  /**
   * Resolves a selector that must name exactly one column.
   */
  public static ColumnWithPath resolveSingle(ColumnSelector selector, DataFrame df, UnresolvedColumnsPolicy policy)
          throws ColumnResolutionException {
    List<ColumnWithPath> cols = resolve(selector, df, policy);
    if (cols.size() != 1) {
      String msg = String.format("resolveSingle(): %s matches %d columns, expected one", selector, cols.size());
      LOGGER.error(msg);
      throw new ColumnResolutionException(msg);
    }
    return cols.get(0);
  }

  public static List<ColumnPath> getColumnPaths(DataFrame df, ColumnSelector selector) throws ColumnResolutionException {
    List<ColumnPath> paths = new ArrayList<>();
    for (ColumnWithPath col : resolve(selector, df, UnresolvedColumnsPolicy.FAIL)) {
      paths.add(col.path());
    }
    return paths;
  }

  /**
   * Walks {@code path} down from {@code df}. An empty path resolves to the frame itself, as an unnamed
   * group column. Addressing through a column that is not a group is an error under every policy.
   *
   * @return the column, or null when it is missing and the policy is SKIP
   */
  public static ColumnWithPath resolvePath(DataFrame df, ColumnPath path, UnresolvedColumnsPolicy policy)
          throws ColumnResolutionException {
    if (path.isEmpty()) {
      return new ColumnWithPath(GroupColumn.create("", df), path, df);
    }

    DataFrame current = df;
    for (int depth = 0; depth < path.size(); depth++) {
      Column column = current.tryGetColumn(path.get(depth));
      if (column == null) {
        switch (policy) {
          case SKIP:
            return null;
          case CREATE:
            return new ColumnWithPath(new MissingColumn(path.last()), path, df);
          default:
            String msg = "resolve(): column not found: " + path;
            LOGGER.error(msg);
            throw new ColumnResolutionException(msg);
        }
      }
      if (depth == path.size() - 1) {
        return new ColumnWithPath(column, path, df);
      }
      if (!column.isGroup()) {
        String msg = String.format("resolve(): cannot resolve %s through %s column %s", path, column.kind(), column.name());
        LOGGER.error(msg);
        throw new ColumnResolutionException(msg);
      }
      current = column.asGroup().df();
    }
    throw new IllegalStateException("resolvePath(): unreachable: " + path);
  }

  /**
   * Drops every column that has an ancestor in the list.
   */
  public static List<ColumnWithPath> top(List<ColumnWithPath> cols) {
    List<ColumnWithPath> result = new ArrayList<>();
    for (ColumnWithPath col : cols) {
      boolean hasAncestor = false;
      for (ColumnWithPath other : cols) {
        if (other.path().size() < col.path().size() && col.path().startsWith(other.path())) {
          hasAncestor = true;
          break;
        }
      }
      if (!hasAncestor) {
        result.add(col);
      }
    }
    return dedup(result);
  }

  // pre-order over all columns below the given root
  public static List<ColumnWithPath> dfs(DataFrame df, DataFrame root, ColumnPath parent) {
    List<ColumnWithPath> result = new ArrayList<>();
    for (Column column : df.columns()) {
      ColumnPath path = parent.plus(column.name());
      result.add(new ColumnWithPath(column, path, root));
      if (column.isGroup()) {
        result.addAll(dfs(column.asGroup().df(), root, path));
      }
    }
    return result;
  }

  private static List<ColumnWithPath> eval(ColumnSelector selector, DataFrame df, UnresolvedColumnsPolicy policy)
          throws ColumnResolutionException {
    List<ColumnWithPath> result = new ArrayList<>();

    if (selector instanceof ColumnSelector.Name) {
      addIfResolved(result, resolvePath(df, ColumnPath.of(((ColumnSelector.Name) selector).getName()), policy));
    } else if (selector instanceof ColumnSelector.PathRef) {
      addIfResolved(result, resolvePath(df, ((ColumnSelector.PathRef) selector).getPath(), policy));
    } else if (selector instanceof ColumnSelector.TypedRef) {
      ColumnSelector.TypedRef typedRef = (ColumnSelector.TypedRef) selector;
      ColumnWithPath col = resolvePath(df, typedRef.getPath(), policy);
      if (col != null && !col.isMissing() && !col.column().type().isSubtypeOf(typedRef.getExpectedType())) {
        String msg = String.format("resolve(): column %s has type %s, expected %s",
                typedRef.getPath(), col.column().type(), typedRef.getExpectedType());
        LOGGER.error(msg);
        throw new ColumnResolutionException(msg);
      }
      addIfResolved(result, col);
    } else if (selector instanceof ColumnSelector.AllColumns) {
      for (Column column : df.columns()) {
        result.add(new ColumnWithPath(column, ColumnPath.of(column.name()), df));
      }
    } else if (selector instanceof ColumnSelector.NoColumns) {
      // nothing
    } else if (selector instanceof ColumnSelector.Dfs) {
      result.addAll(dfs(df, df, ColumnPath.empty()));
    } else if (selector instanceof ColumnSelector.ByIndex) {
      for (int colno : ((ColumnSelector.ByIndex) selector).getIndices()) {
        if (colno < 0 || colno >= df.ncol()) {
          if (policy == UnresolvedColumnsPolicy.FAIL) {
            String msg = String.format("resolve(): column index %d out of range, ncol=%d", colno, df.ncol());
            LOGGER.error(msg);
            throw new ColumnResolutionException(msg);
          }
          continue;
        }
        Column column = df.column(colno);
        result.add(new ColumnWithPath(column, ColumnPath.of(column.name()), df));
      }
    } else if (selector instanceof ColumnSelector.Union) {
      for (ColumnSelector child : ((ColumnSelector.Union) selector).getSelectors()) {
        result.addAll(eval(child, df, policy));
      }
    } else if (selector instanceof ColumnSelector.Except) {
      ColumnSelector.Except except = (ColumnSelector.Except) selector;
      List<ColumnPath> excluded = new ArrayList<>();
      for (ColumnWithPath col : eval(except.getExcluded(), df, policy)) {
        excluded.add(col.path());
      }
      for (ColumnWithPath col : eval(except.getSource(), df, policy)) {
        exceptInto(col, excluded, result);
      }
    } else if (selector instanceof ColumnSelector.Intersect) {
      ColumnSelector.Intersect intersect = (ColumnSelector.Intersect) selector;
      Set<ColumnPath> rightPaths = new HashSet<>();
      for (ColumnWithPath col : eval(intersect.getRight(), df, policy)) {
        rightPaths.add(col.path());
      }
      for (ColumnWithPath col : eval(intersect.getLeft(), df, policy)) {
        if (rightPaths.contains(col.path())) {
          result.add(col);
        }
      }
    } else if (selector instanceof ColumnSelector.Filter) {
      ColumnSelector.Filter filter = (ColumnSelector.Filter) selector;
      for (ColumnWithPath col : eval(filter.getSource(), df, policy)) {
        if (filter.getPredicate().test(col)) {
          result.add(col);
        }
      }
    } else if (selector instanceof ColumnSelector.Children) {
      for (ColumnWithPath col : eval(((ColumnSelector.Children) selector).getSource(), df, policy)) {
        if (col.column().isGroup()) {
          for (Column child : col.column().asGroup().df().columns()) {
            result.add(new ColumnWithPath(child, col.path().plus(child.name()), df));
          }
        }
      }
    } else {
      throw new IllegalArgumentException("resolve(): unsupported selector: " + selector.getClass().getName());
    }
    return result;
  }

  private static void addIfResolved(List<ColumnWithPath> result, ColumnWithPath col) {
    if (col != null) {
      result.add(col);
    }
  }

  /**
   * Excluding a column nested in a selected group replaces the group with its remaining children.
   */
  private static void exceptInto(ColumnWithPath col, List<ColumnPath> excluded, List<ColumnWithPath> result) {
    boolean hasExcludedDescendant = false;
    for (ColumnPath path : excluded) {
      if (col.path().startsWith(path)) {
        return;
      }
      hasExcludedDescendant |= path.startsWith(col.path());
    }
    if (hasExcludedDescendant && col.column().isGroup()) {
      for (Column child : col.column().asGroup().df().columns()) {
        exceptInto(new ColumnWithPath(child, col.path().plus(child.name()), col.df()), excluded, result);
      }
    } else {
      result.add(col);
    }
  }

  private static List<ColumnWithPath> dedup(List<ColumnWithPath> cols) {
    Map<ColumnPath, ColumnWithPath> byPath = new LinkedHashMap<>();
    for (ColumnWithPath col : cols) {
      if (!byPath.containsKey(col.path())) {
        byPath.put(col.path(), col);
      }
    }
    return new ArrayList<>(byPath.values());
  }
}
