package com.skt.metatron.coltree.select;

import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Declarative description of a set of columns. Selectors are plain values; {@link ColumnResolver}
 * evaluates them against a frame.
 *
 * <pre>
 *   cols("a", "b").and(path("g", "x"))
 *   dfs().except(cols("id"))
 * </pre>
 */
public abstract class ColumnSelector {

  public static ColumnSelector cols(String... names) {
    List<ColumnSelector> selectors = new ArrayList<>();
    for (String name : names) {
      selectors.add(new Name(name));
    }
    return selectors.size() == 1 ? selectors.get(0) : new Union(selectors);
  }

  public static ColumnSelector path(String... names) {
    return new PathRef(ColumnPath.of(names));
  }

  public static ColumnSelector path(ColumnPath path) {
    return new PathRef(path);
  }

  public static ColumnSelector paths(List<ColumnPath> paths) {
    List<ColumnSelector> selectors = new ArrayList<>();
    for (ColumnPath path : paths) {
      selectors.add(new PathRef(path));
    }
    return new Union(selectors);
  }

  public static ColumnSelector typed(ColumnPath path, ColumnType expectedType) {
    return new TypedRef(path, expectedType);
  }

  public static ColumnSelector all() {
    return new AllColumns();
  }

  public static ColumnSelector none() {
    return new NoColumns();
  }

  // every column, nested ones included, in pre-order
  public static ColumnSelector dfs() {
    return new Dfs();
  }

  public static ColumnSelector byIndex(int... indices) {
    return new ByIndex(indices);
  }

  public ColumnSelector and(ColumnSelector other) {
    return new Union(Arrays.asList(this, other));
  }

  public ColumnSelector except(ColumnSelector other) {
    return new Except(this, other);
  }

  public ColumnSelector intersect(ColumnSelector other) {
    return new Intersect(this, other);
  }

  public ColumnSelector filter(ColumnPredicate predicate) {
    return new Filter(this, predicate);
  }

  public ColumnSelector children() {
    return new Children(this);
  }

  public List<ColumnWithPath> resolve(DataFrame df, UnresolvedColumnsPolicy policy) throws ColumnResolutionException {
    return ColumnResolver.resolve(this, df, policy);
  }

  public static class Name extends ColumnSelector {
    private final String name;

    Name(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class PathRef extends ColumnSelector {
    private final ColumnPath path;

    PathRef(ColumnPath path) {
      this.path = path;
    }

    public ColumnPath getPath() {
      return path;
    }

    @Override
    public String toString() {
      return path.toString();
    }
  }

  /**
   * Path reference that also checks the element type of the resolved column.
   */
  public static class TypedRef extends ColumnSelector {
    private final ColumnPath path;
    private final ColumnType expectedType;

    TypedRef(ColumnPath path, ColumnType expectedType) {
      this.path = path;
      this.expectedType = expectedType;
    }

    public ColumnPath getPath() {
      return path;
    }

    public ColumnType getExpectedType() {
      return expectedType;
    }
  }

  public static class AllColumns extends ColumnSelector {
  }

  public static class NoColumns extends ColumnSelector {
  }

  public static class Dfs extends ColumnSelector {
  }

  public static class ByIndex extends ColumnSelector {
    private final int[] indices;

    ByIndex(int[] indices) {
      this.indices = indices.clone();
    }

    public int[] getIndices() {
      return indices.clone();
    }
  }

  public static class Union extends ColumnSelector {
    private final List<ColumnSelector> selectors;

    Union(List<ColumnSelector> selectors) {
      this.selectors = Collections.unmodifiableList(new ArrayList<>(selectors));
    }

    public List<ColumnSelector> getSelectors() {
      return selectors;
    }

    @Override
    public String toString() {
      return selectors.toString();
    }
  }

  public static class Except extends ColumnSelector {
    private final ColumnSelector source;
    private final ColumnSelector excluded;

    Except(ColumnSelector source, ColumnSelector excluded) {
      this.source = source;
      this.excluded = excluded;
    }

    public ColumnSelector getSource() {
      return source;
    }

    public ColumnSelector getExcluded() {
      return excluded;
    }
  }

  public static class Intersect extends ColumnSelector {
    private final ColumnSelector left;
    private final ColumnSelector right;

    Intersect(ColumnSelector left, ColumnSelector right) {
      this.left = left;
      this.right = right;
    }

    public ColumnSelector getLeft() {
      return left;
    }

    public ColumnSelector getRight() {
      return right;
    }
  }

  public static class Filter extends ColumnSelector {
    private final ColumnSelector source;
    private final ColumnPredicate predicate;

    Filter(ColumnSelector source, ColumnPredicate predicate) {
      this.source = source;
      this.predicate = predicate;
    }

    public ColumnSelector getSource() {
      return source;
    }

    public ColumnPredicate getPredicate() {
      return predicate;
    }
  }

  /**
   * The direct children of every group column the source selects.
   */
  public static class Children extends ColumnSelector {
    private final ColumnSelector source;

    Children(ColumnSelector source) {
      this.source = source;
    }

    public ColumnSelector getSource() {
      return source;
    }
  }
}
