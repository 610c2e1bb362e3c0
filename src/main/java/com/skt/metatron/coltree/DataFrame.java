package com.skt.metatron.coltree;

import com.skt.metatron.coltree.aggregate.AggregateBody;
import com.skt.metatron.coltree.aggregate.Aggregations;
import com.skt.metatron.coltree.aggregate.PivotClause;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.group.GroupBy;
import com.skt.metatron.coltree.group.GroupedDataFrame;
import com.skt.metatron.coltree.schema.ColumnSchema;
import com.skt.metatron.coltree.schema.SchemaExtractor;
import com.skt.metatron.coltree.select.ColumnPredicate;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;
import com.skt.metatron.coltree.sort.RowSorter;
import com.skt.metatron.coltree.sort.SortKey;
import com.skt.metatron.coltree.tree.ColumnInserter;
import com.skt.metatron.coltree.tree.ColumnRemover;
import com.skt.metatron.coltree.tree.ColumnToInsert;
import com.skt.metatron.coltree.tree.GroupClause;
import com.skt.metatron.coltree.tree.InsertClause;
import com.skt.metatron.coltree.tree.MoveClause;
import com.skt.metatron.coltree.type.ColumnType;
import com.skt.metatron.coltree.type.ConverterRegistry;
import com.skt.metatron.coltree.type.DataType;
import com.skt.metatron.coltree.type.StringParsers;
import org.apache.commons.collections.map.HashedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered list of uniquely named columns of equal length. Columns may be value columns, group columns
 * holding a nested frame, or frame columns holding one frame per row.
 *
 * Every operation returns a new frame. {@link #set(String, Column)} is the only mutation.
 */
public class DataFrame {
  private static Logger LOGGER = LoggerFactory.getLogger(DataFrame.class);

  public static final int DEFAULT_SHOW_LIMIT = 20;

  private List<Column> columns;
  private Map<String, Integer> nameIdxs;
  private int nrow;

  public DataFrame(List<? extends Column> columns) throws StructuralException {
    this(new ArrayList<Column>(columns), -1);
    validate();
  }

  private DataFrame(List<Column> columns, int nrow) {
    this.columns = columns;
    this.nrow = nrow >= 0 ? nrow : (columns.isEmpty() ? 0 : columns.get(0).size());
    buildNameIdxs();
  }

  public static DataFrame of(Column... columns) throws StructuralException {
    List<Column> list = new ArrayList<>();
    Collections.addAll(list, columns);
    return new DataFrame(list);
  }

  public static DataFrame empty() {
    return empty(0);
  }

  /**
   * A frame without columns that still has a row count.
   */
  public static DataFrame empty(int nrow) {
    return new DataFrame(new ArrayList<Column>(), nrow);
  }

  private void buildNameIdxs() {
    nameIdxs = new HashedMap();
    for (int colno = 0; colno < columns.size(); colno++) {
      String name = columns.get(colno).name();
      if (!nameIdxs.containsKey(name)) {
        nameIdxs.put(name, colno);
      }
    }
  }

  private void validate() throws StructuralException {
    Set<String> names = new HashSet<>();
    for (Column column : columns) {
      if (column.size() != nrow) {
        String msg = String.format("DataFrame(): unequal column sizes: %s (%d), %s (%d)",
                columns.get(0).name(), nrow, column.name(), column.size());
        LOGGER.error(msg);
        throw new StructuralException(msg);
      }
      // unnamed columns may repeat
      if (!column.name().isEmpty() && !names.add(column.name())) {
        String msg = "DataFrame(): duplicate column name: " + column.name();
        LOGGER.error(msg);
        throw new StructuralException(msg);
      }
    }
  }

  public int ncol() {
    return columns.size();
  }

  public int nrow() {
    return nrow;
  }

  public List<Column> columns() {
    return Collections.unmodifiableList(columns);
  }

  public List<String> columnNames() {
    List<String> names = new ArrayList<>();
    for (Column column : columns) {
      names.add(column.name());
    }
    return names;
  }

  public Column column(int colno) {
    return columns.get(colno);
  }

  public Column column(String colName) throws ColumnResolutionException {
    Column column = tryGetColumn(colName);
    if (column == null) {
      String msg = "column(): column not found: " + colName;
      LOGGER.error(msg);
      throw new ColumnResolutionException(msg);
    }
    return column;
  }

  public Column column(ColumnPath path) throws ColumnResolutionException {
    return ColumnResolver.resolvePath(this, path, UnresolvedColumnsPolicy.FAIL).column();
  }

  public Column tryGetColumn(String colName) {
    Integer colno = nameIdxs.get(colName);
    return colno == null ? null : columns.get(colno);
  }

  public int getColumnIndex(String colName) {
    Integer colno = nameIdxs.get(colName);
    return colno == null ? -1 : colno;
  }

  public boolean hasColumn(String colName) {
    return nameIdxs.containsKey(colName);
  }

  public Row row(int rowno) {
    if (rowno < 0 || rowno >= nrow) {
      throw new IndexOutOfBoundsException(String.format("row(): rowno=%d nrow=%d", rowno, nrow));
    }
    return new Row(this, rowno);
  }

  public List<Row> rows() {
    List<Row> rows = new ArrayList<>(nrow);
    for (int rowno = 0; rowno < nrow; rowno++) {
      rows.add(new Row(this, rowno));
    }
    return rows;
  }

  /**
   * Gathers rows by index, in the given order. Indices may repeat.
   */
  public DataFrame getRows(List<Integer> rownos) {
    List<Column> newColumns = new ArrayList<>(columns.size());
    for (Column column : columns) {
      newColumns.add(column.slice(rownos));
    }
    return new DataFrame(newColumns, rownos.size());
  }

  public DataFrame getRows(int from, int to) {
    List<Integer> rownos = new ArrayList<>();
    for (int rowno = from; rowno < to; rowno++) {
      rownos.add(rowno);
    }
    return getRows(rownos);
  }

  /**
   * Replaces the column with this name, or appends it. The column is renamed to {@code colName}.
   */
  public void set(String colName, Column column) throws StructuralException {
    if (!columns.isEmpty() && column.size() != nrow) {
      String msg = String.format("set(): column %s has %d rows, frame has %d", colName, column.size(), nrow);
      LOGGER.error(msg);
      throw new StructuralException(msg);
    }
    Column renamed = column.rename(colName);
    Integer colno = nameIdxs.get(colName);
    if (colno == null) {
      columns.add(renamed);
      nameIdxs.put(colName, columns.size() - 1);
    } else {
      columns.set(colno, renamed);
    }
    nrow = column.size();
  }

  public DataFrame plus(Column column) throws StructuralException {
    List<Column> newColumns = new ArrayList<>(columns);
    newColumns.add(column);
    if (columns.isEmpty() && nrow != 0 && column.size() != nrow) {
      String msg = String.format("plus(): column %s has %d rows, frame has %d", column.name(), column.size(), nrow);
      LOGGER.error(msg);
      throw new StructuralException(msg);
    }
    return new DataFrame(newColumns);
  }

  public DataFrame select(String... colNames) throws ColTreeException {
    return select(ColumnSelector.cols(colNames));
  }

  /**
   * Keeps the selected columns. Nested selections keep their enclosing groups.
   */
  public DataFrame select(ColumnSelector selector) throws ColTreeException {
    List<ColumnWithPath> selected = ColumnResolver.top(ColumnResolver.resolve(selector, this, UnresolvedColumnsPolicy.FAIL));
    if (selected.isEmpty()) {
      return empty(nrow);
    }
    List<ColumnToInsert> toInsert = new ArrayList<>();
    for (ColumnWithPath col : selected) {
      toInsert.add(new ColumnToInsert(col.path(), null, col.column()));
    }
    return ColumnInserter.insert(null, toInsert);
  }

  public DataFrame remove(String... colNames) throws ColTreeException {
    return remove(ColumnSelector.cols(colNames));
  }

  public DataFrame remove(ColumnSelector selector) throws ColTreeException {
    return ColumnRemover.remove(this, selector).df();
  }

  public MoveClause move(String... colNames) throws ColTreeException {
    return move(ColumnSelector.cols(colNames));
  }

  public MoveClause move(ColumnSelector selector) throws ColTreeException {
    return new MoveClause(this, selector);
  }

  public DataFrame moveTo(int columnIndex, ColumnSelector selector) throws ColTreeException {
    return move(selector).to(columnIndex);
  }

  public DataFrame moveToLeft(ColumnSelector selector) throws ColTreeException {
    return move(selector).toLeft();
  }

  public DataFrame moveToRight(ColumnSelector selector) throws ColTreeException {
    return move(selector).toRight();
  }

  public InsertClause insert(Column column) {
    return new InsertClause(this, column);
  }

  public GroupClause group(String... colNames) {
    return group(ColumnSelector.cols(colNames));
  }

  public GroupClause group(ColumnSelector selector) {
    return new GroupClause(this, selector);
  }

  /**
   * Replaces the group column at {@code groupPath} with its children, in place.
   */
  public DataFrame ungroup(ColumnPath groupPath) throws ColTreeException {
    if (!column(groupPath).isGroup()) {
      String msg = "ungroup(): not a group column: " + groupPath;
      LOGGER.error(msg);
      throw new ColumnResolutionException(msg);
    }
    return move(ColumnSelector.path(groupPath).children()).into(new MoveClause.PathFunction() {
      @Override
      public ColumnPath apply(ColumnWithPath col) {
        return col.path().dropLast(2).plus(col.name());
      }
    });
  }

  public DataFrame ungroup(String groupName) throws ColTreeException {
    return ungroup(ColumnPath.of(groupName));
  }

  /**
   * Replaces the column at {@code path}. The new column must have the frame's row count.
   */
  public DataFrame replace(ColumnPath path, Column newColumn) throws ColTreeException {
    if (path.isEmpty()) {
      String msg = "replace(): empty path";
      LOGGER.error(msg);
      throw new ColumnResolutionException(msg);
    }
    int colno = getColumnIndex(path.get(0));
    if (colno == -1) {
      String msg = "replace(): column not found: " + path;
      LOGGER.error(msg);
      throw new ColumnResolutionException(msg);
    }
    Column replacement = newColumn;
    if (path.size() > 1) {
      Column column = columns.get(colno);
      if (!column.isGroup()) {
        String msg = String.format("replace(): %s is not a group column: %s", column.name(), path);
        LOGGER.error(msg);
        throw new ColumnResolutionException(msg);
      }
      GroupColumn group = column.asGroup();
      replacement = group.withDf(group.df().replace(path.dropFirst(), newColumn));
    }
    List<Column> newColumns = new ArrayList<>(columns);
    newColumns.set(colno, replacement);
    return new DataFrame(newColumns);
  }

  public DataFrame rename(ColumnPath path, String newName) throws ColTreeException {
    return replace(path, column(path).rename(newName));
  }

  public DataFrame rename(String colName, String newName) throws ColTreeException {
    return rename(ColumnPath.of(colName), newName);
  }

  public DataFrame sortBy(String... colNames) throws ColTreeException {
    return sortBy(SortKey.asc(colNames));
  }

  public DataFrame sortBy(ColumnSelector selector) throws ColTreeException {
    return sortBy(SortKey.asc(selector));
  }

  public DataFrame sortByDesc(String... colNames) throws ColTreeException {
    return sortBy(SortKey.desc(colNames));
  }

  public DataFrame sortByDesc(ColumnSelector selector) throws ColTreeException {
    return sortBy(SortKey.desc(selector));
  }

  /**
   * Stable sort by the given keys, the first key being the most significant.
   */
  public DataFrame sortBy(SortKey... keys) throws ColTreeException {
    return RowSorter.sort(this, Arrays.asList(keys));
  }

  public GroupedDataFrame groupBy(String... colNames) throws ColTreeException {
    return groupBy(ColumnSelector.cols(colNames));
  }

  public GroupedDataFrame groupBy(ColumnSelector selector) throws ColTreeException {
    return GroupBy.groupBy(this, selector);
  }

  /**
   * Runs {@code body} once over the whole frame and returns its yields as a single row.
   */
  public DataFrame aggregate(AggregateBody body) throws ColTreeException {
    return Aggregations.aggregate(this, body);
  }

  public PivotClause pivot(String... colNames) {
    return pivot(ColumnSelector.cols(colNames));
  }

  public PivotClause pivot(ColumnSelector selector) {
    return PivotClause.of(this, selector);
  }

  public DataFrame cast(ColumnSelector selector, ColumnType newType) throws ColTreeException {
    return cast(selector, newType, ConverterRegistry.getDefault());
  }

  public DataFrame cast(ColumnSelector selector, ColumnType newType, ConverterRegistry registry) throws ColTreeException {
    DataFrame df = this;
    for (ColumnWithPath col : ColumnResolver.resolve(selector, this, UnresolvedColumnsPolicy.FAIL)) {
      df = df.replace(col.path(), registry.castTo(col.column(), newType));
    }
    return df;
  }

  /**
   * Guesses the type of every string column, nested ones included.
   */
  public DataFrame parse() throws ColTreeException {
    return parse(ColumnSelector.dfs().filter(ColumnPredicate.ofType(DataType.STRING)));
  }

  public DataFrame parse(ColumnSelector selector) throws ColTreeException {
    DataFrame df = this;
    for (ColumnWithPath col : ColumnResolver.resolve(selector, this, UnresolvedColumnsPolicy.FAIL)) {
      if (col.column() instanceof ValueColumn) {
        df = df.replace(col.path(), StringParsers.tryParseAny((ValueColumn) col.column()));
      }
    }
    return df;
  }

  public List<ColumnSchema> schema() {
    return SchemaExtractor.extract(this);
  }

  public void show() {
    show(DEFAULT_SHOW_LIMIT);
  }

  public void show(int limit) {
    System.out.print(render(limit));
  }

  @Override
  public String toString() {
    return render(DEFAULT_SHOW_LIMIT);
  }

  /**
   * Text table of the leaf columns. Nested columns are headed by their dotted path.
   */
  public String render(int limit) {
    limit = nrow < limit ? nrow : limit;

    List<String> headers = new ArrayList<>();
    List<Column> leaves = new ArrayList<>();
    collectLeaves(this, ColumnPath.empty(), headers, leaves);

    List<Integer> widths = new ArrayList<>();
    for (int i = 0; i < leaves.size(); i++) {
      int width = Math.max(headers.get(i).length(), leaves.get(i).type().toString().length());
      for (int rowno = 0; rowno < limit; rowno++) {
        width = Math.max(width, cellString(leaves.get(i).get(rowno)).length());
      }
      widths.add(width);
    }

    StringBuilder sb = new StringBuilder();
    renderSep(sb, widths);
    List<String> types = new ArrayList<>();
    for (Column leaf : leaves) {
      types.add(leaf.type().toString());
    }
    renderLine(sb, widths, headers);
    renderLine(sb, widths, types);
    renderSep(sb, widths);
    for (int rowno = 0; rowno < limit; rowno++) {
      List<String> cells = new ArrayList<>();
      for (Column leaf : leaves) {
        cells.add(cellString(leaf.get(rowno)));
      }
      renderLine(sb, widths, cells);
    }
    renderSep(sb, widths);
    if (limit < nrow) {
      sb.append(String.format("(%d of %d rows)%n", limit, nrow));
    }
    return sb.toString();
  }

  private static void collectLeaves(DataFrame df, ColumnPath parent, List<String> headers, List<Column> leaves) {
    for (Column column : df.columns) {
      ColumnPath path = parent.plus(column.name());
      if (column.isGroup()) {
        collectLeaves(column.asGroup().df(), path, headers, leaves);
      } else {
        headers.add(path.toString());
        leaves.add(column);
      }
    }
  }

  private static String cellString(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof DataFrame) {
      DataFrame df = (DataFrame) value;
      return String.format("[%d x %d]", df.nrow(), df.ncol());
    }
    return value.toString();
  }

  private static void renderSep(StringBuilder sb, List<Integer> widths) {
    sb.append("+");
    for (int width : widths) {
      for (int i = 0; i < width; i++) {
        sb.append("-");
      }
      sb.append("+");
    }
    sb.append(String.format("%n"));
  }

  private static void renderLine(StringBuilder sb, List<Integer> widths, List<String> cells) {
    sb.append("|");
    for (int i = 0; i < cells.size(); i++) {
      sb.append(String.format("%" + widths.get(i) + "s", cells.get(i)));
      sb.append("|");
    }
    sb.append(String.format("%n"));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataFrame)) {
      return false;
    }
    DataFrame that = (DataFrame) o;
    return nrow == that.nrow && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + nrow;
  }
}
