package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.type.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sink handed to an {@link AggregateBody}, bound to the rows of one group.
 */
public class AggregateReceiver implements ValueSink {
  private final DataFrame df;
  private final List<NamedValue> values = new ArrayList<>();

  public AggregateReceiver(DataFrame df) {
    this.df = df;
  }

  public DataFrame df() {
    return df;
  }

  public int nrow() {
    return df.nrow();
  }

  public Column column(String colName) throws ColumnResolutionException {
    return df.column(colName);
  }

  public Column column(ColumnPath path) throws ColumnResolutionException {
    return df.column(path);
  }

  @Override
  public NamedValue yieldValue(ColumnPath path, Object value, ColumnType type, Object defaultValue, boolean guessType) {
    NamedValue namedValue = NamedValue.create(path, value, type, defaultValue, guessType);
    values.add(namedValue);
    return namedValue;
  }

  public NamedValue yieldValue(ColumnPath path, Object value) {
    return yieldValue(path, value, null, null, true);
  }

  public NamedValue yieldValue(String colName, Object value) {
    return yieldValue(ColumnPath.of(colName), value);
  }

  /**
   * A single value is yielded as it is, several values as one list.
   */
  public NamedValue yieldOneOrMany(ColumnPath path, List<?> list, ColumnType elementType, Object defaultValue) {
    if (list.size() == 1) {
      return yieldValue(path, list.get(0), elementType, defaultValue, false);
    }
    return yieldValue(path, new ArrayList<Object>(list), ColumnType.listOf(elementType), defaultValue, false);
  }

  public NamedValue into(Object value, String colName) {
    return yieldValue(ColumnPath.of(colName), value);
  }

  public NamedValue into(Object value, ColumnPath path) {
    return yieldValue(path, value);
  }

  public NamedValue count() {
    return count("count");
  }

  public NamedValue count(String resultName) {
    return yieldValue(ColumnPath.of(resultName), df.nrow(), ColumnType.INT, 0, false);
  }

  public NamedValue aggregate(String resultName, Aggregator aggregator, String colName) throws ColTreeException {
    return yieldValue(ColumnPath.of(resultName), aggregator.aggregate(column(colName)));
  }

  public NamedValue aggregate(String resultName, Aggregator aggregator, ColumnPath path) throws ColTreeException {
    return yieldValue(ColumnPath.of(resultName), aggregator.aggregate(column(path)));
  }

  /**
   * Pivot inside this group. Its values are yielded into this receiver.
   */
  public PivotClause pivot(String... colNames) {
    return pivot(ColumnSelector.cols(colNames));
  }

  public PivotClause pivot(ColumnSelector selector) {
    return PivotClause.of(this, selector);
  }

  public List<NamedValue> values() {
    return Collections.unmodifiableList(values);
  }
}
