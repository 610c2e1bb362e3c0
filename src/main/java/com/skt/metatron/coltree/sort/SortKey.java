package com.skt.metatron.coltree.sort;

import com.skt.metatron.coltree.select.ColumnSelector;

/**
 * Columns to order rows by, with a direction. Ascending keys put nulls first and descending keys put
 * them last, unless {@link #nullsLast()} is asked for.
 */
public class SortKey {
  private final ColumnSelector selector;
  private final boolean desc;
  private final boolean nullsLast;

  private SortKey(ColumnSelector selector, boolean desc, boolean nullsLast) {
    this.selector = selector;
    this.desc = desc;
    this.nullsLast = nullsLast;
  }

  public static SortKey asc(String... colNames) {
    return asc(ColumnSelector.cols(colNames));
  }

  public static SortKey asc(ColumnSelector selector) {
    return new SortKey(selector, false, false);
  }

  public static SortKey desc(String... colNames) {
    return desc(ColumnSelector.cols(colNames));
  }

  public static SortKey desc(ColumnSelector selector) {
    return new SortKey(selector, true, false);
  }

  public SortKey nullsLast() {
    return new SortKey(selector, desc, true);
  }

  public ColumnSelector selector() {
    return selector;
  }

  public boolean isDesc() {
    return desc;
  }

  public boolean nullsAtEnd() {
    return nullsLast || desc;
  }
}
