package com.skt.metatron.coltree.sort;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;
import com.skt.metatron.coltree.type.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the rows of a frame by value columns. The sort is stable: rows with equal keys keep their
 * relative order.
 */
public class RowSorter {
  private static Logger LOGGER = LoggerFactory.getLogger(RowSorter.class);

  private RowSorter() {
  }

  public static DataFrame sort(DataFrame df, List<SortKey> keys) throws ColTreeException {
    List<Column> orderByCols = new ArrayList<>();
    List<SortKey> orderByKeys = new ArrayList<>();
    for (SortKey key : keys) {
      for (ColumnWithPath col : ColumnResolver.resolve(key.selector(), df, UnresolvedColumnsPolicy.FAIL)) {
        orderByCols.add(col.column());
        orderByKeys.add(key);
      }
    }
    LOGGER.debug("sort(): {} rows by {} columns", df.nrow(), orderByCols.size());
    return df.getRows(permutation(df.nrow(), orderByCols, orderByKeys));
  }

  /**
   * Row numbers {@code 0..nrow-1} in sorted order. {@code keys.get(i)} gives the direction of
   * {@code orderByCols.get(i)}.
   */
  public static List<Integer> permutation(int nrow, final List<Column> orderByCols, final List<SortKey> keys)
          throws ConversionException {
    for (Column column : orderByCols) {
      checkComparable(column);
    }

    List<Integer> rownos = new ArrayList<>(nrow);
    for (int rowno = 0; rowno < nrow; rowno++) {
      rownos.add(rowno);
    }

    Collections.sort(rownos, new Comparator<Integer>() {
      @Override
      public int compare(Integer rowno1, Integer rowno2) {
        int result;
        for (int i = 0; i < orderByCols.size(); i++) {
          Column column = orderByCols.get(i);
          result = compareValues(column.get(rowno1), column.get(rowno2), keys.get(i));
          if (result != 0) {
            return result;
          }
        }
        return 0;
      }
    });
    return rownos;
  }

  private static int compareValues(Object obj1, Object obj2, SortKey key) {
    if (obj1 == null && obj2 == null) {
      return 0;
    } else if (obj1 == null) {
      return key.nullsAtEnd() ? 1 : -1;
    } else if (obj2 == null) {
      return key.nullsAtEnd() ? -1 : 1;
    }

    int result;
    if (obj1.getClass() == obj2.getClass()) {
      result = ((Comparable) obj1).compareTo(obj2);
    } else {
      // mixed numeric classes, checked by checkComparable()
      result = Double.compare(((Number) obj1).doubleValue(), ((Number) obj2).doubleValue());
    }
    return key.isDesc() ? -result : result;
  }

  private static void checkComparable(Column column) throws ConversionException {
    DataType dataType = column.type().getDataType();
    if (!(column instanceof ValueColumn) || column.type().isList()
            || dataType == DataType.ROW || dataType == DataType.FRAME) {
      String msg = String.format("sort(): cannot order by %s column %s: %s", column.kind(), column.name(), column.type());
      LOGGER.error(msg);
      throw new ConversionException(msg);
    }

    Class<?> firstClass = null;
    boolean mixed = false;
    boolean allNumbers = true;
    for (Object value : column.values()) {
      if (value == null) {
        continue;
      }
      if (!(value instanceof Comparable)) {
        String msg = String.format("sort(): values of column %s are not comparable: %s", column.name(), value.getClass().getSimpleName());
        LOGGER.error(msg);
        throw new ConversionException(msg);
      }
      allNumbers &= value instanceof Number;
      if (firstClass == null) {
        firstClass = value.getClass();
      } else if (firstClass != value.getClass()) {
        mixed = true;
      }
    }
    if (mixed && !allNumbers) {
      String msg = String.format("sort(): column %s mixes values that cannot be compared", column.name());
      LOGGER.error(msg);
      throw new ConversionException(msg);
    }
  }
}
