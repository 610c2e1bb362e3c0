package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.type.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Built-in reductions. Nulls are skipped; an all-null column sums to null.
 */
public class Aggregators {
  private static Logger LOGGER = LoggerFactory.getLogger(Aggregators.class);

  enum AggrType {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX
  }

  public static final Aggregator COUNT = new BuiltIn(AggrType.COUNT);
  public static final Aggregator SUM = new BuiltIn(AggrType.SUM);
  public static final Aggregator AVG = new BuiltIn(AggrType.AVG);
  public static final Aggregator MIN = new BuiltIn(AggrType.MIN);
  public static final Aggregator MAX = new BuiltIn(AggrType.MAX);

  private Aggregators() {
  }

  private static class BuiltIn implements Aggregator {
    private final AggrType aggrType;

    BuiltIn(AggrType aggrType) {
      this.aggrType = aggrType;
    }

    @Override
    public Object aggregate(Column column) throws ColTreeException {
      switch (aggrType) {
        case COUNT:
          long count = 0;
          for (Object value : column.values()) {
            if (value != null) {
              count++;
            }
          }
          return count;
        case SUM:
        case AVG:
          return sumOrAvg(column);
        case MIN:
        case MAX:
          return minOrMax(column);
        default:
          throw new IllegalStateException("aggregate(): " + aggrType);
      }
    }

    private Object sumOrAvg(Column column) throws ConversionException {
      DataType dataType = column.type().getDataType();
      if (!dataType.isNumeric()) {
        String msg = String.format("aggregate(): column type of aggregation value should be numeric: %s %s",
                column.name(), column.type());
        LOGGER.error(msg);
        throw new ConversionException(msg);
      }
      boolean integral = dataType == DataType.INT || dataType == DataType.LONG;

      long longSum = 0;
      double doubleSum = 0;
      long count = 0;
      for (Object value : column.values()) {
        if (value == null) {
          continue;
        }
        count++;
        if (integral) {
          longSum += ((Number) value).longValue();
        } else {
          doubleSum += ((Number) value).doubleValue();
        }
      }
      if (count == 0) {
        return null;
      }

      if (aggrType == AggrType.SUM) {
        return integral ? (Object) longSum : (Object) doubleSum;
      }
      double sum = integral ? (double) longSum : doubleSum;
      return BigDecimal.valueOf(sum / count).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private Object minOrMax(Column column) throws ConversionException {
      Comparable result = null;
      for (Object value : column.values()) {
        if (value == null) {
          continue;
        }
        if (!(value instanceof Comparable)) {
          String msg = String.format("aggregate(): values of column %s are not comparable", column.name());
          LOGGER.error(msg);
          throw new ConversionException(msg);
        }
        Comparable cmp = (Comparable) value;
        if (result == null || (aggrType == AggrType.MIN ? cmp.compareTo(result) < 0 : cmp.compareTo(result) > 0)) {
          result = cmp;
        }
      }
      return result;
    }
  }
}
