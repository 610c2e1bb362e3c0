package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.column.Column;

/**
 * Reduces a column to one value.
 */
public interface Aggregator {
  Object aggregate(Column column) throws ColTreeException;
}
