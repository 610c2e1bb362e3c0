package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.ColTreeException;

/**
 * User code run once per group. Values go through {@code receiver}; the return value is used only
 * when nothing was yielded inside a pivot.
 */
public interface AggregateBody {
  Object aggregate(AggregateReceiver receiver) throws ColTreeException;
}
