package com.skt.metatron.coltree.select;

/**
 * What the resolver does with a name or path that matches no column.
 */
public enum UnresolvedColumnsPolicy {
  FAIL,
  SKIP,
  CREATE
}
