package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.select.ColumnSelector;

/**
 * {@code df.group(selector).into(name)}: moves the selected columns under a group column. The group
 * takes the place of the leftmost selected column.
 */
public class GroupClause {
  private final DataFrame df;
  private final ColumnSelector selector;

  public GroupClause(DataFrame df, ColumnSelector selector) {
    this.df = df;
    this.selector = selector;
  }

  public DataFrame into(String groupName) throws ColTreeException {
    return new MoveClause(df, selector).under(groupName);
  }
}
