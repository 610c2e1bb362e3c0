package com.skt.metatron.coltree.tree;

import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gives each column the shortest path suffix that is unique among the given columns.
 */
public class PathShortener {

  private PathShortener() {
  }

  /**
   * Starts every column at its last name and lengthens only the colliding ones by one name per round
   * until no collision can be resolved any further. Input order is kept.
   */
  public static List<ColumnWithPath> shortenPaths(List<ColumnWithPath> columns) {
    Map<ColumnPath, List<ColumnWithPath>> byPath = new LinkedHashMap<>();
    for (ColumnWithPath col : columns) {
      add(byPath, col.path().last(1), col);
    }

    while (true) {
      List<ColumnPath> conflicts = new ArrayList<>();
      for (Map.Entry<ColumnPath, List<ColumnWithPath>> entry : byPath.entrySet()) {
        if (entry.getValue().size() > 1 && canExtend(entry.getKey(), entry.getValue())) {
          conflicts.add(entry.getKey());
        }
      }
      if (conflicts.isEmpty()) {
        break;
      }
      for (ColumnPath key : conflicts) {
        List<ColumnWithPath> cols = byPath.remove(key);
        for (ColumnWithPath col : cols) {
          ColumnPath newPath = col.path().size() > key.size() ? col.path().last(key.size() + 1) : col.path();
          add(byPath, newPath, col);
        }
      }
    }

    Map<ColumnWithPath, ColumnPath> assigned = new IdentityHashMap<>();
    for (Map.Entry<ColumnPath, List<ColumnWithPath>> entry : byPath.entrySet()) {
      for (ColumnWithPath col : entry.getValue()) {
        assigned.put(col, entry.getKey());
      }
    }
    List<ColumnWithPath> result = new ArrayList<>();
    for (ColumnWithPath col : columns) {
      result.add(col.changePath(assigned.get(col)));
    }
    return result;
  }

  private static boolean canExtend(ColumnPath key, List<ColumnWithPath> cols) {
    for (ColumnWithPath col : cols) {
      if (col.path().size() > key.size()) {
        return true;
      }
    }
    return false;
  }

  private static void add(Map<ColumnPath, List<ColumnWithPath>> byPath, ColumnPath path, ColumnWithPath col) {
    List<ColumnWithPath> list = byPath.get(path);
    if (list == null) {
      list = new ArrayList<>();
      byPath.put(path, list);
    }
    list.add(col);
  }
}
