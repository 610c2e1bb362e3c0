package com.skt.metatron.coltree.aggregate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out column names that are unique among the names seen so far. A taken name gets a
 * numeric suffix: name_1, name_2, ...
 */
public class ColumnNameGenerator {
  private final Set<String> names = new HashSet<>();
  private final List<String> ordered = new ArrayList<>();

  public ColumnNameGenerator() {
  }

  public ColumnNameGenerator(Collection<String> reserved) {
    for (String name : reserved) {
      addIfAbsent(name);
    }
  }

  public String addUnique(String preferredName) {
    String name = preferredName;
    int k = 1;
    while (names.contains(name)) {
      name = preferredName + "_" + k++;
    }
    names.add(name);
    ordered.add(name);
    return name;
  }

  public boolean addIfAbsent(String name) {
    if (!names.add(name)) {
      return false;
    }
    ordered.add(name);
    return true;
  }

  public boolean contains(String name) {
    return names.contains(name);
  }

  public List<String> names() {
    return Collections.unmodifiableList(ordered);
  }
}
