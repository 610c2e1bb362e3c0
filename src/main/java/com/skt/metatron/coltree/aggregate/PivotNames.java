package com.skt.metatron.coltree.aggregate;

import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.column.ColumnPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column names for pivot key values. The same key prefix always maps to the same name within one
 * pivot, and distinct values that print alike get distinct names.
 */
public class PivotNames {
  private static Logger LOGGER = LoggerFactory.getLogger(PivotNames.class);

  private final Collection<String> reservedTopNames;
  private final Map<ColumnPath, ColumnNameGenerator> generators = new HashMap<>();
  private final Map<List<Object>, String> assigned = new HashMap<>();
  private int generatedCnt;

  public PivotNames() {
    this(Collections.<String>emptyList());
  }

  /**
   * @param reservedTopNames names already used at the top level, such as the groupBy key columns
   */
  public PivotNames(Collection<String> reservedTopNames) {
    this.reservedTopNames = reservedTopNames;
  }

  public ColumnPath pathFor(ColumnPath groupPath, List<Object> keyValues) throws StructuralException {
    ColumnPath path = ColumnPath.empty();
    for (int i = 0; i < keyValues.size(); i++) {
      List<Object> prefix = new ArrayList<>();
      prefix.add(groupPath);
      prefix.addAll(keyValues.subList(0, i + 1));

      String name = assigned.get(prefix);
      if (name == null) {
        name = generatorFor(groupPath.plus(path)).addUnique(String.valueOf(keyValues.get(i)));
        assigned.put(prefix, name);
        if (++generatedCnt > Pivots.MAX_PIVOT_COLUMNS) {
          String msg = String.format("pathFor(): too many pivot columns: more than %d", Pivots.MAX_PIVOT_COLUMNS);
          LOGGER.error(msg);
          throw new StructuralException(msg);
        }
      }
      path = path.plus(name);
    }
    return path;
  }

  private ColumnNameGenerator generatorFor(ColumnPath parent) {
    ColumnNameGenerator generator = generators.get(parent);
    if (generator == null) {
      generator = parent.isEmpty() ? new ColumnNameGenerator(reservedTopNames) : new ColumnNameGenerator();
      generators.put(parent, generator);
    }
    return generator;
  }
}
