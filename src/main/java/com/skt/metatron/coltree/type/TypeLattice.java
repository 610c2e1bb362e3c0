package com.skt.metatron.coltree.type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Least upper bound of column types over the closed {@link DataType} lattice.
 */
public class TypeLattice {

  private TypeLattice() {
  }

  public static ColumnType commonSupertype(ColumnType... types) {
    List<ColumnType> list = new ArrayList<>();
    for (ColumnType type : types) {
      list.add(type);
    }
    return commonSupertype(list);
  }

  public static ColumnType commonSupertype(Collection<ColumnType> types) {
    if (types.isEmpty()) {
      return ColumnType.ANY.withNullable(true);
    }

    boolean nullable = false;
    Set<DataType> dataTypes = new LinkedHashSet<>();
    for (ColumnType type : types) {
      nullable |= type.isNullable();
      dataTypes.add(type.getDataType());
    }

    if (dataTypes.size() == 1) {
      DataType dataType = dataTypes.iterator().next();
      if (dataType == DataType.LIST) {
        return ColumnType.listOf(commonSupertype(elementTypes(types))).withNullable(nullable);
      }
      return ColumnType.of(dataType, nullable);
    }

    if (dataTypes.contains(DataType.LIST)) {
      // a mix of list and scalar types is a list of everything
      return ColumnType.listOf(commonSupertype(elementTypes(types))).withNullable(nullable);
    }

    boolean allNumeric = true;
    for (DataType dataType : dataTypes) {
      allNumeric &= dataType.isNumeric();
    }
    if (allNumeric) {
      return ColumnType.of(numericSupertype(dataTypes), nullable);
    }
    return ColumnType.of(DataType.ANY, nullable);
  }

  private static List<ColumnType> elementTypes(Collection<ColumnType> types) {
    List<ColumnType> elementTypes = new ArrayList<>();
    for (ColumnType type : types) {
      elementTypes.add(type.isList() ? type.getElementType() : type);
    }
    return elementTypes;
  }

  private static DataType numericSupertype(Set<DataType> dataTypes) {
    if (dataTypes.contains(DataType.NUMBER)) {
      return DataType.NUMBER;
    }
    if (dataTypes.contains(DataType.DECIMAL)) {
      return dataTypes.contains(DataType.DOUBLE) ? DataType.NUMBER : DataType.DECIMAL;
    }
    if (dataTypes.contains(DataType.DOUBLE)) {
      return DataType.DOUBLE;
    }
    if (dataTypes.contains(DataType.LONG)) {
      return DataType.LONG;
    }
    return DataType.INT;
  }
}
