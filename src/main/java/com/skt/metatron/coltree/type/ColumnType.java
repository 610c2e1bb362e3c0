package com.skt.metatron.coltree.type;

import java.util.ArrayList;
import java.util.List;

/**
 * Element type of a column: a {@link DataType} tag, nullability, and the element type of LIST columns.
 */
public final class ColumnType {
  public static final ColumnType BOOLEAN = new ColumnType(DataType.BOOLEAN, false, null);
  public static final ColumnType INT = new ColumnType(DataType.INT, false, null);
  public static final ColumnType LONG = new ColumnType(DataType.LONG, false, null);
  public static final ColumnType DOUBLE = new ColumnType(DataType.DOUBLE, false, null);
  public static final ColumnType DECIMAL = new ColumnType(DataType.DECIMAL, false, null);
  public static final ColumnType NUMBER = new ColumnType(DataType.NUMBER, false, null);
  public static final ColumnType STRING = new ColumnType(DataType.STRING, false, null);
  public static final ColumnType DATE = new ColumnType(DataType.DATE, false, null);
  public static final ColumnType TIME = new ColumnType(DataType.TIME, false, null);
  public static final ColumnType DATETIME = new ColumnType(DataType.DATETIME, false, null);
  public static final ColumnType ROW = new ColumnType(DataType.ROW, false, null);
  public static final ColumnType FRAME = new ColumnType(DataType.FRAME, false, null);
  public static final ColumnType ANY = new ColumnType(DataType.ANY, false, null);

  private final DataType dataType;
  private final boolean nullable;
  private final ColumnType elementType;

  private ColumnType(DataType dataType, boolean nullable, ColumnType elementType) {
    this.dataType = dataType;
    this.nullable = nullable;
    this.elementType = elementType;
  }

  public static ColumnType of(DataType dataType) {
    if (dataType == DataType.LIST) {
      return listOf(ANY.withNullable(true));
    }
    return new ColumnType(dataType, false, null);
  }

  public static ColumnType of(DataType dataType, boolean nullable) {
    return of(dataType).withNullable(nullable);
  }

  public static ColumnType listOf(ColumnType elementType) {
    if (elementType == null) {
      throw new IllegalArgumentException("listOf(): element type is null");
    }
    return new ColumnType(DataType.LIST, false, elementType);
  }

  /**
   * Runtime type of a single value. A null value is a nullable ANY.
   */
  public static ColumnType ofValue(Object value) {
    if (value == null) {
      return ANY.withNullable(true);
    }
    DataType dataType = DataType.of(value);
    if (dataType == DataType.LIST) {
      List<ColumnType> elementTypes = new ArrayList<>();
      boolean hasNulls = false;
      for (Object element : (List<?>) value) {
        if (element == null) {
          hasNulls = true;
        } else {
          elementTypes.add(ofValue(element));
        }
      }
      ColumnType elementType = elementTypes.isEmpty() ? ANY : TypeLattice.commonSupertype(elementTypes);
      return listOf(elementType.withNullable(elementType.isNullable() || hasNulls));
    }
    return new ColumnType(dataType, false, null);
  }

  public DataType getDataType() {
    return dataType;
  }

  public boolean isNullable() {
    return nullable;
  }

  public ColumnType getElementType() {
    return elementType;
  }

  public boolean isList() {
    return dataType == DataType.LIST;
  }

  public ColumnType withNullable(boolean nullable) {
    if (this.nullable == nullable) {
      return this;
    }
    return new ColumnType(dataType, nullable, elementType);
  }

  /**
   * True when every value of this type is a valid value of {@code other}. Numeric widening is not
   * subtyping: an INT value is not a LONG value.
   */
  public boolean isSubtypeOf(ColumnType other) {
    if (nullable && !other.nullable) {
      return false;
    }
    if (other.dataType == DataType.ANY) {
      return true;
    }
    if (dataType == other.dataType) {
      if (dataType == DataType.LIST) {
        return elementType.isSubtypeOf(other.elementType);
      }
      return true;
    }
    return other.dataType == DataType.NUMBER && dataType.isNumeric();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnType)) {
      return false;
    }
    ColumnType that = (ColumnType) o;
    if (dataType != that.dataType || nullable != that.nullable) {
      return false;
    }
    return elementType == null ? that.elementType == null : elementType.equals(that.elementType);
  }

  @Override
  public int hashCode() {
    int result = dataType.hashCode();
    result = 31 * result + (nullable ? 1 : 0);
    result = 31 * result + (elementType == null ? 0 : elementType.hashCode());
    return result;
  }

  @Override
  public String toString() {
    String str = dataType == DataType.LIST ? "LIST<" + elementType + ">" : dataType.name();
    return nullable ? str + "?" : str;
  }
}
