package com.skt.metatron.coltree.select;

import com.skt.metatron.coltree.column.ColumnKind;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.type.DataType;

import java.util.regex.Pattern;

public interface ColumnPredicate {
  boolean test(ColumnWithPath col);

  static ColumnPredicate nameMatches(String regex) {
    final Pattern pattern = Pattern.compile(regex);
    return new ColumnPredicate() {
      @Override
      public boolean test(ColumnWithPath col) {
        return pattern.matcher(col.name()).matches();
      }
    };
  }

  static ColumnPredicate ofKind(final ColumnKind kind) {
    return new ColumnPredicate() {
      @Override
      public boolean test(ColumnWithPath col) {
        return col.column().kind() == kind;
      }
    };
  }

  static ColumnPredicate ofType(final DataType dataType) {
    return new ColumnPredicate() {
      @Override
      public boolean test(ColumnWithPath col) {
        return col.column().type().getDataType() == dataType;
      }
    };
  }

  // value and frame columns
  static ColumnPredicate isLeaf() {
    return new ColumnPredicate() {
      @Override
      public boolean test(ColumnWithPath col) {
        return !col.column().isGroup();
      }
    };
  }
}
