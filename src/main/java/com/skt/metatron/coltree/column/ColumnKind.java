package com.skt.metatron.coltree.column;

public enum ColumnKind {
  VALUE,
  GROUP,
  FRAME
}
