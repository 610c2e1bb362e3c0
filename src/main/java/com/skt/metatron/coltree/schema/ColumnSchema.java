package com.skt.metatron.coltree.schema;

import com.skt.metatron.coltree.column.ColumnKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Structure of one column: kind, element type and, for groups and frames, the nested columns.
 */
public class ColumnSchema {
  private String name;
  private List<String> path;
  private ColumnKind kind;
  private String type;
  private boolean nullable;
  private List<ColumnSchema> children = new ArrayList<>();

  public ColumnSchema() {
  }

  public ColumnSchema(String name, List<String> path, ColumnKind kind, String type, boolean nullable) {
    this.name = name;
    this.path = path;
    this.kind = kind;
    this.type = type;
    this.nullable = nullable;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<String> getPath() {
    return path;
  }

  public void setPath(List<String> path) {
    this.path = path;
  }

  public ColumnKind getKind() {
    return kind;
  }

  public void setKind(ColumnKind kind) {
    this.kind = kind;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public boolean isNullable() {
    return nullable;
  }

  public void setNullable(boolean nullable) {
    this.nullable = nullable;
  }

  public List<ColumnSchema> getChildren() {
    return children;
  }

  public void setChildren(List<ColumnSchema> children) {
    this.children = children;
  }

  @Override
  public String toString() {
    return name + ": " + kind + " " + type;
  }
}
