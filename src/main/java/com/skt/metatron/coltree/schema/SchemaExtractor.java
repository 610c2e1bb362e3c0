package com.skt.metatron.coltree.schema;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ColumnPath;

import java.util.ArrayList;
import java.util.List;

public class SchemaExtractor {

  private SchemaExtractor() {
  }

  public static List<ColumnSchema> extract(DataFrame df) {
    return extract(df, ColumnPath.empty());
  }

  /**
   * A frame column takes its children from its first non-null frame.
   */
  private static List<ColumnSchema> extract(DataFrame df, ColumnPath parent) {
    List<ColumnSchema> schemas = new ArrayList<>();
    for (Column column : df.columns()) {
      ColumnPath path = parent.plus(column.name());
      ColumnSchema schema = new ColumnSchema(column.name(), path.names(), column.kind(),
              column.type().toString(), column.type().isNullable());
      if (column.isGroup()) {
        schema.setChildren(extract(column.asGroup().df(), path));
      } else if (column.isFrame()) {
        for (DataFrame frame : column.asFrame().frames()) {
          if (frame != null) {
            schema.setChildren(extract(frame, path));
            break;
          }
        }
      }
      schemas.add(schema);
    }
    return schemas;
  }
}
