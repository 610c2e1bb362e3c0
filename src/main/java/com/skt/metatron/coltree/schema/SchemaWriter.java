package com.skt.metatron.coltree.schema;

import com.skt.metatron.coltree.ColTreeException;
import org.codehaus.jackson.map.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Renders schemas as JSON or as an indented text tree.
 */
public class SchemaWriter {
  private static Logger LOGGER = LoggerFactory.getLogger(SchemaWriter.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SchemaWriter() {
  }

  public static String toJson(List<ColumnSchema> schemas) throws ColTreeException {
    try {
      return MAPPER.writeValueAsString(schemas);
    } catch (IOException e) {
      LOGGER.error("toJson(): cannot serialize schema", e);
      throw new ColTreeException("toJson(): cannot serialize schema", e);
    }
  }

  public static List<ColumnSchema> fromJson(String json) throws ColTreeException {
    try {
      return MAPPER.readValue(json, MAPPER.getTypeFactory().constructCollectionType(List.class, ColumnSchema.class));
    } catch (IOException e) {
      LOGGER.error("fromJson(): cannot parse schema: " + json, e);
      throw new ColTreeException("fromJson(): cannot parse schema", e);
    }
  }

  public static String toText(List<ColumnSchema> schemas) {
    StringBuilder sb = new StringBuilder();
    appendText(sb, schemas, 0);
    return sb.toString();
  }

  private static void appendText(StringBuilder sb, List<ColumnSchema> schemas, int indent) {
    for (ColumnSchema schema : schemas) {
      for (int i = 0; i < indent; i++) {
        sb.append("    ");
      }
      sb.append(schema.getName()).append(":");
      switch (schema.getKind()) {
        case GROUP:
          sb.append(String.format("%n"));
          appendText(sb, schema.getChildren(), indent + 1);
          break;
        case FRAME:
          sb.append(" *").append(String.format("%n"));
          appendText(sb, schema.getChildren(), indent + 1);
          break;
        default:
          sb.append(" ").append(schema.getType()).append(String.format("%n"));
          break;
      }
    }
  }
}
