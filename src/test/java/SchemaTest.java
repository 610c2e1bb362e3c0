import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnKind;
import com.skt.metatron.coltree.schema.ColumnSchema;
import com.skt.metatron.coltree.schema.SchemaWriter;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SchemaTest {

  @Test
  public void test_schema() throws ColTreeException {
    List<ColumnSchema> schema = Fixtures.sample().schema();
    assertEquals(4, schema.size());

    ColumnSchema g = schema.get(1);
    assertEquals(ColumnKind.GROUP, g.getKind());
    assertEquals("ROW", g.getType());
    assertEquals(2, g.getChildren().size());
    assertEquals(Arrays.asList("g", "y"), g.getChildren().get(1).getPath());
    assertEquals("INT", g.getChildren().get(1).getType());
  }

  @Test
  public void test_toText() throws ColTreeException {
    String text = SchemaWriter.toText(Fixtures.sample().schema());
    System.out.print(text);

    String expected = String.format("a: INT%ng:%n    x: STRING%n    y: INT%nb: STRING%nc: DOUBLE%n");
    assertEquals(expected, text);
  }

  @Test
  public void test_toText_frame() throws Exception {
    DataFrame grouped = Fixtures.loadDataFrame("dataprep/sales.csv").groupBy("region").plain();
    String text = SchemaWriter.toText(grouped.schema());
    assertTrue(text.startsWith(String.format("region: STRING%ngroups: *%n    region: STRING%n    city: STRING%n")));
    assertTrue(text.contains(String.format("    qty: INT%n    price: DOUBLE%n")));
  }

  @Test
  public void test_json_round_trip() throws ColTreeException {
    DataFrame df = DataFrame.of(Fixtures.col("n", 1, null), Fixtures.group("g", Fixtures.col("s", "a", "b")));
    String json = SchemaWriter.toJson(df.schema());
    System.out.println(json);
    assertTrue(json.contains("\"GROUP\""));
    assertTrue(json.contains("\"INT?\""));

    List<ColumnSchema> parsed = SchemaWriter.fromJson(json);
    assertEquals(2, parsed.size());
    assertEquals("n", parsed.get(0).getName());
    assertTrue(parsed.get(0).isNullable());
    assertEquals(ColumnKind.GROUP, parsed.get(1).getKind());
    assertEquals("STRING", parsed.get(1).getChildren().get(0).getType());
    assertFalse(parsed.get(1).getChildren().get(0).isNullable());
  }

  @Test(expected = ColTreeException.class)
  public void test_fromJson_malformed() throws ColTreeException {
    SchemaWriter.fromJson("[{\"name\": ");
  }
}
