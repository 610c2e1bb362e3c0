import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.aggregate.AggregateBody;
import com.skt.metatron.coltree.aggregate.AggregateReceiver;
import com.skt.metatron.coltree.aggregate.Aggregators;
import com.skt.metatron.coltree.aggregate.PivotClause;
import com.skt.metatron.coltree.aggregate.PivotNames;
import com.skt.metatron.coltree.aggregate.Pivots;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.type.ColumnType;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class PivotTest {

  private static DataFrame sales;
  private static DataFrame kv;

  @BeforeClass
  public static void setUp() throws Exception {
    sales = Fixtures.loadDataFrame("dataprep/sales.csv");
    kv = Fixtures.loadDataFrame("dataprep/pivot_test.csv");
  }

  private static List<String> childNames(DataFrame df, String group) throws ColTreeException {
    return df.column(group).asGroup().df().columnNames();
  }

  @Test
  public void test_pivot_groupBy_value() throws ColTreeException {
    DataFrame result = kv.pivot("key").groupBy("id").value("value");
    result.show();

    assertEquals(Arrays.asList("id", "a", "b", "c"), result.columnNames());
    assertEquals(Arrays.asList(1, 2), result.column("id").values());
    assertEquals(Arrays.asList(10, 30), result.column("a").values());
    assertEquals(Arrays.asList(20, null), result.column("b").values());
    assertEquals(Arrays.asList(null, 40), result.column("c").values());
    assertEquals(ColumnType.INT, result.column("a").type());
    assertEquals(ColumnType.INT.withNullable(true), result.column("b").type());
  }

  @Test
  public void test_groupBy_pivot_count() throws ColTreeException {
    DataFrame result = kv.groupBy("id").pivot("key").count();
    assertEquals(Arrays.asList("id", "a", "b", "c"), result.columnNames());
    assertEquals(Arrays.asList(1, 1), result.column("a").values());
    assertEquals(Arrays.asList(1, 0), result.column("b").values());
    assertEquals(Arrays.asList(0, 1), result.column("c").values());
    assertEquals(ColumnType.INT, result.column("c").type());
  }

  @Test
  public void test_pivot_without_groupBy() throws ColTreeException {
    DataFrame result = kv.pivot("key").value("value");
    assertEquals(1, result.nrow());
    assertEquals(Arrays.asList("a", "b", "c"), result.columnNames());
    assertEquals(Arrays.asList(10, 30), result.column("a").get(0));
    assertEquals(ColumnType.listOf(ColumnType.INT), result.column("a").type());
    assertEquals(20, result.column("b").get(0));
  }

  @Test
  public void test_pivot_two_columns_nests() throws ColTreeException {
    DataFrame result = sales.pivot("region", "product").count();
    result.show();

    assertEquals(Arrays.asList("east", "west"), result.columnNames());
    assertEquals(Arrays.asList("apple", "pear"), childNames(result, "east"));
    assertEquals(Arrays.asList("apple"), childNames(result, "west"));
    assertEquals(1, result.column(ColumnPath.of("east", "apple")).get(0));
    assertEquals(2, result.column(ColumnPath.of("east", "pear")).get(0));
    assertEquals(2, result.column(ColumnPath.of("west", "apple")).get(0));
  }

  @Test
  public void test_pivot_with_aggregator() throws ColTreeException {
    DataFrame result = sales.pivot("product").groupBy("region").with(Aggregators.SUM, "qty");
    assertEquals(Arrays.asList("region", "apple", "pear"), result.columnNames());
    assertEquals(Arrays.asList(3L, 6L), result.column("apple").values());
    assertEquals(Arrays.asList(6L, null), result.column("pear").values());
  }

  @Test
  public void test_pivot_with_default() throws ColTreeException {
    DataFrame result = sales.pivot("product").groupBy("region").withDefault(0L).with(Aggregators.SUM, "qty");
    assertEquals(Arrays.asList(6L, 0L), result.column("pear").values());
    assertEquals(ColumnType.LONG, result.column("pear").type());
  }

  @Test
  public void test_pivot_several_values() throws ColTreeException {
    AggregateBody body = new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.aggregate("sum", Aggregators.SUM, "value");
        r.count("n");
        return null;
      }
    };

    DataFrame byKey = kv.pivot("key").groupBy("id").aggregate(body);
    assertEquals(Arrays.asList("id", "a", "b", "c"), byKey.columnNames());
    assertEquals(Arrays.asList("sum", "n"), childNames(byKey, "b"));
    assertEquals(Arrays.asList(20L, null), byKey.column(ColumnPath.of("b", "sum")).values());
    assertEquals(Arrays.asList(1, 0), byKey.column(ColumnPath.of("b", "n")).values());

    DataFrame byValue = kv.pivot("key").groupBy("id").groupByValue().aggregate(body);
    assertEquals(Arrays.asList("id", "sum", "n"), byValue.columnNames());
    assertEquals(Arrays.asList("a", "b", "c"), childNames(byValue, "sum"));
    assertEquals(Arrays.asList(0, 1), byValue.column(ColumnPath.of("n", "c")).values());
  }

  @Test
  public void test_pivot_withGrouping() throws ColTreeException {
    DataFrame result = kv.groupBy("id").pivot("key").withGrouping("keys").count();
    assertEquals(Arrays.asList("id", "keys"), result.columnNames());
    assertEquals(Arrays.asList("a", "b", "c"), childNames(result, "keys"));
  }

  @Test
  public void test_pivot_inside_aggregate() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.count("total");
        r.pivot("product").count();
        return null;
      }
    });
    result.show();
    assertEquals(Arrays.asList("region", "total", "apple", "pear"), result.columnNames());
    assertEquals(Arrays.asList(1, 2), result.column("apple").values());
    assertEquals(Arrays.asList(2, 0), result.column("pear").values());
  }

  @Test
  public void test_pivot_value_clashes_with_key_name() throws ColTreeException {
    DataFrame df = DataFrame.of(
            Fixtures.col("id", 1, 2),
            Fixtures.col("k", "id", "x"),
            Fixtures.col("v", 5, 6));
    DataFrame result = df.pivot("k").groupBy("id").value("v");
    assertEquals(Arrays.asList("id", "id_1", "x"), result.columnNames());
    assertEquals(Arrays.asList(5, null), result.column("id_1").values());
  }

  @Test
  public void test_pivot_names_are_stable() throws ColTreeException {
    PivotNames names = new PivotNames(Arrays.asList("id"));
    assertEquals(ColumnPath.of("id_1", "x"), names.pathFor(ColumnPath.empty(), Arrays.<Object>asList("id", "x")));
    assertEquals(ColumnPath.of("id_1", "y"), names.pathFor(ColumnPath.empty(), Arrays.<Object>asList("id", "y")));
    assertEquals(ColumnPath.of("id_1", "x"), names.pathFor(ColumnPath.empty(), Arrays.<Object>asList("id", "x")));
    // 1 and "1" print alike
    assertEquals(ColumnPath.of("1"), names.pathFor(ColumnPath.empty(), Arrays.<Object>asList(1)));
    assertEquals(ColumnPath.of("1_1"), names.pathFor(ColumnPath.empty(), Arrays.<Object>asList("1")));
  }

  @Test(expected = StructuralException.class)
  public void test_too_many_pivot_columns() throws ColTreeException {
    List<Object> keys = new ArrayList<>();
    for (int i = 0; i <= Pivots.MAX_PIVOT_COLUMNS; i++) {
      keys.add("k" + i);
    }
    DataFrame df = DataFrame.of(Fixtures.col("k", keys.toArray()));
    df.pivot("k").count();
  }

  @Test(expected = IllegalStateException.class)
  public void test_groupBy_on_grouped_pivot() throws ColTreeException {
    PivotClause clause = kv.groupBy("id").pivot("key");
    clause.groupBy("id");
  }
}
