import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.aggregate.AggregateBody;
import com.skt.metatron.coltree.aggregate.AggregateReceiver;
import com.skt.metatron.coltree.aggregate.Aggregators;
import com.skt.metatron.coltree.aggregate.AggregationResult;
import com.skt.metatron.coltree.aggregate.ColumnNameGenerator;
import com.skt.metatron.coltree.aggregate.NamedValue;
import com.skt.metatron.coltree.aggregate.YieldValue;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.type.ColumnFactory;
import com.skt.metatron.coltree.type.ColumnType;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class AggregateTest {

  private static DataFrame sales;

  @BeforeClass
  public static void setUp() throws Exception {
    sales = Fixtures.loadDataFrame("dataprep/sales.csv");
  }

  @Test
  public void test_aggregate_whole_frame() throws ColTreeException {
    DataFrame result = sales.aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.count();
        r.aggregate("qty_sum", Aggregators.SUM, "qty");
        r.yieldValue("max_price", Aggregators.MAX.aggregate(r.column("price")));
        return null;
      }
    });
    result.show();

    assertEquals(1, result.nrow());
    assertEquals(Arrays.asList("count", "qty_sum", "max_price"), result.columnNames());
    assertEquals(5, result.column("count").get(0));
    assertEquals(15L, result.column("qty_sum").get(0));
    assertEquals(ColumnType.LONG, result.column("qty_sum").type());
    assertEquals(2.0, result.column("max_price").get(0));
  }

  @Test
  public void test_aggregate_groupBy() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.aggregate("total", Aggregators.SUM, "qty");
        r.aggregate("avg_price", Aggregators.AVG, "price");
        r.aggregate("first_city", Aggregators.MIN, "city");
        return null;
      }
    });
    result.show();

    assertEquals(Arrays.asList("region", "total", "avg_price", "first_city"), result.columnNames());
    assertEquals(Arrays.asList(9L, 6L), result.column("total").values());
    assertEquals(Arrays.asList(1.83, 1.38), result.column("avg_price").values());
    assertEquals(Arrays.asList("boston", "portland"), result.column("first_city").values());
  }

  @Test
  public void test_nested_yield_paths() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.yieldValue(ColumnPath.of("qty", "min"), Aggregators.MIN.aggregate(r.column("qty")));
        r.yieldValue(ColumnPath.of("qty", "max"), Aggregators.MAX.aggregate(r.column("qty")));
        return null;
      }
    });
    assertEquals(Arrays.asList("region", "qty"), result.columnNames());
    assertEquals(Arrays.asList("min", "max"), result.column("qty").asGroup().df().columnNames());
    assertEquals(Arrays.asList(2, 1), result.column(ColumnPath.of("qty", "min")).values());
    assertEquals(Arrays.asList(4, 5), result.column(ColumnPath.of("qty", "max")).values());
  }

  @Test
  public void test_yield_wrappers() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        r.yieldValue("ignored", YieldValue.named(r.nrow(), "rows"));
        if (r.nrow() > 2) {
          r.yieldValue("big", YieldValue.withDefault(true, false));
        }
        r.into(YieldValue.plain("x"), "tag");
        return null;
      }
    });
    assertEquals(Arrays.asList("region", "rows", "big", "tag"), result.columnNames());
    assertEquals(Arrays.asList(3, 2), result.column("rows").values());
    assertEquals(Arrays.asList(true, false), result.column("big").values());
    assertEquals(ColumnType.BOOLEAN, result.column("big").type());
    assertEquals(Arrays.asList("x", "x"), result.column("tag").values());
  }

  @Test
  public void test_missing_values_are_null() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) {
        if (r.nrow() < 3) {
          r.yieldValue("small", 1);
        }
        return null;
      }
    });
    assertEquals(Arrays.asList(null, 1), result.column("small").values());
    assertEquals(ColumnType.INT.withNullable(true), result.column("small").type());
  }

  @Test
  public void test_repeated_yield_makes_list() throws ColTreeException {
    DataFrame result = sales.aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) {
        r.yieldValue("v", 1);
        r.yieldValue("v", 2L);
        return null;
      }
    });
    assertEquals(ColumnType.listOf(ColumnType.LONG), result.column("v").type());
    assertEquals(Arrays.asList(1, 2L), result.column("v").get(0));
  }

  @Test
  public void test_yieldOneOrMany() throws ColTreeException {
    DataFrame result = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) throws ColTreeException {
        List<Object> products = new ArrayList<>();
        for (Object product : r.column("product").values()) {
          if (!products.contains(product)) {
            products.add(product);
          }
        }
        r.yieldOneOrMany(ColumnPath.of("products"), products, ColumnType.STRING, null);
        return null;
      }
    });
    assertEquals(ColumnType.listOf(ColumnType.STRING), result.column("products").type());
    assertEquals(Arrays.asList("apple", "pear"), result.column("products").get(0));
    assertEquals(Collections.singletonList("apple"), result.column("products").get(1));
  }

  @Test
  public void test_nothing_yielded() throws ColTreeException {
    DataFrame result = sales.aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) {
        return null;
      }
    });
    assertEquals(1, result.nrow());
    assertEquals(0, result.ncol());

    DataFrame grouped = sales.groupBy("region").aggregate(new AggregateBody() {
      @Override
      public Object aggregate(AggregateReceiver r) {
        return null;
      }
    });
    assertEquals(Arrays.asList("region"), grouped.columnNames());
    assertEquals(2, grouped.nrow());
  }

  @Test
  public void test_empty_path_is_unnamed_column() throws ColTreeException {
    List<List<NamedValue>> rows = new ArrayList<>();
    AggregateReceiver r = new AggregateReceiver(sales);
    r.yieldValue(ColumnPath.empty(), 7);
    rows.add(r.values());
    DataFrame result = AggregationResult.build(rows);
    assertEquals(Arrays.asList(""), result.columnNames());
    assertEquals(7, result.column("").get(0));
  }

  @Test
  public void test_aggregators() throws ColTreeException {
    ValueColumn ints = Fixtures.col("n", 1, null, 3);
    assertEquals(2L, Aggregators.COUNT.aggregate(ints));
    assertEquals(4L, Aggregators.SUM.aggregate(ints));
    assertEquals(2.0, Aggregators.AVG.aggregate(ints));
    assertEquals(1, Aggregators.MIN.aggregate(ints));
    assertEquals(3, Aggregators.MAX.aggregate(ints));

    ValueColumn doubles = Fixtures.col("d", 0.5, 0.25);
    assertEquals(0.75, Aggregators.SUM.aggregate(doubles));
    assertEquals(0.38, Aggregators.AVG.aggregate(doubles));

    ValueColumn nulls = ColumnFactory.createValueColumn("z", Arrays.asList(null, null), ColumnType.INT.withNullable(true));
    assertNull(Aggregators.SUM.aggregate(nulls));
    assertNull(Aggregators.MAX.aggregate(nulls));
    assertEquals(0L, Aggregators.COUNT.aggregate(nulls));
  }

  @Test(expected = ConversionException.class)
  public void test_sum_of_strings() throws ColTreeException {
    Aggregators.SUM.aggregate(sales.column("city"));
  }

  @Test
  public void test_column_name_generator() {
    ColumnNameGenerator generator = new ColumnNameGenerator(Arrays.asList("id"));
    assertEquals("id_1", generator.addUnique("id"));
    assertEquals("id_2", generator.addUnique("id"));
    assertEquals("a", generator.addUnique("a"));
    assertTrue(generator.contains("id_1"));
    assertFalse(generator.addIfAbsent("a"));
    assertEquals(Arrays.asList("id", "id_1", "id_2", "a"), generator.names());
  }
}
