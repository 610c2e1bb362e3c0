import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.group.GroupedDataFrame;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.sort.SortKey;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class SortTest {

  private static DataFrame sales;

  @BeforeClass
  public static void setUp() throws Exception {
    sales = Fixtures.loadDataFrame("dataprep/sales.csv");
  }

  @Test
  public void test_sortBy() throws ColTreeException {
    DataFrame sorted = sales.sortBy("qty");
    sorted.show();

    assertEquals(5, sorted.nrow());
    assertEquals(Arrays.asList(1, 2, 3, 4, 5), sorted.column("qty").values());
    assertEquals(Arrays.asList("portland", "newyork", "boston", "boston", "seattle"), sorted.column("city").values());
    assertEquals(sales.columnNames(), sorted.columnNames());
  }

  @Test
  public void test_sortByDesc() throws ColTreeException {
    DataFrame sorted = sales.sortByDesc("qty");
    assertEquals(Arrays.asList(5, 4, 3, 2, 1), sorted.column("qty").values());
  }

  @Test
  public void test_sort_is_stable() throws ColTreeException {
    assertEquals(Arrays.asList("seattle", "boston", "portland", "newyork", "boston"),
            sales.sortBy("price").column("city").values());
    assertEquals(Arrays.asList("newyork", "boston", "boston", "portland", "seattle"),
            sales.sortByDesc("price").column("city").values());
  }

  @Test
  public void test_sort_multiple_keys() throws ColTreeException {
    DataFrame sorted = sales.sortBy(SortKey.asc("region"), SortKey.desc("qty"));
    assertEquals(Arrays.asList("east", "east", "east", "west", "west"), sorted.column("region").values());
    assertEquals(Arrays.asList(4, 3, 2, 5, 1), sorted.column("qty").values());
  }

  @Test
  public void test_sort_nulls() throws ColTreeException {
    DataFrame df = DataFrame.of(Fixtures.col("n", 2, null, 1), Fixtures.col("s", "b", "n", "a"));

    assertEquals(Arrays.asList(null, 1, 2), df.sortBy("n").column("n").values());
    assertEquals(Arrays.asList(2, 1, null), df.sortByDesc("n").column("n").values());
    assertEquals(Arrays.asList(1, 2, null), df.sortBy(SortKey.asc("n").nullsLast()).column("n").values());
    assertEquals(Arrays.asList("a", "b", "n"), df.sortBy(SortKey.asc("n").nullsLast()).column("s").values());
  }

  @Test
  public void test_sort_nested_column() throws ColTreeException {
    DataFrame sorted = Fixtures.sample().sortByDesc(ColumnSelector.path("g", "y"));
    assertEquals(Arrays.asList(2, 1), sorted.column("a").values());
    assertEquals(Arrays.asList("q", "p"), sorted.column(ColumnPath.of("g", "x")).values());
  }

  @Test
  public void test_sort_mixed_numbers() throws ColTreeException {
    DataFrame df = DataFrame.of(Fixtures.col("n", 2, 1.5, 1L));
    List<Double> sorted = new ArrayList<>();
    for (Object value : df.sortBy("n").column("n").values()) {
      sorted.add(((Number) value).doubleValue());
    }
    assertEquals(Arrays.asList(1.0, 1.5, 2.0), sorted);
  }

  @Test(expected = ColumnResolutionException.class)
  public void test_sort_missing_column() throws ColTreeException {
    sales.sortBy("nope");
  }

  @Test(expected = ConversionException.class)
  public void test_sort_by_group_column() throws ColTreeException {
    Fixtures.sample().sortBy("g");
  }

  @Test(expected = ConversionException.class)
  public void test_sort_incomparable_values() throws ColTreeException {
    DataFrame.of(Fixtures.col("m", 1, "x")).sortBy("m");
  }

  @Test
  public void test_grouped_sortBy() throws ColTreeException {
    GroupedDataFrame grouped = sales.groupBy("region").sortBy(SortKey.desc("region"));
    grouped.plain().show();

    assertEquals(Arrays.asList("west", "east"), grouped.keys().column("region").values());
    assertEquals(Arrays.asList(5, 1), grouped.groups().frames().get(0).column("qty").values());
    assertEquals(3, grouped.get("east").nrow());
  }

  @Test
  public void test_grouped_sortByCount() throws ColTreeException {
    GroupedDataFrame grouped = sales.groupBy("region", "product");

    GroupedDataFrame asc = grouped.sortByCount();
    assertEquals(Arrays.asList("east", "west", "east"), asc.keys().column("region").values());
    assertEquals(Arrays.asList("apple", "apple", "pear"), asc.keys().column("product").values());

    GroupedDataFrame desc = grouped.sortByCountDesc();
    assertEquals(Arrays.asList("west", "east", "east"), desc.keys().column("region").values());
    assertEquals(Arrays.asList("apple", "pear", "apple"), desc.keys().column("product").values());
    assertEquals(Arrays.asList(2L, 2L, 1L), toLongs(desc.count().column("count").values()));
  }

  private static List<Long> toLongs(List<Object> values) {
    List<Long> longs = new ArrayList<>();
    for (Object value : values) {
      longs.add(((Number) value).longValue());
    }
    return longs;
  }
}
