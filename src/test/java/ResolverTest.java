import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.ColumnResolutionException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.column.ColumnKind;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.select.ColumnPredicate;
import com.skt.metatron.coltree.select.ColumnResolver;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.select.UnresolvedColumnsPolicy;
import com.skt.metatron.coltree.type.ColumnType;
import com.skt.metatron.coltree.type.DataType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ResolverTest {

  private static List<String> paths(List<ColumnWithPath> cols) {
    List<String> paths = new ArrayList<>();
    for (ColumnWithPath col : cols) {
      paths.add(col.path().toString());
    }
    return paths;
  }

  private static List<String> resolve(DataFrame df, ColumnSelector selector) throws ColumnResolutionException {
    return paths(ColumnResolver.resolve(selector, df, UnresolvedColumnsPolicy.FAIL));
  }

  @Test
  public void test_name_and_path() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("b", "g.x"), resolve(df, ColumnSelector.cols("b").and(ColumnSelector.path("g", "x"))));

    ColumnWithPath col = ColumnResolver.resolveSingle(ColumnSelector.path("g", "y"), df, UnresolvedColumnsPolicy.FAIL);
    assertEquals(ColumnPath.of("g", "y"), col.path());
    assertEquals(1, col.depth());
    assertTrue(col.df() == df);
  }

  @Test(expected = ColumnResolutionException.class)
  public void test_missing_fail() throws ColTreeException {
    resolve(Fixtures.sample(), ColumnSelector.path("g", "nope"));
  }

  @Test
  public void test_missing_skip() throws ColTreeException {
    List<ColumnWithPath> cols = ColumnResolver.resolve(ColumnSelector.cols("nope", "a"), Fixtures.sample(), UnresolvedColumnsPolicy.SKIP);
    assertEquals(Arrays.asList("a"), paths(cols));
  }

  @Test
  public void test_missing_create() throws ColTreeException {
    List<ColumnWithPath> cols = ColumnResolver.resolve(ColumnSelector.path("g", "nope"), Fixtures.sample(), UnresolvedColumnsPolicy.CREATE);
    assertEquals(1, cols.size());
    assertTrue(cols.get(0).isMissing());
    assertEquals("nope", cols.get(0).name());
    assertEquals(0, cols.get(0).column().size());
  }

  @Test(expected = ColumnResolutionException.class)
  public void test_through_value_column() throws ColTreeException {
    // an error under every policy
    ColumnResolver.resolve(ColumnSelector.path("a", "z"), Fixtures.sample(), UnresolvedColumnsPolicy.SKIP);
  }

  @Test
  public void test_union_dedup() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("c", "a"), resolve(df, ColumnSelector.cols("c", "a").and(ColumnSelector.cols("a"))));
  }

  @Test
  public void test_all_and_dfs() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("a", "g", "b", "c"), resolve(df, ColumnSelector.all()));
    assertEquals(Arrays.asList("a", "g", "g.x", "g.y", "b", "c"), resolve(df, ColumnSelector.dfs()));
    assertEquals(new ArrayList<String>(), resolve(df, ColumnSelector.none()));
  }

  @Test
  public void test_except_nested() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("a", "g.y", "b", "c"), resolve(df, ColumnSelector.all().except(ColumnSelector.path("g", "x"))));
    assertEquals(Arrays.asList("a", "b", "c"), resolve(df, ColumnSelector.all().except(ColumnSelector.cols("g"))));
  }

  @Test
  public void test_intersect_filter_children() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("a"), resolve(df, ColumnSelector.cols("a", "b").intersect(ColumnSelector.cols("c", "a"))));
    assertEquals(Arrays.asList("g"), resolve(df, ColumnSelector.dfs().filter(ColumnPredicate.ofKind(ColumnKind.GROUP))));
    assertEquals(Arrays.asList("g.x", "g.y"), resolve(df, ColumnSelector.cols("g").children()));
    assertEquals(Arrays.asList("g.x", "b"), resolve(df, ColumnSelector.dfs().filter(ColumnPredicate.ofType(DataType.STRING))));
    assertEquals(Arrays.asList("g.y"), resolve(df, ColumnSelector.dfs().filter(ColumnPredicate.nameMatches("[y-z]"))));
  }

  @Test
  public void test_byIndex() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("c", "a"), resolve(df, ColumnSelector.byIndex(3, 0)));
    assertEquals(Arrays.asList("a"), paths(ColumnResolver.resolve(ColumnSelector.byIndex(0, 9), df, UnresolvedColumnsPolicy.SKIP)));
  }

  @Test
  public void test_typed() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertEquals(Arrays.asList("a"), resolve(df, ColumnSelector.typed(ColumnPath.of("a"), ColumnType.INT)));
    assertEquals(Arrays.asList("a"), resolve(df, ColumnSelector.typed(ColumnPath.of("a"), ColumnType.NUMBER)));
  }

  @Test(expected = ColumnResolutionException.class)
  public void test_typed_mismatch() throws ColTreeException {
    resolve(Fixtures.sample(), ColumnSelector.typed(ColumnPath.of("a"), ColumnType.STRING));
  }

  @Test
  public void test_top() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    List<ColumnWithPath> cols = ColumnResolver.resolve(ColumnSelector.path("g", "x").and(ColumnSelector.cols("g", "a")), df, UnresolvedColumnsPolicy.FAIL);
    assertEquals(Arrays.asList("g", "a"), paths(ColumnResolver.top(cols)));
  }
}
