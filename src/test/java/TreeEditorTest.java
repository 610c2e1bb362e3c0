import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.column.ColumnPath;
import com.skt.metatron.coltree.column.ColumnWithPath;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.select.ColumnSelector;
import com.skt.metatron.coltree.tree.ColumnInserter;
import com.skt.metatron.coltree.tree.ColumnPosition;
import com.skt.metatron.coltree.tree.ColumnRemover;
import com.skt.metatron.coltree.tree.ColumnToInsert;
import com.skt.metatron.coltree.tree.PathShortener;
import com.skt.metatron.coltree.tree.RemoveResult;
import com.skt.metatron.coltree.tree.TreeNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TreeEditorTest {

  private static void assertRoundTrip(DataFrame df, ColumnSelector selector) throws ColTreeException {
    RemoveResult removed = ColumnRemover.remove(df, selector);
    DataFrame restored = ColumnInserter.insert(removed.df(), removed.toInsertable());
    assertEquals(df.columnNames(), restored.columnNames());
    assertEquals(df, restored);
  }

  @Test
  public void test_remove_nested() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    RemoveResult removed = ColumnRemover.remove(df, ColumnSelector.path("g", "x").and(ColumnSelector.cols("c")));

    assertEquals(Arrays.asList("a", "g", "b"), removed.df().columnNames());
    assertEquals(Arrays.asList("y"), removed.df().column("g").asGroup().df().columnNames());
    assertEquals(2, removed.removedColumns().size());

    TreeNode<ColumnPosition> x = removed.removedColumns().get(0);
    assertEquals(ColumnPath.of("g", "x"), x.pathFromRoot());
    assertEquals(0, x.data().getOriginalIndex());
    assertTrue(x.data().wasRemoved());

    // g lost only one child, so it stays
    TreeNode<ColumnPosition> g = x.parent();
    assertEquals(1, g.data().getOriginalIndex());
    assertFalse(g.data().wasRemoved());
  }

  @Test
  public void test_remove_in_selector_order() throws ColTreeException {
    RemoveResult removed = ColumnRemover.remove(Fixtures.sample(), ColumnSelector.cols("c", "a"));
    List<ColumnWithPath> cols = removed.toColumnsWithPath(Fixtures.sample());
    assertEquals("c", cols.get(0).name());
    assertEquals("a", cols.get(1).name());
  }

  @Test
  public void test_remove_all_children_drops_group() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    DataFrame rest = df.remove(ColumnSelector.path("g", "x").and(ColumnSelector.path("g", "y")));
    assertEquals(Arrays.asList("a", "b", "c"), rest.columnNames());
  }

  @Test
  public void test_remove_everything() throws ColTreeException {
    DataFrame rest = Fixtures.sample().remove(ColumnSelector.all());
    assertEquals(0, rest.ncol());
    assertEquals(2, rest.nrow());
  }

  @Test
  public void test_remove_nothing() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    RemoveResult removed = ColumnRemover.remove(df, ColumnSelector.none());
    assertTrue(removed.removedNothing());
    assertNull(removed.removeRoot());
    assertTrue(removed.df() == df);
  }

  @Test
  public void test_round_trip() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    assertRoundTrip(df, ColumnSelector.cols("a"));
    assertRoundTrip(df, ColumnSelector.cols("a", "c"));
    assertRoundTrip(df, ColumnSelector.path("g", "x"));
    assertRoundTrip(df, ColumnSelector.path("g", "y").and(ColumnSelector.cols("a")));
    assertRoundTrip(df, ColumnSelector.path("g", "x").and(ColumnSelector.path("g", "y")));
    assertRoundTrip(df, ColumnSelector.path("g", "x").and(ColumnSelector.cols("c")));
    assertRoundTrip(df, ColumnSelector.cols("g", "b"));
  }

  @Test
  public void test_insert_creates_groups() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    ValueColumn d = Fixtures.col("d", true, false);
    DataFrame result = df.insert(d).into(ColumnPath.of("new", "deep", "d"));

    assertEquals(Arrays.asList("a", "g", "b", "c", "new"), result.columnNames());
    assertEquals(d, result.column(ColumnPath.of("new", "deep", "d")));
  }

  @Test(expected = StructuralException.class)
  public void test_insert_same_path_twice() throws ColTreeException {
    List<ColumnToInsert> toInsert = new ArrayList<>();
    toInsert.add(new ColumnToInsert(ColumnPath.of("c"), null, Fixtures.col("c", 1)));
    toInsert.add(new ColumnToInsert(ColumnPath.of("c"), null, Fixtures.col("c", 2)));
    ColumnInserter.insert(null, toInsert);
  }

  @Test(expected = StructuralException.class)
  public void test_insert_same_nested_path_twice() throws ColTreeException {
    List<ColumnToInsert> toInsert = new ArrayList<>();
    toInsert.add(new ColumnToInsert(ColumnPath.of("g", "c"), null, Fixtures.col("c", 1, 2)));
    toInsert.add(new ColumnToInsert(ColumnPath.of("g", "c"), null, Fixtures.col("c", 3, 4)));
    ColumnInserter.insert(Fixtures.sample(), toInsert);
  }

  @Test
  public void test_shorten_paths() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    List<ColumnWithPath> cols = new ArrayList<>();
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("a", "b", "c"), df));
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("d", "b", "c"), df));
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("e", "f"), df));
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("g", "x"), df));
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("x"), df));

    List<ColumnWithPath> shortened = PathShortener.shortenPaths(cols);
    assertEquals(ColumnPath.of("a", "b", "c"), shortened.get(0).path());
    assertEquals(ColumnPath.of("d", "b", "c"), shortened.get(1).path());
    assertEquals(ColumnPath.of("f"), shortened.get(2).path());
    assertEquals(ColumnPath.of("g", "x"), shortened.get(3).path());
    assertEquals(ColumnPath.of("x"), shortened.get(4).path());
  }

  @Test
  public void test_shorten_paths_identical() throws ColTreeException {
    DataFrame df = Fixtures.sample();
    List<ColumnWithPath> cols = new ArrayList<>();
    cols.add(new ColumnWithPath(df.column("a"), ColumnPath.of("x"), df));
    cols.add(new ColumnWithPath(df.column("b"), ColumnPath.of("x"), df));

    List<ColumnWithPath> shortened = PathShortener.shortenPaths(cols);
    assertEquals(ColumnPath.of("x"), shortened.get(0).path());
    assertEquals(ColumnPath.of("x"), shortened.get(1).path());
    assertEquals("b", shortened.get(1).column().name());
  }
}
