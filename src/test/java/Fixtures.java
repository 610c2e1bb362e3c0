import com.skt.metatron.coltree.ColTreeException;
import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.DataFrames;
import com.skt.metatron.coltree.StructuralException;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.GroupColumn;
import com.skt.metatron.coltree.column.ValueColumn;
import com.skt.metatron.coltree.type.ColumnFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frames and columns shared by the tests.
 */
public class Fixtures {

  static int limitRowCnt = 10000;

  static String getResourcePath(String relPath) {
    URL url = Fixtures.class.getClassLoader().getResource(relPath);
    return (new File(url.getFile())).getAbsolutePath();
  }

  static List<String[]> loadGridCsv(String path) throws IOException {
    List<String[]> grid = new ArrayList<>();
    String line;
    String cvsSplitBy = ",";

    try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(getResourcePath(path)), "UTF-8"))) {
      while ((line = br.readLine()) != null) {
        String[] strCols = line.split(cvsSplitBy);
        grid.add(strCols);
        if (grid.size() == limitRowCnt)
          break;
      }
    }
    return grid;
  }

  static DataFrame loadDataFrame(String path) throws IOException, ColTreeException {
    return DataFrames.fromGrid(loadGridCsv(path), true).parse();
  }

  static ValueColumn col(String name, Object... values) {
    List<Object> list = Arrays.asList(values);
    return ColumnFactory.createValueColumn(name, list, ColumnFactory.guessValueType(list));
  }

  static GroupColumn group(String name, Column... columns) throws StructuralException {
    return GroupColumn.create(name, DataFrame.of(columns));
  }

  static Map<String, Object> record(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  // a: INT, g: {x: STRING, y: INT}, b: STRING, c: DOUBLE
  static DataFrame sample() throws StructuralException {
    return DataFrame.of(
            col("a", 1, 2),
            group("g", col("x", "p", "q"), col("y", 10, 20)),
            col("b", "u", "v"),
            col("c", 0.5, 1.5));
  }
}
