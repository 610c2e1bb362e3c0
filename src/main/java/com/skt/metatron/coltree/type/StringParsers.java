package com.skt.metatron.coltree.type;

import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.column.ValueColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * String parsers for the scalar tags, tried in a fixed order when guessing the type of a string column.
 */
public class StringParsers {
  private static Logger LOGGER = LoggerFactory.getLogger(StringParsers.class);

  private static final DateTimeFormatter DATETIME_WITH_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]");

  public interface StringParser {
    DataType type();

    /**
     * @return parsed value, or null when {@code str} is not of this type
     */
    Object parse(String str);
  }

  private static final StringParser INT_PARSER = new SimpleParser(DataType.INT) {
    @Override
    public Object parse(String str) {
      try {
        return Integer.valueOf(str.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
  };

  private static final StringParser LONG_PARSER = new SimpleParser(DataType.LONG) {
    @Override
    public Object parse(String str) {
      try {
        return Long.valueOf(str.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
  };

  private static final StringParser DOUBLE_PARSER = new SimpleParser(DataType.DOUBLE) {
    @Override
    public Object parse(String str) {
      String s = str.trim();
      switch (s.toLowerCase(Locale.ROOT)) {
        case "nan":
          return Double.NaN;
        case "inf":
        case "+inf":
        case "infinity":
          return Double.POSITIVE_INFINITY;
        case "-inf":
        case "-infinity":
          return Double.NEGATIVE_INFINITY;
        default:
          break;
      }
      // Double.valueOf() also accepts hex floats and a trailing 'd'
      if (!s.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
        return null;
      }
      return Double.valueOf(s);
    }
  };

  private static final StringParser BOOLEAN_PARSER = new SimpleParser(DataType.BOOLEAN) {
    @Override
    public Object parse(String str) {
      switch (str.trim().toUpperCase(Locale.ROOT)) {
        case "T":
        case "TRUE":
        case "YES":
          return Boolean.TRUE;
        case "F":
        case "FALSE":
        case "NO":
          return Boolean.FALSE;
        default:
          return null;
      }
    }
  };

  private static final StringParser DECIMAL_PARSER = new SimpleParser(DataType.DECIMAL) {
    @Override
    public Object parse(String str) {
      try {
        return new BigDecimal(str.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
  };

  private static final StringParser DATE_PARSER = new SimpleParser(DataType.DATE) {
    @Override
    public Object parse(String str) {
      try {
        return LocalDate.parse(str.trim());
      } catch (DateTimeParseException e) {
        return null;
      }
    }
  };

  private static final StringParser TIME_PARSER = new SimpleParser(DataType.TIME) {
    @Override
    public Object parse(String str) {
      try {
        return LocalTime.parse(str.trim());
      } catch (DateTimeParseException e) {
        return null;
      }
    }
  };

  private static final StringParser DATETIME_PARSER = new SimpleParser(DataType.DATETIME) {
    @Override
    public Object parse(String str) {
      String s = str.trim();
      try {
        if (s.indexOf('T') >= 0) {
          return LocalDateTime.parse(s);
        }
        return LocalDateTime.parse(s, DATETIME_WITH_SPACE);
      } catch (DateTimeParseException e) {
        return null;
      }
    }
  };

  private static final List<StringParser> PARSERS = Collections.unmodifiableList(Arrays.asList(
          INT_PARSER, LONG_PARSER, DOUBLE_PARSER, BOOLEAN_PARSER, DECIMAL_PARSER, DATE_PARSER, TIME_PARSER, DATETIME_PARSER));

  private StringParsers() {
  }

  public static StringParser parserFor(DataType type) {
    for (StringParser parser : PARSERS) {
      if (parser.type() == type) {
        return parser;
      }
    }
    return null;
  }

  /**
   * Converter that parses strings into {@code type}. Blank strings become null, anything else that
   * does not parse is an error.
   */
  public static TypeConverter converterFor(final DataType type) {
    final StringParser parser = parserFor(type);
    if (parser == null) {
      return null;
    }
    return new TypeConverter() {
      @Override
      public Object convert(Object value) throws ConversionException {
        String str = value.toString();
        if (str.trim().isEmpty()) {
          return null;
        }
        Object parsed = parser.parse(str);
        if (parsed == null) {
          throw new ConversionException(String.format("convert(): cannot parse '%s' as %s", str, type));
        }
        return parsed;
      }
    };
  }

  /**
   * Finds the first parser that accepts every non-blank value and converts the column with it.
   * Columns that are not string columns, or that no parser fits, are returned as they are.
   */
  public static ValueColumn tryParseAny(ValueColumn column) {
    if (column.type().getDataType() != DataType.STRING) {
      return column;
    }

    List<String> strs = new ArrayList<>();
    for (Object value : column.values()) {
      if (value != null && !value.toString().trim().isEmpty()) {
        strs.add(value.toString());
      }
    }
    if (strs.isEmpty()) {
      return column;
    }

    for (StringParser parser : PARSERS) {
      List<Object> parsed = parseAll(parser, column.values());
      if (parsed != null) {
        boolean hasNulls = parsed.contains(null);
        LOGGER.debug("tryParseAny(): column {} parsed as {}", column.name(), parser.type());
        return new ValueColumn(column.name(), parsed, ColumnType.of(parser.type(), hasNulls));
      }
    }
    return column;
  }

  private static List<Object> parseAll(StringParser parser, List<Object> values) {
    List<Object> parsed = new ArrayList<>(values.size());
    for (Object value : values) {
      if (value == null || value.toString().trim().isEmpty()) {
        parsed.add(null);
        continue;
      }
      Object obj = parser.parse(value.toString());
      if (obj == null) {
        return null;
      }
      parsed.add(obj);
    }
    return parsed;
  }

  private abstract static class SimpleParser implements StringParser {
    private final DataType type;

    SimpleParser(DataType type) {
      this.type = type;
    }

    @Override
    public DataType type() {
      return type;
    }
  }
}
