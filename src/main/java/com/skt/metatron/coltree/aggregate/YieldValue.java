package com.skt.metatron.coltree.aggregate;

/**
 * Wrappers a body can return or yield to name a value or give it a default.
 */
public abstract class YieldValue {

  public static YieldValue plain(Object value) {
    return new Plain(value);
  }

  public static YieldValue named(Object value, String name) {
    return new Named(value, name);
  }

  public static YieldValue withDefault(Object value, Object defaultValue) {
    return new Defaulted(value, defaultValue);
  }

  public static class Plain extends YieldValue {
    private final Object value;

    Plain(Object value) {
      this.value = value;
    }

    public Object getValue() {
      return value;
    }
  }

  public static class Named extends YieldValue {
    private final Object value;
    private final String name;

    Named(Object value, String name) {
      this.value = value;
      this.name = name;
    }

    public Object getValue() {
      return value;
    }

    public String getName() {
      return name;
    }
  }

  public static class Defaulted extends YieldValue {
    private final Object value;
    private final Object defaultValue;

    Defaulted(Object value, Object defaultValue) {
      this.value = value;
      this.defaultValue = defaultValue;
    }

    public Object getValue() {
      return value;
    }

    public Object getDefaultValue() {
      return defaultValue;
    }
  }
}
