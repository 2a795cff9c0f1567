/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Tunable heuristics of the name assembler, read from a string map the same way
 * request parameters are, each with a default.
 */
public final class NamingOptions {

  public enum Param {
    // minimum length of a parent substituent name searched for group names
    DEDUP_MIN_LENGTH("dedup.minlen", 10),
    RETAINED_ACIDS("retained.acids", true),
    HALOGEN_TERMINAL_OMIT("halogen.terminal.omit", true),
    // double-bond position for branched ylidene fragments
    YLIDENE_LOCANT("ylidene.locant", 2),
    HYDROAZOLE_RENUMBER("hydroazole.renumber", true);

    private final String name;
    private final Object defaultValue;

    Param(String name, Object defaultValue) {
      this.name = name;
      this.defaultValue = defaultValue;
    }

    public String getName() {
      return name;
    }
  }

  private static final NamingOptions DEFAULTS = new NamingOptions(Collections.<String, String>emptyMap());

  private final Map<String, String> params;

  public NamingOptions(Map<String, String> params) {
    this.params = ImmutableMap.copyOf(params);
  }

  public static NamingOptions defaults() {
    return DEFAULTS;
  }

  public String getString(Param param) {
    String value = params.get(param.name);
    if (value != null)
      return value;
    return param.defaultValue != null ? param.defaultValue.toString() : "";
  }

  public int getInt(Param param) {
    String value = getString(param).trim();
    if (value.isEmpty()) {
      if (param.defaultValue != null)
        return (int) param.defaultValue;
      throw new IllegalArgumentException(param.name + " not provided and no default!");
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Bad value for " + param.name + ": " + value, ex);
    }
  }

  public boolean getBoolean(Param param) {
    String value = params.get(param.name);
    if (value != null) {
      switch (value.toLowerCase(Locale.ROOT)) {
        case "f":
        case "false":
        case "off":
        case "0":
          return false;
        case "t":
        case "true":
        case "on":
        case "1":
          return true;
        default:
          throw new IllegalArgumentException("Can not interpret boolean string param: " + value);
      }
    }
    return param.defaultValue != null && (boolean) param.defaultValue;
  }

  @Override
  public String toString() {
    return "NamingOptions" + params;
  }
}
