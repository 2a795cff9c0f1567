/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.dictionary;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Dictionary backed by a properties file on the classpath with the keys
 * {@code alkane.<n>}, {@code multiplier.basic.<n>} and {@code multiplier.group.<n>}.
 * Counts past the basic table are composed from unit and tens numerals, the group
 * form of those adds "kis".
 */
public final class ResourceNomenclatureDictionary implements NomenclatureDictionary {

  public static final String DEFAULT_RESOURCE = "/org/openscience/iupac/nomenclature.properties";

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceNomenclatureDictionary.class);

  private static volatile ResourceNomenclatureDictionary defaultInstance;

  private final ImmutableMap<String, String> entries;

  public ResourceNomenclatureDictionary(String resource) throws IOException {
    Properties props = new Properties();
    try (InputStream in = getClass().getResourceAsStream(resource)) {
      if (in == null)
        throw new IOException("Dictionary resource not found: " + resource);
      try (Reader rdr = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        props.load(rdr);
      }
    }
    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (String key : props.stringPropertyNames())
      builder.put(key, props.getProperty(key).trim());
    this.entries = builder.build();
  }

  /**
   * Shared dictionary loaded from {@link #DEFAULT_RESOURCE}.
   *
   * @return the dictionary
   * @throws IllegalStateException the bundled resource is missing
   */
  public static ResourceNomenclatureDictionary getDefault() {
    ResourceNomenclatureDictionary dict = defaultInstance;
    if (dict == null) {
      synchronized (ResourceNomenclatureDictionary.class) {
        dict = defaultInstance;
        if (dict == null) {
          try {
            dict = new ResourceNomenclatureDictionary(DEFAULT_RESOURCE);
          } catch (IOException e) {
            throw new IllegalStateException("Could not load bundled dictionary", e);
          }
          defaultInstance = dict;
        }
      }
    }
    return dict;
  }

  @Override
  public String getChainName(int carbons) {
    String stem = entries.get("alkane." + carbons);
    if (stem == null) {
      LOGGER.warn("No chain name for length {}, using fallback", carbons);
      return "C" + carbons;
    }
    return stem;
  }

  @Override
  public String getAlkaneName(int carbons) {
    return getChainName(carbons) + "ane";
  }

  @Override
  public String getSimpleMultiplier(int count) {
    String prefix = numeral(count);
    if (prefix == null) {
      LOGGER.warn("No basic multiplier for count {}, using fallback", count);
      return count + "-";
    }
    return prefix;
  }

  @Override
  public String getSimpleMultiplierWithVowel(int count, char nextChar) {
    String prefix = getSimpleMultiplier(count);
    char ch = Character.toLowerCase(nextChar);
    if (prefix.length() > 2 && prefix.endsWith("a") && (ch == 'a' || ch == 'o'))
      return prefix.substring(0, prefix.length() - 1);
    return prefix;
  }

  @Override
  public String getComplexMultiplier(int count) {
    String prefix = entries.get("multiplier.group." + count);
    if (prefix != null)
      return prefix;
    String basic = numeral(count);
    if (basic == null) {
      LOGGER.warn("No group multiplier for count {}, using fallback", count);
      return count + "-kis-";
    }
    return basic + "kis";
  }

  /**
   * Basic numeral from the table, or composed from {@code multiplier.unit.<n>} and
   * {@code multiplier.tens.<n>} for 21-99 ("henicosa", "docosa", "tritriaconta").
   */
  private String numeral(int count) {
    String prefix = entries.get("multiplier.basic." + count);
    if (prefix != null || count < 21 || count > 99)
      return prefix;
    String tens = entries.get("multiplier.tens." + (count / 10));
    if (tens == null)
      return null;
    if (count % 10 == 0)
      return tens;
    String unit = entries.get("multiplier.unit." + (count % 10));
    if (unit == null)
      return null;
    // icosa loses its i after a vowel: docosa, tricosa
    if (tens.startsWith("i") && isVowel(unit.charAt(unit.length() - 1)))
      tens = tens.substring(1);
    return unit + tens;
  }

  private static boolean isVowel(char ch) {
    return "aeiou".indexOf(ch) >= 0;
  }
}
