/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.openscience.iupac.dictionary.NomenclatureDictionary;

/**
 * Multiplicative prefixes: "di", "tri", "tetra" for simple names and "bis", "tris",
 * "tetrakis" for compound (bracketed) names.
 */
public final class MultiplierResolver {

  private final NomenclatureDictionary dictionary;

  public MultiplierResolver(NomenclatureDictionary dictionary) {
    this.dictionary = dictionary;
  }

  /**
   * @param count    number of identical items
   * @param complex  use bis/tris/... form
   * @param nextChar first character of what follows, selects vowel elision in the
   *                 simple form; 0 for none
   * @return the prefix, "" when count is 1 or less
   */
  public String getMultiplicativePrefix(int count, boolean complex, char nextChar) {
    if (count <= 1)
      return "";
    if (complex)
      return dictionary.getComplexMultiplier(count);
    if (nextChar == 0)
      return dictionary.getSimpleMultiplier(count);
    return dictionary.getSimpleMultiplierWithVowel(count, nextChar);
  }

  public String getMultiplicativePrefix(int count, boolean complex) {
    return getMultiplicativePrefix(count, complex, (char) 0);
  }

  /**
   * Multiply a principal suffix, picking the vowel form from its first letter
   * ("tetrol"). Prefix names are never elided.
   */
  public String multiplySuffix(int count, String suffix) {
    char next = suffix.isEmpty() ? 0 : suffix.charAt(0);
    return getMultiplicativePrefix(count, false, next) + suffix;
  }

  public NomenclatureDictionary getDictionary() {
    return dictionary;
  }
}
