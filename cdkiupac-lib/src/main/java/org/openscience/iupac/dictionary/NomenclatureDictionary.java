/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.dictionary;

/**
 * Static, read-only vocabulary consumed by the name assembler: alkane stems and
 * multiplying prefixes.
 */
public interface NomenclatureDictionary {

  /**
   * Stem of the unbranched hydrocarbon, e.g. 3 gives "prop".
   *
   * @param carbons number of carbons
   * @return the stem
   */
  String getChainName(int carbons);

  /**
   * Full alkane name, e.g. 3 gives "propane".
   *
   * @param carbons number of carbons
   * @return the alkane name
   */
  String getAlkaneName(int carbons);

  /**
   * Simple multiplying prefix, e.g. 2 gives "di".
   *
   * @param count multiplicity
   * @return the prefix
   */
  String getSimpleMultiplier(int count);

  /**
   * Simple multiplying prefix adjusted for the first letter of what follows, e.g.
   * (4, 'o') gives "tetr" as in "tetrol".
   *
   * @param count    multiplicity
   * @param nextChar first character of the multiplied term
   * @return the prefix
   */
  String getSimpleMultiplierWithVowel(int count, char nextChar);

  /**
   * Multiplying prefix for compound terms, e.g. 2 gives "bis".
   *
   * @param count multiplicity
   * @return the prefix
   */
  String getComplexMultiplier(int count);
}
