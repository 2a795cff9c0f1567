/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.iupac.cdk.CdkMolecules;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.Molecule;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

class YlideneNamerTest {

  private static YlideneNamer namer(NamingOptions options) {
    NomenclatureDictionary dict = ResourceNomenclatureDictionary.getDefault();
    AlkylNamer alkyl = new AlkylNamer(dict);
    return new YlideneNamer(dict, alkyl, new RingSubstituentNamer(dict, alkyl), options);
  }

  private static Set<Integer> ids(Integer... ids) {
    return new LinkedHashSet<>(Arrays.asList(ids));
  }

  @Test
  void unbranched() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCC=N");
    assertThat(namer(NamingOptions.defaults()).name(mol, ids(1, 2, 3), 4, 3), is("propylidene"));
  }

  @Test
  void unbranchedInternal() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC(C)=N");
    assertThat(namer(NamingOptions.defaults()).name(mol, ids(1, 2, 3), 4, 2), is("propan-2-ylidene"));
  }

  @Test
  void branchedUsesConfiguredLocant() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC(C)C(C)=N");
    Set<Integer> fragment = ids(1, 2, 3, 4, 5);
    assertThat(namer(NamingOptions.defaults()).name(mol, fragment, 6, 4), is("pentan-2-ylidene"));
    NamingOptions three = new NamingOptions(ImmutableMap.of("ylidene.locant", "3"));
    assertThat(namer(three).name(mol, fragment, 6, 4), is("pentan-3-ylidene"));
    NamingOptions tooHigh = new NamingOptions(ImmutableMap.of("ylidene.locant", "9"));
    assertThat(namer(tooHigh).name(mol, fragment, 6, 4), is("pentan-4-ylidene"));
  }

  @Test
  void ringFragment() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CCCCC1=N");
    assertThat(namer(NamingOptions.defaults()).name(mol, ids(1, 2, 3, 4, 5, 6), 7, 6), is("cyclohexylidene"));
  }

  @Test
  void nonCarbonRoot() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("ON=C");
    assertThat(namer(NamingOptions.defaults()).name(mol, ids(1), 2, 1), is("alkylidene"));
  }
}
