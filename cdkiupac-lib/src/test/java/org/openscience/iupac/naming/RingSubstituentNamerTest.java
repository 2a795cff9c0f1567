/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

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

class RingSubstituentNamerTest {

  private final NomenclatureDictionary dict  = ResourceNomenclatureDictionary.getDefault();
  private final RingSubstituentNamer   namer = new RingSubstituentNamer(dict, new AlkylNamer(dict));

  private String name(String smi, int attach, Integer... fragment) throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles(smi);
    return namer.name(mol, new LinkedHashSet<>(Arrays.asList(fragment)), attach);
  }

  @Test
  void phenyl() throws InvalidSmilesException {
    assertThat(name("c1ccccc1N", 1, 1, 2, 3, 4, 5, 6), is("phenyl"));
  }

  @Test
  void substitutedPhenyl() throws InvalidSmilesException {
    assertThat(name("Cc1ccc(cc1)N", 5, 1, 2, 3, 4, 5, 6, 7), is("4-methylphenyl"));
  }

  @Test
  void cyclohexyl() throws InvalidSmilesException {
    assertThat(name("C1CCCCC1N", 6, 1, 2, 3, 4, 5, 6), is("cyclohexyl"));
  }

  @Test
  void heterocycles() throws InvalidSmilesException {
    assertThat(name("C1CCOC1N", 5, 1, 2, 3, 4, 5), is("oxolan-2-yl"));
    assertThat(name("c1ccncc1N", 6, 1, 2, 3, 4, 5, 6), is("pyridin-3-yl"));
  }

  @Test
  void ylidene() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CCCCC1=N");
    assertThat(namer.nameYlidene(mol, new LinkedHashSet<>(Arrays.asList(1, 2, 3, 4, 5, 6)), 6),
               is("cyclohexylidene"));
  }

  @Test
  void fusedRingsFallBack() throws InvalidSmilesException {
    assertThat(name("c1ccc2ccccc2c1N", 1, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10), is(RingSubstituentNamer.ARYL));
  }

  @Test
  void acyclicAtomFallsBack() throws InvalidSmilesException {
    assertThat(name("CCN", 1, 1, 2), is(RingSubstituentNamer.CYCLOALKYL));
  }

  @Test
  void ylideneFallBackKeepsEnding() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC=N");
    assertThat(namer.nameYlidene(mol, new LinkedHashSet<>(Arrays.asList(1, 2)), 2), is("cycloalkylidene"));
  }
}
