/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.iupac.cdk.CdkMolecules;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

class NSubstituentDetectorTest {

  private final NSubstituentDetector detector;

  NSubstituentDetectorTest() {
    NomenclatureDictionary dict = ResourceNomenclatureDictionary.getDefault();
    AlkylNamer alkyl = new AlkylNamer(dict);
    RingSubstituentNamer ring = new RingSubstituentNamer(dict, alkyl);
    MultiplierResolver multipliers = new MultiplierResolver(dict);
    detector = new NSubstituentDetector(alkyl, ring,
                                        new YlideneNamer(dict, alkyl, ring, NamingOptions.defaults()),
                                        multipliers);
  }

  // ethanamine backbone: atoms 1 and 2 are the chain, 3 is the nitrogen
  private NSubstituentDetector.Result detect(String smi) throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles(smi);
    ParentStructure parent = ParentStructure.chain().atoms(mol, 2, 1).build();
    FunctionalGroup amine = FunctionalGroup.builder(FunctionalGroup.AMINE)
                                           .atoms(mol.atom(3))
                                           .principal()
                                           .build();
    return detector.detect(amine, parent, mol);
  }

  @Test
  void dimethyl() throws InvalidSmilesException {
    NSubstituentDetector.Result result = detect("CCN(C)C");
    assertThat(result.getPrefix(), is("N,N-dimethyl"));
    assertThat(result.getSubstituents().size(), is(2));
    assertThat(result.getConsumedAtomIds(), containsInAnyOrder(4, 5));
  }

  @Test
  void phenyl() throws InvalidSmilesException {
    assertThat(detect("CCNc1ccccc1").getPrefix(), is("N-phenyl"));
  }

  @Test
  void hydroxy() throws InvalidSmilesException {
    assertThat(detect("CCNO").getPrefix(), is("N-hydroxy"));
  }

  @Test
  void compoundNamesUseBis() throws InvalidSmilesException {
    assertThat(detect("CCN(C(C)C)C(C)C").getPrefix(), is("N,N-bis(propan-2-yl)"));
  }

  @Test
  void doubleBondedCarbonIsYlideneamino() throws InvalidSmilesException {
    NSubstituentDetector.Result result = detect("CCN=C(C)C");
    assertThat(result.getPrefix(), is("(propan-2-ylideneamino)"));
    assertThat(result.getSubstituents().get(0).isDoubleBond(), is(true));
  }

  @Test
  void primaryAmineHasNone() throws InvalidSmilesException {
    assertThat(detect("CCN").isEmpty(), is(true));
  }

  @Test
  void onlyAminesAndImines() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCO");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 2, 1).build();
    FunctionalGroup alcohol = FunctionalGroup.builder(FunctionalGroup.ALCOHOL)
                                             .atoms(mol.atom(3))
                                             .principal()
                                             .build();
    assertThat(detector.detect(alcohol, parent, mol).isEmpty(), is(true));
    assertThat(detector.detect(null, parent, mol).isEmpty(), is(true));
  }
}
