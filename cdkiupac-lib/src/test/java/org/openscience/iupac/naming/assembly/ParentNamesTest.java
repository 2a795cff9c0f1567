/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.iupac.cdk.CdkMolecules;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;

class ParentNamesTest {

  private final NomenclatureDictionary dict = ResourceNomenclatureDictionary.getDefault();

  private String chainName(String smi, int... ids) throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles(smi);
    return ParentNames.baseName(ParentStructure.chain().atoms(mol, ids).build(), mol, dict);
  }

  private String ringName(String smi, int... ids) throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles(smi);
    return ParentNames.baseName(ParentStructure.ring().atoms(mol, ids).build(), mol, dict);
  }

  @Test
  void alkanes() throws InvalidSmilesException {
    assertThat(chainName("CCC", 1, 2, 3), is("propane"));
    assertThat(chainName("C", 1), is("methane"));
  }

  @Test
  void unsaturatedChains() throws InvalidSmilesException {
    assertThat(chainName("CC=CC", 1, 2, 3, 4), is("but-2-ene"));
    assertThat(chainName("C=CC=C", 1, 2, 3, 4), is("buta-1,3-diene"));
    assertThat(chainName("C=CCC#C", 1, 2, 3, 4, 5), is("pent-1-en-4-yne"));
  }

  @Test
  void twoCarbonChainsCarryNoLocant() throws InvalidSmilesException {
    assertThat(chainName("C=C", 1, 2), is("ethene"));
    assertThat(chainName("C#C", 1, 2), is("ethyne"));
    assertThat(chainName("CC", 1, 2), is("ethane"));
  }

  @Test
  void explicitLocantsNumberBonds() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C=CCC");
    ParentStructure parent = ParentStructure.chain()
                                            .atoms(mol, 1, 2, 3, 4)
                                            .locants(Arrays.asList(4, 3, 2, 1))
                                            .build();
    assertThat(ParentNames.baseName(parent, mol, dict), is("but-3-ene"));
  }

  @Test
  void rings() throws InvalidSmilesException {
    assertThat(ringName("c1ccccc1", 1, 2, 3, 4, 5, 6), is("benzene"));
    assertThat(ringName("C1=CC=CC=C1", 1, 2, 3, 4, 5, 6), is("benzene"));
    assertThat(ringName("C1CCCC1", 1, 2, 3, 4, 5), is("cyclopentane"));
  }

  @Test
  void heteroatomHydrides() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C[SiH2]C");
    assertThat(ParentNames.baseName(ParentStructure.heteroatom().atoms(mol, 2).build(), mol, dict),
               is("silane"));
    Molecule boron = CdkMolecules.parseSmiles("CB(C)C");
    assertThat(ParentNames.baseName(ParentStructure.heteroatom().atoms(boron, 2).build(), boron, dict),
               is("borane"));
  }

  @Test
  void assembledNameWins() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CCOC1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 1, 2, 3, 4, 5).name("oxolane").build();
    assertThat(ParentNames.baseName(parent, mol, dict), is("oxolane"));
  }

  @Test
  void elision() {
    assertThat(ParentNames.elide("propane", "ol"), is("propan"));
    assertThat(ParentNames.elide("but-2-ene", "al"), is("but-2-en"));
    assertThat(ParentNames.elide("oxolane", "amine"), is("oxolan"));
    assertThat(ParentNames.elide("1,3-thiazole", "ol"), is("1,3-thiazol"));
    assertThat(ParentNames.elide("hexane", "dione"), is("hexane"));
    assertThat(ParentNames.elide("cyclohexane", "carboxylic acid"), is("cyclohexane"));
    assertThat(ParentNames.elide("propane", null), is("propane"));
  }

  @Test
  void combine() {
    assertThat(ParentNames.combine("chloro", "benzene"), is("chlorobenzene"));
    assertThat(ParentNames.combine("2-methyl", "4,5-dihydro-1,3-thiazole"), is("2-methyl-4,5-dihydro-1,3-thiazole"));
    assertThat(ParentNames.combine("", "ethane"), is("ethane"));
    assertThat(ParentNames.combine(null, "ethane"), is("ethane"));
  }
}
