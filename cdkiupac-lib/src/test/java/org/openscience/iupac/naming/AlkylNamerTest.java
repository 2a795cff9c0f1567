/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.iupac.cdk.CdkMolecules;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.Molecule;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;

class AlkylNamerTest {

  private final AlkylNamer namer = new AlkylNamer(ResourceNomenclatureDictionary.getDefault());

  private String name(String smi, int attach, Integer... fragment) throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles(smi);
    return namer.name(mol, Arrays.asList(fragment), attach);
  }

  @Test
  void methyl() throws InvalidSmilesException {
    assertThat(name("CN", 1, 1), is("methyl"));
  }

  @Test
  void propan2yl() throws InvalidSmilesException {
    assertThat(name("CC(C)N", 2, 1, 2, 3), is("propan-2-yl"));
  }

  @Test
  void branchedChain() throws InvalidSmilesException {
    assertThat(name("CC(C)CN", 4, 1, 2, 3, 4), is("2-methylpropyl"));
    assertThat(name("CC(C)(C)N", 2, 1, 2, 3, 4), is("2-methylpropan-2-yl"));
  }

  @Test
  void unsaturated() throws InvalidSmilesException {
    assertThat(name("C=CCN", 3, 1, 2, 3), is("prop-2-en-1-yl"));
  }

  @Test
  void acyl() throws InvalidSmilesException {
    assertThat(name("C(=O)N", 1, 1, 2), is("formyl"));
    assertThat(name("CC(=O)N", 2, 1, 2, 3), is("acetyl"));
    assertThat(name("CCC(=O)N", 3, 1, 2, 3, 4), is("propanoyl"));
  }

  @Test
  void ringAtomsAreNotAlkyl() throws InvalidSmilesException {
    assertThat(name("C1CCCCC1N", 1, 1, 2, 3, 4, 5, 6), is(nullValue()));
  }

  @Test
  void heteroatomsAreNotAlkyl() throws InvalidSmilesException {
    assertThat(name("CSCN", 3, 1, 2, 3), is(nullValue()));
  }

  @Test
  void attachmentMustBeInFragment() throws InvalidSmilesException {
    assertThat(name("CCN", 1, 2), is(nullValue()));
  }
}
