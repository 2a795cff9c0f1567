/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.iupac.cdk.CdkMolecules;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.SubstituentPart;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import java.util.Collections;

class HydroAzoleRenumberingTest {

  private static AssemblyContext context(Molecule mol, ParentStructure parent, NamingOptions options) {
    return new AssemblyContext(mol, parent, ResourceNomenclatureDictionary.getDefault(), options);
  }

  private static Candidates candidates(String parentName, SubstituentPart... parts) {
    return Candidates.initial(Collections.<FunctionalGroup>emptyList(), Collections.<ParentBranch>emptyList(),
                              parentName)
                     .toBuilder().parts(Arrays.asList(parts)).build();
  }

  @Test
  void thiazolineNumberedFromSulfur() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC1=NCCS1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 2, 3, 4, 5, 6).build();
    Candidates in = candidates("thiazoline", SubstituentPart.located("methyl", Arrays.asList("1"), false));
    Candidates out = HydroAzoleRenumbering.apply(in, context(mol, parent, NamingOptions.defaults()));
    assertThat(out.getParentName(), is("4,5-dihydro-1,3-thiazole"));
    assertThat(out.getPrefix(), is("2-methyl"));
    assertThat(out.getRenumbering(), is(ImmutableMap.of(5, 1, 1, 2, 2, 3, 3, 4, 4, 5)));
  }

  @Test
  void imidazolineKeepsIndicatedHydrogen() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CN=CN1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 1, 2, 3, 4, 5).build();
    Candidates out = HydroAzoleRenumbering.apply(candidates("imidazoline"),
                                                 context(mol, parent, NamingOptions.defaults()));
    assertThat(out.getParentName(), is("4,5-dihydro-1H-imidazole"));
  }

  @Test
  void ringOrderRecoveredFromMolecule() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CN=CO1");
    // members listed out of ring order
    ParentStructure parent = ParentStructure.ring().atoms(mol, 1, 3, 2, 4, 5).build();
    Candidates out = HydroAzoleRenumbering.apply(candidates("oxazoline"),
                                                 context(mol, parent, NamingOptions.defaults()));
    assertThat(out.getParentName(), is("4,5-dihydro-1,3-oxazole"));
  }

  @Test
  void partsFollowNewNumbering() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC1CN=CS1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 2, 3, 4, 5, 6).build();
    Candidates in = candidates("thiazoline", SubstituentPart.located("methyl", Arrays.asList("1"), false));
    Candidates out = HydroAzoleRenumbering.apply(in, context(mol, parent, NamingOptions.defaults()));
    assertThat(out.getParentName(), is("4,5-dihydro-1,3-thiazole"));
    assertThat(out.getPrefix(), is("5-methyl"));
    assertThat(out.getParts().get(0).getLocants(), contains("5"));
  }

  @Test
  void otherParentsUntouched() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CCOC1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 1, 2, 3, 4, 5).build();
    Candidates in = candidates("oxolane");
    assertThat(HydroAzoleRenumbering.apply(in, context(mol, parent, NamingOptions.defaults())), is(sameInstance(in)));
  }

  @Test
  void disabledByOption() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("C1CN=CN1");
    ParentStructure parent = ParentStructure.ring().atoms(mol, 1, 2, 3, 4, 5).build();
    Candidates in = candidates("imidazoline");
    NamingOptions off = new NamingOptions(ImmutableMap.of("hydroazole.renumber", "false"));
    assertThat(HydroAzoleRenumbering.apply(in, context(mol, parent, off)), is(sameInstance(in)));
  }
}
