/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

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
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import java.util.Collections;

class PrefixStagesTest {

  private static AssemblyContext context(Molecule mol, ParentStructure parent) {
    return new AssemblyContext(mol, parent, ResourceNomenclatureDictionary.getDefault(), NamingOptions.defaults());
  }

  private static Candidates withParts(String parentName, SubstituentPart... parts) {
    return Candidates.initial(Collections.<FunctionalGroup>emptyList(), Collections.<ParentBranch>emptyList(),
                              parentName)
                     .toBuilder().parts(Arrays.asList(parts)).build();
  }

  @Test
  void normalizeDropsMultipliersAndPunctuation() {
    assertThat(PrefixStages.normalize("2,3-dimethyl"), is("methyl"));
    assertThat(PrefixStages.normalize("1,1-bis(propan-2-yl)"), is("propanyl"));
    assertThat(PrefixStages.normalize("N,N-dimethyl"), is("methyl"));
    assertThat(PrefixStages.normalize("tris(2-chloroethyl)"), is("chloroethyl"));
    assertThat(PrefixStages.normalize(null), is(""));
  }

  @Test
  void parentNameKeepsItsStem() {
    assertThat(PrefixStages.normalizeParent("pentane"), is("pentane"));
    assertThat(PrefixStages.normalizeParent("2,3-dimethylbutane"), is("dimethylbutane"));
  }

  @Test
  void alphabetize() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    SubstituentPart methyl = SubstituentPart.located("methyl", Arrays.asList("2"), false);
    SubstituentPart chloro = SubstituentPart.located("chloro", Arrays.asList("1"), false);
    SubstituentPart ethyl = SubstituentPart.located("ethyl", Arrays.asList("3"), false);
    Candidates out = PrefixStages.alphabetize(withParts("butane", methyl, chloro, ethyl), context(mol, parent));
    assertThat(out.getParts(), contains(chloro, ethyl, methyl));
  }

  @Test
  void partsInParentNameSuppressed() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    SubstituentPart methyl = SubstituentPart.located("methyl", Arrays.asList("2"), false);
    SubstituentPart chloro = SubstituentPart.located("chloro", Arrays.asList("1"), false);
    Candidates out = PrefixStages.suppressParentDuplicates(withParts("2-methylbutane", methyl, chloro),
                                                           context(mol, parent));
    assertThat(out.getParts(), contains(chloro));
  }

  @Test
  void multipliedPartsInParentNameSuppressed() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    SubstituentPart methyls = SubstituentPart.located("methyl", Arrays.asList("2", "3"), false);
    SubstituentPart chloro = SubstituentPart.located("chloro", Arrays.asList("1"), false);
    Candidates out = PrefixStages.suppressParentDuplicates(withParts("3-methylbutane", methyls, chloro),
                                                           context(mol, parent));
    assertThat(out.getParts(), contains(chloro));
  }

  @Test
  void partsRestatingPrincipalSuppressed() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCCO");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    FunctionalGroup alcohol = FunctionalGroup.builder(FunctionalGroup.ALCOHOL)
                                             .prefix("hydroxy")
                                             .principal()
                                             .locant(1)
                                             .build();
    SubstituentPart hydroxy = SubstituentPart.located("hydroxy", Arrays.asList("1"), false);
    SubstituentPart wrapped = SubstituentPart.located("2-hydroxyethyl", Arrays.asList("3"), false);
    SubstituentPart methyl = SubstituentPart.located("methyl", Arrays.asList("2"), false);
    Candidates in = withParts("butane", hydroxy, wrapped, methyl).toBuilder().principal(alcohol).build();
    assertThat(PrefixStages.suppressParentDuplicates(in, context(mol, parent)).getParts(),
               contains(wrapped, methyl));
  }

  @Test
  void joinSeparator() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC[SiH](C)C");
    SubstituentPart ethyl = SubstituentPart.unlocated("ethyl", 1, false);
    SubstituentPart methyl = SubstituentPart.unlocated("methyl", 2, false);
    ParentStructure silane = ParentStructure.heteroatom().atoms(mol, 3).build();
    assertThat(PrefixStages.join(withParts("silane", ethyl, methyl), context(mol, silane)).getPrefix(),
               is("ethyldimethyl"));

    ParentStructure chain = ParentStructure.chain().atoms(mol, 1, 2).build();
    SubstituentPart chloro = SubstituentPart.located("chloro", Arrays.asList("1"), false);
    SubstituentPart twoMethyl = SubstituentPart.located("methyl", Arrays.asList("2"), false);
    assertThat(PrefixStages.join(withParts("ethane", chloro, twoMethyl), context(mol, chain)).getPrefix(),
               is("1-chloro-2-methyl"));
  }
}
