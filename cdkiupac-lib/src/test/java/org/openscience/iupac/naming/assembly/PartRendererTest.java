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
import org.openscience.iupac.model.Substituent;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.SubstituentPart;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

class PartRendererTest {

  private static List<SubstituentPart> render(Molecule mol, ParentStructure parent, Candidates in) {
    AssemblyContext ctx = new AssemblyContext(mol, parent, ResourceNomenclatureDictionary.getDefault(),
                                              NamingOptions.defaults());
    return PartRenderer.render(in, ctx).getParts();
  }

  private static List<String> text(List<SubstituentPart> parts, Molecule mol, ParentStructure parent) {
    AssemblyContext ctx = new AssemblyContext(mol, parent, ResourceNomenclatureDictionary.getDefault(),
                                              NamingOptions.defaults());
    List<String> result = new ArrayList<>();
    for (SubstituentPart part : parts)
      result.add(part.render(ctx.getMultipliers()));
    return result;
  }

  private static ParentBranch branch(Substituent sub) {
    return new ParentBranch(sub, Collections.<Integer>emptySet());
  }

  @Test
  void sameNamesShareLocants() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CC(C)C(C)C");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 4, 6).build();
    Candidates in = Candidates.initial(Collections.<FunctionalGroup>emptyList(),
                                       Arrays.asList(branch(Substituent.of("methyl", 3)),
                                                     branch(Substituent.of("methyl", 2))),
                                       "butane");
    List<SubstituentPart> parts = render(mol, parent, in);
    assertThat(text(parts, mol, parent), contains("2,3-dimethyl"));
  }

  @Test
  void groupWithSeveralLocants() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("ClC(Cl)C");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 2, 4).build();
    FunctionalGroup halide = FunctionalGroup.builder(FunctionalGroup.HALIDE)
                                            .atoms(mol.atom(1), mol.atom(3))
                                            .locants(Arrays.asList(1, 1))
                                            .build();
    Candidates in = Candidates.initial(Collections.singletonList(halide), Collections.<ParentBranch>emptyList(),
                                       "ethane");
    assertThat(text(render(mol, parent, in), mol, parent), contains("1,1-dichloro"));
  }

  @Test
  void nonNumericLocantIsDropped() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    Candidates in = Candidates.initial(Collections.<FunctionalGroup>emptyList(),
                                       Collections.singletonList(branch(Substituent.builder("methyl")
                                                                                   .locant("alpha")
                                                                                   .build())),
                                       "butane");
    List<SubstituentPart> parts = render(mol, parent, in);
    assertThat(parts.size(), is(1));
    assertThat(parts.get(0).getLocants().isEmpty(), is(true));
    assertThat(text(parts, mol, parent), contains("methyl"));
  }

  @Test
  void locatedNameWithoutLocantIsVerbatim() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CCCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3, 4).build();
    Candidates in = Candidates.initial(Collections.<FunctionalGroup>emptyList(),
                                       Collections.singletonList(branch(Substituent.builder("alkyl")
                                                                                   .assembledName("2,2-dimethyl")
                                                                                   .build())),
                                       "butane");
    List<SubstituentPart> parts = render(mol, parent, in);
    assertThat(parts.get(0).isVerbatim(), is(true));
    assertThat(text(parts, mol, parent), contains("2,2-dimethyl"));
  }

  @Test
  void heteroatomParentHasNoLocants() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("CP(C)C");
    ParentStructure parent = ParentStructure.heteroatom().atoms(mol, 2).build();
    Candidates in = Candidates.initial(Collections.<FunctionalGroup>emptyList(),
                                       Arrays.asList(branch(Substituent.of("methyl", 1)),
                                                     branch(Substituent.of("methyl", 1)),
                                                     branch(Substituent.of("methyl", 1))),
                                       "phosphane");
    assertThat(text(render(mol, parent, in), mol, parent), contains("trimethyl"));
  }

  @Test
  void aminoChainStartsWithNitrogen() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("NCC");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 1, 2, 3).build();
    FunctionalGroup amine = FunctionalGroup.builder(FunctionalGroup.AMINE).atoms(mol.atom(1)).principal().build();
    Candidates in = Candidates.initial(Collections.<FunctionalGroup>emptyList(),
                                       Collections.singletonList(branch(Substituent.of("methyl", 1))),
                                       "azane")
                              .toBuilder().principal(amine).build();
    assertThat(text(render(mol, parent, in), mol, parent), contains("N-methyl"));
  }

  @Test
  void singleLocantKeptWithPrincipal() throws InvalidSmilesException {
    Molecule mol = CdkMolecules.parseSmiles("ClCCO");
    ParentStructure parent = ParentStructure.chain().atoms(mol, 2, 3).build();
    FunctionalGroup halide = FunctionalGroup.builder(FunctionalGroup.HALIDE).atoms(mol.atom(1)).locant(1).build();
    FunctionalGroup alcohol = FunctionalGroup.builder(FunctionalGroup.ALCOHOL).atoms(mol.atom(4)).principal()
                                             .locant(2).build();
    Candidates in = Candidates.initial(Collections.singletonList(halide), Collections.<ParentBranch>emptyList(),
                                       "ethane")
                              .toBuilder().principal(alcohol).build();
    assertThat(text(render(mol, parent, in), mol, parent), contains("1-chloro"));
  }
}
