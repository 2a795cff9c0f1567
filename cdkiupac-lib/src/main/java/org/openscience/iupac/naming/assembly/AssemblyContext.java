/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.model.Substituent;
import org.openscience.iupac.naming.AlkylNamer;
import org.openscience.iupac.naming.CarbamoylNamer;
import org.openscience.iupac.naming.MultiplierResolver;
import org.openscience.iupac.naming.NSubstituentDetector;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.PhosphorusNamer;
import org.openscience.iupac.naming.RingSubstituentNamer;
import org.openscience.iupac.naming.SulfanylNamer;
import org.openscience.iupac.naming.YlideneNamer;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only inputs and collaborators shared by the stages of one naming call.
 */
public final class AssemblyContext {

  private final Molecule               mol;
  private final ParentStructure        parent;
  private final NomenclatureDictionary dictionary;
  private final NamingOptions          options;
  private final MultiplierResolver     multipliers;
  private final RingSubstituentNamer   ringNamer;
  private final SulfanylNamer          sulfanylNamer;
  private final PhosphorusNamer        phosphorusNamer;
  private final CarbamoylNamer         carbamoylNamer;
  private final NSubstituentDetector   nDetector;

  public AssemblyContext(Molecule mol, ParentStructure parent,
                         NomenclatureDictionary dictionary, NamingOptions options) {
    this.mol = mol;
    this.parent = parent;
    this.dictionary = dictionary;
    this.options = options;
    this.multipliers = new MultiplierResolver(dictionary);
    AlkylNamer alkylNamer = new AlkylNamer(dictionary);
    this.ringNamer = new RingSubstituentNamer(dictionary, alkylNamer);
    this.sulfanylNamer = new SulfanylNamer(alkylNamer, ringNamer);
    this.phosphorusNamer = new PhosphorusNamer(alkylNamer, ringNamer, multipliers);
    this.carbamoylNamer = new CarbamoylNamer(alkylNamer, ringNamer, multipliers);
    YlideneNamer ylideneNamer = new YlideneNamer(dictionary, alkylNamer, ringNamer, options);
    this.nDetector = new NSubstituentDetector(alkylNamer, ringNamer, ylideneNamer, multipliers);
  }

  public Molecule getMolecule() {
    return mol;
  }

  public ParentStructure getParent() {
    return parent;
  }

  public NomenclatureDictionary getDictionary() {
    return dictionary;
  }

  public NamingOptions getOptions() {
    return options;
  }

  public MultiplierResolver getMultipliers() {
    return multipliers;
  }

  public RingSubstituentNamer getRingNamer() {
    return ringNamer;
  }

  public SulfanylNamer getSulfanylNamer() {
    return sulfanylNamer;
  }

  public PhosphorusNamer getPhosphorusNamer() {
    return phosphorusNamer;
  }

  public CarbamoylNamer getCarbamoylNamer() {
    return carbamoylNamer;
  }

  public NSubstituentDetector getNDetector() {
    return nDetector;
  }

  /**
   * Start state of the pipeline: groups located on the parent, parent substituents
   * resolved to atom ids and the parent hydride named.
   *
   * @param groups the detected functional groups
   * @return the candidates before the first stage
   */
  public Candidates initialCandidates(List<FunctionalGroup> groups) {
    List<ParentBranch> branches = new ArrayList<>();
    for (Substituent sub : parent.getSubstituents())
      branches.add(ParentBranch.resolve(sub, mol));
    return Candidates.initial(GroupLocator.locateAll(groups, parent, mol),
                              branches,
                              ParentNames.baseName(parent, mol, dictionary));
  }
}
