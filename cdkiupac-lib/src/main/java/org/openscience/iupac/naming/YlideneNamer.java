/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names a carbon fragment double bonded to a nitrogen, =C(R)(R'). Unbranched fragments
 * are numbered from the chain end nearest the double bond ("ethylidene",
 * "propan-2-ylidene"). Branched fragments are named from their carbon count with the
 * double bond at a configured position, "pentan-2-ylidene".
 */
public final class YlideneNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(YlideneNamer.class);

  public static final String YLIDENE    = "ylidene";
  public static final String ALKYLIDENE = "alkylidene";

  private final NomenclatureDictionary dictionary;
  private final AlkylNamer             alkylNamer;
  private final RingSubstituentNamer   ringNamer;
  private final NamingOptions          options;

  public YlideneNamer(NomenclatureDictionary dictionary, AlkylNamer alkylNamer,
                      RingSubstituentNamer ringNamer, NamingOptions options) {
    this.dictionary = dictionary;
    this.alkylNamer = alkylNamer;
    this.ringNamer = ringNamer;
    this.options = options;
  }

  /**
   * @param mol      the molecule
   * @param fragment the fragment atoms
   * @param nitrogen the nitrogen the fragment is double bonded to
   * @param attach   the fragment carbon double bonded to the nitrogen
   * @return the name, "alkylidene" if the fragment can not be resolved
   */
  public String name(Molecule mol, Set<Integer> fragment, int nitrogen, int attach) {
    Atom root = mol.atom(attach);
    if (root == null || !root.isCarbon()) {
      LOGGER.warn("Ylidene root {} on N{} is not carbon", attach, nitrogen);
      return ALKYLIDENE;
    }
    if (root.isInRing())
      return ringNamer.nameYlidene(mol, fragment, attach);

    Set<Integer> carbons = new LinkedHashSet<>();
    for (Integer id : fragment) {
      Atom atom = mol.atom(id);
      if (atom == null || !atom.isCarbon() || atom.isInRing()) {
        LOGGER.warn("Ylidene fragment at {} is not an acyclic hydrocarbon", attach);
        return ALKYLIDENE;
      }
      carbons.add(id);
    }

    AlkylNamer.FragmentChain chain = alkylNamer.chainOf(mol, carbons, attach);
    if (chain == null) {
      LOGGER.warn("Ylidene fragment at {} is not a tree", attach);
      return ALKYLIDENE;
    }
    if (!chain.isBranched())
      return alkylNamer.render(mol, chain, YLIDENE);

    // position of the double bond is not derived for branched fragments
    int count = carbons.size();
    int locant = Math.max(1, Math.min(options.getInt(NamingOptions.Param.YLIDENE_LOCANT), count - 1));
    return dictionary.getChainName(count) + "an-" + locant + "-" + YLIDENE;
  }
}
