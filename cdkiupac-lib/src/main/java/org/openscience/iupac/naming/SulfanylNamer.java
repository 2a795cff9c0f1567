/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Names an -S-R group: "methylsulfanyl", "(propan-2-yl)sulfanyl", "phenylsulfanyl".
 */
public final class SulfanylNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SulfanylNamer.class);

  public static final String SULFANYL = "sulfanyl";

  private final AlkylNamer           alkylNamer;
  private final RingSubstituentNamer ringNamer;

  public SulfanylNamer(AlkylNamer alkylNamer, RingSubstituentNamer ringNamer) {
    this.alkylNamer = alkylNamer;
    this.ringNamer = ringNamer;
  }

  /**
   * @param mol      the molecule
   * @param fragment the sulfur and the R group atoms
   * @param sulfur   the sulfur atom id
   * @return the name, "sulfanyl" if R can not be named
   */
  public String name(Molecule mol, Set<Integer> fragment, int sulfur) {
    int carbon = -1;
    for (Integer nbr : mol.neighbours(sulfur)) {
      Atom atom = mol.atom(nbr);
      if (fragment.contains(nbr) && atom != null && atom.isCarbon()) {
        carbon = nbr;
        break;
      }
    }
    if (carbon < 0) {
      LOGGER.debug("No carbon on sulfur {}", sulfur);
      return SULFANYL;
    }

    Set<Integer> branch = SubstituentCollector.collectWithin(mol, carbon, fragment, sulfur);
    Atom atom = mol.atom(carbon);
    if (atom.isInRing()) {
      if (atom.isAromatic() && isBenzeneRing(mol, mol.smallestRing(carbon)) &&
          branch.size() == 6)
        return "phenyl" + SULFANYL;
      return withSulfanyl(ringNamer.name(mol, branch, carbon));
    }

    String alkyl = alkylNamer.name(mol, branch, carbon);
    if (alkyl == null) {
      LOGGER.warn("Could not name S-substituent at {}, using {}", carbon, SULFANYL);
      return SULFANYL;
    }
    return withSulfanyl(alkyl);
  }

  private static String withSulfanyl(String name) {
    if (SubstituentPart.needsWrapping(name))
      return SubstituentPart.wrap(name) + SULFANYL;
    return name + SULFANYL;
  }

  private static boolean isBenzeneRing(Molecule mol, List<Integer> ring) {
    if (ring.size() != 6)
      return false;
    for (Integer id : ring) {
      if (!mol.atom(id).isCarbon())
        return false;
    }
    return true;
  }
}
