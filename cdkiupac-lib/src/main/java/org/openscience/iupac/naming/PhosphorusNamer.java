/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Names phosphorus-centred substituents, -P(=O)R2 as "dimethylphosphoryl" and -PR2 as
 * "ethyl(methyl)phosphanyl".
 */
public final class PhosphorusNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PhosphorusNamer.class);

  public static final String PHOSPHORYL = "phosphoryl";
  public static final String PHOSPHANYL = "phosphanyl";

  private final BranchNamer branches;

  public PhosphorusNamer(AlkylNamer alkylNamer, RingSubstituentNamer ringNamer, MultiplierResolver multipliers) {
    this.branches = new BranchNamer(alkylNamer, ringNamer, multipliers);
  }

  /**
   * @param mol        the molecule
   * @param fragment   the phosphorus, its oxo oxygen and the R group atoms
   * @param phosphorus the phosphorus atom id
   * @return the name, "phosphoryl" when the ligands can not be resolved
   */
  public String namePhosphoryl(Molecule mol, Set<Integer> fragment, int phosphorus) {
    return name(mol, fragment, phosphorus, PHOSPHORYL);
  }

  /**
   * @param mol        the molecule
   * @param fragment   the phosphorus and the R group atoms
   * @param phosphorus the phosphorus atom id
   * @return the name, "phosphanyl" when the ligands can not be resolved
   */
  public String namePhosphanyl(Molecule mol, Set<Integer> fragment, int phosphorus) {
    return name(mol, fragment, phosphorus, PHOSPHANYL);
  }

  private String name(Molecule mol, Set<Integer> fragment, int phosphorus, String ending) {
    if (!"P".equals(mol.symbol(phosphorus))) {
      LOGGER.warn("Atom {} is not phosphorus, using {}", phosphorus, ending);
      return ending;
    }
    boolean oxoSeen = false;
    List<String> ligands = new ArrayList<>();
    // neighbours are visited in bond order, the ligand list is sorted on joining
    for (Bond bond : mol.bondsOf(phosphorus)) {
      int nbr = bond.other(phosphorus);
      if (!fragment.contains(nbr))
        continue;
      if (!oxoSeen && PHOSPHORYL.equals(ending) &&
          bond.getOrder() == BondOrder.DOUBLE && "O".equals(mol.symbol(nbr))) {
        oxoSeen = true;
        continue;
      }
      ligands.add(branches.name(mol, fragment, nbr, phosphorus));
    }
    if (PHOSPHORYL.equals(ending) && !oxoSeen)
      LOGGER.warn("No P=O on phosphoryl at {}", phosphorus);
    if (ligands.isEmpty())
      return ending;
    return branches.join(ligands) + ending;
  }
}
