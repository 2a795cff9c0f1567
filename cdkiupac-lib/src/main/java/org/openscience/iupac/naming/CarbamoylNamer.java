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
 * Names an amide that is not the principal group as a prefix: -C(=O)NH2 "carbamoyl",
 * -C(=O)NHCH3 "methylcarbamoyl", -C(=O)N(CH3)2 "dimethylcarbamoyl".
 */
public final class CarbamoylNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(CarbamoylNamer.class);

  public static final String CARBAMOYL = "carbamoyl";

  private final BranchNamer branches;

  public CarbamoylNamer(AlkylNamer alkylNamer, RingSubstituentNamer ringNamer, MultiplierResolver multipliers) {
    this.branches = new BranchNamer(alkylNamer, ringNamer, multipliers);
  }

  /**
   * @param mol      the molecule
   * @param fragment the carbonyl carbon, its oxygen, the nitrogen and the N substituents
   * @param nitrogen the amide nitrogen
   * @return the name, "carbamoyl" when the amide can not be resolved
   */
  public String name(Molecule mol, Set<Integer> fragment, int nitrogen) {
    if (!"N".equals(mol.symbol(nitrogen))) {
      LOGGER.warn("Atom {} is not nitrogen, using {}", nitrogen, CARBAMOYL);
      return CARBAMOYL;
    }
    int carbonyl = carbonylCarbon(mol, nitrogen);
    if (carbonyl < 0) {
      LOGGER.warn("No carbonyl on amide nitrogen {}, using {}", nitrogen, CARBAMOYL);
      return CARBAMOYL;
    }
    List<String> ligands = new ArrayList<>();
    for (Integer nbr : mol.neighbours(nitrogen)) {
      if (nbr == carbonyl || !fragment.contains(nbr))
        continue;
      ligands.add(branches.name(mol, fragment, nbr, nitrogen));
    }
    if (ligands.isEmpty())
      return CARBAMOYL;
    return branches.join(ligands) + CARBAMOYL;
  }

  /**
   * The carbon on the nitrogen that carries a double-bonded oxygen.
   */
  static int carbonylCarbon(Molecule mol, int nitrogen) {
    for (Integer nbr : mol.neighbours(nitrogen)) {
      if (!"C".equals(mol.symbol(nbr)))
        continue;
      for (Bond bond : mol.bondsOf(nbr)) {
        if (bond.getOrder() == BondOrder.DOUBLE && "O".equals(mol.symbol(bond.other(nbr))))
          return nbr;
      }
    }
    return -1;
  }
}
