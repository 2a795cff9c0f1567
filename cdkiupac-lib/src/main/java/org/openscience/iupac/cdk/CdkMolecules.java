/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.cdk;

import org.openscience.cdk.exception.InvalidSmilesException;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads CDK structures into the naming model. Atom ids are the 1-based positions of
 * the atoms in the container.
 */
public final class CdkMolecules {

  private static final Logger LOGGER = LoggerFactory.getLogger(CdkMolecules.class);

  private CdkMolecules() {
  }

  /**
   * Convert a container, ring membership is perceived first.
   *
   * @param container the CDK structure
   * @return the molecule
   */
  public static Molecule fromAtomContainer(IAtomContainer container) {
    Cycles.markRingAtomsAndBonds(container);
    Molecule.Builder builder = Molecule.builder();
    for (IAtom atom : container.atoms()) {
      Integer charge = atom.getFormalCharge();
      builder.atom(new Atom(atom.getIndex() + 1,
                            atom.getSymbol(),
                            atom.isAromatic(),
                            atom.isInRing(),
                            charge != null ? charge : 0));
    }
    for (IBond bond : container.bonds()) {
      builder.bond(bond.getBegin().getIndex() + 1,
                   bond.getEnd().getIndex() + 1,
                   order(bond));
    }
    return builder.build();
  }

  public static Molecule parseSmiles(String smi) throws InvalidSmilesException {
    SmilesParser smipar = new SmilesParser(SilentChemObjectBuilder.getInstance());
    return fromAtomContainer(smipar.parseSmiles(smi));
  }

  private static BondOrder order(IBond bond) {
    if (bond.isAromatic())
      return BondOrder.AROMATIC;
    if (bond.getOrder() == null) {
      LOGGER.warn("Bond {} has no order, reading it as single", bond.getIndex());
      return BondOrder.SINGLE;
    }
    switch (bond.getOrder()) {
      case SINGLE:
        return BondOrder.SINGLE;
      case DOUBLE:
        return BondOrder.DOUBLE;
      case TRIPLE:
        return BondOrder.TRIPLE;
      default:
        LOGGER.warn("Bond order {} read as single", bond.getOrder());
        return BondOrder.SINGLE;
    }
  }
}
