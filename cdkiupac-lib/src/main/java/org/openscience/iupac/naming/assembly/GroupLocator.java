/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import org.openscience.iupac.chain.ChainFilter;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.SubstituentCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Fills in the parent locant of groups that arrive without one.
 */
final class GroupLocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GroupLocator.class);

  private static final String[] FRAGMENT_NAMED = {
      FunctionalGroup.AMIDE, FunctionalGroup.PHOSPHORYL, FunctionalGroup.PHOSPHANYL, FunctionalGroup.THIOETHER
  };

  private GroupLocator() {
  }

  /**
   * @return the group with locants, unchanged if it already had them
   */
  static FunctionalGroup locate(FunctionalGroup group, ParentStructure parent, Molecule mol) {
    if (!group.getLocants().isEmpty())
      return group;
    int locant = attachmentLocant(group, parent, mol);
    if (locant < 0) {
      LOGGER.debug("No parent locant for {}", group);
      return group;
    }
    return group.toBuilder().locants(Collections.singletonList(locant)).build();
  }

  static List<FunctionalGroup> locateAll(List<FunctionalGroup> groups, ParentStructure parent, Molecule mol) {
    List<FunctionalGroup> result = new ArrayList<>(groups.size());
    for (FunctionalGroup group : groups)
      result.add(locate(group, parent, mol));
    return result;
  }

  /**
   * A group atom that stays in the backbone and is a parent member (the carbonyl
   * carbon of a ketone), else a parent atom bonded to one of the group's atoms, else
   * for groups named from their fragment (amide, phosphorus, thioether) the parent
   * atom that fragment hangs off.
   */
  static int attachmentLocant(FunctionalGroup group, ParentStructure parent, Molecule mol) {
    String kind = group.getName() != null ? group.getName() : group.getType();
    for (Atom atom : group.getAtoms()) {
      if (ChainFilter.shouldExclude(atom, kind, group.getType()))
        continue;
      int loc = parent.locantOf(atom.getId());
      if (loc >= 0)
        return loc;
    }
    for (Atom atom : group.getAtoms()) {
      if (!mol.contains(atom.getId()))
        continue;
      for (Integer nbr : mol.neighbours(atom.getId())) {
        int loc = parent.locantOf(nbr);
        if (loc >= 0)
          return loc;
      }
    }
    // named from its whole fragment, the group may be handed over by an atom further
    // out, e.g. the nitrogen of a carbamoyl
    if (!group.isType(FRAGMENT_NAMED))
      return -1;
    Set<Integer> parentAtoms = parent.atomIds();
    for (Atom atom : group.getAtoms()) {
      for (Integer id : SubstituentCollector.collect(mol, atom.getId(), parentAtoms)) {
        for (Integer nbr : mol.neighbours(id)) {
          int loc = parent.locantOf(nbr);
          if (loc >= 0)
            return loc;
        }
      }
    }
    return -1;
  }
}
