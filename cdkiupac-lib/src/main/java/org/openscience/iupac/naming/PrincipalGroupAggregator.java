/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.base.Preconditions;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.FunctionalGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges principal groups of one type into the single unit the suffix is built from,
 * two ketones at 2 and 4 become one ketone with multiplicity 2 at [2, 4].
 */
public final class PrincipalGroupAggregator {

  private PrincipalGroupAggregator() {
  }

  /**
   * @param principals principal groups, all of the same type, with locants resolved
   * @return the merged group
   * @throws IllegalStateException    the list is empty
   * @throws IllegalArgumentException the groups are of different types
   */
  public static FunctionalGroup aggregate(List<FunctionalGroup> principals) {
    Preconditions.checkState(principals != null && !principals.isEmpty(),
                             "No principal group to aggregate");
    FunctionalGroup first = principals.get(0);
    if (principals.size() == 1)
      return first;

    Set<Atom> atoms = new LinkedHashSet<>();
    List<Integer> locants = new ArrayList<>();
    int multiplicity = 0;
    for (FunctionalGroup group : principals) {
      Preconditions.checkArgument(group.getType().equals(first.getType()),
                                  "Cannot aggregate principal %s with %s",
                                  group.getType(), first.getType());
      atoms.addAll(group.getAtoms());
      locants.addAll(group.getLocants());
      multiplicity += Math.max(group.getMultiplicity(), group.getLocants().size());
    }
    Collections.sort(locants);
    return FunctionalGroup.builder(first.getType())
                          .name(first.getName())
                          .prefix(first.getPrefix())
                          .suffix(first.getSuffix())
                          .assembledName(first.getAssembledName())
                          .principal()
                          .atoms(atoms)
                          .locants(locants)
                          .multiplicity(multiplicity)
                          .build();
  }
}
