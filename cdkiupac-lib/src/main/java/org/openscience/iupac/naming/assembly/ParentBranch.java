/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableSet;
import org.openscience.iupac.model.AtomRef;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.Substituent;

import java.util.Collections;
import java.util.Set;

/**
 * A parent substituent with its atom references resolved to atom ids.
 */
public final class ParentBranch {

  private final Substituent           substituent;
  private final ImmutableSet<Integer> atomIds;

  public ParentBranch(Substituent substituent, Set<Integer> atomIds) {
    this.substituent = substituent;
    this.atomIds = ImmutableSet.copyOf(atomIds);
  }

  static ParentBranch resolve(Substituent substituent, Molecule mol) {
    return new ParentBranch(substituent, AtomRef.resolveAll(mol, substituent.getAtoms()));
  }

  public Substituent getSubstituent() {
    return substituent;
  }

  public Set<Integer> getAtomIds() {
    return atomIds;
  }

  public String getType() {
    return substituent.getType();
  }

  public String displayName() {
    return substituent.displayName();
  }

  /**
   * @return the raw locant text, trimmed, null if missing
   */
  public String locant() {
    String loc = substituent.getLocant();
    if (loc == null || loc.trim().isEmpty())
      return null;
    return loc.trim();
  }

  public boolean overlaps(Set<Integer> ids) {
    return !Collections.disjoint(atomIds, ids);
  }

  @Override
  public String toString() {
    return substituent.toString();
  }
}
