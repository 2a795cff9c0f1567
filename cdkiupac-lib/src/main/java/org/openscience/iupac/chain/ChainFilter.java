/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.chain;

import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Membership predicates used while choosing a parent chain or ring: which atoms of a
 * characteristic group may be part of the backbone and which belong to the group.
 */
public final class ChainFilter {

  private ChainFilter() {
  }

  /**
   * Decide whether an atom of a characteristic group is kept out of the parent chain.
   * Rules are tried most specific first.
   *
   * @param atom   the atom
   * @param fgName group name (e.g. "ketone", "thiocyanate", "amine")
   * @param fgType group type or pattern (e.g. "SC#N")
   * @return true if the atom belongs to the group rather than the chain
   */
  public static boolean shouldExclude(Atom atom, String fgName, String fgType) {
    String symbol = atom.getSymbol();
    String name = fgName != null ? fgName.toLowerCase(Locale.ROOT) : "";

    if (name.contains("thiocyanate") || name.contains("thiocyano") || "SC#N".equals(fgType))
      return true;

    if (name.contains("amine") || name.equals("amino"))
      return false;

    if (name.contains("ketone") ||
        name.contains("aldehyde") ||
        name.contains("carboxylic") ||
        name.contains("acid") ||
        name.contains("ester") ||
        name.contains("oate") ||
        name.contains("amide") ||
        name.equals("carbonyl"))
      return "O".equals(symbol) || (name.contains("amide") && "N".equals(symbol));

    if (name.contains("alcohol") || name.equals("ol"))
      return "O".equals(symbol);

    if (name.contains("ether") || name.equals("oxy"))
      return "O".equals(symbol);

    if (name.contains("nitrile") || name.equals("cyano"))
      return "N".equals(symbol);

    return !atom.isCarbon();
  }

  /**
   * A chain is valid when each consecutive pair of members is bonded.
   *
   * @param chain member atom ids in order
   * @param mol   the molecule
   * @return the chain is one connected path
   */
  public static boolean isValidChain(List<Integer> chain, Molecule mol) {
    if (chain.isEmpty())
      return false;
    for (int i = 0; i + 1 < chain.size(); i++) {
      if (!mol.isBonded(chain.get(i), chain.get(i + 1)))
        return false;
    }
    return true;
  }

  /**
   * A ring is valid when it is a valid chain that also closes back on itself.
   *
   * @param ring member atom ids in cyclic order
   * @param mol  the molecule
   * @return the members form one cycle
   */
  public static boolean isValidRing(List<Integer> ring, Molecule mol) {
    return ring.size() >= 3 &&
           isValidChain(ring, mol) &&
           mol.isBonded(ring.get(0), ring.get(ring.size() - 1));
  }

  /**
   * Score a candidate chain by how many groups bond through their defining heteroatom
   * directly to a chain atom. Used as a tie-break between equally long chains.
   *
   * @param chain  candidate chain atom ids
   * @param mol    the molecule
   * @param groups detected groups
   * @return number of directly attached groups
   */
  public static int countDirectAttachments(Collection<Integer> chain, Molecule mol,
                                           Collection<FunctionalGroup> groups) {
    Set<Integer> chainSet = new HashSet<>(chain);
    int count = 0;
    for (FunctionalGroup group : groups) {
      Atom hetero = definingHeteroatom(group);
      if (hetero == null || chainSet.contains(hetero.getId()))
        continue;
      for (Integer nbr : mol.neighbours(hetero.getId())) {
        if (chainSet.contains(nbr)) {
          count++;
          break;
        }
      }
    }
    return count;
  }

  private static Atom definingHeteroatom(FunctionalGroup group) {
    for (Atom atom : group.getAtoms()) {
      if (!atom.isCarbon())
        return atom;
    }
    return null;
  }

  public static boolean isHydrocarbonChain(Collection<Integer> chain, Molecule mol) {
    for (Integer id : chain) {
      Atom atom = mol.atom(id);
      if (atom == null || !atom.isCarbon())
        return false;
    }
    return true;
  }

  /**
   * Halogens can never be part of a parent chain.
   */
  public static boolean containsHalogen(Collection<Integer> chain, Molecule mol) {
    for (Integer id : chain) {
      Atom atom = mol.atom(id);
      if (atom != null && atom.isHalogen())
        return true;
    }
    return false;
  }

  /**
   * Only amines put a heteroatom into the parent chain ("ethanamine").
   */
  public static boolean requiresHeteroatomChains(Collection<FunctionalGroup> groups) {
    for (FunctionalGroup group : groups) {
      String name = group.getName() != null ? group.getName() : group.getType();
      if (name.toLowerCase(Locale.ROOT).contains("amine"))
        return true;
    }
    return false;
  }
}
