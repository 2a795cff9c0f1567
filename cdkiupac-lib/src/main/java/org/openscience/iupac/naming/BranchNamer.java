/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names the branches hanging off a central atom of a larger fragment (the R groups of
 * -PR2, -C(=O)NR2) and joins them into a ligand list, "ethyl(methyl)".
 */
final class BranchNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BranchNamer.class);

  static final String ALKYL = "alkyl";

  static final Map<String, String> HALO = ImmutableMap.of(
      "F", "fluoro",
      "Cl", "chloro",
      "Br", "bromo",
      "I", "iodo");

  private static final Map<String, String> ALKOXY = ImmutableMap.of(
      "methyl", "methoxy",
      "ethyl", "ethoxy",
      "propyl", "propoxy",
      "butyl", "butoxy",
      "phenyl", "phenoxy");

  private final AlkylNamer           alkylNamer;
  private final RingSubstituentNamer ringNamer;
  private final MultiplierResolver   multipliers;

  BranchNamer(AlkylNamer alkylNamer, RingSubstituentNamer ringNamer, MultiplierResolver multipliers) {
    this.alkylNamer = alkylNamer;
    this.ringNamer = ringNamer;
    this.multipliers = multipliers;
  }

  /**
   * Name the branch of a fragment that starts at root, away from the center.
   *
   * @return the name, "alkyl" when the branch is not recognised
   */
  String name(Molecule mol, Set<Integer> fragment, int root, int center) {
    Set<Integer> branch = SubstituentCollector.collectWithin(mol, root, fragment, center);
    Atom atom = mol.atom(root);
    if (atom == null)
      return ALKYL;
    if (branch.size() == 1 && HALO.containsKey(atom.getSymbol()))
      return HALO.get(atom.getSymbol());
    if ("O".equals(atom.getSymbol()))
      return oxyName(mol, branch, root);
    if (atom.isInRing())
      return ringNamer.name(mol, branch, root);
    String name = alkylNamer.name(mol, branch, root);
    if (name == null) {
      LOGGER.warn("Unrecognised branch at atom {}, naming it {}", root, ALKYL);
      return ALKYL;
    }
    return name;
  }

  private String oxyName(Molecule mol, Set<Integer> branch, int oxygen) {
    if (branch.size() == 1)
      return "hydroxy";
    for (Integer nbr : mol.neighbours(oxygen)) {
      if (!branch.contains(nbr))
        continue;
      String name = name(mol, branch, nbr, oxygen);
      String contracted = ALKOXY.get(name);
      if (contracted != null)
        return contracted;
      return name + "oxy";
    }
    return "hydroxy";
  }

  /**
   * Join ligand names: identical ligands are multiplied, different ones are listed
   * alphabetically with all but the first in parentheses.
   */
  String join(List<String> names) {
    Multimap<String, String> byName = MultimapBuilder.treeKeys().arrayListValues().build();
    for (String name : names)
      byName.put(name, name);
    List<String> parts = new ArrayList<>();
    for (String name : byName.keySet()) {
      Collection<String> same = byName.get(name);
      boolean complex = SubstituentPart.needsWrapping(name);
      String display = complex ? SubstituentPart.wrap(name) : name;
      parts.add(multipliers.getMultiplicativePrefix(same.size(), complex) + display);
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < parts.size(); i++) {
      String part = parts.get(i);
      if (i > 0 && !SubstituentPart.isAlreadyWrapped(part))
        sb.append('(').append(part).append(')');
      else
        sb.append(part);
    }
    return sb.toString();
  }
}
