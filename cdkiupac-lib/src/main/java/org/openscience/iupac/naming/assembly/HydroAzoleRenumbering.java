/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableMap;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.SubstituentPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the trivial names of the dihydro five-membered azoles ("thiazoline") as
 * hydro prefixes on the aromatic parent ("4,5-dihydro-1,3-thiazole"). The ring is
 * renumbered from the senior heteroatom and prefix locants follow the new numbering.
 */
final class HydroAzoleRenumbering {

  private static final Logger LOGGER = LoggerFactory.getLogger(HydroAzoleRenumbering.class);

  private static final Map<String, String> AZOLES = ImmutableMap.of(
      "thiazoline", "1,3-thiazole",
      "oxazoline", "1,3-oxazole",
      "imidazoline", "1H-imidazole",
      "pyrazoline", "1H-pyrazole");

  private static final int RING_SIZE = 5;

  private HydroAzoleRenumbering() {
  }

  /**
   * One way of numbering the ring: the atom ids in new locant order.
   */
  private static final class Numbering implements Comparable<Numbering> {

    final List<Integer> order;
    final int           firstRank;
    final List<Integer> heteroLocants  = new ArrayList<>();
    final boolean       firstSaturated;
    final List<Integer> doubleLocants  = new ArrayList<>();
    final List<Integer> prefixLocants  = new ArrayList<>();

    Numbering(List<Integer> order, Molecule mol, ParentStructure parent, List<SubstituentPart> parts) {
      this.order = order;
      this.firstRank = seniority(mol.symbol(order.get(0)));
      for (int i = 0; i < order.size(); i++) {
        if (seniority(mol.symbol(order.get(i))) > 0)
          heteroLocants.add(i + 1);
        Bond bond = mol.bondBetween(order.get(i), order.get((i + 1) % order.size()));
        if (bond != null && bond.getOrder() == BondOrder.DOUBLE)
          doubleLocants.add(i + 1);
      }
      this.firstSaturated = !doubleLocants.contains(1) && !doubleLocants.contains(order.size());
      Map<Integer, Integer> map = mapping(parent);
      for (SubstituentPart part : parts) {
        for (String locant : part.getLocants()) {
          Integer old = parseLocant(locant);
          if (old != null && map.containsKey(old))
            prefixLocants.add(map.get(old));
        }
      }
      Collections.sort(prefixLocants);
    }

    Map<Integer, Integer> mapping(ParentStructure parent) {
      Map<Integer, Integer> map = new HashMap<>();
      for (int i = 0; i < order.size(); i++) {
        int old = parent.locantOf(order.get(i));
        if (old >= 0)
          map.put(old, i + 1);
      }
      return map;
    }

    List<Integer> saturatedLocants() {
      List<Integer> locants = new ArrayList<>();
      for (int i = 2; i <= order.size(); i++) {
        if (!doubleLocants.contains(i) && !doubleLocants.contains(i - 1))
          locants.add(i);
      }
      return locants;
    }

    @Override
    public int compareTo(Numbering that) {
      int cmp = Integer.compare(that.firstRank, this.firstRank);
      if (cmp != 0)
        return cmp;
      cmp = compareLocants(this.heteroLocants, that.heteroLocants);
      if (cmp != 0)
        return cmp;
      cmp = Boolean.compare(that.firstSaturated, this.firstSaturated);
      if (cmp != 0)
        return cmp;
      cmp = compareLocants(this.doubleLocants, that.doubleLocants);
      if (cmp != 0)
        return cmp;
      return compareLocants(this.prefixLocants, that.prefixLocants);
    }
  }

  static Candidates apply(Candidates in, AssemblyContext ctx) {
    if (!ctx.getOptions().getBoolean(NamingOptions.Param.HYDROAZOLE_RENUMBER))
      return in;
    String parentName = in.getParentName();
    String trivial = null;
    for (String name : AZOLES.keySet()) {
      if (parentName.endsWith(name)) {
        trivial = name;
        break;
      }
    }
    if (trivial == null)
      return in;

    ParentStructure parent = ctx.getParent();
    Molecule mol = ctx.getMolecule();
    List<Integer> ring = ringOrder(parent, mol);
    if (ring == null) {
      LOGGER.warn("Can not renumber {}, parent is not a five-membered ring", parentName);
      return in;
    }

    Numbering best = null;
    for (int start = 0; start < RING_SIZE; start++) {
      for (int dir = -1; dir <= 1; dir += 2) {
        List<Integer> order = new ArrayList<>(RING_SIZE);
        for (int k = 0; k < RING_SIZE; k++)
          order.add(ring.get(Math.floorMod(start + dir * k, RING_SIZE)));
        Numbering numbering = new Numbering(order, mol, parent, in.getParts());
        if (best == null || numbering.compareTo(best) < 0)
          best = numbering;
      }
    }

    Map<Integer, Integer> renumbering = best.mapping(parent);
    List<Integer> hydro = best.saturatedLocants();
    String head = parentName.substring(0, parentName.length() - trivial.length());
    String name = ParentNames.joinLocants(hydro) + "-" +
                  ctx.getMultipliers().getMultiplicativePrefix(hydro.size(), false) + "hydro-" +
                  AZOLES.get(trivial);
    if (!head.isEmpty())
      name = head.endsWith("-") ? head + name : head + "-" + name;
    if (in.hasPrincipal())
      name = ParentNames.elide(name, SuffixAppender.suffixOf(in.getPrincipal(), ctx));

    List<SubstituentPart> parts = new ArrayList<>();
    for (SubstituentPart part : in.getParts())
      parts.add(remap(part, renumbering));
    parts.sort(SubstituentPart.ALPHABETICAL);

    LOGGER.debug("Renumbered {} as {} with {}", parentName, name, renumbering);
    return in.toBuilder()
             .parentName(name)
             .parts(parts)
             .prefix(PrefixStages.render(parts, ctx.getMultipliers(), "-"))
             .renumbering(renumbering)
             .build();
  }

  /**
   * Ring members in cyclic order, null unless the parent is a bonded five-membered ring.
   */
  private static List<Integer> ringOrder(ParentStructure parent, Molecule mol) {
    if (parent.size() != RING_SIZE)
      return null;
    List<Integer> ids = parent.atomIdList();
    for (Integer id : ids) {
      if (!mol.contains(id))
        return null;
    }
    boolean cyclic = true;
    for (int i = 0; i < ids.size(); i++) {
      if (!mol.isBonded(ids.get(i), ids.get((i + 1) % ids.size())))
        cyclic = false;
    }
    if (cyclic)
      return ids;
    List<Integer> ring = mol.smallestRing(ids.get(0));
    if (ring.size() != RING_SIZE || !ring.containsAll(ids))
      return null;
    return ring;
  }

  private static SubstituentPart remap(SubstituentPart part, Map<Integer, Integer> renumbering) {
    if (part.isVerbatim() || part.getLocants().isEmpty())
      return part;
    List<String> locants = new ArrayList<>();
    for (String locant : part.getLocants()) {
      Integer old = parseLocant(locant);
      Integer mapped = old != null ? renumbering.get(old) : null;
      locants.add(mapped != null ? mapped.toString() : locant);
    }
    return part.withLocants(locants);
  }

  private static int seniority(String symbol) {
    if (symbol == null)
      return 0;
    switch (symbol) {
      case "O":
        return 3;
      case "S":
        return 2;
      case "N":
        return 1;
      default:
        return 0;
    }
  }

  private static int compareLocants(List<Integer> a, List<Integer> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int cmp = Integer.compare(a.get(i), b.get(i));
      if (cmp != 0)
        return cmp;
    }
    return Integer.compare(a.size(), b.size());
  }

  private static Integer parseLocant(String locant) {
    try {
      return Integer.parseInt(locant);
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
