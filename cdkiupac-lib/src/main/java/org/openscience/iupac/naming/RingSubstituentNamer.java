/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.Molecule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names a monocyclic ring attached through one of its atoms: "phenyl", "pyridin-3-yl",
 * "cyclohexyl", "oxolan-2-yl", "4-methylphenyl". Fused or unrecognised rings fall back
 * to "aryl" or "cycloalkyl".
 */
public final class RingSubstituentNamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(RingSubstituentNamer.class);

  public static final String ARYL       = "aryl";
  public static final String CYCLOALKYL = "cycloalkyl";

  // saturated rings with one heteroatom, keyed by "<size><symbol>"
  private static final Map<String, String> SATURATED_HETEROCYCLES = ImmutableMap.<String, String>builder()
      .put("3O", "oxiran")
      .put("3N", "aziridin")
      .put("3S", "thiiran")
      .put("4O", "oxetan")
      .put("4N", "azetidin")
      .put("4S", "thietan")
      .put("5O", "oxolan")
      .put("5N", "pyrrolidin")
      .put("5S", "thiolan")
      .put("6O", "oxan")
      .put("6N", "piperidin")
      .put("6S", "thian")
      .build();

  private static final Map<String, String> AROMATIC_HETEROCYCLES = ImmutableMap.of(
      "5O", "furan",
      "5S", "thiophen",
      "5N", "pyrrol",
      "6N", "pyridin");

  private final NomenclatureDictionary dictionary;
  private final AlkylNamer             alkylNamer;
  private final MultiplierResolver     multipliers;

  public RingSubstituentNamer(NomenclatureDictionary dictionary, AlkylNamer alkylNamer) {
    this.dictionary = dictionary;
    this.alkylNamer = alkylNamer;
    this.multipliers = new MultiplierResolver(dictionary);
  }

  /**
   * Name a ring attached by a single bond.
   *
   * @param mol      the molecule
   * @param fragment atoms of the ring fragment, including any groups on the ring
   * @param attach   ring atom bonded to the rest of the molecule
   * @return the name, never null
   */
  public String name(Molecule mol, Set<Integer> fragment, int attach) {
    return name(mol, fragment, attach, "yl");
  }

  /**
   * Name a ring attached by a double bond, "cyclohexylidene".
   */
  public String nameYlidene(Molecule mol, Set<Integer> fragment, int attach) {
    return name(mol, fragment, attach, "ylidene");
  }

  // "aryl" / "arylidene", "cycloalkyl" / "cycloalkylidene"
  private static String generic(boolean aromatic, String ending) {
    String base = aromatic ? ARYL : CYCLOALKYL;
    return ending.startsWith("yl") ? base + ending.substring(2) : base;
  }

  private String name(Molecule mol, Set<Integer> fragment, int attach, String ending) {
    List<Integer> ring = mol.smallestRing(attach);
    Atom root = mol.atom(attach);
    if (ring.isEmpty() || root == null) {
      LOGGER.warn("Atom {} is not in a ring, using generic ring name", attach);
      return generic(root != null && root.isAromatic(), ending);
    }
    boolean aromatic = isAromatic(mol, ring);
    String fallback = generic(aromatic, ending);

    Set<Integer> ringSet = new HashSet<>(ring);
    for (Integer id : fragment) {
      Atom atom = mol.atom(id);
      if (atom != null && atom.isInRing() && !ringSet.contains(id)) {
        LOGGER.warn("Fused or multiple rings on fragment at {}, using {}", attach, fallback);
        return fallback;
      }
    }

    List<Integer> hetero = new ArrayList<>();
    for (int i = 0; i < ring.size(); i++) {
      if (!mol.atom(ring.get(i)).isCarbon())
        hetero.add(i);
    }

    boolean substituted = fragment.size() > ring.size();
    if (hetero.isEmpty()) {
      String base;
      if (aromatic && ring.size() == 6)
        base = "phen" + ending;
      else if (!aromatic)
        base = carbocycle(mol, ring, ending);
      else
        return fallback;
      if (!substituted)
        return base;
      String prefix = ringPrefixes(mol, ring, fragment);
      return prefix != null ? prefix + base : fallback;
    }

    if (hetero.size() != 1) {
      LOGGER.warn("Ring with {} heteroatoms at {}, using {}", hetero.size(), attach, fallback);
      return fallback;
    }
    if (substituted)
      LOGGER.warn("Groups on heterocyclic substituent at {} are not named", attach);

    int h = hetero.get(0);
    String key = ring.size() + mol.atom(ring.get(h)).getSymbol();
    String stem = aromatic ? AROMATIC_HETEROCYCLES.get(key) : SATURATED_HETEROCYCLES.get(key);
    if (stem == null) {
      LOGGER.warn("No name for ring {} at {}, using {}", key, attach, fallback);
      return fallback;
    }
    int position = Math.min(h, ring.size() - h) + 1;
    return stem + "-" + position + "-" + ending;
  }

  private String carbocycle(Molecule mol, List<Integer> ring, String ending) {
    String stem = "cyclo" + dictionary.getChainName(ring.size());
    List<Integer> fwd = new ArrayList<>();
    List<Integer> rev = new ArrayList<>();
    int n = ring.size();
    for (int i = 0; i < n; i++) {
      Bond bond = mol.bondBetween(ring.get(i), ring.get((i + 1) % n));
      if (bond != null && bond.getOrder() == BondOrder.DOUBLE) {
        fwd.add(i + 1);
        // the same bond numbered the other way round
        rev.add(i == n - 1 ? 1 : n - i);
      }
    }
    if (fwd.isEmpty())
      return stem + ending;
    List<Integer> locs = lower(fwd, rev);
    return stem + (locs.size() > 1 ? "a" : "") + "-" + AlkylNamer.joinLocants(locs) + "-" +
           multipliers.getMultiplicativePrefix(locs.size(), false) + "en-1-" + ending;
  }

  private String ringPrefixes(Molecule mol, List<Integer> ring, Set<Integer> fragment) {
    Set<Integer> ringSet = new HashSet<>(ring);
    List<String> names = new ArrayList<>();
    List<Integer> fwd = new ArrayList<>();
    List<Integer> rev = new ArrayList<>();
    int n = ring.size();
    for (int i = 0; i < n; i++) {
      for (Integer nbr : mol.neighbours(ring.get(i))) {
        if (ringSet.contains(nbr) || !fragment.contains(nbr))
          continue;
        Set<Integer> branch = SubstituentCollector.collect(mol, nbr, ringSet);
        String name = branchName(mol, branch, nbr);
        if (name == null) {
          LOGGER.warn("Unnamed group at ring atom {}", ring.get(i));
          return null;
        }
        names.add(name);
        fwd.add(i + 1);
        rev.add(i == 0 ? 1 : n - i + 1);
      }
    }
    List<Integer> locs = lower(fwd, rev) == fwd ? fwd : rev;
    Multimap<String, Integer> byName = MultimapBuilder.treeKeys().arrayListValues().build();
    for (int i = 0; i < names.size(); i++)
      byName.put(names.get(i), locs.get(i));
    StringBuilder sb = new StringBuilder();
    for (String name : byName.keySet()) {
      Collection<Integer> nameLocs = byName.get(name);
      boolean complex = AlkylNamer.containsDigit(name);
      if (sb.length() > 0)
        sb.append('-');
      sb.append(AlkylNamer.joinLocants(new ArrayList<>(nameLocs))).append('-')
        .append(multipliers.getMultiplicativePrefix(nameLocs.size(), complex))
        .append(complex ? "(" + name + ")" : name);
    }
    return sb.toString();
  }

  private String branchName(Molecule mol, Set<Integer> branch, int root) {
    Atom atom = mol.atom(root);
    if (branch.size() == 1 && BranchNamer.HALO.containsKey(atom.getSymbol()))
      return BranchNamer.HALO.get(atom.getSymbol());
    return alkylNamer.name(mol, branch, root);
  }

  private static List<Integer> lower(List<Integer> a, List<Integer> b) {
    List<Integer> x = new ArrayList<>(a);
    List<Integer> y = new ArrayList<>(b);
    Collections.sort(x);
    Collections.sort(y);
    for (int i = 0; i < x.size(); i++) {
      int cmp = Integer.compare(x.get(i), y.get(i));
      if (cmp < 0)
        return a;
      if (cmp > 0)
        return b;
    }
    return a;
  }

  private static boolean isAromatic(Molecule mol, List<Integer> ring) {
    for (Integer id : ring) {
      if (!mol.atom(id).isAromatic())
        return false;
    }
    return true;
  }
}
