/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.Molecule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names acyclic carbon fragments by the atom they attach through: "methyl",
 * "propan-2-yl", "2-methylpropyl", "prop-2-en-1-yl", "acetyl". The fragment's
 * longest carbon path containing the attachment atom is the substituent chain, numbered
 * to give the attachment the lowest locant.
 */
public final class AlkylNamer {

  private final NomenclatureDictionary dictionary;
  private final MultiplierResolver     multipliers;

  public AlkylNamer(NomenclatureDictionary dictionary) {
    this.dictionary = dictionary;
    this.multipliers = new MultiplierResolver(dictionary);
  }

  /**
   * Name a fragment attached through a single bond.
   *
   * @param mol      the molecule
   * @param fragment fragment atom ids (not including the atom it hangs off)
   * @param attach   fragment atom bonded to the rest of the molecule
   * @return the name, null if the fragment is not an acyclic alkyl or acyl group
   */
  public String name(Molecule mol, Collection<Integer> fragment, int attach) {
    Atom root = mol.atom(attach);
    if (root == null || !root.isCarbon() || !fragment.contains(attach))
      return null;

    int carbonylO = -1;
    Set<Integer> carbons = new LinkedHashSet<>();
    for (Integer id : fragment) {
      Atom atom = mol.atom(id);
      if (atom == null)
        return null;
      if (atom.isCarbon()) {
        if (atom.isInRing())
          return null;
        carbons.add(id);
      } else if ("O".equals(atom.getSymbol()) && carbonylO < 0 && isDoubleBonded(mol, id, attach)) {
        carbonylO = id;
      } else {
        return null;
      }
    }

    FragmentChain chain = FragmentChain.select(mol, carbons, attach);
    if (chain == null)
      return null;

    if (carbonylO >= 0)
      return acylName(mol, chain);
    return render(mol, chain, "yl");
  }

  /**
   * Describe the substituent chain of a fragment, used by the ylidene namer.
   *
   * @return the chain, null if the carbons do not form a tree
   */
  FragmentChain chainOf(Molecule mol, Set<Integer> carbons, int attach) {
    return FragmentChain.select(mol, carbons, attach);
  }

  /**
   * The chain with its branches as prefixes and the given free-valence ending.
   */
  String render(Molecule mol, FragmentChain chain, String ending) {
    String branches = branchPrefix(mol, chain);
    String stem = dictionary.getChainName(chain.size());
    List<Integer> doubles = chain.multipleBonds(mol, BondOrder.DOUBLE);
    List<Integer> triples = chain.multipleBonds(mol, BondOrder.TRIPLE);

    StringBuilder sb = new StringBuilder(branches);
    if (doubles.isEmpty() && triples.isEmpty()) {
      if (chain.attachLocant() == 1) {
        sb.append(stem).append(ending);
      } else {
        sb.append(stem).append("an-").append(chain.attachLocant()).append('-').append(ending);
      }
      return sb.toString();
    }

    sb.append(stem);
    if (doubles.size() + triples.size() > 1)
      sb.append('a');
    if (!doubles.isEmpty()) {
      sb.append('-').append(joinLocants(doubles)).append('-')
        .append(multipliers.getMultiplicativePrefix(doubles.size(), false)).append("en");
    }
    if (!triples.isEmpty()) {
      sb.append('-').append(joinLocants(triples)).append('-')
        .append(multipliers.getMultiplicativePrefix(triples.size(), false)).append("yn");
    }
    sb.append('-').append(chain.attachLocant()).append('-').append(ending);
    return sb.toString();
  }

  private String acylName(Molecule mol, FragmentChain chain) {
    if (chain.attachLocant() != 1 ||
        !chain.multipleBonds(mol, BondOrder.DOUBLE).isEmpty() ||
        !chain.multipleBonds(mol, BondOrder.TRIPLE).isEmpty())
      return null;
    String branches = branchPrefix(mol, chain);
    if (branches.isEmpty()) {
      if (chain.size() == 1)
        return "formyl";
      if (chain.size() == 2)
        return "acetyl";
    }
    return branches + dictionary.getChainName(chain.size()) + "anoyl";
  }

  private String branchPrefix(Molecule mol, FragmentChain chain) {
    Multimap<String, Integer> byName = MultimapBuilder.treeKeys().arrayListValues().build();
    for (Map.Entry<Integer, Integer> e : chain.branchRoots().entrySet()) {
      int branchRoot = e.getKey();
      Set<Integer> branch = SubstituentCollector.collect(mol, branchRoot, chain.path());
      FragmentChain sub = FragmentChain.select(mol, branch, branchRoot);
      String name = sub != null ? render(mol, sub, "yl") : "alkyl";
      byName.put(name, e.getValue());
    }
    if (byName.isEmpty())
      return "";
    List<String> parts = new ArrayList<>();
    for (String name : byName.keySet()) {
      Collection<Integer> locs = byName.get(name);
      boolean complex = containsDigit(name);
      String display = complex ? "(" + name + ")" : name;
      parts.add(joinLocants(new ArrayList<>(locs)) + "-" +
                multipliers.getMultiplicativePrefix(locs.size(), complex) + display);
    }
    return String.join("-", parts);
  }

  static String joinLocants(List<Integer> locants) {
    List<Integer> sorted = new ArrayList<>(locants);
    Collections.sort(sorted);
    StringBuilder sb = new StringBuilder();
    for (Integer loc : sorted) {
      if (sb.length() > 0)
        sb.append(',');
      sb.append(loc);
    }
    return sb.toString();
  }

  static boolean containsDigit(String str) {
    for (int i = 0; i < str.length(); i++) {
      if (Character.isDigit(str.charAt(i)))
        return true;
    }
    return false;
  }

  private static boolean isDoubleBonded(Molecule mol, int a, int b) {
    Bond bond = mol.bondBetween(a, b);
    return bond != null && bond.getOrder() == BondOrder.DOUBLE;
  }

  /**
   * A numbered path through a carbon tree together with the branch roots hanging off
   * it, keyed to the locant of the path atom they attach to.
   */
  static final class FragmentChain {

    private final List<Integer>         path;
    private final int                   attachLocant;
    private final Map<Integer, Integer> branchRoots;

    private FragmentChain(List<Integer> path, int attachLocant, Map<Integer, Integer> branchRoots) {
      this.path = path;
      this.attachLocant = attachLocant;
      this.branchRoots = branchRoots;
    }

    List<Integer> path() {
      return path;
    }

    int size() {
      return path.size();
    }

    int attachLocant() {
      return attachLocant;
    }

    Map<Integer, Integer> branchRoots() {
      return branchRoots;
    }

    boolean isBranched() {
      return !branchRoots.isEmpty();
    }

    /**
     * Lower locants of path bonds with the given order.
     */
    List<Integer> multipleBonds(Molecule mol, BondOrder order) {
      List<Integer> locs = new ArrayList<>();
      for (int i = 0; i + 1 < path.size(); i++) {
        Bond bond = mol.bondBetween(path.get(i), path.get(i + 1));
        if (bond != null && bond.getOrder() == order)
          locs.add(i + 1);
      }
      return locs;
    }

    static FragmentChain select(Molecule mol, Set<Integer> carbons, int attach) {
      if (!carbons.contains(attach))
        return null;
      Map<Integer, List<Integer>> adj = new HashMap<>();
      int edges = 0;
      for (Integer c : carbons) {
        List<Integer> nbrs = new ArrayList<>();
        for (Integer nbr : mol.neighbours(c)) {
          if (carbons.contains(nbr))
            nbrs.add(nbr);
        }
        edges += nbrs.size();
        adj.put(c, nbrs);
      }
      // a tree has n-1 edges, anything else has a cycle or is disconnected
      if (edges / 2 != carbons.size() - 1)
        return null;

      FragmentChain best = null;
      for (Integer u : carbons) {
        Map<Integer, Integer> prev = bfs(adj, u);
        for (Integer v : carbons) {
          List<Integer> path = trace(prev, u, v);
          if (path == null || !path.contains(attach))
            continue;
          FragmentChain cand = numbered(mol, adj, path, attach);
          if (best == null || cand.betterThan(mol, best))
            best = cand;
        }
      }
      return best;
    }

    private static FragmentChain numbered(Molecule mol, Map<Integer, List<Integer>> adj,
                                          List<Integer> path, int attach) {
      Set<Integer> onPath = new HashSet<>(path);
      Map<Integer, Integer> branches = new HashMap<>();
      for (int i = 0; i < path.size(); i++) {
        for (Integer nbr : adj.get(path.get(i))) {
          if (!onPath.contains(nbr))
            branches.put(nbr, i + 1);
        }
      }
      return new FragmentChain(path, path.indexOf(attach) + 1, branches);
    }

    private boolean betterThan(Molecule mol, FragmentChain that) {
      if (size() != that.size())
        return size() > that.size();
      if (attachLocant != that.attachLocant)
        return attachLocant < that.attachLocant;
      int cmp = compareLocants(unsaturation(mol), that.unsaturation(mol));
      if (cmp != 0)
        return cmp < 0;
      if (branchRoots.size() != that.branchRoots.size())
        return branchRoots.size() > that.branchRoots.size();
      return compareLocants(new ArrayList<>(branchRoots.values()),
                            new ArrayList<>(that.branchRoots.values())) < 0;
    }

    private List<Integer> unsaturation(Molecule mol) {
      List<Integer> locs = multipleBonds(mol, BondOrder.DOUBLE);
      locs.addAll(multipleBonds(mol, BondOrder.TRIPLE));
      return locs;
    }

    private static int compareLocants(List<Integer> a, List<Integer> b) {
      List<Integer> x = new ArrayList<>(a);
      List<Integer> y = new ArrayList<>(b);
      Collections.sort(x);
      Collections.sort(y);
      for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
        int cmp = Integer.compare(x.get(i), y.get(i));
        if (cmp != 0)
          return cmp;
      }
      return Integer.compare(y.size(), x.size());
    }

    private static Map<Integer, Integer> bfs(Map<Integer, List<Integer>> adj, int from) {
      Map<Integer, Integer> prev = new HashMap<>();
      Deque<Integer> queue = new ArrayDeque<>();
      prev.put(from, from);
      queue.add(from);
      while (!queue.isEmpty()) {
        int cur = queue.poll();
        for (Integer nbr : adj.get(cur)) {
          if (prev.containsKey(nbr))
            continue;
          prev.put(nbr, cur);
          queue.add(nbr);
        }
      }
      return prev;
    }

    private static List<Integer> trace(Map<Integer, Integer> prev, int from, int to) {
      if (!prev.containsKey(to))
        return null;
      List<Integer> path = new ArrayList<>();
      int cur = to;
      while (cur != from) {
        path.add(cur);
        cur = prev.get(cur);
      }
      path.add(from);
      return path;
    }
  }
}
