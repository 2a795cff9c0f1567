/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import org.openscience.iupac.model.AtomRef;
import org.openscience.iupac.model.Molecule;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the connected atoms of one substituent island from a root atom. Traversal
 * never enters an excluded atom (parent members, a pivot) and every atom is visited
 * at most once, so rings terminate.
 */
public final class SubstituentCollector {

  private SubstituentCollector() {
  }

  /**
   * @param mol      the molecule
   * @param root     root atom id
   * @param excluded atom ids the traversal may not enter
   * @return the island, in breadth-first order, root first; empty if root is excluded
   *         or unknown
   */
  public static Set<Integer> collect(Molecule mol, int root, Collection<Integer> excluded) {
    if (!mol.contains(root) || excluded.contains(root))
      return Collections.emptySet();
    Set<Integer> blocked = new HashSet<>(excluded);
    Set<Integer> visited = new LinkedHashSet<>();
    Deque<Integer> queue = new ArrayDeque<>();
    visited.add(root);
    queue.add(root);
    while (!queue.isEmpty()) {
      int cur = queue.poll();
      for (Integer nbr : mol.neighbours(cur)) {
        if (blocked.contains(nbr) || !visited.add(nbr))
          continue;
        queue.add(nbr);
      }
    }
    return visited;
  }

  /**
   * Collect with an extra pivot atom that also stops the traversal, e.g. the
   * heteroatom the fragment hangs off.
   */
  public static Set<Integer> collect(Molecule mol, int root, Collection<Integer> excluded, int pivot) {
    Set<Integer> blocked = new HashSet<>(excluded);
    blocked.add(pivot);
    return collect(mol, root, blocked);
  }

  /**
   * Collect without leaving a known fragment or crossing the pivot, used to split a
   * fragment into the branches on one of its atoms.
   */
  public static Set<Integer> collectWithin(Molecule mol, int root, Set<Integer> fragment, int pivot) {
    Set<Integer> blocked = new HashSet<>();
    for (Integer id : reachable(mol, root)) {
      if (!fragment.contains(id))
        blocked.add(id);
    }
    blocked.add(pivot);
    return collect(mol, root, blocked);
  }

  private static Set<Integer> reachable(Molecule mol, int root) {
    return collect(mol, root, Collections.<Integer>emptySet());
  }

  /**
   * Collect from a root given in either addressing scheme.
   *
   * @return the island, empty if the reference does not resolve
   */
  public static Set<Integer> collect(Molecule mol, AtomRef root, Collection<Integer> excluded) {
    int id = root.resolve(mol);
    if (id < 0)
      return Collections.emptySet();
    return collect(mol, id, excluded);
  }
}
