/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only molecular graph. Atoms keep their input order, bonds refer to atom ids.
 */
public final class Molecule {

  private final ImmutableList<Atom>               atoms;
  private final ImmutableList<Bond>               bonds;
  private final ImmutableMap<Integer, Integer>    positions;
  private final ImmutableListMultimap<Integer, Bond> adjacency;

  private Molecule(List<Atom> atoms, List<Bond> bonds) {
    this.atoms = ImmutableList.copyOf(atoms);
    this.bonds = ImmutableList.copyOf(bonds);
    Map<Integer, Integer> pos = new LinkedHashMap<>();
    for (int i = 0; i < atoms.size(); i++) {
      if (pos.put(atoms.get(i).getId(), i) != null)
        throw new IllegalArgumentException("Duplicate atom id: " + atoms.get(i).getId());
    }
    this.positions = ImmutableMap.copyOf(pos);
    ImmutableListMultimap.Builder<Integer, Bond> adj = ImmutableListMultimap.builder();
    for (Bond bond : bonds) {
      if (!pos.containsKey(bond.getAtom1()) || !pos.containsKey(bond.getAtom2()))
        throw new IllegalArgumentException("Bond refers to unknown atom: " + bond);
      adj.put(bond.getAtom1(), bond);
      adj.put(bond.getAtom2(), bond);
    }
    this.adjacency = adj.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Atom> atoms() {
    return atoms;
  }

  public List<Bond> bonds() {
    return bonds;
  }

  public int getAtomCount() {
    return atoms.size();
  }

  /**
   * Atom with the given id.
   *
   * @param id atom id
   * @return the atom, null if there is no such atom
   */
  public Atom atom(int id) {
    Integer pos = positions.get(id);
    return pos != null ? atoms.get(pos) : null;
  }

  public boolean contains(int id) {
    return positions.containsKey(id);
  }

  /**
   * Atom at a position of the atom sequence.
   *
   * @param index position
   * @return the atom, null if out of range
   */
  public Atom atomAt(int index) {
    if (index < 0 || index >= atoms.size())
      return null;
    return atoms.get(index);
  }

  /**
   * Position of an atom id in the atom sequence.
   *
   * @param id atom id
   * @return the position or -1
   */
  public int indexOf(int id) {
    Integer pos = positions.get(id);
    return pos != null ? pos : -1;
  }

  public String symbol(int id) {
    Atom atom = atom(id);
    return atom != null ? atom.getSymbol() : "";
  }

  public List<Bond> bondsOf(int id) {
    return adjacency.get(id);
  }

  public List<Integer> neighbours(int id) {
    List<Integer> nbrs = new ArrayList<>();
    for (Bond bond : adjacency.get(id))
      nbrs.add(bond.other(id));
    return nbrs;
  }

  public Bond bondBetween(int a, int b) {
    for (Bond bond : adjacency.get(a)) {
      if (bond.other(a) == b)
        return bond;
    }
    return null;
  }

  public boolean isBonded(int a, int b) {
    return bondBetween(a, b) != null;
  }

  /**
   * The smallest ring through an atom, as a cyclic sequence of atom ids starting at
   * the atom. Only ring-flagged atoms are traversed.
   *
   * @param id atom id
   * @return ring member ids, empty if the atom is in no ring
   */
  public List<Integer> smallestRing(int id) {
    Atom start = atom(id);
    if (start == null || !start.isInRing())
      return Collections.emptyList();
    List<Integer> best = Collections.emptyList();
    for (Bond bond : adjacency.get(id)) {
      int nbr = bond.other(id);
      Atom nbrAtom = atom(nbr);
      if (nbrAtom == null || !nbrAtom.isInRing())
        continue;
      List<Integer> path = shortestPathAvoiding(nbr, id, bond);
      if (!path.isEmpty() && (best.isEmpty() || path.size() < best.size()))
        best = path;
    }
    if (best.isEmpty())
      return best;
    // path runs nbr..id, present it as id, nbr, ...
    List<Integer> ring = new ArrayList<>(best.size());
    ring.add(id);
    ring.addAll(best.subList(0, best.size() - 1));
    return ring;
  }

  private List<Integer> shortestPathAvoiding(int from, int to, Bond skip) {
    Map<Integer, Integer> prev = new HashMap<>();
    Deque<Integer> queue = new ArrayDeque<>();
    prev.put(from, from);
    queue.add(from);
    while (!queue.isEmpty()) {
      int cur = queue.poll();
      if (cur == to)
        break;
      for (Bond bond : adjacency.get(cur)) {
        if (bond == skip)
          continue;
        int nxt = bond.other(cur);
        if (prev.containsKey(nxt))
          continue;
        Atom atom = atom(nxt);
        if (atom == null || !atom.isInRing())
          continue;
        prev.put(nxt, cur);
        queue.add(nxt);
      }
    }
    if (!prev.containsKey(to))
      return Collections.emptyList();
    List<Integer> path = new ArrayList<>();
    int cur = to;
    while (cur != from) {
      path.add(cur);
      cur = prev.get(cur);
    }
    path.add(from);
    Collections.reverse(path);
    return path;
  }

  @Override
  public String toString() {
    return "Molecule{atoms=" + atoms + ", bonds=" + bonds + '}';
  }

  public static final class Builder {

    private final List<Atom> atoms = new ArrayList<>();
    private final List<Bond> bonds = new ArrayList<>();

    private Builder() {
    }

    public Builder atom(Atom atom) {
      atoms.add(atom);
      return this;
    }

    public Builder atom(int id, String symbol) {
      return atom(new Atom(id, symbol));
    }

    public Builder bond(int a, int b, BondOrder order) {
      bonds.add(new Bond(a, b, order));
      return this;
    }

    public Builder bond(int a, int b) {
      return bond(a, b, BondOrder.SINGLE);
    }

    public Molecule build() {
      return new Molecule(atoms, bonds);
    }
  }
}
