/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * A fragment hanging off a principal amine/imine nitrogen, only alive for one naming
 * call.
 */
public final class NSubstituent {

  private final String               name;
  private final int                  rootAtom;
  private final int                  nitrogen;
  private final String               label;
  private final boolean              ring;
  private final boolean              doubleBond;
  private final ImmutableSet<Integer> atoms;

  public NSubstituent(String name, int rootAtom, int nitrogen, String label,
                      boolean ring, boolean doubleBond, Set<Integer> atoms) {
    this.name = name;
    this.rootAtom = rootAtom;
    this.nitrogen = nitrogen;
    this.label = label;
    this.ring = ring;
    this.doubleBond = doubleBond;
    this.atoms = ImmutableSet.copyOf(atoms);
  }

  public String getName() {
    return name;
  }

  public int getRootAtom() {
    return rootAtom;
  }

  public int getNitrogen() {
    return nitrogen;
  }

  /**
   * @return "N", "N'", "N''", ...
   */
  public String getLabel() {
    return label;
  }

  public boolean isRing() {
    return ring;
  }

  public boolean isDoubleBond() {
    return doubleBond;
  }

  public Set<Integer> getAtoms() {
    return atoms;
  }

  @Override
  public String toString() {
    return label + "-" + name;
  }
}
