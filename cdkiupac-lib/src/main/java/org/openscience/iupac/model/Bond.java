/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import java.util.Objects;

/**
 * A bond between two atoms, addressed by atom id.
 */
public final class Bond {

  private final int       atom1;
  private final int       atom2;
  private final BondOrder order;

  public Bond(int atom1, int atom2, BondOrder order) {
    this.atom1 = atom1;
    this.atom2 = atom2;
    this.order = Objects.requireNonNull(order, "order");
  }

  public int getAtom1() {
    return atom1;
  }

  public int getAtom2() {
    return atom2;
  }

  public BondOrder getOrder() {
    return order;
  }

  public boolean contains(int atomId) {
    return atom1 == atomId || atom2 == atomId;
  }

  /**
   * The atom at the other end of this bond.
   *
   * @param atomId one end of the bond
   * @return the other end
   * @throws IllegalArgumentException the atom is not part of this bond
   */
  public int other(int atomId) {
    if (atom1 == atomId)
      return atom2;
    if (atom2 == atomId)
      return atom1;
    throw new IllegalArgumentException("Atom " + atomId + " is not in bond " + this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Bond)) return false;
    Bond bond = (Bond) o;
    return atom1 == bond.atom1 && atom2 == bond.atom2 && order == bond.order;
  }

  @Override
  public int hashCode() {
    return Objects.hash(atom1, atom2, order);
  }

  @Override
  public String toString() {
    return atom1 + "-" + atom2 + ":" + order;
  }
}
