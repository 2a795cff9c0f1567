/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import java.util.Objects;

/**
 * An atom of the input graph. The id is the caller's handle for the atom and is
 * independent of its position in {@link Molecule#atoms()}.
 */
public final class Atom {

  private final int     id;
  private final String  symbol;
  private final boolean aromatic;
  private final boolean inRing;
  private final int     charge;

  public Atom(int id, String symbol, boolean aromatic, boolean inRing, int charge) {
    this.id = id;
    this.symbol = Objects.requireNonNull(symbol, "symbol");
    this.aromatic = aromatic;
    this.inRing = inRing;
    this.charge = charge;
  }

  public Atom(int id, String symbol) {
    this(id, symbol, false, false, 0);
  }

  public int getId() {
    return id;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isAromatic() {
    return aromatic;
  }

  public boolean isInRing() {
    return inRing;
  }

  public int getCharge() {
    return charge;
  }

  public boolean isCarbon() {
    return "C".equals(symbol);
  }

  public boolean isHalogen() {
    switch (symbol) {
      case "F":
      case "Cl":
      case "Br":
      case "I":
        return true;
      default:
        return false;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Atom)) return false;
    Atom atom = (Atom) o;
    return id == atom.id &&
           aromatic == atom.aromatic &&
           inRing == atom.inRing &&
           charge == atom.charge &&
           symbol.equals(atom.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, symbol, aromatic, inRing, charge);
  }

  @Override
  public String toString() {
    return symbol + id;
  }
}
