/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

public enum BondOrder {
  SINGLE(1),
  DOUBLE(2),
  TRIPLE(3),
  AROMATIC(1);

  private final int numeric;

  BondOrder(int numeric) {
    this.numeric = numeric;
  }

  /**
   * Electron pairs counted for valence; aromatic bonds count as one.
   *
   * @return the numeric order
   */
  public int numeric() {
    return numeric;
  }
}
