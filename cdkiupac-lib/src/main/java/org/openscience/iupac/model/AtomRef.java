/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Address of one atom in a substituent payload. Upstream producers hand over either
 * atom objects or bare positions in the atom sequence; both are captured here and
 * resolved to an atom id once, at the assembler boundary.
 */
public final class AtomRef {

  private static final Logger LOGGER = LoggerFactory.getLogger(AtomRef.class);

  public enum Kind {
    ID,
    INDEX
  }

  private final Kind kind;
  private final int  value;

  private AtomRef(Kind kind, int value) {
    this.kind = kind;
    this.value = value;
  }

  public static AtomRef of(Atom atom) {
    return new AtomRef(Kind.ID, atom.getId());
  }

  public static AtomRef id(int id) {
    return new AtomRef(Kind.ID, id);
  }

  public static AtomRef index(int index) {
    return new AtomRef(Kind.INDEX, index);
  }

  public Kind getKind() {
    return kind;
  }

  public int getValue() {
    return value;
  }

  /**
   * Resolve to an atom id of the molecule.
   *
   * @param mol the molecule
   * @return atom id, or -1 if this reference does not address an atom of mol
   */
  public int resolve(Molecule mol) {
    switch (kind) {
      case ID:
        return mol.contains(value) ? value : -1;
      case INDEX:
        Atom atom = mol.atomAt(value);
        return atom != null ? atom.getId() : -1;
      default:
        return -1;
    }
  }

  /**
   * Normalize a collection of references to atom ids. Unresolvable references are
   * dropped with a warning.
   *
   * @param mol  the molecule
   * @param refs references
   * @return atom ids in encounter order
   */
  public static Set<Integer> resolveAll(Molecule mol, Collection<AtomRef> refs) {
    Set<Integer> ids = new LinkedHashSet<>();
    for (AtomRef ref : refs) {
      int id = ref.resolve(mol);
      if (id < 0)
        LOGGER.warn("Dropping unresolvable atom reference {}", ref);
      else
        ids.add(id);
    }
    return ids;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AtomRef)) return false;
    AtomRef that = (AtomRef) o;
    return value == that.value && kind == that.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return kind == Kind.ID ? "#" + value : "[" + value + "]";
  }
}
