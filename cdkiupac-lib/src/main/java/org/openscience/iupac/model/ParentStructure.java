/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The selected backbone of a name: a chain, a ring or a single heteroatom, with its
 * members already numbered and its branches already resolved upstream.
 */
public final class ParentStructure {

  public enum Type {
    CHAIN,
    RING,
    HETEROATOM
  }

  private final Type                      type;
  private final ImmutableList<Atom>       atoms;
  private final ImmutableList<Integer>    locants;
  private final String                    assembledName;
  private final ImmutableList<Substituent> substituents;

  private ParentStructure(Builder builder) {
    this.type = Preconditions.checkNotNull(builder.type, "type");
    this.atoms = ImmutableList.copyOf(builder.atoms);
    List<Integer> locs = builder.locants;
    if (locs.isEmpty()) {
      locs = new ArrayList<>();
      for (int i = 0; i < atoms.size(); i++)
        locs.add(i + 1);
    }
    Preconditions.checkArgument(locs.size() == atoms.size(),
                                "%s locants for %s parent atoms", locs.size(), atoms.size());
    this.locants = ImmutableList.copyOf(locs);
    this.assembledName = builder.assembledName != null ? builder.assembledName : "";
    this.substituents = ImmutableList.copyOf(builder.substituents);
  }

  public static Builder builder(Type type) {
    return new Builder(type);
  }

  public static Builder chain() {
    return new Builder(Type.CHAIN);
  }

  public static Builder ring() {
    return new Builder(Type.RING);
  }

  public static Builder heteroatom() {
    return new Builder(Type.HETEROATOM);
  }

  public Type getType() {
    return type;
  }

  public boolean isChain() {
    return type == Type.CHAIN;
  }

  public boolean isRing() {
    return type == Type.RING;
  }

  public List<Atom> getAtoms() {
    return atoms;
  }

  public List<Integer> getLocants() {
    return locants;
  }

  public String getAssembledName() {
    return assembledName;
  }

  public List<Substituent> getSubstituents() {
    return substituents;
  }

  public int size() {
    return atoms.size();
  }

  public Set<Integer> atomIds() {
    Set<Integer> ids = new LinkedHashSet<>();
    for (Atom atom : atoms)
      ids.add(atom.getId());
    return ids;
  }

  public List<Integer> atomIdList() {
    List<Integer> ids = new ArrayList<>(atoms.size());
    for (Atom atom : atoms)
      ids.add(atom.getId());
    return ids;
  }

  /**
   * Locant of a member atom.
   *
   * @param atomId atom id
   * @return the locant, -1 if the atom is not a member
   */
  public int locantOf(int atomId) {
    for (int i = 0; i < atoms.size(); i++) {
      if (atoms.get(i).getId() == atomId)
        return locants.get(i);
    }
    return -1;
  }

  public Builder toBuilder() {
    Builder builder = new Builder(type);
    builder.atoms.addAll(atoms);
    builder.locants.addAll(locants);
    builder.assembledName = assembledName;
    builder.substituents.addAll(substituents);
    return builder;
  }

  @Override
  public String toString() {
    return type + "{" + assembledName + ", atoms=" + atoms + ", subs=" + substituents + '}';
  }

  public static final class Builder {

    private final Type              type;
    private final List<Atom>        atoms        = new ArrayList<>();
    private final List<Integer>     locants      = new ArrayList<>();
    private final List<Substituent> substituents = new ArrayList<>();
    private String                  assembledName;

    private Builder(Type type) {
      this.type = type;
    }

    public Builder atoms(Collection<Atom> atoms) {
      this.atoms.addAll(atoms);
      return this;
    }

    /**
     * Add members by atom id, in numbering order.
     *
     * @param mol the molecule the ids belong to
     * @param ids atom ids
     * @return this builder
     */
    public Builder atoms(Molecule mol, int... ids) {
      for (int id : ids) {
        Atom atom = mol.atom(id);
        Preconditions.checkArgument(atom != null, "No atom with id %s", id);
        atoms.add(atom);
      }
      return this;
    }

    public Builder locants(Collection<Integer> locants) {
      this.locants.clear();
      this.locants.addAll(locants);
      return this;
    }

    public Builder name(String assembledName) {
      this.assembledName = assembledName;
      return this;
    }

    public Builder substituent(Substituent substituent) {
      this.substituents.add(substituent);
      return this;
    }

    public Builder substituents(Collection<Substituent> substituents) {
      this.substituents.addAll(substituents);
      return this;
    }

    public ParentStructure build() {
      return new ParentStructure(this);
    }
  }
}
