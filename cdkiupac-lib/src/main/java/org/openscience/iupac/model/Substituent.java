/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A named branch on the parent structure. The locant is kept as written upstream, it
 * may be missing or non-numeric.
 */
public final class Substituent {

  private final String                 type;
  private final String                 name;
  private final String                 assembledName;
  private final String                 locant;
  private final ImmutableList<AtomRef> atoms;

  private Substituent(Builder builder) {
    this.type = builder.type != null ? builder.type : "";
    this.name = builder.name;
    this.assembledName = builder.assembledName;
    this.locant = builder.locant;
    this.atoms = ImmutableList.copyOf(builder.atoms);
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  /**
   * Simple named branch such as "methyl" at a numeric locant.
   */
  public static Substituent of(String type, int locant) {
    return builder(type).locant(locant).build();
  }

  public String getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String getAssembledName() {
    return assembledName;
  }

  public String getLocant() {
    return locant;
  }

  /**
   * The locant as a number.
   *
   * @return the locant, null if missing or not numeric
   */
  public Integer numericLocant() {
    if (locant == null)
      return null;
    String str = locant.trim();
    if (str.isEmpty())
      return null;
    for (int i = 0; i < str.length(); i++) {
      if (!Character.isDigit(str.charAt(i)))
        return null;
    }
    return Integer.parseInt(str);
  }

  public List<AtomRef> getAtoms() {
    return atoms;
  }

  /**
   * Name used for display: the assembled name, then the name, then the type.
   */
  public String displayName() {
    if (assembledName != null && !assembledName.isEmpty())
      return assembledName;
    if (name != null && !name.isEmpty())
      return name;
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Substituent)) return false;
    Substituent that = (Substituent) o;
    return type.equals(that.type) &&
           Objects.equals(name, that.name) &&
           Objects.equals(assembledName, that.assembledName) &&
           Objects.equals(locant, that.locant) &&
           atoms.equals(that.atoms);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, assembledName, locant, atoms);
  }

  @Override
  public String toString() {
    return (locant != null ? locant + "-" : "") + displayName();
  }

  public static final class Builder {

    private final String        type;
    private final List<AtomRef> atoms = new ArrayList<>();
    private String              name;
    private String              assembledName;
    private String              locant;

    private Builder(String type) {
      this.type = type;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder assembledName(String assembledName) {
      this.assembledName = assembledName;
      return this;
    }

    public Builder locant(int locant) {
      this.locant = Integer.toString(locant);
      return this;
    }

    public Builder locant(String locant) {
      this.locant = locant;
      return this;
    }

    public Builder atoms(Collection<Atom> atoms) {
      for (Atom atom : atoms)
        this.atoms.add(AtomRef.of(atom));
      return this;
    }

    public Builder atomIds(int... ids) {
      for (int id : ids)
        this.atoms.add(AtomRef.id(id));
      return this;
    }

    public Builder atomIndices(int... indices) {
      for (int idx : indices)
        this.atoms.add(AtomRef.index(idx));
      return this;
    }

    public Builder atomRefs(Collection<AtomRef> refs) {
      this.atoms.addAll(refs);
      return this;
    }

    public Substituent build() {
      return new Substituent(this);
    }
  }
}
