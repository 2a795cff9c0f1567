/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A detected characteristic group. Exactly one type of group may be principal; it is
 * expressed as the suffix, every other group as a prefix.
 */
public final class FunctionalGroup {

  public static final String ALCOHOL         = "alcohol";
  public static final String ALKOXY          = "alkoxy";
  public static final String AMIDE           = "amide";
  public static final String AMINE           = "amine";
  public static final String ALDEHYDE        = "aldehyde";
  public static final String CARBOXYLIC_ACID = "carboxylic_acid";
  public static final String ENOL            = "enol";
  public static final String ESTER           = "ester";
  public static final String ETHER           = "ether";
  public static final String HALIDE          = "halide";
  public static final String IMINE           = "imine";
  public static final String KETONE          = "ketone";
  public static final String NITRILE         = "nitrile";
  public static final String PHOSPHANYL      = "phosphanyl";
  public static final String PHOSPHORYL      = "phosphoryl";
  public static final String THIOCYANATE     = "thiocyanate";
  public static final String THIOETHER       = "thioether";

  private final String              type;
  private final String              name;
  private final ImmutableList<Atom> atoms;
  private final boolean             principal;
  private final String              prefix;
  private final String              suffix;
  private final ImmutableList<Integer> locants;
  private final int                 multiplicity;
  private final String              assembledName;

  private FunctionalGroup(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    this.name = builder.name;
    this.atoms = ImmutableList.copyOf(builder.atoms);
    this.principal = builder.principal;
    this.prefix = builder.prefix;
    this.suffix = builder.suffix;
    this.locants = ImmutableList.copyOf(builder.locants);
    this.multiplicity = Math.max(1, builder.multiplicity);
    this.assembledName = builder.assembledName;
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public String getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public List<Atom> getAtoms() {
    return atoms;
  }

  public Set<Integer> atomIds() {
    Set<Integer> ids = new LinkedHashSet<>();
    for (Atom atom : atoms)
      ids.add(atom.getId());
    return ids;
  }

  public boolean isPrincipal() {
    return principal;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getSuffix() {
    return suffix;
  }

  public List<Integer> getLocants() {
    return locants;
  }

  /**
   * @return the first locant, null if the group has none
   */
  public Integer getLocant() {
    return locants.isEmpty() ? null : locants.get(0);
  }

  public int getMultiplicity() {
    return multiplicity;
  }

  public boolean isMultiplicative() {
    return multiplicity > 1;
  }

  public String getAssembledName() {
    return assembledName;
  }

  public boolean isType(String... types) {
    for (String t : types) {
      if (type.equals(t))
        return true;
    }
    return false;
  }

  public Builder toBuilder() {
    Builder builder = new Builder(type);
    builder.name = name;
    builder.atoms.addAll(atoms);
    builder.principal = principal;
    builder.prefix = prefix;
    builder.suffix = suffix;
    builder.locants.addAll(locants);
    builder.multiplicity = multiplicity;
    builder.assembledName = assembledName;
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FunctionalGroup)) return false;
    FunctionalGroup that = (FunctionalGroup) o;
    return principal == that.principal &&
           multiplicity == that.multiplicity &&
           type.equals(that.type) &&
           Objects.equals(name, that.name) &&
           atoms.equals(that.atoms) &&
           Objects.equals(prefix, that.prefix) &&
           Objects.equals(suffix, that.suffix) &&
           locants.equals(that.locants) &&
           Objects.equals(assembledName, that.assembledName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, name, atoms, principal, prefix, suffix, locants, multiplicity, assembledName);
  }

  @Override
  public String toString() {
    return type + (principal ? "*" : "") + locants + atoms;
  }

  public static final class Builder {

    private final String        type;
    private final List<Atom>    atoms   = new ArrayList<>();
    private final List<Integer> locants = new ArrayList<>();
    private String              name;
    private boolean             principal;
    private String              prefix;
    private String              suffix;
    private int                 multiplicity = 1;
    private String              assembledName;

    private Builder(String type) {
      this.type = type;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder atoms(Collection<Atom> atoms) {
      this.atoms.addAll(atoms);
      return this;
    }

    public Builder atoms(Atom... atoms) {
      return atoms(Arrays.asList(atoms));
    }

    public Builder principal(boolean principal) {
      this.principal = principal;
      return this;
    }

    public Builder principal() {
      return principal(true);
    }

    public Builder prefix(String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder suffix(String suffix) {
      this.suffix = suffix;
      return this;
    }

    public Builder locant(int locant) {
      this.locants.add(locant);
      return this;
    }

    public Builder locants(Collection<Integer> locants) {
      this.locants.clear();
      this.locants.addAll(locants);
      return this;
    }

    public Builder multiplicity(int multiplicity) {
      this.multiplicity = multiplicity;
      return this;
    }

    public Builder assembledName(String assembledName) {
      this.assembledName = assembledName;
      return this;
    }

    public FunctionalGroup build() {
      return new FunctionalGroup(this);
    }
  }
}
