/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.naming.NSubstituentDetector;
import org.openscience.iupac.naming.SubstituentPart;

import java.util.List;
import java.util.Map;

/**
 * State passed from one assembly stage to the next. Each stage returns a new value.
 */
public final class Candidates {

  private final FunctionalGroup                principal;
  private final ImmutableList<FunctionalGroup> groups;
  private final ImmutableList<ParentBranch>    branches;
  private final NSubstituentDetector.Result    nSubstituents;
  private final ImmutableList<SubstituentPart> parts;
  private final String                         prefix;
  private final String                         parentName;
  private final ImmutableMap<Integer, Integer> renumbering;
  private final String                         name;

  private Candidates(Builder builder) {
    this.principal = builder.principal;
    this.groups = ImmutableList.copyOf(builder.groups);
    this.branches = ImmutableList.copyOf(builder.branches);
    this.nSubstituents = builder.nSubstituents;
    this.parts = ImmutableList.copyOf(builder.parts);
    this.prefix = builder.prefix;
    this.parentName = builder.parentName;
    this.renumbering = ImmutableMap.copyOf(builder.renumbering);
    this.name = builder.name;
  }

  /**
   * Start state: every group is still a candidate, principal or not.
   */
  public static Candidates initial(List<FunctionalGroup> groups, List<ParentBranch> branches,
                                   String parentName) {
    Builder builder = new Builder();
    builder.groups = groups;
    builder.branches = branches;
    builder.parentName = parentName;
    return builder.build();
  }

  /**
   * @return the aggregated principal group, null when the name has no suffix
   */
  public FunctionalGroup getPrincipal() {
    return principal;
  }

  public boolean hasPrincipal() {
    return principal != null;
  }

  public List<FunctionalGroup> getGroups() {
    return groups;
  }

  public List<ParentBranch> getBranches() {
    return branches;
  }

  public NSubstituentDetector.Result getNSubstituents() {
    return nSubstituents;
  }

  public List<SubstituentPart> getParts() {
    return parts;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getParentName() {
    return parentName;
  }

  /**
   * Old to new parent locants when the parent was renumbered, empty otherwise.
   */
  public Map<Integer, Integer> getRenumbering() {
    return renumbering;
  }

  public String getName() {
    return name;
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.principal = principal;
    builder.groups = groups;
    builder.branches = branches;
    builder.nSubstituents = nSubstituents;
    builder.parts = parts;
    builder.prefix = prefix;
    builder.parentName = parentName;
    builder.renumbering = renumbering;
    builder.name = name;
    return builder;
  }

  @Override
  public String toString() {
    return "Candidates{principal=" + principal + ", groups=" + groups + ", branches=" + branches +
           ", parts=" + parts + ", parent=" + parentName + '}';
  }

  public static final class Builder {

    private FunctionalGroup             principal;
    private List<FunctionalGroup>       groups        = ImmutableList.of();
    private List<ParentBranch>          branches      = ImmutableList.of();
    private NSubstituentDetector.Result nSubstituents = NSubstituentDetector.Result.empty();
    private List<SubstituentPart>       parts         = ImmutableList.of();
    private String                      prefix        = "";
    private String                      parentName    = "";
    private Map<Integer, Integer>       renumbering   = ImmutableMap.of();
    private String                      name;

    private Builder() {
    }

    public Builder principal(FunctionalGroup principal) {
      this.principal = principal;
      return this;
    }

    public Builder groups(List<FunctionalGroup> groups) {
      this.groups = groups;
      return this;
    }

    public Builder branches(List<ParentBranch> branches) {
      this.branches = branches;
      return this;
    }

    public Builder nSubstituents(NSubstituentDetector.Result nSubstituents) {
      this.nSubstituents = nSubstituents;
      return this;
    }

    public Builder parts(List<SubstituentPart> parts) {
      this.parts = parts;
      return this;
    }

    public Builder prefix(String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder parentName(String parentName) {
      this.parentName = parentName;
      return this;
    }

    public Builder renumbering(Map<Integer, Integer> renumbering) {
      this.renumbering = renumbering;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Candidates build() {
      return new Candidates(this);
    }
  }
}
