/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.NSubstituentDetector;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.PrincipalGroupAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Stages that decide which groups and parent substituents survive as prefix
 * candidates. Each removes what another part of the name already expresses.
 */
final class GroupFilters {

  private static final Logger LOGGER = LoggerFactory.getLogger(GroupFilters.class);

  private GroupFilters() {
  }

  /**
   * Take the principal groups out of the pool and merge them into one suffix unit,
   * together with parent substituents that restate the principal group.
   */
  static Candidates removePrincipal(Candidates in, AssemblyContext ctx) {
    List<FunctionalGroup> principals = new ArrayList<>();
    List<FunctionalGroup> rest = new ArrayList<>();
    for (FunctionalGroup group : in.getGroups()) {
      if (group.isPrincipal())
        principals.add(group);
      else
        rest.add(group);
    }
    if (principals.isEmpty())
      return in.toBuilder().groups(rest).build();

    FunctionalGroup principal = PrincipalGroupAggregator.aggregate(principals);
    Set<Integer> principalAtoms = principal.atomIds();
    String principalPrefix = lower(principal.getPrefix());

    List<ParentBranch> branches = new ArrayList<>();
    for (ParentBranch branch : in.getBranches()) {
      if ((principalPrefix != null && principalPrefix.equals(lower(branch.getType()))) ||
          branch.overlaps(principalAtoms)) {
        LOGGER.debug("{} restates the principal group", branch);
        continue;
      }
      branches.add(branch);
    }
    return in.toBuilder()
             .principal(principal)
             .groups(rest)
             .branches(branches)
             .build();
  }

  /**
   * A ketone whose carbonyl belongs to an acyl substituent ("acetyl") at the same
   * locant is named by that substituent.
   */
  static Candidates dropAcylKetones(Candidates in, AssemblyContext ctx) {
    List<ParentBranch> acyls = new ArrayList<>();
    for (ParentBranch branch : in.getBranches()) {
      if (isAcyl(branch.getType()) || isAcyl(branch.getSubstituent().getName()))
        acyls.add(branch);
    }
    if (acyls.isEmpty())
      return in;
    List<FunctionalGroup> kept = new ArrayList<>();
    for (FunctionalGroup group : in.getGroups()) {
      if (group.isType(FunctionalGroup.KETONE) && representedByAcyl(group, acyls)) {
        LOGGER.debug("Ketone {} is part of an acyl substituent", group);
        continue;
      }
      kept.add(group);
    }
    return in.toBuilder().groups(kept).build();
  }

  private static boolean representedByAcyl(FunctionalGroup ketone, List<ParentBranch> acyls) {
    Integer locant = ketone.getLocant();
    for (ParentBranch acyl : acyls) {
      if (acyl.overlaps(ketone.atomIds()))
        return true;
      if (locant != null && locant.toString().equals(acyl.locant()))
        return true;
    }
    return false;
  }

  static boolean isAcyl(String name) {
    if (name == null)
      return false;
    String str = name.toLowerCase(Locale.ROOT);
    return (str.endsWith("yl") && str.contains("oyl")) ||
           str.equals("acetyl") ||
           str.equals("formyl");
  }

  /**
   * Groups made only of parent ring atoms are part of the ring name. A principal
   * imine or enol of an unsaturated three-membered ring ("azirine") still gives the
   * suffix.
   */
  static Candidates dropRingMemberGroups(Candidates in, AssemblyContext ctx) {
    ParentStructure parent = ctx.getParent();
    if (!parent.isRing())
      return in;
    Set<Integer> ringAtoms = parent.atomIds();
    List<FunctionalGroup> kept = new ArrayList<>();
    for (FunctionalGroup group : in.getGroups()) {
      if (isRingMember(group, ringAtoms)) {
        LOGGER.debug("{} is part of the ring", group);
        continue;
      }
      kept.add(group);
    }
    FunctionalGroup principal = in.getPrincipal();
    if (principal != null && isRingMember(principal, ringAtoms) &&
        !isUnsaturatedThreeRingSuffix(principal, in.getParentName())) {
      LOGGER.debug("Principal {} is part of the ring, no suffix", principal);
      principal = null;
    }
    return in.toBuilder().groups(kept).principal(principal).build();
  }

  private static boolean isRingMember(FunctionalGroup group, Set<Integer> ringAtoms) {
    Set<Integer> ids = group.atomIds();
    return !ids.isEmpty() && ringAtoms.containsAll(ids);
  }

  private static boolean isUnsaturatedThreeRingSuffix(FunctionalGroup principal, String parentName) {
    return principal.isType(FunctionalGroup.IMINE, FunctionalGroup.ENOL) &&
           (parentName.endsWith("irine") || parentName.endsWith("irene"));
  }

  /**
   * Groups whose type or prefix is already spelled out in the parent name, or in a
   * long parent substituent name, are dropped. Alkoxy groups are matched by shared
   * atoms instead.
   */
  static Candidates dropNamedInParent(Candidates in, AssemblyContext ctx) {
    String parentName = lower(in.getParentName());
    int minLength = ctx.getOptions().getInt(NamingOptions.Param.DEDUP_MIN_LENGTH);
    List<String> longNames = new ArrayList<>();
    for (ParentBranch branch : in.getBranches()) {
      String name = lower(branch.displayName());
      if (name != null && name.length() > minLength)
        longNames.add(name);
    }

    List<FunctionalGroup> kept = new ArrayList<>();
    for (FunctionalGroup group : in.getGroups()) {
      if (group.isType(FunctionalGroup.ALKOXY)) {
        if (overlapsBranch(group, in.getBranches())) {
          LOGGER.debug("Alkoxy {} shares atoms with a parent substituent", group);
          continue;
        }
        kept.add(group);
        continue;
      }
      if (mentioned(group, parentName, longNames)) {
        LOGGER.debug("{} is already named in the parent", group);
        continue;
      }
      kept.add(group);
    }
    return in.toBuilder().groups(kept).build();
  }

  private static boolean overlapsBranch(FunctionalGroup group, List<ParentBranch> branches) {
    Set<Integer> ids = group.atomIds();
    for (ParentBranch branch : branches) {
      if (branch.overlaps(ids))
        return true;
    }
    return false;
  }

  private static boolean mentioned(FunctionalGroup group, String parentName, List<String> longNames) {
    List<String> needles = new ArrayList<>();
    needles.add(lower(group.getType()));
    if (group.getPrefix() != null && !group.getPrefix().isEmpty())
      needles.add(lower(group.getPrefix()));
    for (String needle : needles) {
      if (parentName.contains(needle))
        return true;
      for (String name : longNames) {
        if (name.contains(needle))
          return true;
      }
    }
    return false;
  }

  /**
   * A parent substituent at the same locant and of the same kind as a group is
   * dropped, the group is named instead.
   */
  static Candidates dropDuplicateBranches(Candidates in, AssemblyContext ctx) {
    List<ParentBranch> kept = new ArrayList<>();
    for (ParentBranch branch : in.getBranches()) {
      if (duplicatesGroup(branch, in.getGroups())) {
        LOGGER.debug("{} duplicates a functional group", branch);
        continue;
      }
      kept.add(branch);
    }
    return in.toBuilder().branches(kept).build();
  }

  private static boolean duplicatesGroup(ParentBranch branch, List<FunctionalGroup> groups) {
    String locant = branch.locant();
    if (locant == null)
      return false;
    String byType = normalizeType(branch.getType());
    String byName = normalizeType(branch.getSubstituent().getName());
    for (FunctionalGroup group : groups) {
      Integer groupLocant = group.getLocant();
      if (groupLocant == null || !locant.equals(groupLocant.toString()))
        continue;
      String key = group.getPrefix() != null && !group.getPrefix().isEmpty()
                   ? normalizeType(group.getPrefix())
                   : normalizeType(group.getType());
      if (key.equals(byType) || key.equals(byName) || normalizeType(group.getType()).equals(byType))
        return true;
    }
    return false;
  }

  static String normalizeType(String type) {
    if (type == null)
      return "";
    String str = type.toLowerCase(Locale.ROOT);
    if (str.equals(FunctionalGroup.ALCOHOL))
      return "hydroxy";
    return str;
  }

  /**
   * Name the groups on a principal amine or imine nitrogen and drop every candidate
   * built from the same atoms.
   */
  static Candidates detectNSubstituents(Candidates in, AssemblyContext ctx) {
    if (!in.hasPrincipal())
      return in;
    NSubstituentDetector.Result result =
        ctx.getNDetector().detect(in.getPrincipal(), ctx.getParent(), ctx.getMolecule());
    if (result.isEmpty())
      return in;
    Set<Integer> consumed = result.getConsumedAtomIds();
    List<FunctionalGroup> groups = new ArrayList<>();
    for (FunctionalGroup group : in.getGroups()) {
      if (!Collections.disjoint(group.atomIds(), consumed)) {
        LOGGER.debug("{} is an N substituent", group);
        continue;
      }
      groups.add(group);
    }
    List<ParentBranch> branches = new ArrayList<>();
    for (ParentBranch branch : in.getBranches()) {
      if (branch.overlaps(consumed)) {
        LOGGER.debug("{} is an N substituent", branch);
        continue;
      }
      branches.add(branch);
    }
    return in.toBuilder()
             .nSubstituents(result)
             .groups(groups)
             .branches(branches)
             .build();
  }

  private static String lower(String str) {
    return str != null ? str.toLowerCase(Locale.ROOT) : null;
  }
}
