/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableMap;
import org.openscience.iupac.chain.ChainFilter;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.model.Substituent;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.SubstituentPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Last stage: the principal characteristic group becomes the suffix, and for amines and
 * imines the nitrogen substituents join the prefixes.
 */
final class SuffixAppender {

  private static final Logger LOGGER = LoggerFactory.getLogger(SuffixAppender.class);

  private static final Map<String, String> CHAIN_SUFFIX = ImmutableMap.<String, String>builder()
      .put(FunctionalGroup.ALCOHOL, "ol")
      .put(FunctionalGroup.ENOL, "ol")
      .put(FunctionalGroup.KETONE, "one")
      .put(FunctionalGroup.ALDEHYDE, "al")
      .put(FunctionalGroup.AMINE, "amine")
      .put(FunctionalGroup.IMINE, "imine")
      .put(FunctionalGroup.NITRILE, "nitrile")
      .put(FunctionalGroup.AMIDE, "amide")
      .put(FunctionalGroup.CARBOXYLIC_ACID, "oic acid")
      .build();

  // carbon of the group is not a ring member
  private static final Map<String, String> RING_SUFFIX = ImmutableMap.of(
      FunctionalGroup.CARBOXYLIC_ACID, "carboxylic acid",
      FunctionalGroup.ALDEHYDE, "carbaldehyde",
      FunctionalGroup.NITRILE, "carbonitrile",
      FunctionalGroup.AMIDE, "carboxamide");

  private static final String[] RETAINED_ACIDS = {null, "formic acid", "acetic acid", "propionic acid"};

  private SuffixAppender() {
  }

  static Candidates append(Candidates in, AssemblyContext ctx) {
    if (!in.hasPrincipal())
      return in.toBuilder().name(ParentNames.combine(in.getPrefix(), in.getParentName())).build();

    FunctionalGroup principal = in.getPrincipal();
    String retained = retainedAcid(in, ctx);
    if (retained != null) {
      LOGGER.debug("Retained name {}", retained);
      return in.toBuilder().name(ParentNames.combine(in.getPrefix(), retained)).build();
    }

    List<Integer> locants = principalLocants(in, ctx);
    StringBuilder body = new StringBuilder(in.getParentName());
    if (!omitLocants(in, ctx, locants))
      body.append('-').append(ParentNames.joinLocants(locants)).append('-');
    body.append(suffixOf(principal, ctx));

    String prefix = in.getPrefix();
    if (principal.isType(FunctionalGroup.AMINE, FunctionalGroup.IMINE) && !in.getNSubstituents().isEmpty())
      prefix = mergeNitrogenPrefix(in, ctx);
    return in.toBuilder().name(ParentNames.combine(prefix, body.toString())).build();
  }

  /**
   * Suffix text of the principal group, multiplied when it occurs more than once.
   */
  static String suffixOf(FunctionalGroup principal, AssemblyContext ctx) {
    String suffix = null;
    if (ctx.getParent().isRing())
      suffix = RING_SUFFIX.get(principal.getType());
    if (suffix == null && principal.getSuffix() != null && !principal.getSuffix().isEmpty())
      suffix = principal.getSuffix();
    if (suffix == null)
      suffix = CHAIN_SUFFIX.get(principal.getType());
    if (suffix == null) {
      LOGGER.warn("No suffix for principal group type {}", principal.getType());
      suffix = principal.getType().toLowerCase(Locale.ROOT);
    }
    int count = count(principal);
    if (count > 1)
      return ctx.getMultipliers().multiplySuffix(count, suffix);
    return suffix;
  }

  private static int count(FunctionalGroup principal) {
    return Math.max(principal.getMultiplicity(), principal.getLocants().size());
  }

  private static String retainedAcid(Candidates in, AssemblyContext ctx) {
    FunctionalGroup principal = in.getPrincipal();
    ParentStructure parent = ctx.getParent();
    if (!ctx.getOptions().getBoolean(NamingOptions.Param.RETAINED_ACIDS))
      return null;
    if (!principal.isType(FunctionalGroup.CARBOXYLIC_ACID) || count(principal) != 1)
      return null;
    if (principal.getSuffix() != null && !principal.getSuffix().equals("oic acid"))
      return null;
    if (!parent.isChain() || parent.size() < 1 || parent.size() >= RETAINED_ACIDS.length)
      return null;
    if (!ChainFilter.isHydrocarbonChain(parent.atomIdList(), ctx.getMolecule()) ||
        !ParentNames.isSaturated(parent, ctx.getMolecule()))
      return null;
    // formic acid takes no substituents
    if (parent.size() == 1 && (!in.getPrefix().isEmpty() || !in.getNSubstituents().isEmpty()))
      return null;
    return RETAINED_ACIDS[parent.size()];
  }

  /**
   * Locants of the principal group on the (possibly renumbered) parent. A parent
   * substituent named as the principal prefix wins for a single group.
   */
  private static List<Integer> principalLocants(Candidates in, AssemblyContext ctx) {
    FunctionalGroup principal = in.getPrincipal();
    List<Integer> locants = new ArrayList<>();
    if (count(principal) == 1 && principal.getPrefix() != null) {
      for (Substituent sub : ctx.getParent().getSubstituents()) {
        Integer locant = sub.numericLocant();
        if (locant != null && principal.getPrefix().equalsIgnoreCase(sub.getType())) {
          locants.add(locant);
          break;
        }
      }
    }
    if (locants.isEmpty())
      locants.addAll(principal.getLocants());
    Map<Integer, Integer> renumbering = in.getRenumbering();
    List<Integer> result = new ArrayList<>(locants.size());
    for (Integer locant : locants) {
      Integer mapped = renumbering.get(locant);
      result.add(mapped != null ? mapped : locant);
    }
    Collections.sort(result);
    return result;
  }

  private static boolean omitLocants(Candidates in, AssemblyContext ctx, List<Integer> locants) {
    ParentStructure parent = ctx.getParent();
    FunctionalGroup principal = in.getPrincipal();
    if (locants.isEmpty() || parent.getType() == ParentStructure.Type.HETEROATOM)
      return true;
    if (locants.size() == 1) {
      if (locants.get(0) != 1)
        return false;
      if (parent.isChain() && parent.size() <= 2)
        return true;
      if (ParentNames.isTerminalType(principal))
        return true;
      return ParentNames.isSymmetricRing(parent, in.getParentName()) &&
             in.getPrefix().isEmpty() &&
             in.getNSubstituents().isEmpty();
    }
    // both chain ends, "hexanedioic acid"
    return locants.size() == 2 &&
           parent.isChain() &&
           ParentNames.isTerminalType(principal) &&
           locants.get(0) == 1 &&
           locants.get(1) == parent.size();
  }

  /**
   * Regroup the chain prefixes with the nitrogen prefixes by base name, "3-methyl" and
   * "N,N-dimethyl" give "N,N,3-trimethyl".
   */
  private static String mergeNitrogenPrefix(Candidates in, AssemblyContext ctx) {
    List<SubstituentPart> all = new ArrayList<>(in.getParts());
    all.addAll(in.getNSubstituents().getParts());
    Map<String, SubstituentPart> merged = new LinkedHashMap<>();
    List<SubstituentPart> verbatim = new ArrayList<>();
    for (SubstituentPart part : all) {
      if (part.isVerbatim()) {
        verbatim.add(part);
        continue;
      }
      String key = part.baseName();
      SubstituentPart prev = merged.get(key);
      merged.put(key, prev != null ? prev.merge(part) : part);
    }
    List<SubstituentPart> parts = new ArrayList<>(merged.values());
    parts.addAll(verbatim);
    parts.sort(SubstituentPart.ALPHABETICAL);
    return PrefixStages.render(parts, ctx.getMultipliers(), "-");
  }
}
