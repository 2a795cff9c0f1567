/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import org.openscience.iupac.chain.ChainFilter;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.NamingOptions;
import org.openscience.iupac.naming.SubstituentPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns the surviving candidates into prefix parts: identical names are grouped, their
 * locants collected and the wrapping decided.
 */
final class PartRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartRenderer.class);

  private static final Pattern LOCANT_LABEL    = Pattern.compile("\\d+|N'*");
  private static final Pattern ALREADY_LOCATED = Pattern.compile("^\\d+(,\\d+)*-");

  private PartRenderer() {
  }

  private static final class Item {

    final String  name;
    final boolean forceWrap;
    final String  locant;

    Item(String name, boolean forceWrap, String locant) {
      this.name = name;
      this.forceWrap = forceWrap;
      this.locant = locant;
    }

    String key() {
      return (forceWrap ? "!" : "") + name;
    }
  }

  static Candidates render(Candidates in, AssemblyContext ctx) {
    ParentStructure parent = ctx.getParent();
    List<Item> items = new ArrayList<>();
    List<SubstituentPart> verbatim = new ArrayList<>();

    for (FunctionalGroup group : in.getGroups()) {
      CandidateNames.Named named = CandidateNames.of(group, ctx);
      if (group.getLocants().isEmpty()) {
        items.add(new Item(named.name, named.forceWrap, null));
      } else {
        for (Integer locant : group.getLocants())
          items.add(new Item(named.name, named.forceWrap, locant.toString()));
      }
    }
    for (ParentBranch branch : in.getBranches()) {
      CandidateNames.Named named = CandidateNames.of(branch, ctx);
      String locant = branch.locant();
      if (locant != null && !LOCANT_LABEL.matcher(locant).matches()) {
        LOGGER.debug("Ignoring locant '{}' of {}", locant, branch);
        locant = null;
      }
      if (locant == null && ALREADY_LOCATED.matcher(named.name).find()) {
        verbatim.add(SubstituentPart.verbatim(named.name));
        continue;
      }
      items.add(new Item(named.name, named.forceWrap, locant));
    }

    if (nitrogenFirst(in, parent)) {
      for (int i = 0; i < items.size(); i++) {
        Item item = items.get(i);
        if ("1".equals(item.locant))
          items.set(i, new Item(item.name, item.forceWrap, "N"));
      }
    }

    if (items.size() == 1 && verbatim.isEmpty() && !in.hasPrincipal() &&
        "1".equals(items.get(0).locant) && omitSingleLocant(items.get(0), in, ctx)) {
      Item item = items.get(0);
      items.set(0, new Item(item.name, item.forceWrap, null));
    }

    ListMultimap<String, Item> byName = LinkedListMultimap.create();
    for (Item item : items)
      byName.put(item.key(), item);

    List<SubstituentPart> parts = new ArrayList<>();
    boolean heteroatomParent = parent.getType() == ParentStructure.Type.HETEROATOM;
    for (String key : byName.keySet()) {
      List<Item> same = byName.get(key);
      Item first = same.get(0);
      if (heteroatomParent) {
        parts.add(SubstituentPart.unlocated(first.name, same.size(), first.forceWrap));
        continue;
      }
      List<String> locants = new ArrayList<>();
      int unlocated = 0;
      for (Item item : same) {
        if (item.locant != null)
          locants.add(item.locant);
        else
          unlocated++;
      }
      if (!locants.isEmpty())
        parts.add(SubstituentPart.located(first.name, locants, first.forceWrap));
      if (unlocated > 0)
        parts.add(SubstituentPart.unlocated(first.name, unlocated, first.forceWrap));
    }
    parts.addAll(verbatim);
    LOGGER.debug("Rendered parts {}", parts);
    return in.toBuilder().parts(parts).build();
  }

  /**
   * Prefix locant 1 is written N when the principal amine nitrogen starts the chain.
   */
  private static boolean nitrogenFirst(Candidates in, ParentStructure parent) {
    if (!in.hasPrincipal() || !in.getPrincipal().isType(FunctionalGroup.AMINE))
      return false;
    if (!parent.isChain() || parent.getAtoms().isEmpty())
      return false;
    Atom first = parent.getAtoms().get(0);
    return "N".equals(first.getSymbol());
  }

  private static boolean omitSingleLocant(Item item, Candidates in, AssemblyContext ctx) {
    ParentStructure parent = ctx.getParent();
    if (ParentNames.isSymmetricRing(parent, in.getParentName()))
      return true;
    return ctx.getOptions().getBoolean(NamingOptions.Param.HALOGEN_TERMINAL_OMIT) &&
           parent.isChain() &&
           parent.size() <= 2 &&
           CandidateNames.isHalogenPrefix(item.name) &&
           ChainFilter.isHydrocarbonChain(parent.atomIdList(), ctx.getMolecule());
  }
}
