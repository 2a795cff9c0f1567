/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimap;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.NSubstituent;
import org.openscience.iupac.model.ParentStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the groups on the nitrogen(s) of a principal amine or imine and renders them as
 * "N-methyl", "N,N-dimethyl", "N,N'-diethyl" or "(propan-2-ylideneamino)".
 */
public final class NSubstituentDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(NSubstituentDetector.class);

  // multiplied with di/tri, anything else with bis/tris
  private static final Set<String> SIMPLE_NAMES =
      ImmutableSet.of("methyl", "ethyl", "propyl", "butyl", "formyl", "acetyl");

  /**
   * Outcome of one detection.
   */
  public static final class Result {

    private static final Result EMPTY = new Result(ImmutableList.<NSubstituent>of(),
                                                   ImmutableList.<SubstituentPart>of(), "",
                                                   ImmutableSet.<Integer>of());

    private final ImmutableList<NSubstituent>    substituents;
    private final ImmutableList<SubstituentPart> parts;
    private final String                         prefix;
    private final ImmutableSet<Integer>          consumedAtomIds;

    Result(List<NSubstituent> substituents, List<SubstituentPart> parts, String prefix,
           Set<Integer> consumedAtomIds) {
      this.substituents = ImmutableList.copyOf(substituents);
      this.parts = ImmutableList.copyOf(parts);
      this.prefix = prefix;
      this.consumedAtomIds = ImmutableSet.copyOf(consumedAtomIds);
    }

    public static Result empty() {
      return EMPTY;
    }

    public List<NSubstituent> getSubstituents() {
      return substituents;
    }

    /**
     * The grouped prefixes in alphabetical order.
     */
    public List<SubstituentPart> getParts() {
      return parts;
    }

    /**
     * @return e.g. "N,N-dimethyl", empty if the nitrogens carry nothing
     */
    public String getPrefix() {
      return prefix;
    }

    public Set<Integer> getConsumedAtomIds() {
      return consumedAtomIds;
    }

    public boolean isEmpty() {
      return substituents.isEmpty();
    }
  }

  private final AlkylNamer           alkylNamer;
  private final RingSubstituentNamer ringNamer;
  private final YlideneNamer         ylideneNamer;
  private final MultiplierResolver   multipliers;

  public NSubstituentDetector(AlkylNamer alkylNamer, RingSubstituentNamer ringNamer,
                              YlideneNamer ylideneNamer, MultiplierResolver multipliers) {
    this.alkylNamer = alkylNamer;
    this.ringNamer = ringNamer;
    this.ylideneNamer = ylideneNamer;
    this.multipliers = multipliers;
  }

  /**
   * @param principal the (aggregated) principal amine or imine group
   * @param parent    the parent structure
   * @param mol       the molecule
   * @return the N substituents, empty for other group types
   */
  public Result detect(FunctionalGroup principal, ParentStructure parent, Molecule mol) {
    if (principal == null || !principal.isType(FunctionalGroup.AMINE, FunctionalGroup.IMINE))
      return Result.empty();

    List<Integer> nitrogens = principalNitrogens(principal, mol);
    if (nitrogens.isEmpty()) {
      LOGGER.debug("No principal nitrogen found for {}", principal);
      return Result.empty();
    }

    Set<Integer> blocked = new HashSet<>(parent.atomIds());
    blocked.addAll(principal.atomIds());
    blocked.addAll(nitrogens);

    List<NSubstituent> found = new ArrayList<>();
    Set<Integer> consumed = new LinkedHashSet<>();
    for (int i = 0; i < nitrogens.size(); i++) {
      int nitrogen = nitrogens.get(i);
      String label = label(i);
      for (Bond bond : mol.bondsOf(nitrogen)) {
        int nbr = bond.other(nitrogen);
        if (blocked.contains(nbr) || consumed.contains(nbr))
          continue;
        NSubstituent sub = classify(mol, bond, nitrogen, nbr, label, blocked);
        if (sub == null)
          continue;
        found.add(sub);
        consumed.addAll(sub.getAtoms());
      }
    }
    if (found.isEmpty())
      return Result.empty();

    List<SubstituentPart> parts = group(found);
    List<String> rendered = new ArrayList<>();
    for (SubstituentPart part : parts)
      rendered.add(part.render(multipliers));
    return new Result(found, parts, String.join("-", rendered), consumed);
  }

  /**
   * Nitrogens of the principal group in encounter order. For an imine the nitrogen
   * is the acyclic singly bonded one on the C=N carbon, falling back to the imine
   * nitrogen itself.
   */
  List<Integer> principalNitrogens(FunctionalGroup principal, Molecule mol) {
    List<Integer> result = new ArrayList<>();
    if (principal.isType(FunctionalGroup.IMINE)) {
      Atom carbon = principal.getAtoms().isEmpty() ? null : principal.getAtoms().get(0);
      if (carbon != null) {
        for (Bond bond : mol.bondsOf(carbon.getId())) {
          int nbr = bond.other(carbon.getId());
          Atom atom = mol.atom(nbr);
          if (bond.getOrder() == BondOrder.SINGLE && atom != null &&
              "N".equals(atom.getSymbol()) && !atom.isInRing()) {
            result.add(nbr);
            return result;
          }
        }
      }
    }
    for (Atom atom : principal.getAtoms()) {
      if ("N".equals(atom.getSymbol()) && !result.contains(atom.getId()) &&
          (principal.isType(FunctionalGroup.AMINE) || !atom.isInRing()))
        result.add(atom.getId());
    }
    return result;
  }

  private NSubstituent classify(Molecule mol, Bond bond, int nitrogen, int nbr, String label,
                                Set<Integer> blocked) {
    Atom atom = mol.atom(nbr);
    if (atom == null)
      return null;
    Set<Integer> fragment = SubstituentCollector.collect(mol, nbr, blocked);
    if (atom.isInRing()) {
      boolean dbl = bond.getOrder() == BondOrder.DOUBLE;
      String name = dbl ? ringNamer.nameYlidene(mol, fragment, nbr)
                        : ringNamer.name(mol, fragment, nbr);
      return new NSubstituent(name, nbr, nitrogen, label, true, dbl, fragment);
    }
    if (bond.getOrder() == BondOrder.DOUBLE) {
      String name = ylideneNamer.name(mol, fragment, nitrogen, nbr);
      return new NSubstituent(name, nbr, nitrogen, label, false, true, fragment);
    }
    if (atom.isCarbon()) {
      String name = alkylNamer.name(mol, fragment, nbr);
      if (name == null) {
        LOGGER.warn("Unrecognised group at {} on {}, naming it {}", nbr, label, BranchNamer.ALKYL);
        name = BranchNamer.ALKYL;
      }
      return new NSubstituent(name, nbr, nitrogen, label, false, false, fragment);
    }
    if ("O".equals(atom.getSymbol()) && fragment.size() == 1)
      return new NSubstituent("hydroxy", nbr, nitrogen, label, false, false, fragment);
    LOGGER.debug("Skipping {} neighbour {} of {}", atom.getSymbol(), nbr, label);
    return null;
  }

  private List<SubstituentPart> group(List<NSubstituent> found) {
    Multimap<String, NSubstituent> byName = LinkedHashMultimap.create();
    for (NSubstituent sub : found)
      byName.put(sub.getName(), sub);
    List<SubstituentPart> parts = new ArrayList<>();
    for (String name : byName.keySet()) {
      Collection<NSubstituent> same = byName.get(name);
      NSubstituent first = same.iterator().next();
      if (same.size() == 1 && first.isDoubleBond()) {
        parts.add(SubstituentPart.unlocated(name + "amino", 1, true));
        continue;
      }
      List<String> labels = new ArrayList<>();
      for (NSubstituent sub : same)
        labels.add(sub.getLabel());
      boolean complex = (same.size() > 1 && !SIMPLE_NAMES.contains(name)) ||
                        (first.isRing() && first.isDoubleBond());
      parts.add(SubstituentPart.located(name, labels, complex));
    }
    parts.sort(SubstituentPart.ALPHABETICAL);
    return parts;
  }

  private static String label(int index) {
    StringBuilder sb = new StringBuilder("N");
    for (int i = 0; i < index; i++)
      sb.append('\'');
    return sb.toString();
  }
}
