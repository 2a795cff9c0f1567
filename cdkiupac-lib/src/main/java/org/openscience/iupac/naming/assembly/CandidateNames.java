/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableMap;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.naming.CarbamoylNamer;
import org.openscience.iupac.naming.SubstituentCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Display names of prefix candidates. Groups whose name depends on the atoms around
 * them (thioethers, phosphorus groups, amides, bare rings) go through the specialised
 * namers, everything else uses the name supplied upstream.
 */
final class CandidateNames {

  private static final Logger LOGGER = LoggerFactory.getLogger(CandidateNames.class);

  static final Map<String, String> HALO_PREFIX = ImmutableMap.of(
      "F", "fluoro",
      "Cl", "chloro",
      "Br", "bromo",
      "I", "iodo");

  private CandidateNames() {
  }

  /**
   * A display name and whether it must be bracketed regardless of its text.
   */
  static final class Named {

    final String  name;
    final boolean forceWrap;

    Named(String name, boolean forceWrap) {
      this.name = name;
      this.forceWrap = forceWrap;
    }
  }

  static Named of(FunctionalGroup group, AssemblyContext ctx) {
    Molecule mol = ctx.getMolecule();
    Set<Integer> parentAtoms = ctx.getParent().atomIds();
    switch (group.getType()) {
      case FunctionalGroup.THIOETHER: {
        int sulfur = firstOf(group.atomIds(), mol, "S");
        if (sulfur >= 0)
          return plain(ctx.getSulfanylNamer().name(mol, fragment(mol, sulfur, parentAtoms), sulfur));
        break;
      }
      case FunctionalGroup.PHOSPHORYL:
      case FunctionalGroup.PHOSPHANYL: {
        int phosphorus = firstOf(group.atomIds(), mol, "P");
        if (phosphorus >= 0)
          return composed(phosphorus(ctx, group.getType(), phosphorus, parentAtoms), group.getType());
        break;
      }
      case FunctionalGroup.AMIDE: {
        int nitrogen = firstOf(group.atomIds(), mol, "N");
        if (nitrogen >= 0)
          return composed(carbamoyl(ctx, nitrogen, parentAtoms), CarbamoylNamer.CARBAMOYL);
        break;
      }
      case FunctionalGroup.HALIDE:
        if (isEmpty(group.getAssembledName()) && isEmpty(group.getPrefix())) {
          for (Atom atom : group.getAtoms()) {
            String halo = HALO_PREFIX.get(atom.getSymbol());
            if (halo != null)
              return plain(halo);
          }
        }
        break;
      default:
        break;
    }
    if (!isEmpty(group.getAssembledName()))
      return plain(group.getAssembledName());
    if (!isEmpty(group.getPrefix()))
      return plain(group.getPrefix());
    LOGGER.debug("No prefix for {}, using its type", group);
    return plain(group.getType());
  }

  static Named of(ParentBranch branch, AssemblyContext ctx) {
    Molecule mol = ctx.getMolecule();
    Set<Integer> parentAtoms = ctx.getParent().atomIds();
    String type = branch.getType().toLowerCase(Locale.ROOT);
    String name = branch.getSubstituent().getName();
    String kind = name != null ? name.toLowerCase(Locale.ROOT).replaceFirst("^\\d+-", "") : type;
    Set<Integer> atoms = branch.getAtomIds();

    if (kind.equals(FunctionalGroup.THIOETHER) || type.equals(FunctionalGroup.THIOETHER)) {
      int sulfur = firstOf(atoms, mol, "S");
      return plain(sulfur >= 0 ? ctx.getSulfanylNamer().name(mol, fragment(mol, sulfur, parentAtoms), sulfur)
                               : "sulfanyl");
    }
    if (kind.equals(FunctionalGroup.PHOSPHORYL) || kind.equals(FunctionalGroup.PHOSPHANYL)) {
      int phosphorus = firstOf(atoms, mol, "P");
      return composed(phosphorus >= 0 ? phosphorus(ctx, kind, phosphorus, parentAtoms) : kind, kind);
    }
    if (kind.equals(FunctionalGroup.AMIDE)) {
      int nitrogen = firstOf(atoms, mol, "N");
      return composed(nitrogen >= 0 ? carbamoyl(ctx, nitrogen, parentAtoms) : CarbamoylNamer.CARBAMOYL,
                      CarbamoylNamer.CARBAMOYL);
    }
    if (isEmpty(name) && isEmpty(branch.getSubstituent().getAssembledName()) &&
        (type.equals("ring") || type.equals("aryl")))
      return ring(branch, ctx, parentAtoms);
    return plain(branch.displayName());
  }

  private static Named ring(ParentBranch branch, AssemblyContext ctx, Set<Integer> parentAtoms) {
    Molecule mol = ctx.getMolecule();
    int attach = -1;
    Bond link = null;
    for (Integer id : branch.getAtomIds()) {
      Atom atom = mol.atom(id);
      if (atom == null || !atom.isInRing())
        continue;
      for (Bond bond : mol.bondsOf(id)) {
        if (parentAtoms.contains(bond.other(id))) {
          attach = id;
          link = bond;
          break;
        }
      }
      if (attach >= 0)
        break;
    }
    if (attach < 0) {
      LOGGER.warn("Ring substituent {} has no ring atom bonded to the parent", branch);
      return plain(branch.getType());
    }
    Set<Integer> fragment = fragment(mol, attach, parentAtoms);
    if (link.getOrder() == BondOrder.DOUBLE)
      return new Named(ctx.getRingNamer().nameYlidene(mol, fragment, attach), true);
    return plain(ctx.getRingNamer().name(mol, fragment, attach));
  }

  private static String phosphorus(AssemblyContext ctx, String type, int phosphorus, Set<Integer> parentAtoms) {
    Molecule mol = ctx.getMolecule();
    Set<Integer> fragment = fragment(mol, phosphorus, parentAtoms);
    if (FunctionalGroup.PHOSPHORYL.equals(type))
      return ctx.getPhosphorusNamer().namePhosphoryl(mol, fragment, phosphorus);
    return ctx.getPhosphorusNamer().namePhosphanyl(mol, fragment, phosphorus);
  }

  private static String carbamoyl(AssemblyContext ctx, int nitrogen, Set<Integer> parentAtoms) {
    Molecule mol = ctx.getMolecule();
    Set<Integer> fragment = fragment(mol, nitrogen, parentAtoms);
    return ctx.getCarbamoylNamer().name(mol, fragment, nitrogen);
  }

  private static Set<Integer> fragment(Molecule mol, int root, Set<Integer> parentAtoms) {
    return SubstituentCollector.collect(mol, root, parentAtoms);
  }

  private static int firstOf(Collection<Integer> ids, Molecule mol, String symbol) {
    for (Integer id : ids) {
      if (symbol.equals(mol.symbol(id)))
        return id;
    }
    return -1;
  }

  static boolean isHalogenPrefix(String name) {
    return HALO_PREFIX.containsValue(name);
  }

  private static Named plain(String name) {
    return new Named(name, false);
  }

  /**
   * A name built from ligands on a bare ending ("dimethyl" + "phosphoryl") is always
   * bracketed, the bare ending never is.
   */
  private static Named composed(String name, String ending) {
    return new Named(name, !name.equals(ending));
  }

  private static boolean isEmpty(String str) {
    return str == null || str.isEmpty();
  }
}
