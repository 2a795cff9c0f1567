/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import com.google.common.collect.ImmutableMap;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.model.Atom;
import org.openscience.iupac.model.Bond;
import org.openscience.iupac.model.BondOrder;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parent hydride names: derived from the parent atoms when upstream supplied none,
 * trimmed before a vowel-led suffix, and joined with the prefixes.
 */
public final class ParentNames {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParentNames.class);

  // longest ending first
  private static final String[][] ELISIONS = {
      {"olane", "olan"},
      {"etane", "etan"},
      {"irane", "iran"},
      {"irine", "irin"},
      {"idine", "idin"},
      {"ane", "an"},
      {"ene", "en"},
      {"yne", "yn"},
      {"ole", "ol"}
  };

  private static final Map<String, String> HETEROATOM_HYDRIDES = ImmutableMap.<String, String>builder()
      .put("B", "borane")
      .put("N", "azane")
      .put("O", "oxidane")
      .put("P", "phosphane")
      .put("S", "sulfane")
      .put("Si", "silane")
      .put("Ge", "germane")
      .build();

  private ParentNames() {
  }

  /**
   * Name of the parent hydride, the upstream name when one was assembled.
   *
   * @param parent     the parent structure
   * @param mol        the molecule
   * @param dictionary stems
   * @return the parent name, e.g. "propane", "but-2-ene", "cyclohexane", "silane"
   */
  public static String baseName(ParentStructure parent, Molecule mol, NomenclatureDictionary dictionary) {
    if (!parent.getAssembledName().isEmpty())
      return parent.getAssembledName();
    switch (parent.getType()) {
      case CHAIN:
        return chainName(parent, mol, dictionary);
      case RING:
        return ringName(parent, mol, dictionary);
      case HETEROATOM:
        return heteroatomName(parent);
      default:
        throw new IllegalStateException("Unknown parent type: " + parent.getType());
    }
  }

  private static String chainName(ParentStructure parent, Molecule mol, NomenclatureDictionary dictionary) {
    List<Atom> atoms = parent.getAtoms();
    List<Integer> enes = new ArrayList<>();
    List<Integer> ynes = new ArrayList<>();
    for (int i = 0; i + 1 < atoms.size(); i++) {
      Bond bond = mol.bondBetween(atoms.get(i).getId(), atoms.get(i + 1).getId());
      if (bond == null)
        continue;
      int locant = Math.min(parent.getLocants().get(i), parent.getLocants().get(i + 1));
      if (bond.getOrder() == BondOrder.DOUBLE)
        enes.add(locant);
      else if (bond.getOrder() == BondOrder.TRIPLE)
        ynes.add(locant);
    }
    if (enes.isEmpty() && ynes.isEmpty())
      return dictionary.getAlkaneName(atoms.size());

    Collections.sort(enes);
    Collections.sort(ynes);
    // ethene and ethyne need no locant
    boolean located = atoms.size() > 2;
    StringBuilder sb = new StringBuilder(dictionary.getChainName(atoms.size()));
    if (enes.size() > 1 || ynes.size() > 1)
      sb.append('a');
    if (!enes.isEmpty()) {
      if (located)
        sb.append('-').append(joinLocants(enes)).append('-');
      if (enes.size() > 1)
        sb.append(dictionary.getSimpleMultiplier(enes.size()));
      sb.append(ynes.isEmpty() ? "ene" : "en");
    }
    if (!ynes.isEmpty()) {
      if (located)
        sb.append('-').append(joinLocants(ynes)).append('-');
      if (ynes.size() > 1)
        sb.append(dictionary.getSimpleMultiplier(ynes.size()));
      sb.append("yne");
    }
    return sb.toString();
  }

  private static String ringName(ParentStructure parent, Molecule mol, NomenclatureDictionary dictionary) {
    int size = parent.size();
    boolean carbocycle = true;
    boolean aromatic = true;
    for (Atom atom : parent.getAtoms()) {
      if (!atom.isCarbon())
        carbocycle = false;
      if (!atom.isAromatic())
        aromatic = false;
    }
    if (carbocycle && size == 6 && (aromatic || countDoubleBonds(parent, mol) == 3))
      return "benzene";
    if (!carbocycle || !isSaturated(parent, mol))
      LOGGER.warn("No name for ring parent {}, naming it as a cycloalkane", parent);
    return "cyclo" + dictionary.getAlkaneName(size);
  }

  private static String heteroatomName(ParentStructure parent) {
    if (parent.getAtoms().isEmpty()) {
      LOGGER.warn("Heteroatom parent without atoms");
      return "";
    }
    String symbol = parent.getAtoms().get(0).getSymbol();
    String name = HETEROATOM_HYDRIDES.get(symbol);
    if (name == null) {
      LOGGER.warn("No hydride name for {}", symbol);
      return symbol.toLowerCase(Locale.ROOT) + "ane";
    }
    return name;
  }

  private static int countDoubleBonds(ParentStructure parent, Molecule mol) {
    int count = 0;
    List<Integer> ids = parent.atomIdList();
    for (int i = 0; i < ids.size(); i++) {
      for (int j = i + 1; j < ids.size(); j++) {
        Bond bond = mol.bondBetween(ids.get(i), ids.get(j));
        if (bond != null && bond.getOrder() == BondOrder.DOUBLE)
          count++;
      }
    }
    return count;
  }

  /**
   * @return no multiple or aromatic bond joins two parent atoms
   */
  static boolean isSaturated(ParentStructure parent, Molecule mol) {
    List<Integer> ids = parent.atomIdList();
    for (int i = 0; i < ids.size(); i++) {
      for (int j = i + 1; j < ids.size(); j++) {
        Bond bond = mol.bondBetween(ids.get(i), ids.get(j));
        if (bond != null && bond.getOrder() != BondOrder.SINGLE)
          return false;
      }
    }
    return true;
  }

  /**
   * Drop the terminal "e" of the parent name when the suffix starts with a vowel,
   * "propane" + "ol" gives "propan".
   */
  static Candidates elide(Candidates in, AssemblyContext ctx) {
    if (!in.hasPrincipal())
      return in;
    String suffix = SuffixAppender.suffixOf(in.getPrincipal(), ctx);
    return in.toBuilder().parentName(elide(in.getParentName(), suffix)).build();
  }

  public static String elide(String parentName, String suffix) {
    if (suffix == null || suffix.isEmpty() || !isVowel(suffix.charAt(0)))
      return parentName;
    for (String[] elision : ELISIONS) {
      if (parentName.endsWith(elision[0]))
        return parentName.substring(0, parentName.length() - elision[0].length()) + elision[1];
    }
    return parentName;
  }

  private static boolean isVowel(char ch) {
    return "aeiouy".indexOf(Character.toLowerCase(ch)) >= 0;
  }

  /**
   * Prefixes go straight onto the parent name unless it starts with a locant.
   */
  public static String combine(String prefix, String parentName) {
    if (prefix == null || prefix.isEmpty())
      return parentName;
    if (!parentName.isEmpty() && Character.isDigit(parentName.charAt(0)))
      return prefix + "-" + parentName;
    return prefix + parentName;
  }

  static boolean isSymmetricRing(ParentStructure parent, String parentName) {
    return parent.isRing() && (parentName.contains("benzene") || parentName.contains("cyclo"));
  }

  static String joinLocants(List<Integer> locants) {
    StringBuilder sb = new StringBuilder();
    for (Integer locant : locants) {
      if (sb.length() > 0)
        sb.append(',');
      sb.append(locant);
    }
    return sb.toString();
  }

  static boolean isTerminalType(FunctionalGroup group) {
    return group.isType(FunctionalGroup.AMIDE, FunctionalGroup.CARBOXYLIC_ACID,
                        FunctionalGroup.ALDEHYDE, FunctionalGroup.NITRILE);
  }
}
