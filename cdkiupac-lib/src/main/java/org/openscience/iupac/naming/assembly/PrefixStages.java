/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.MultiplierResolver;
import org.openscience.iupac.naming.SubstituentPart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordering, filtering and joining of the rendered prefix parts.
 */
final class PrefixStages {

  private static final Logger LOGGER = LoggerFactory.getLogger(PrefixStages.class);

  private static final Pattern MULTIPLIER_WORD =
      Pattern.compile("\\b(di|tri|tetra|penta|hexa|hepta|octa|nona|deca|bis|tris|tetrakis)\\b");
  private static final Pattern PUNCTUATION     = Pattern.compile("[0-9,()\\[\\]\\-\\s]");
  private static final Pattern LEADING_LOCANTS = Pattern.compile("^[0-9n',]+-");

  private PrefixStages() {
  }

  static Candidates alphabetize(Candidates in, AssemblyContext ctx) {
    List<SubstituentPart> parts = new ArrayList<>(in.getParts());
    parts.sort(SubstituentPart.ALPHABETICAL);
    return in.toBuilder().parts(parts).build();
  }

  /**
   * Drop parts the parent name already spells out, parts restating the principal
   * prefix and, under an alcohol suffix, plain hydroxy parts.
   */
  static Candidates suppressParentDuplicates(Candidates in, AssemblyContext ctx) {
    MultiplierResolver multipliers = ctx.getMultipliers();
    String parent = normalizeParent(in.getParentName());
    FunctionalGroup principal = in.getPrincipal();
    String principalPrefix = principal != null && principal.getPrefix() != null
                             ? principal.getPrefix().toLowerCase(Locale.ROOT)
                             : null;

    List<SubstituentPart> kept = new ArrayList<>();
    for (SubstituentPart part : in.getParts()) {
      String text = normalize(part.render(multipliers));
      if (!text.isEmpty() && !parent.isEmpty() && parent.contains(text)) {
        LOGGER.debug("{} already in parent name {}", part, in.getParentName());
        continue;
      }
      if (principalPrefix != null && principalPrefix.equals(part.baseName().toLowerCase(Locale.ROOT))) {
        LOGGER.debug("{} restates the principal group", part);
        continue;
      }
      if (principal != null && principal.isType(FunctionalGroup.ALCOHOL) &&
          !part.isWrapped() && part.baseName().contains("hydroxy")) {
        LOGGER.debug("{} restates the alcohol suffix", part);
        continue;
      }
      kept.add(part);
    }
    return in.toBuilder().parts(kept).build();
  }

  static Candidates join(Candidates in, AssemblyContext ctx) {
    String separator = ctx.getParent().getType() == ParentStructure.Type.HETEROATOM ? "" : "-";
    return in.toBuilder().prefix(render(in.getParts(), ctx.getMultipliers(), separator)).build();
  }

  static String render(List<SubstituentPart> parts, MultiplierResolver multipliers, String separator) {
    StringBuilder sb = new StringBuilder();
    for (SubstituentPart part : parts) {
      if (sb.length() > 0)
        sb.append(separator);
      sb.append(part.render(multipliers));
    }
    return sb.toString();
  }

  /**
   * Rendered prefix reduced to its letters: leading locants and multiplier dropped,
   * "2,3-dimethyl" gives "methyl".
   */
  static String normalize(String str) {
    if (str == null)
      return "";
    String lower = LEADING_LOCANTS.matcher(str.toLowerCase(Locale.ROOT)).replaceFirst("");
    lower = SubstituentPart.stripMultiplier(lower);
    lower = MULTIPLIER_WORD.matcher(lower).replaceAll("");
    return PUNCTUATION.matcher(lower).replaceAll("");
  }

  /**
   * Parent name reduced to its letters, its own stem is kept ("pentane").
   */
  static String normalizeParent(String str) {
    if (str == null)
      return "";
    return PUNCTUATION.matcher(str.toLowerCase(Locale.ROOT)).replaceAll("");
  }
}
