/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One prefix of a name before it is turned into text: a substituent name, the locants
 * it sits on and how many times it occurs, e.g. {[2,3], methyl, 2} renders
 * "2,3-dimethyl". Parts that arrive already rendered upstream are kept verbatim.
 */
public final class SubstituentPart {

  private static final Pattern COMPOUND_SUFFIX =
      Pattern.compile(".+(sulfanyl|sulfonyl|sulfinyl|phosphanyl|phosphoryl|carbamoyl)$");
  private static final Pattern COMPOUND_ALKYL  =
      Pattern.compile("^(methyl|ethyl|propyl|butyl|pentyl|hexyl|heptyl|octyl|phenyl|benzyl|" +
                      "trimethylsilyl|triethylsilyl|dimethyl|diethyl)(oxy|thio|amino)$");
  private static final Pattern LEADING_LOCANTS = Pattern.compile("^[0-9N',]+-");

  // longest first so "tetrakis" is not read as "tetra"
  private static final String[] MULTIPLIERS = {
      "pentakis", "tetrakis", "hexakis", "heptakis", "octakis", "nonakis", "decakis",
      "bis", "tris", "penta", "tetra", "hexa", "hepta", "octa", "nona", "deca", "tri", "di"
  };

  /**
   * Nitrogen labels (N, N', N'') before numbers, numbers ascending.
   */
  public static final Comparator<String> LOCANT_ORDER = new Comparator<String>() {
    @Override
    public int compare(String a, String b) {
      boolean aN = a.startsWith("N");
      boolean bN = b.startsWith("N");
      if (aN && bN)
        return Integer.compare(a.length(), b.length());
      if (aN)
        return -1;
      if (bN)
        return +1;
      Integer x = parse(a);
      Integer y = parse(b);
      if (x != null && y != null)
        return Integer.compare(x, y);
      return a.compareTo(b);
    }
  };

  public static final Comparator<SubstituentPart> ALPHABETICAL = new Comparator<SubstituentPart>() {
    @Override
    public int compare(SubstituentPart a, SubstituentPart b) {
      int cmp = a.sortKey().compareToIgnoreCase(b.sortKey());
      if (cmp != 0)
        return cmp;
      cmp = a.baseName().compareTo(b.baseName());
      if (cmp != 0)
        return cmp;
      return String.join(",", a.locants).compareTo(String.join(",", b.locants));
    }
  };

  private final ImmutableList<String> locants;
  private final String                name;
  private final int                   count;
  private final boolean               forceWrap;
  private final String                verbatim;

  private SubstituentPart(List<String> locants, String name, int count, boolean forceWrap, String verbatim) {
    List<String> sorted = new ArrayList<>(locants);
    sorted.sort(LOCANT_ORDER);
    this.locants = ImmutableList.copyOf(sorted);
    this.name = name;
    this.count = Math.max(1, count);
    this.forceWrap = forceWrap;
    this.verbatim = verbatim;
  }

  /**
   * A substituent on the given locants, occurring once per locant.
   */
  public static SubstituentPart located(String name, Collection<String> locants, boolean forceWrap) {
    return new SubstituentPart(new ArrayList<>(locants), name, locants.size(), forceWrap, null);
  }

  /**
   * A substituent written without locants, e.g. on a heteroatom parent.
   */
  public static SubstituentPart unlocated(String name, int count, boolean forceWrap) {
    return new SubstituentPart(ImmutableList.<String>of(), name, count, forceWrap, null);
  }

  /**
   * Text already rendered upstream ("2,2-dimethyl"), used as is.
   */
  public static SubstituentPart verbatim(String text) {
    return new SubstituentPart(ImmutableList.<String>of(), text, 1, false, text);
  }

  public List<String> getLocants() {
    return locants;
  }

  public String getName() {
    return name;
  }

  public int getCount() {
    return count;
  }

  public boolean isVerbatim() {
    return verbatim != null;
  }

  public boolean isForceWrap() {
    return forceWrap;
  }

  /**
   * The name is enclosed in brackets when rendered, which also selects bis/tris.
   */
  public boolean isWrapped() {
    if (isVerbatim())
      return false;
    return forceWrap || isAlreadyWrapped(name) || needsWrapping(name);
  }

  /**
   * Same name on other locants.
   */
  public SubstituentPart withLocants(Collection<String> newLocants) {
    if (isVerbatim())
      return this;
    return new SubstituentPart(new ArrayList<>(newLocants), name, newLocants.size(), forceWrap, null);
  }

  /**
   * Combine two parts of the same base name, "3-methyl" and "N,N-dimethyl" give
   * "N,N,3-trimethyl".
   */
  public SubstituentPart merge(SubstituentPart that) {
    List<String> all = new ArrayList<>(locants);
    all.addAll(that.locants);
    if (all.isEmpty())
      return unlocated(name, count + that.count, forceWrap || that.forceWrap);
    return new SubstituentPart(all, name, all.size(), forceWrap || that.forceWrap, null);
  }

  public String render(MultiplierResolver multipliers) {
    if (isVerbatim())
      return verbatim;
    boolean wrapped = isWrapped();
    String display = wrapped && !isAlreadyWrapped(name) ? wrap(name) : name;
    StringBuilder sb = new StringBuilder();
    if (!locants.isEmpty())
      sb.append(String.join(",", locants)).append('-');
    sb.append(multipliers.getMultiplicativePrefix(count, wrapped));
    sb.append(display);
    return sb.toString();
  }

  /**
   * Name used for grouping: the substituent name without locants, multiplier or outer
   * brackets.
   */
  public String baseName() {
    if (!isVerbatim())
      return unwrap(name);
    return unwrap(stripMultiplier(LEADING_LOCANTS.matcher(verbatim).replaceFirst("")));
  }

  /**
   * Alphabetization key: the first name inside any brackets and leading locants.
   */
  public String sortKey() {
    String str = isVerbatim()
                 ? stripMultiplier(LEADING_LOCANTS.matcher(verbatim).replaceFirst(""))
                 : name;
    return principalName(str).toLowerCase(Locale.ROOT);
  }

  /**
   * Names with their own locants, a compound suffix ("methylsulfanyl") or nested
   * brackets must be enclosed.
   */
  public static boolean needsWrapping(String name) {
    if (name.indexOf('(') >= 0 || name.indexOf('[') >= 0)
      return true;
    for (int i = 0; i < name.length(); i++) {
      if (Character.isDigit(name.charAt(i)))
        return true;
    }
    return COMPOUND_SUFFIX.matcher(name).matches() || COMPOUND_ALKYL.matcher(name).matches();
  }

  /**
   * Enclose in square brackets when the name already has parentheses, otherwise in
   * parentheses.
   */
  public static String wrap(String name) {
    if (isAlreadyWrapped(name))
      return name;
    if (name.indexOf('(') >= 0)
      return "[" + name + "]";
    return "(" + name + ")";
  }

  static boolean isAlreadyWrapped(String name) {
    if (name.length() < 2)
      return false;
    char first = name.charAt(0);
    char last = name.charAt(name.length() - 1);
    if (!((first == '(' && last == ')') || (first == '[' && last == ']')))
      return false;
    return closingIndex(name, 0) == name.length() - 1;
  }

  public static String stripMultiplier(String str) {
    for (String mult : MULTIPLIERS) {
      if (str.startsWith(mult) && str.length() > mult.length())
        return str.substring(mult.length());
    }
    return str;
  }

  private static String unwrap(String str) {
    while (isAlreadyWrapped(str))
      str = str.substring(1, str.length() - 1);
    return str;
  }

  static String principalName(String name) {
    String result = name;
    while (true) {
      String before = result;
      if (isAlreadyWrapped(result))
        result = result.substring(1, result.length() - 1);
      result = LEADING_LOCANTS.matcher(result).replaceFirst("");
      if (result.equals(before))
        break;
    }
    if (!result.isEmpty() && (result.charAt(0) == '(' || result.charAt(0) == '[')) {
      int end = closingIndex(result, 0);
      if (end > 0)
        return principalName(result.substring(1, end));
    }
    return result;
  }

  private static int closingIndex(String str, int open) {
    int depth = 0;
    for (int i = open; i < str.length(); i++) {
      char ch = str.charAt(i);
      if (ch == '(' || ch == '[')
        depth++;
      else if (ch == ')' || ch == ']') {
        depth--;
        if (depth == 0)
          return i;
      }
    }
    return -1;
  }

  private static Integer parse(String str) {
    try {
      return Integer.parseInt(str);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SubstituentPart)) return false;
    SubstituentPart that = (SubstituentPart) o;
    return count == that.count &&
           forceWrap == that.forceWrap &&
           locants.equals(that.locants) &&
           name.equals(that.name) &&
           Objects.equals(verbatim, that.verbatim);
  }

  @Override
  public int hashCode() {
    return Objects.hash(locants, name, count, forceWrap, verbatim);
  }

  @Override
  public String toString() {
    return locants + name + "x" + count;
  }
}
