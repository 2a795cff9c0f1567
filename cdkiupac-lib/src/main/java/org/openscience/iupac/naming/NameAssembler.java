/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming;

import com.google.common.base.Preconditions;
import org.openscience.iupac.chain.ChainFilter;
import org.openscience.iupac.dictionary.NomenclatureDictionary;
import org.openscience.iupac.dictionary.ResourceNomenclatureDictionary;
import org.openscience.iupac.model.FunctionalGroup;
import org.openscience.iupac.model.Molecule;
import org.openscience.iupac.model.ParentStructure;
import org.openscience.iupac.naming.assembly.AssemblyContext;
import org.openscience.iupac.naming.assembly.AssemblyStep;
import org.openscience.iupac.naming.assembly.Candidates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the substitutive name of a molecule from its selected parent structure and
 * detected functional groups. The name is assembled by the {@link AssemblyStep}s in
 * declaration order.
 *
 * <pre>{@code
 * NameAssembler assembler = new NameAssembler();
 * String name = assembler.buildSubstitutiveName(parent, groups, mol); // "propan-2-ol"
 * }</pre>
 *
 * Instances hold no per-call state and may be shared between threads.
 */
public final class NameAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(NameAssembler.class);

  private final NomenclatureDictionary dictionary;
  private final NamingOptions          options;

  public NameAssembler(NomenclatureDictionary dictionary, NamingOptions options) {
    this.dictionary = Preconditions.checkNotNull(dictionary, "dictionary");
    this.options = Preconditions.checkNotNull(options, "options");
  }

  public NameAssembler() {
    this(ResourceNomenclatureDictionary.getDefault(), NamingOptions.defaults());
  }

  /**
   * Assemble the name.
   *
   * @param parent the parent chain, ring or heteroatom with its resolved substituents
   * @param groups functional groups of the molecule, principal ones flagged
   * @param mol    the molecule
   * @return the name, best effort when parts of the structure could not be named
   */
  public String buildSubstitutiveName(ParentStructure parent, List<FunctionalGroup> groups, Molecule mol) {
    Preconditions.checkNotNull(parent, "parent");
    Preconditions.checkNotNull(groups, "groups");
    Preconditions.checkNotNull(mol, "mol");

    if (parent.isChain() && !ChainFilter.isValidChain(parent.atomIdList(), mol))
      LOGGER.warn("Parent chain {} is not a bonded path", parent.atomIdList());
    else if (parent.isRing() && !ChainFilter.isValidRing(parent.atomIdList(), mol))
      LOGGER.warn("Parent ring {} is not a closed cycle", parent.atomIdList());

    AssemblyContext ctx = new AssemblyContext(mol, parent, dictionary, options);
    Candidates candidates = ctx.initialCandidates(groups);
    for (AssemblyStep step : AssemblyStep.values()) {
      candidates = step.apply(candidates, ctx);
      if (LOGGER.isDebugEnabled())
        LOGGER.debug("{}: {}", step, candidates);
    }
    return candidates.getName();
  }

  public NomenclatureDictionary getDictionary() {
    return dictionary;
  }

  public NamingOptions getOptions() {
    return options;
  }
}
