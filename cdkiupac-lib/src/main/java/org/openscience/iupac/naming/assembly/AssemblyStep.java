/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

/**
 * The assembly stages in the order they must run. Each stage sees only what the
 * earlier ones left, so reordering changes the names produced.
 */
public enum AssemblyStep implements AssemblyStage {
  REMOVE_PRINCIPAL(GroupFilters::removePrincipal),
  DROP_ACYL_KETONES(GroupFilters::dropAcylKetones),
  DROP_RING_MEMBER_GROUPS(GroupFilters::dropRingMemberGroups),
  DROP_NAMED_IN_PARENT(GroupFilters::dropNamedInParent),
  DROP_DUPLICATE_BRANCHES(GroupFilters::dropDuplicateBranches),
  DETECT_N_SUBSTITUENTS(GroupFilters::detectNSubstituents),
  RENDER(PartRenderer::render),
  ALPHABETIZE(PrefixStages::alphabetize),
  SUPPRESS_PARENT_DUPLICATES(PrefixStages::suppressParentDuplicates),
  JOIN(PrefixStages::join),
  ELIDE(ParentNames::elide),
  RENUMBER_HYDROAZOLE(HydroAzoleRenumbering::apply),
  APPEND_SUFFIX(SuffixAppender::append);

  private final AssemblyStage stage;

  AssemblyStep(AssemblyStage stage) {
    this.stage = stage;
  }

  @Override
  public Candidates apply(Candidates in, AssemblyContext ctx) {
    return stage.apply(in, ctx);
  }
}
