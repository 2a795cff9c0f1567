/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.naming.assembly;

/**
 * One pass of name assembly, a pure transform of the candidate state.
 */
@FunctionalInterface
public interface AssemblyStage {

  Candidates apply(Candidates in, AssemblyContext ctx);
}
