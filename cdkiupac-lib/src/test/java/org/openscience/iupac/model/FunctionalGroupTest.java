/*
 * Copyright (c) 2018. NextMove Software Ltd.
 */

package org.openscience.iupac.model;

import org.junit.jupiter.api.Test;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Collections;

class FunctionalGroupTest {

  @Test
  void builderDefaults() {
    FunctionalGroup group = FunctionalGroup.builder(FunctionalGroup.ALCOHOL).build();
    assertThat(group.isPrincipal(), is(false));
    assertThat(group.getMultiplicity(), is(1));
    assertThat(group.getLocant(), is(nullValue()));
    assertThat(group.isMultiplicative(), is(false));
  }

  @Test
  void locantsReplaceOnCopy() {
    FunctionalGroup group = FunctionalGroup.builder(FunctionalGroup.KETONE)
                                           .locant(2)
                                           .locant(4)
                                           .build();
    assertThat(group.getLocants(), contains(2, 4));
    FunctionalGroup copy = group.toBuilder().locants(Collections.singletonList(3)).build();
    assertThat(copy.getLocants(), contains(3));
    assertThat(copy, is(not(group)));
    assertThat(group.toBuilder().build(), is(group));
  }

  @Test
  void atomIdsInOrder() {
    FunctionalGroup group = FunctionalGroup.builder(FunctionalGroup.CARBOXYLIC_ACID)
                                           .atoms(new Atom(5, "O"), new Atom(3, "C"), new Atom(6, "O"))
                                           .build();
    assertThat(group.atomIds(), contains(5, 3, 6));
    assertThat(group.isType(FunctionalGroup.AMIDE, FunctionalGroup.CARBOXYLIC_ACID), is(true));
  }
}
