/*
 * Copyright 2025 The Relooper Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.relooper.util;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BitsTest {

  @Test
  public void basics() {
    Bits bits = Bits.of(3, 70, 130);
    assertThat(bits.count()).isEqualTo(3);
    assertThat(bits.min()).isEqualTo(3);
    assertThat(bits.test(70)).isTrue();
    assertThat(bits.test(71)).isFalse();
    assertThat(bits.test(1000)).isFalse();
    assertThat(bits.nextSetBit(4)).isEqualTo(70);
    assertThat(bits.nextSetBit(71)).isEqualTo(130);
    assertThat(bits.nextSetBit(131)).isEqualTo(-1);
    assertThat(bits.stream().toArray()).asList().containsExactly(3, 70, 130).inOrder();
    assertThat(bits.toString()).isEqualTo("{3, 70, 130}");
    assertThat(Bits.EMPTY.isEmpty()).isTrue();
    assertThat(Bits.EMPTY.min()).isEqualTo(-1);
    assertThat(Bits.EMPTY.toString()).isEqualTo("{}");
    assertThat(Bits.forRange(2, 5)).isEqualTo(Bits.of(2, 3, 4, 5));
  }

  @Test
  public void ops() {
    Bits x = Bits.of(1, 2, 100);
    Bits y = Bits.of(2, 3);
    assertThat(Bits.Op.UNION.apply(x, y)).isEqualTo(Bits.of(1, 2, 3, 100));
    assertThat(Bits.Op.INTERSECTION.apply(x, y)).isEqualTo(Bits.of(2));
    assertThat(Bits.Op.DIFFERENCE.apply(x, y)).isEqualTo(Bits.of(1, 100));
    assertThat(Bits.Op.DIFFERENCE.apply(y, x)).isEqualTo(Bits.of(3));
    // Removing the only element in a high word leaves a set equal to one built directly.
    Bits low = Bits.Op.DIFFERENCE.apply(x, Bits.of(100));
    assertThat(low).isEqualTo(Bits.of(1, 2));
    assertThat(low.hashCode()).isEqualTo(Bits.of(1, 2).hashCode());
    assertThat(Bits.Op.DIFFERENCE.apply(x, x)).isEqualTo(Bits.EMPTY);
    // Unchanged results are returned as is.
    assertThat(Bits.Op.UNION.apply(x, Bits.EMPTY)).isSameInstanceAs(x);
  }

  @Test
  public void setRelations() {
    Bits x = Bits.of(1, 2, 100);
    assertThat(x.containsAll(Bits.of(1, 100))).isTrue();
    assertThat(x.containsAll(Bits.of(1, 200))).isFalse();
    assertThat(x.containsAll(Bits.EMPTY)).isTrue();
    assertThat(x.intersects(Bits.of(100, 101))).isTrue();
    assertThat(x.intersects(Bits.of(3))).isFalse();
    assertThat(Bits.EMPTY.intersects(x)).isFalse();
  }

  @Test
  public void builder() {
    Bits.Builder builder = new Bits.Builder();
    assertThat(builder.build()).isSameInstanceAs(Bits.EMPTY);
    builder.set(5).set(64).setAll(Bits.of(1, 5));
    assertThat(builder.test(64)).isTrue();
    assertThat(builder.test(6)).isFalse();
    Bits built = builder.build();
    assertThat(built).isEqualTo(Bits.of(1, 5, 64));
    // Later changes to the builder don't affect a Bits that has already been built.
    builder.set(7);
    assertThat(built.test(7)).isFalse();
    assertThat(builder.build().count()).isEqualTo(4);
  }

  @Test
  public void joinBits() {
    assertThat(StringUtil.joinBits(Bits.of(0, 2), ", ", i -> "b" + i)).isEqualTo("b0, b2");
    assertThat(StringUtil.indent(2)).isEqualTo("    ");
  }
}
