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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * An immutable set of non-negative ints, represented as a bit vector. Iteration is always in
 * increasing order.
 *
 * <p>Bits are used as persistent snapshots of block sets: each operation returns a new Bits rather
 * than modifying its arguments, so a value that has been handed to one caller can never be changed
 * by another. A {@link Builder} can be used to assemble a Bits incrementally.
 */
public final class Bits {

  public static final Bits EMPTY = new Bits(new long[0]);

  /** Never has trailing zero words, so that equal sets have equal arrays. */
  private final long[] words;

  private Bits(long[] words) {
    this.words = words;
  }

  /** Returns a Bits containing just the given int. */
  public static Bits of(int i) {
    Preconditions.checkArgument(i >= 0);
    long[] words = new long[(i >> 6) + 1];
    words[i >> 6] = 1L << i;
    return new Bits(words);
  }

  /** Returns a Bits containing each of the given ints. */
  public static Bits of(int... elements) {
    Builder builder = new Builder();
    for (int i : elements) {
      builder.set(i);
    }
    return builder.build();
  }

  /** Returns a Bits containing all ints from {@code min} to {@code max} (inclusive). */
  public static Bits forRange(int min, int max) {
    Builder builder = new Builder();
    for (int i = min; i <= max; i++) {
      builder.set(i);
    }
    return builder.build();
  }

  /** Returns true if {@code i} is an element of this set. */
  public boolean test(int i) {
    int w = i >> 6;
    return i >= 0 && w < words.length && (words[w] & (1L << i)) != 0;
  }

  public boolean isEmpty() {
    return words.length == 0;
  }

  /** Returns the number of elements in this set. */
  public int count() {
    int result = 0;
    for (long word : words) {
      result += Long.bitCount(word);
    }
    return result;
  }

  /** Returns the smallest element of this set, or -1 if it is empty. */
  public int min() {
    return nextSetBit(0);
  }

  /** Returns the smallest element of this set that is {@code >= from}, or -1 if there is none. */
  public int nextSetBit(int from) {
    int w = from >> 6;
    if (w >= words.length) {
      return -1;
    }
    long word = words[w] & (-1L << from);
    for (; ; ) {
      if (word != 0) {
        return (w << 6) + Long.numberOfTrailingZeros(word);
      }
      if (++w == words.length) {
        return -1;
      }
      word = words[w];
    }
  }

  /** Calls {@code consumer} with each element of this set, in increasing order. */
  public void forEach(IntConsumer consumer) {
    for (int w = 0; w < words.length; w++) {
      long word = words[w];
      while (word != 0) {
        consumer.accept((w << 6) + Long.numberOfTrailingZeros(word));
        word &= word - 1;
      }
    }
  }

  /** Returns the elements of this set, in increasing order. */
  public IntStream stream() {
    IntStream.Builder builder = IntStream.builder();
    forEach(builder::add);
    return builder.build();
  }

  /** Returns true if this set and {@code other} have at least one element in common. */
  public boolean intersects(Bits other) {
    int n = Math.min(words.length, other.words.length);
    for (int i = 0; i < n; i++) {
      if ((words[i] & other.words[i]) != 0) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if every element of {@code other} is also an element of this set. */
  public boolean containsAll(Bits other) {
    if (other.words.length > words.length) {
      return false;
    }
    for (int i = 0; i < other.words.length; i++) {
      if ((other.words[i] & ~words[i]) != 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bits other && Arrays.equals(words, other.words);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(words);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    forEach(
        i -> {
          if (sb.length() > 1) {
            sb.append(", ");
          }
          sb.append(i);
        });
    return sb.append("}").toString();
  }

  /** Returns a copy of {@code words} with any trailing zero words removed. */
  private static long[] trim(long[] words, int length) {
    while (length > 0 && words[length - 1] == 0) {
      --length;
    }
    return (length == words.length) ? words : Arrays.copyOf(words, length);
  }

  /** The binary operations on Bits. */
  public enum Op {
    UNION {
      @Override
      long apply(long x, long y) {
        return x | y;
      }
    },
    INTERSECTION {
      @Override
      long apply(long x, long y) {
        return x & y;
      }
    },
    DIFFERENCE {
      @Override
      long apply(long x, long y) {
        return x & ~y;
      }
    };

    abstract long apply(long x, long y);

    /** Returns the result of applying this operation to {@code x} and {@code y}. */
    public Bits apply(Bits x, Bits y) {
      int length =
          switch (this) {
            case UNION -> Math.max(x.words.length, y.words.length);
            case INTERSECTION -> Math.min(x.words.length, y.words.length);
            case DIFFERENCE -> x.words.length;
          };
      long[] result = new long[length];
      for (int i = 0; i < length; i++) {
        long xw = (i < x.words.length) ? x.words[i] : 0;
        long yw = (i < y.words.length) ? y.words[i] : 0;
        result[i] = apply(xw, yw);
      }
      Bits bits = new Bits(trim(result, length));
      // Avoid allocating a new object when the result is unchanged.
      if (bits.equals(x)) {
        return x;
      } else if (bits.equals(y)) {
        return y;
      }
      return bits;
    }

    /** Updates {@code builder} to the result of applying this operation to it and {@code y}. */
    public void into(Builder builder, Bits y) {
      builder.ensureCapacity(y.words.length);
      for (int i = 0; i < builder.words.length; i++) {
        long yw = (i < y.words.length) ? y.words[i] : 0;
        builder.words[i] = apply(builder.words[i], yw);
      }
    }
  }

  /** A mutable set of non-negative ints that can be converted to a Bits. */
  public static final class Builder {
    private long[] words = new long[1];

    private void ensureCapacity(int numWords) {
      if (numWords > words.length) {
        words = Arrays.copyOf(words, Math.max(numWords, words.length * 2));
      }
    }

    /** Adds {@code i} to this set. */
    @CanIgnoreReturnValue
    public Builder set(int i) {
      Preconditions.checkArgument(i >= 0);
      ensureCapacity((i >> 6) + 1);
      words[i >> 6] |= 1L << i;
      return this;
    }

    /** Adds each element of {@code bits} to this set. */
    @CanIgnoreReturnValue
    public Builder setAll(Bits bits) {
      Op.UNION.into(this, bits);
      return this;
    }

    public boolean test(int i) {
      int w = i >> 6;
      return i >= 0 && w < words.length && (words[w] & (1L << i)) != 0;
    }

    /** Returns a Bits with the current contents of this Builder. */
    public Bits build() {
      long[] trimmed = trim(words.clone(), words.length);
      return (trimmed.length == 0) ? EMPTY : new Bits(trimmed);
    }
  }
}
