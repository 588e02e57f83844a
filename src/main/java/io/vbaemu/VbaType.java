/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.vbaemu;

/**
 * Declared types of literal values. The Java representation of each value is
 * given in brackets.
 */
public enum VbaType {
  INTEGER("Integer"),       // 16 bit (Short)
  LONG("Long"),             // 32 bit (Integer)
  LONG_LONG("LongLong"),    // 64 bit (Long)
  SINGLE("Single"),         // (Float)
  DOUBLE("Double"),         // (Double)
  CURRENCY("Currency"),     // Fixed point scaled by 10 000 (Long)
  STRING("String"),         // (String)
  BOOLEAN("Boolean"),       // (Boolean)
  EMPTY("Empty"),           // (null)
  NULL("Null"),             // (null)
  NOTHING("Nothing");       // (null)

  public static final long CURRENCY_SCALE = 10_000L;

  private final String typeName;

  VbaType(String typeName) {
    this.typeName = typeName;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * Number of bits for integer types
   */
  public int bits() {
    switch (this) {
      case INTEGER:   return 16;
      case LONG:      return 32;
      case LONG_LONG: return 64;
      default: throw new IllegalStateException("Internal error: " + this + " is not an integer type");
    }
  }

  public static VbaType integerOfBits(int bits) {
    switch (bits) {
      case 16: return INTEGER;
      case 32: return LONG;
      case 64: return LONG_LONG;
      default: throw new IllegalArgumentException("Internal error: no integer type of " + bits + " bits");
    }
  }

  @Override
  public String toString() {
    return typeName;
  }
}
