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
 * Options that control how source is tokenised and parsed.
 * Create through the builder:
 * <pre>
 *   EmuContext context = EmuContext.create()
 *                                  .typeSuffixes(false)
 *                                  .debug(1)
 *                                  .build();
 * </pre>
 */
public class EmuContext {

  // Whether to log token streams and parsed trees
  public int debugLevel = 0;

  // Whether "name$", "name%", "name#" and "name@" are single names
  public boolean typeSuffixes = true;

  // Used when source is parsed without a name (MD5 of content if null)
  public String defaultStreamName = null;

  ///////////////////////////////

  public static EmuContextBuilder create() {
    return new EmuContext().getEmuContextBuilder();
  }

  private EmuContext() {}

  private EmuContextBuilder getEmuContextBuilder() {
    return new EmuContextBuilder();
  }

  public class EmuContextBuilder {
    private EmuContextBuilder() {}

    public EmuContextBuilder debug(int value)                  { debugLevel        = value;   return this; }
    public EmuContextBuilder typeSuffixes(boolean value)       { typeSuffixes      = value;   return this; }
    public EmuContextBuilder defaultStreamName(String name)    { defaultStreamName = name;    return this; }

    public EmuContext build() {
      if (debugLevel < 0) {
        throw new IllegalArgumentException("Debug level must not be negative: " + debugLevel);
      }
      return EmuContext.this;
    }
  }

  //////////////////////////////////

  public boolean isDebug() {
    return debugLevel > 0;
  }

  /**
   * Name to use for a stream given the name supplied by the caller
   * @param name  the name or null
   * @return the name, or the default name, or null if neither is known
   */
  public String streamName(String name) {
    return name == null || name.isEmpty() ? defaultStreamName : name;
  }
}
