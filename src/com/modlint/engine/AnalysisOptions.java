/*
 * Copyright 2026 The Modlint Authors.
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

package com.modlint.engine;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * Options for a {@link RuleRunner}.
 *
 * <p>Options are read when a run starts; changing them while a run is in progress has no effect on
 * that run.
 */
public class AnalysisOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Whether results of previous runs carried by the project may be reused. */
  private boolean cacheEnabled = true;

  /**
   * Number of threads visiting modules of rules whose modules are independent. 1 visits every
   * module on the calling thread.
   */
  private int numThreads = 1;

  public AnalysisOptions() {}

  public boolean isCacheEnabled() {
    return cacheEnabled;
  }

  public void setCacheEnabled(boolean cacheEnabled) {
    this.cacheEnabled = cacheEnabled;
  }

  public int getNumThreads() {
    return numThreads;
  }

  public void setNumThreads(int numThreads) {
    checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);
    this.numThreads = numThreads;
  }

  @Override
  public String toString() {
    return "AnalysisOptions{cacheEnabled=" + cacheEnabled + ", numThreads=" + numThreads + "}";
  }
}
