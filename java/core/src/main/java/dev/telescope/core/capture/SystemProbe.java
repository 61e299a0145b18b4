/*
 * Copyright 2025 Google LLC
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
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.telescope.core.capture;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.time.Instant;

/**
 * SystemProbe reads the clocks and memory figures that go into a capture entry.
 */
public interface SystemProbe {

  /**
   * Returns a monotonic timestamp in nanoseconds, comparable only with other
   * values from the same probe.
   *
   * @return the current monotonic time
   */
  long nanoTime();

  /**
   * Returns the current wall-clock instant.
   *
   * @return now
   */
  Instant now();

  /**
   * Returns the peak memory used by the process since it started.
   *
   * @return peak usage in bytes
   */
  long peakMemoryBytes();

  /**
   * Returns the probe backed by the running JVM.
   *
   * @return the JVM probe
   */
  static SystemProbe jvm() {
    return JvmProbe.INSTANCE;
  }

  /**
   * Reads System.nanoTime and sums the peak usage of every JVM memory pool.
   */
  final class JvmProbe implements SystemProbe {

    private static final JvmProbe INSTANCE = new JvmProbe();

    private JvmProbe() {
    }

    @Override
    public long nanoTime() {
      return System.nanoTime();
    }

    @Override
    public Instant now() {
      return Instant.now();
    }

    @Override
    public long peakMemoryBytes() {
      long total = 0;
      for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
        if (pool.isValid() && pool.getPeakUsage() != null) {
          total += pool.getPeakUsage().getUsed();
        }
      }
      return total;
    }
  }
}
