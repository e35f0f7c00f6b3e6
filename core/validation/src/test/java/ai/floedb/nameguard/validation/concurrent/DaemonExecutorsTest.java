/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.nameguard.validation.concurrent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class DaemonExecutorsTest {

  @Test
  void threadsAreNamedDaemons() throws Exception {
    ExecutorService executor = DaemonExecutors.bounded("lookup", 2);
    try {
      Future<Thread> worker = executor.submit(Thread::currentThread);
      Thread thread = worker.get(2, TimeUnit.SECONDS);

      assertThat(thread.isDaemon()).isTrue();
      assertThat(thread.getName()).startsWith("lookup-");
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void submitBeyondTheBoundIsRejected() throws Exception {
    ExecutorService executor = DaemonExecutors.bounded("lookup", 1);
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    try {
      executor.submit(
          () -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
          });
      assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

      assertThatThrownBy(() -> executor.submit(() -> null))
          .isInstanceOf(RejectedExecutionException.class);
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void rejectsEmptyPool() {
    assertThatThrownBy(() -> DaemonExecutors.bounded("lookup", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
