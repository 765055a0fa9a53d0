/*
 * Copyright 2026 The MeshPolicy Authors
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

package io.meshpolicy.index.watch;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.function.ThrowingRunnable;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CellTest {
  private final Cell<String> cell = new Cell<String>("a");
  private final AtomicInteger notifications = new AtomicInteger();
  private final Runnable listener = new Runnable() {
    @Override
    public void run() {
      notifications.incrementAndGet();
    }
  };

  @Test
  public void sendIfModified_skipsEqualValues() {
    cell.subscribe(listener, MoreExecutors.directExecutor());

    assertThat(cell.sendIfModified("a")).isFalse();
    assertThat(notifications.get()).isEqualTo(0);

    assertThat(cell.sendIfModified("b")).isTrue();
    assertThat(cell.get()).isEqualTo("b");
    assertThat(notifications.get()).isEqualTo(1);
  }

  @Test
  public void send_alwaysNotifies() {
    cell.subscribe(listener, MoreExecutors.directExecutor());
    cell.send("a");
    assertThat(notifications.get()).isEqualTo(1);
  }

  @Test
  public void close_notifiesOnceAndRejectsFurtherSends() {
    cell.subscribe(listener, MoreExecutors.directExecutor());
    cell.close();
    cell.close();

    assertThat(cell.isClosed()).isTrue();
    assertThat(cell.get()).isEqualTo("a");
    assertThat(notifications.get()).isEqualTo(1);
    assertThrows(IllegalStateException.class, new ThrowingRunnable() {
      @Override
      public void run() {
        cell.send("b");
      }
    });
  }

  @Test
  public void cancelledRegistration_isNotNotified() {
    Cell<String>.Registration registration =
        cell.subscribe(listener, MoreExecutors.directExecutor());
    assertThat(cell.subscriberCount()).isEqualTo(1);

    registration.cancel();
    cell.send("b");

    assertThat(cell.subscriberCount()).isEqualTo(0);
    assertThat(notifications.get()).isEqualTo(0);
  }

  @Test
  public void snapshotVersionsIncrease() {
    long initial = cell.snapshot().version;
    cell.sendIfModified("b");
    cell.sendIfModified("b");
    assertThat(cell.snapshot().version).isEqualTo(initial + 1);
  }
}
