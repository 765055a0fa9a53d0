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

package io.meshpolicy.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Function;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import io.grpc.Status;
import io.grpc.internal.SerializingExecutor;
import io.grpc.stub.ServerCallStreamObserver;
import io.meshpolicy.index.watch.KeyedCursor;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Streams the values of a {@link KeyedCursor} to a client. The first message is the current
 * value; each later message is the latest value once the client can accept more. Values that
 * change while the client is not ready are coalesced. The stream fails with {@code NOT_FOUND}
 * once the watched key goes away.
 *
 * <p>All callbacks run in a {@link SerializingExecutor}.
 */
final class PolicyStream<V, R> {
  private static final Logger logger = Logger.getLogger(PolicyStream.class.getName());

  private final ServerCallStreamObserver<R> responseObserver;
  private final Function<V, R> converter;
  private final String target;
  private final SerializingExecutor serializingExecutor;
  private final Runnable sendTask = new Runnable() {
    @Override
    public void run() {
      send();
    }
  };

  @Nullable
  private KeyedCursor<?, V> cursor;
  private boolean done;

  private PolicyStream(ServerCallStreamObserver<R> responseObserver, Function<V, R> converter,
      String target, Executor executor) {
    this.responseObserver = checkNotNull(responseObserver, "responseObserver");
    this.converter = checkNotNull(converter, "converter");
    this.target = checkNotNull(target, "target");
    this.serializingExecutor = new SerializingExecutor(checkNotNull(executor, "executor"));
  }

  /**
   * Serves {@code watch} on {@code responseObserver}. Must be called from the service method so
   * the readiness and cancellation handlers are installed before the call starts.
   *
   * @param target describes the watched key in error messages
   */
  static <V, R> void serve(ListenableFuture<? extends KeyedCursor<?, V>> watch,
      ServerCallStreamObserver<R> responseObserver, Function<V, R> converter, String target,
      Executor executor) {
    new PolicyStream<V, R>(responseObserver, converter, target, executor).start(watch);
  }

  private void start(ListenableFuture<? extends KeyedCursor<?, V>> watch) {
    responseObserver.setOnReadyHandler(new Runnable() {
      @Override
      public void run() {
        serializingExecutor.execute(sendTask);
      }
    });
    responseObserver.setOnCancelHandler(new Runnable() {
      @Override
      public void run() {
        serializingExecutor.execute(new Runnable() {
          @Override
          public void run() {
            logger.log(Level.FINE, "Watch of {0} cancelled by the client", target);
            close();
          }
        });
      }
    });
    Futures.addCallback(watch, new FutureCallback<KeyedCursor<?, V>>() {
      @Override
      public void onSuccess(@Nullable KeyedCursor<?, V> result) {
        if (done) {
          if (result != null) {
            result.cancel();
          }
          return;
        }
        if (result == null) {
          fail(Status.NOT_FOUND.withDescription("No such target: " + target));
          return;
        }
        cursor = result;
        cursor.start(sendTask, serializingExecutor);
        send();
      }

      @Override
      public void onFailure(Throwable t) {
        logger.log(Level.WARNING, "Failed to watch " + target, t);
        if (!done) {
          fail(Status.INTERNAL.withDescription("Failed to watch " + target).withCause(t));
        }
      }
    }, serializingExecutor);
  }

  private void send() {
    if (done || cursor == null) {
      return;
    }
    if (cursor.isClosed()) {
      fail(Status.NOT_FOUND.withDescription(target + " was removed"));
      return;
    }
    if (!responseObserver.isReady()) {
      return;
    }
    V value = cursor.poll();
    if (value != null) {
      responseObserver.onNext(converter.apply(value));
    }
  }

  private void fail(Status status) {
    close();
    responseObserver.onError(status.asRuntimeException());
  }

  private void close() {
    done = true;
    if (cursor != null) {
      cursor.cancel();
      cursor = null;
    }
  }
}
