/*
 * Copyright (C) 2011 Everit Kft. (http://www.everit.biz)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.everit.authentication.cerbere.validation;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.input.ProxyInputStream;

/**
 * Fails the reads of the wrapped stream once a deadline has passed. A read that is already
 * blocked is not interrupted, it is bounded by the socket timeout of the connection.
 */
final class DeadlineInputStream extends ProxyInputStream {

  private final long deadlineNanos;

  private final long timeoutMillis;

  /**
   * Constructor.
   *
   * @param in
   *          the stream to read
   * @param startNanos
   *          the {@link System#nanoTime()} when the exchange started
   * @param timeoutMillis
   *          the allowed duration of the exchange in milliseconds
   */
  DeadlineInputStream(final InputStream in, final long startNanos, final long timeoutMillis) {
    super(in);
    this.deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  protected void beforeRead(final int n) throws IOException {
    if ((System.nanoTime() - deadlineNanos) > 0) {
      throw new SocketTimeoutException(
          "Response not received within " + timeoutMillis + " ms");
    }
  }

}
