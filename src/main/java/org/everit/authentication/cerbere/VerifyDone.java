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
package org.everit.authentication.cerbere;

/**
 * Completion callback of a {@link VerifyCallback}.
 */
@FunctionalInterface
public interface VerifyDone {

  /**
   * Reports the outcome of the verification.
   *
   * @param error
   *          the error that occurred during the verification, <code>null</code> if none
   * @param user
   *          the application user, <code>null</code> if the authentication must fail
   * @param info
   *          additional information passed to the {@link AuthenticationHandler}, can be
   *          <code>null</code>
   */
  void done(Exception error, Object user, Object info);

}
