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

import java.io.IOException;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * The host side of the authentication: decides what the user sees after the Cerbere
 * authentication succeeded, failed or ended with an error.
 */
public interface AuthenticationHandler {

  /**
   * Invoked if the verification reported an error.
   */
  void error(HttpServletRequest req, HttpServletResponse resp, Exception error)
      throws IOException;

  /**
   * Invoked if the ticket is rejected and cannot be retried or the verification did not return a
   * user.
   *
   * @param info
   *          the {@link TicketValidationException} or the info returned by the verification
   */
  void fail(HttpServletRequest req, HttpServletResponse resp, Object info) throws IOException;

  /**
   * Checks if the request belongs to an already authenticated user. Authenticated requests are
   * passed to the filter chain without any Cerbere interaction.
   */
  boolean isAuthenticated(HttpServletRequest req);

  /**
   * Invoked if the ticket is valid and the verification returned a user.
   *
   * @param serviceUrl
   *          the service URL the ticket was issued for
   */
  void success(HttpServletRequest req, HttpServletResponse resp, String serviceUrl, Object user,
      Object info) throws IOException;

}
