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
import java.util.Objects;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.http.HttpSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthenticationHandler} that keeps the authenticated user in the {@link HttpSession}.
 * After a successful authentication the user is redirected to the service URL, that does not
 * contain the ticket anymore.
 */
public class SessionAuthenticationHandler implements AuthenticationHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionAuthenticationHandler.class);

  /**
   * The URL where the user will be redirected in case of failures. If <code>null</code>, 401 is
   * sent.
   */
  private final String failureUrl;

  private final String sessionAttributeName;

  /**
   * Constructor.
   *
   * @param sessionAttributeName
   *          the name of the session attribute that stores the user. Cannot be <code>null</code>.
   * @param failureUrl
   *          the URL where the user is redirected in case of failures, can be <code>null</code>
   */
  public SessionAuthenticationHandler(final String sessionAttributeName,
      final String failureUrl) {
    this.sessionAttributeName = Objects.requireNonNull(sessionAttributeName,
        "sessionAttributeName cannot be null");
    this.failureUrl = failureUrl;
  }

  @Override
  public void error(final HttpServletRequest req, final HttpServletResponse resp,
      final Exception error) throws IOException {
    LOGGER.error("Cerbere authentication error", error);
    resp.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
  }

  @Override
  public void fail(final HttpServletRequest req, final HttpServletResponse resp,
      final Object info) throws IOException {
    if (info instanceof Exception) {
      LOGGER.info(((Exception) info).getMessage());
    } else {
      LOGGER.info("Cerbere authentication failed: " + info);
    }
    if (failureUrl != null) {
      resp.sendRedirect(failureUrl);
    } else {
      resp.sendError(HttpServletResponse.SC_UNAUTHORIZED);
    }
  }

  public String getSessionAttributeName() {
    return sessionAttributeName;
  }

  @Override
  public boolean isAuthenticated(final HttpServletRequest req) {
    HttpSession httpSession = req.getSession(false);
    return (httpSession != null) && (httpSession.getAttribute(sessionAttributeName) != null);
  }

  @Override
  public void success(final HttpServletRequest req, final HttpServletResponse resp,
      final String serviceUrl, final Object user, final Object info) throws IOException {
    HttpSession httpSession = req.getSession();
    httpSession.setAttribute(sessionAttributeName, user);
    resp.sendRedirect(serviceUrl);
  }

}
