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

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.http.HttpSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the user out of the application and of the Cerbere server. The local session is
 * invalidated and the user is redirected to the logout page of the server.
 */
public class CerbereLogoutServlet extends HttpServlet {

  private static final Logger LOGGER = LoggerFactory.getLogger(CerbereLogoutServlet.class);

  private static final long serialVersionUID = 5904484742173432400L;

  private final boolean autoRedirect;

  private final transient CasRedirects redirects;

  private final String returnUrl;

  /**
   * Constructor that leads the user back to the service URL of the configuration.
   *
   * @param configuration
   *          the configuration of the Cerbere client
   * @param autoRedirect
   *          <code>true</code> if the server should redirect the user back automatically,
   *          otherwise the server only shows a link
   */
  public CerbereLogoutServlet(final CerbereConfiguration configuration,
      final boolean autoRedirect) {
    this(new CasRedirects(
        Objects.requireNonNull(configuration, "configuration cannot be null").getCasUrl()),
        configuration.getServiceUrl(), autoRedirect);
  }

  /**
   * Constructor.
   *
   * @param redirects
   *          builds the logout URL. Cannot be <code>null</code>.
   * @param returnUrl
   *          the URL the user returns to after logout, <code>null</code> for no way back
   * @param autoRedirect
   *          <code>true</code> if the server should redirect the user back automatically
   */
  public CerbereLogoutServlet(final CasRedirects redirects, final String returnUrl,
      final boolean autoRedirect) {
    this.redirects = Objects.requireNonNull(redirects, "redirects cannot be null");
    this.returnUrl = returnUrl;
    this.autoRedirect = autoRedirect;
  }

  @Override
  protected void doGet(final HttpServletRequest req, final HttpServletResponse resp)
      throws ServletException, IOException {
    logout(req, resp);
  }

  @Override
  protected void doPost(final HttpServletRequest req, final HttpServletResponse resp)
      throws ServletException, IOException {
    logout(req, resp);
  }

  private void logout(final HttpServletRequest req, final HttpServletResponse resp)
      throws IOException {
    HttpSession httpSession = req.getSession(false);
    if (httpSession != null) {
      try {
        httpSession.invalidate();
      } catch (IllegalStateException e) {
        LOGGER.debug(e.getMessage(), e);
      }
    }
    redirects.redirectToLogout(resp, returnUrl, autoRedirect);
  }

}
