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
import java.io.PrintWriter;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import javax.servlet.http.HttpServletResponse;

/**
 * Builds the login and logout URLs of the Cerbere server and sends the redirects. Every redirect
 * is a <code>307 Temporary Redirect</code> with a small HTML body that links to the target, for
 * clients that do not follow redirects automatically.
 */
public class CasRedirects {

  public static final int SC_TEMPORARY_REDIRECT = 307;

  private static final String LOGIN_PATH = "/login";

  private static final String LOGOUT_PATH = "/logout";

  static String escapeHtml(final String value) {
    return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
        .replace("\"", "&quot;");
  }

  /**
   * Sends a temporary redirect with an HTML fallback link.
   *
   * @param resp
   *          the response to write
   * @param location
   *          the target URL
   * @param label
   *          the text of the fallback link
   */
  public static void sendRedirect(final HttpServletResponse resp, final String location,
      final String label) throws IOException {
    resp.setStatus(SC_TEMPORARY_REDIRECT);
    resp.setHeader("Location", location);
    resp.setContentType("text/html; charset=UTF-8");
    PrintWriter writer = resp.getWriter();
    writer.write("<a href=\"" + escapeHtml(location) + "\">" + escapeHtml(label) + "</a>");
    writer.flush();
  }

  private static String urlEncode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private final String casUrl;

  /**
   * Constructor.
   *
   * @param casUrl
   *          the base URL of the Cerbere server including the base path
   */
  public CasRedirects(final URI casUrl) {
    String url = Objects.requireNonNull(casUrl, "casUrl cannot be null").toString();
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    this.casUrl = url;
  }

  public String loginUrl(final String service) {
    Objects.requireNonNull(service, "service cannot be null");
    return casUrl + LOGIN_PATH + "?service=" + urlEncode(service);
  }

  /**
   * The logout URL that does not lead back to the application.
   */
  public String logoutUrl() {
    return casUrl + LOGOUT_PATH;
  }

  /**
   * The logout URL that leads back to the application.
   *
   * @param returnUrl
   *          the URL the user returns to after logout, <code>null</code> for no way back
   * @param autoRedirect
   *          <code>true</code> if the server should redirect the user automatically, otherwise the
   *          server only shows a link to the return URL
   */
  public String logoutUrl(final String returnUrl, final boolean autoRedirect) {
    if (returnUrl == null) {
      return logoutUrl();
    }
    if (autoRedirect) {
      return casUrl + LOGOUT_PATH + "?service=" + urlEncode(returnUrl);
    }
    return casUrl + LOGOUT_PATH + "?url=" + urlEncode(returnUrl);
  }

  public void redirectToLogin(final HttpServletResponse resp, final String service)
      throws IOException {
    sendRedirect(resp, loginUrl(service), "CAS login");
  }

  public void redirectToLogout(final HttpServletResponse resp, final String returnUrl,
      final boolean autoRedirect) throws IOException {
    sendRedirect(resp, logoutUrl(returnUrl, autoRedirect), "CAS logout");
  }

}
