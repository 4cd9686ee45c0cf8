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

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.http.HttpSession;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

public class SessionAuthenticationHandlerTest {

  private static final String ATTRIBUTE = "cerbere.user";

  private HttpServletRequest req;

  private HttpServletResponse resp;

  @Before
  public void setUp() {
    req = Mockito.mock(HttpServletRequest.class);
    resp = Mockito.mock(HttpServletResponse.class);
  }

  @Test
  public void testError() throws Exception {
    new SessionAuthenticationHandler(ATTRIBUTE, "/failed.html")
        .error(req, resp, new IllegalStateException("boom"));

    Mockito.verify(resp).sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
  }

  @Test
  public void testFailWithFailureUrl() throws Exception {
    new SessionAuthenticationHandler(ATTRIBUTE, "/failed.html")
        .fail(req, resp, new CasProtocolException("INVALID_TICKET", "ticket expired"));

    Mockito.verify(resp).sendRedirect("/failed.html");
  }

  @Test
  public void testFailWithoutFailureUrl() throws Exception {
    new SessionAuthenticationHandler(ATTRIBUTE, null).fail(req, resp, "unknown user");

    Mockito.verify(resp).sendError(HttpServletResponse.SC_UNAUTHORIZED);
  }

  @Test
  public void testIsAuthenticated() {
    SessionAuthenticationHandler handler = new SessionAuthenticationHandler(ATTRIBUTE, null);
    Assert.assertFalse(handler.isAuthenticated(req));

    HttpSession session = Mockito.mock(HttpSession.class);
    Mockito.when(req.getSession(false)).thenReturn(session);
    Assert.assertFalse(handler.isAuthenticated(req));

    Mockito.when(session.getAttribute(ATTRIBUTE)).thenReturn("alice");
    Assert.assertTrue(handler.isAuthenticated(req));
  }

  @Test
  public void testSuccess() throws Exception {
    HttpSession session = Mockito.mock(HttpSession.class);
    Mockito.when(req.getSession()).thenReturn(session);

    new SessionAuthenticationHandler(ATTRIBUTE, null)
        .success(req, resp, "https://app.example.com/page", "alice", null);

    Mockito.verify(session).setAttribute(ATTRIBUTE, "alice");
    Mockito.verify(resp).sendRedirect("https://app.example.com/page");
  }

}
