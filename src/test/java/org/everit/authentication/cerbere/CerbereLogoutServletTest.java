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

import java.io.PrintWriter;
import java.io.StringWriter;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import javax.servlet.http.HttpSession;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

public class CerbereLogoutServletTest {

  private CerbereConfiguration configuration;

  private HttpServletRequest req;

  private HttpServletResponse resp;

  @Before
  public void setUp() throws Exception {
    configuration = CerbereConfiguration.builder()
        .casUrl("https://cerbere.example.com/cas/public")
        .serviceUrl("https://app.example.com/")
        .build();
    req = Mockito.mock(HttpServletRequest.class);
    resp = Mockito.mock(HttpServletResponse.class);
    Mockito.when(resp.getWriter()).thenReturn(new PrintWriter(new StringWriter()));
  }

  @Test
  public void testInvalidatedSessionIsIgnored() throws Exception {
    HttpSession session = Mockito.mock(HttpSession.class);
    Mockito.doThrow(new IllegalStateException("already invalidated")).when(session)
        .invalidate();
    Mockito.when(req.getSession(false)).thenReturn(session);

    new CerbereLogoutServlet(configuration, false).doPost(req, resp);

    Mockito.verify(resp).setHeader("Location",
        "https://cerbere.example.com/cas/public/logout?url=https%3A%2F%2Fapp.example.com%2F");
  }

  @Test
  public void testLogoutInvalidatesSession() throws Exception {
    HttpSession session = Mockito.mock(HttpSession.class);
    Mockito.when(req.getSession(false)).thenReturn(session);

    new CerbereLogoutServlet(configuration, true).doGet(req, resp);

    Mockito.verify(session).invalidate();
    Mockito.verify(resp).setStatus(CasRedirects.SC_TEMPORARY_REDIRECT);
    Mockito.verify(resp).setHeader("Location",
        "https://cerbere.example.com/cas/public/logout?service=https%3A%2F%2Fapp.example.com%2F");
  }

  @Test
  public void testLogoutWithoutReturnUrl() throws Exception {
    new CerbereLogoutServlet(new CasRedirects(configuration.getCasUrl()), null, true)
        .doGet(req, resp);

    Mockito.verify(resp).setHeader("Location", "https://cerbere.example.com/cas/public/logout");
  }

}
