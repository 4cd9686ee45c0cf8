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

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.everit.authentication.cerbere.profile.AttributeNormalizer;
import org.everit.authentication.cerbere.profile.Profile;
import org.everit.authentication.cerbere.validation.HttpClientTransport;
import org.everit.authentication.cerbere.validation.TicketValidator;
import org.everit.authentication.cerbere.validation.ValidationRequestBuilder;
import org.everit.authentication.cerbere.validation.ValidationResponseParser;
import org.everit.authentication.cerbere.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link Filter} that authenticates the users with a Cerbere (CAS 2.0 / SAML 1.1) server.
 * The filter handles one of the followings in order:
 * <ul>
 * <li>Passes the request to the {@link FilterChain} if the {@link AuthenticationHandler} reports
 * that the user is already authenticated.</li>
 * <li>Redirects the user to the login page of the server if the request does not contain a
 * service ticket.</li>
 * <li>Validates the service ticket, normalizes the attributes of the subject to a
 * {@link Profile} and passes it to the {@link VerifyCallback}. The outcome of the verification is
 * forwarded to the {@link AuthenticationHandler}.</li>
 * </ul>
 * <p>
 * A ticket rejected by the server is retried once in a time window by redirecting the user to
 * the same URL without the ticket, see {@link StaleTicketRetryPolicy}. The retry marker is kept in
 * the service URL, so the ticket issued after the retry is validated with the marker and a second
 * rejection is final. Transport errors are passed to
 * {@link AuthenticationHandler#error(HttpServletRequest, HttpServletResponse, Exception)} and
 * unparseable responses to
 * {@link AuthenticationHandler#fail(HttpServletRequest, HttpServletResponse, Object)} without
 * retry.
 * </p>
 */
public class CerbereAuthentication implements Filter {

  /**
   * Records the outcome reported by the {@link VerifyCallback}.
   */
  private static final class Verified implements VerifyDone {

    private boolean called;

    private Exception error;

    private Object info;

    private Object user;

    @Override
    public void done(final Exception error, final Object user, final Object info) {
      if (called) {
        throw new IllegalStateException("done has already been called");
      }
      this.called = true;
      this.error = error;
      this.user = user;
      this.info = info;
    }

  }

  private static final String HEADER_HOST = "Host";

  private static final String HEADER_X_FORWARDED_HOST = "X-Forwarded-Host";

  private static final String HEADER_X_FORWARDED_PROTO = "X-Forwarded-Proto";

  private static final String HEADER_X_PROXIED_PROTOCOL = "X-Proxied-Protocol";

  private static final String HEADER_X_PROXIED_REQUEST_URI = "X-Proxied-Request-Uri";

  private static final Logger LOGGER = LoggerFactory.getLogger(CerbereAuthentication.class);

  /**
   * Returns the first element of a possibly comma separated header value.
   */
  private static String firstHeaderValue(final HttpServletRequest req, final String name) {
    String value = req.getHeader(name);
    if (value == null) {
      return null;
    }
    int comma = value.indexOf(',');
    if (comma >= 0) {
      value = value.substring(0, comma);
    }
    value = value.trim();
    return value.isEmpty() ? null : value;
  }

  private static TicketValidator createTicketValidator(final CerbereConfiguration configuration,
      final HttpClientTransport transport) {
    return new TicketValidator(new ValidationRequestBuilder(configuration.getCasUrl()), transport,
        new ValidationResponseParser());
  }

  private final AuthenticationHandler authenticationHandler;

  private final CerbereConfiguration configuration;

  private final AttributeNormalizer normalizer;

  private final CasRedirects redirects;

  private final StaleTicketRetryPolicy retryPolicy;

  private final TicketValidator ticketValidator;

  /**
   * The transport created by this filter, closed when the filter is destroyed.
   */
  private final Closeable ownedTransport;

  private final VerifyCallback verifyCallback;

  /**
   * Constructor that validates the tickets over HTTPS with the timeouts and response size limit of
   * the configuration.
   *
   * @throws NullPointerException
   *           if one of the parameters is <code>null</code>
   */
  public CerbereAuthentication(final CerbereConfiguration configuration,
      final VerifyCallback verifyCallback, final AuthenticationHandler authenticationHandler) {
    this(configuration, verifyCallback, authenticationHandler,
        new HttpClientTransport(
            Objects.requireNonNull(configuration, "configuration cannot be null")
                .getConnectTimeout(),
            configuration.getReadTimeout(), configuration.getResponseTimeout(),
            configuration.getMaxResponseSize()));
  }

  private CerbereAuthentication(final CerbereConfiguration configuration,
      final VerifyCallback verifyCallback, final AuthenticationHandler authenticationHandler,
      final HttpClientTransport transport) {
    this(configuration, verifyCallback, authenticationHandler,
        createTicketValidator(configuration, transport), new StaleTicketRetryPolicy(),
        transport);
  }

  /**
   * Constructor.
   *
   * @throws NullPointerException
   *           if one of the parameters is <code>null</code>
   */
  public CerbereAuthentication(final CerbereConfiguration configuration,
      final VerifyCallback verifyCallback, final AuthenticationHandler authenticationHandler,
      final TicketValidator ticketValidator, final StaleTicketRetryPolicy retryPolicy) {
    this(configuration, verifyCallback, authenticationHandler, ticketValidator, retryPolicy,
        null);
  }

  private CerbereAuthentication(final CerbereConfiguration configuration,
      final VerifyCallback verifyCallback, final AuthenticationHandler authenticationHandler,
      final TicketValidator ticketValidator, final StaleTicketRetryPolicy retryPolicy,
      final Closeable ownedTransport) {
    this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
    this.verifyCallback = Objects.requireNonNull(verifyCallback,
        "verifyCallback cannot be null");
    this.authenticationHandler = Objects.requireNonNull(authenticationHandler,
        "authenticationHandler cannot be null");
    this.ticketValidator = Objects.requireNonNull(ticketValidator,
        "ticketValidator cannot be null");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
    this.ownedTransport = ownedTransport;
    this.normalizer = new AttributeNormalizer(configuration.getPropertyMap());
    this.redirects = new CasRedirects(configuration.getCasUrl());
  }

  /**
   * Creates the service URL forwarded to the Cerbere server. The headers set by reverse proxies
   * take precedence over the values of the request. The query string is not part of the service
   * URL, except the {@value CerbereAuthenticationConstants#REQ_PARAM_RETRY} parameter of a retried
   * request.
   *
   * @param req
   *          the request used to build the service URL
   * @return the service URL
   */
  String createServiceUrl(final HttpServletRequest req) {
    String scheme = firstHeaderValue(req, HEADER_X_FORWARDED_PROTO);
    if (scheme == null) {
      scheme = firstHeaderValue(req, HEADER_X_PROXIED_PROTOCOL);
    }
    if (scheme == null) {
      scheme = req.getScheme() != null ? req.getScheme() : "http";
    }

    String host = firstHeaderValue(req, HEADER_X_FORWARDED_HOST);
    if (host == null) {
      host = firstHeaderValue(req, HEADER_HOST);
    }
    if (host == null) {
      host = req.getServerName() + ":" + req.getServerPort();
    }

    String path = firstHeaderValue(req, HEADER_X_PROXIED_REQUEST_URI);
    if (path == null) {
      path = req.getRequestURI();
    }
    int queryStart = path.indexOf('?');
    if (queryStart >= 0) {
      path = path.substring(0, queryStart);
    }

    String serviceUrl = scheme + "://" + host + path;
    String retryMarker = getRequestParameter(req, CerbereAuthenticationConstants.REQ_PARAM_RETRY);
    if (retryMarker != null) {
      serviceUrl = serviceUrl + "?" + CerbereAuthenticationConstants.REQ_PARAM_RETRY + "="
          + URLEncoder.encode(retryMarker, StandardCharsets.UTF_8);
    }
    return serviceUrl;
  }

  @Override
  public void destroy() {
    if (ownedTransport == null) {
      return;
    }
    try {
      ownedTransport.close();
    } catch (IOException e) {
      LOGGER.debug(e.getMessage(), e);
    }
  }

  @Override
  public void doFilter(final ServletRequest request, final ServletResponse response,
      final FilterChain chain) throws IOException, ServletException {

    HttpServletRequest httpServletRequest = (HttpServletRequest) request;
    HttpServletResponse httpServletResponse = (HttpServletResponse) response;

    if (authenticationHandler.isAuthenticated(httpServletRequest)) {
      chain.doFilter(request, response);
      return;
    }

    String serviceUrl = createServiceUrl(httpServletRequest);
    String serviceTicket = getRequestParameter(httpServletRequest,
        CerbereAuthenticationConstants.REQ_PARAM_TICKET);

    if (serviceTicket == null) {
      redirects.redirectToLogin(httpServletResponse, serviceUrl);
    } else {
      performServiceTicketValidation(httpServletRequest, httpServletResponse, serviceTicket,
          serviceUrl);
    }
  }

  public CerbereConfiguration getConfiguration() {
    return configuration;
  }

  public String getName() {
    return CerbereAuthenticationConstants.STRATEGY_NAME;
  }

  /**
   * Returns the value of a query parameter if available.
   *
   * @return the trimmed value of the parameter if available and not empty, otherwise
   *         <code>null</code>
   */
  private String getRequestParameter(final HttpServletRequest req, final String name) {
    String queryString = req.getQueryString();
    if ((queryString == null) || !queryString.contains(name)) {
      return null;
    }
    String value = req.getParameter(name);
    if (value == null) {
      return null;
    }
    value = value.trim();
    if (value.isEmpty()) {
      return null;
    }
    return value;
  }

  @Override
  public void init(final FilterConfig filterConfig) throws ServletException {
    // Nothing to do here.
  }

  private void performServiceTicketValidation(final HttpServletRequest req,
      final HttpServletResponse resp, final String serviceTicket, final String serviceUrl)
      throws IOException {

    ValidationResult result;
    try {
      result = ticketValidator.validate(serviceTicket, serviceUrl);
    } catch (CasProtocolException e) {
      retryOrFail(req, resp, e);
      return;
    } catch (CasResponseParseException e) {
      authenticationHandler.fail(req, resp, e);
      return;
    } catch (TicketValidationException e) {
      authenticationHandler.error(req, resp, e);
      return;
    }

    Profile profile = normalizer.normalize(result.getSubjectId(), result.getAttributes());

    Verified verified = new Verified();
    try {
      if (configuration.isPassReqToCallback()) {
        verifyCallback.verify(req, profile.getId(), profile, verified);
      } else {
        verifyCallback.verify(profile.getId(), profile, verified);
      }
    } catch (Exception e) {
      authenticationHandler.error(req, resp, e);
      return;
    }

    if (!verified.called) {
      authenticationHandler.error(req, resp,
          new IllegalStateException("The verify callback returned without calling done"));
    } else if (verified.error != null) {
      authenticationHandler.error(req, resp, verified.error);
    } else if (verified.user == null) {
      authenticationHandler.fail(req, resp, verified.info);
    } else {
      authenticationHandler.success(req, resp, serviceUrl, verified.user, verified.info);
    }
  }

  private void retryOrFail(final HttpServletRequest req, final HttpServletResponse resp,
      final CasProtocolException e) throws IOException {
    String requestUrl = req.getRequestURI();
    if (req.getQueryString() != null) {
      requestUrl = requestUrl + "?" + req.getQueryString();
    }
    Optional<String> retryUrl = retryPolicy.retryUrl(requestUrl,
        req.getParameter(CerbereAuthenticationConstants.REQ_PARAM_RETRY));
    if (retryUrl.isPresent()) {
      LOGGER.info("Service ticket validation failed, retrying without the ticket: "
          + e.getMessage());
      CasRedirects.sendRedirect(resp, retryUrl.get(), "Retry");
    } else {
      authenticationHandler.fail(req, resp, e);
    }
  }

}
