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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates the SAML 1.1 service ticket validation requests of the Cerbere server.
 */
public class ValidationRequestBuilder {

  /**
   * The path of the SAML validation endpoint relative to the base URL of the server.
   */
  public static final String SAML_VALIDATE_PATH = "/samlValidate";

  /**
   * The template of the SOAP envelope. Parameters in order:
   * <ul>
   * <li>1: The unique identifier of the request.</li>
   * <li>2: The ISO-8601 issue instant of the request.</li>
   * <li>3: The XML escaped service ticket.</li>
   * </ul>
   */
  private static final String SOAP_ENVELOPE_TEMPLATE =
      "<SOAP-ENV:Envelope xmlns:SOAP-ENV=\"http://schemas.xmlsoap.org/soap/envelope/\">"
          + "<SOAP-ENV:Header/><SOAP-ENV:Body>"
          + "<samlp:Request xmlns:samlp=\"urn:oasis:names:tc:SAML:1.0:protocol\""
          + " MajorVersion=\"1\" MinorVersion=\"1\" RequestID=\"%1$s\" IssueInstant=\"%2$s\">"
          + "<samlp:AssertionArtifact>%3$s</samlp:AssertionArtifact>"
          + "</samlp:Request></SOAP-ENV:Body></SOAP-ENV:Envelope>";

  private static final String SOAP_ACTION = "http://www.oasis-open.org/committees/security";

  /**
   * The template of the validation URL. Parameters in order:
   * <ul>
   * <li>1: The base URL of the server without trailing slash, for e.g.:
   * https://cerbere.example.com/cas/public</li>
   * <li>2: The URL encoded service URL.</li>
   * </ul>
   */
  private static final String VALIDATION_URL_TEMPLATE = "%1$s" + SAML_VALIDATE_PATH
      + "?TARGET=%2$s";

  static String escapeXml(final String value) {
    StringBuilder builder = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '&':
          builder.append("&amp;");
          break;
        case '<':
          builder.append("&lt;");
          break;
        case '>':
          builder.append("&gt;");
          break;
        case '"':
          builder.append("&quot;");
          break;
        case '\'':
          builder.append("&apos;");
          break;
        default:
          builder.append(c);
      }
    }
    return builder.toString();
  }

  private static void requireNotBlank(final String value, final String name) {
    if ((value == null) || value.trim().isEmpty()) {
      throw new IllegalArgumentException(name + " cannot be blank");
    }
  }

  private final String baseUrl;

  private final Clock clock;

  private final Supplier<String> requestIdGenerator;

  /**
   * Constructor that generates random request identifiers and uses the system clock.
   */
  public ValidationRequestBuilder(final URI casUrl) {
    this(casUrl, () -> "_" + UUID.randomUUID(), Clock.systemUTC());
  }

  /**
   * Constructor.
   *
   * @param casUrl
   *          the base URL of the Cerbere server including the base path
   * @param requestIdGenerator
   *          generates a new identifier for every request. SAML request identifiers cannot start
   *          with a digit.
   * @param clock
   *          the clock of the issue instants
   * @throws NullPointerException
   *           if one of the parameters is <code>null</code>
   */
  public ValidationRequestBuilder(final URI casUrl, final Supplier<String> requestIdGenerator,
      final Clock clock) {
    Objects.requireNonNull(casUrl, "casUrl cannot be null");
    String url = casUrl.getScheme() + "://" + casUrl.getRawAuthority()
        + (casUrl.getRawPath() == null ? "" : casUrl.getRawPath());
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    this.baseUrl = url;
    this.requestIdGenerator = Objects.requireNonNull(requestIdGenerator,
        "requestIdGenerator cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /**
   * Creates a validation request.
   *
   * @param ticket
   *          the service ticket sent by the server
   * @param service
   *          the absolute URL of the service the ticket was issued for
   * @return the request, never <code>null</code>
   * @throws IllegalArgumentException
   *           if the ticket or the service is blank
   */
  public ValidationRequest build(final String ticket, final String service) {
    requireNotBlank(ticket, "ticket");
    requireNotBlank(service, "service");

    String requestId = requestIdGenerator.get();
    Instant issueInstant = clock.instant().truncatedTo(ChronoUnit.MILLIS);

    URI uri = URI.create(String.format(VALIDATION_URL_TEMPLATE, baseUrl,
        URLEncoder.encode(service, StandardCharsets.UTF_8)));

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("soapaction", SOAP_ACTION);
    headers.put("content-type", "text/xml; charset=utf-8");
    headers.put("accept", "text/xml");
    headers.put("connection", "keep-alive");
    headers.put("cache-control", "no-cache");
    headers.put("pragma", "no-cache");

    String body = String.format(SOAP_ENVELOPE_TEMPLATE,
        escapeXml(requestId),
        DateTimeFormatter.ISO_INSTANT.format(issueInstant),
        escapeXml(ticket));

    return new ValidationRequest(ticket, service, requestId, issueInstant, uri, headers, body);
  }

}
