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
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A service ticket validation request ready to be sent to the Cerbere server. Instances are
 * created by the {@link ValidationRequestBuilder}.
 */
public final class ValidationRequest {

  private final String body;

  private final Map<String, String> headers;

  private final Instant issueInstant;

  private final String requestId;

  private final String service;

  private final String ticket;

  private final URI uri;

  ValidationRequest(final String ticket, final String service, final String requestId,
      final Instant issueInstant, final URI uri, final Map<String, String> headers,
      final String body) {
    this.ticket = Objects.requireNonNull(ticket, "ticket cannot be null");
    this.service = Objects.requireNonNull(service, "service cannot be null");
    this.requestId = Objects.requireNonNull(requestId, "requestId cannot be null");
    this.issueInstant = Objects.requireNonNull(issueInstant, "issueInstant cannot be null");
    this.uri = Objects.requireNonNull(uri, "uri cannot be null");
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.body = Objects.requireNonNull(body, "body cannot be null");
  }

  /**
   * The SOAP envelope posted to the server.
   */
  public String getBody() {
    return body;
  }

  /**
   * The HTTP headers of the request, in sending order.
   */
  public Map<String, String> getHeaders() {
    return headers;
  }

  public Instant getIssueInstant() {
    return issueInstant;
  }

  public String getMethod() {
    return "POST";
  }

  public String getRequestId() {
    return requestId;
  }

  public String getService() {
    return service;
  }

  public String getTicket() {
    return ticket;
  }

  public URI getUri() {
    return uri;
  }

  @Override
  public String toString() {
    return "ValidationRequest [requestId=" + requestId + ", uri=" + uri + "]";
  }

}
