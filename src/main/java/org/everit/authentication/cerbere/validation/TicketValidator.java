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

import java.util.Objects;

import org.everit.authentication.cerbere.CasProtocolException;
import org.everit.authentication.cerbere.TicketValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates service tickets on the Cerbere server: builds the request, sends it with the
 * {@link Transport} and parses the response.
 */
public class TicketValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TicketValidator.class);

  private final ValidationResponseParser parser;

  private final ValidationRequestBuilder requestBuilder;

  private final Transport transport;

  /**
   * Constructor.
   *
   * @throws NullPointerException
   *           if one of the parameters is <code>null</code>
   */
  public TicketValidator(final ValidationRequestBuilder requestBuilder,
      final Transport transport, final ValidationResponseParser parser) {
    this.requestBuilder = Objects.requireNonNull(requestBuilder,
        "requestBuilder cannot be null");
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.parser = Objects.requireNonNull(parser, "parser cannot be null");
  }

  /**
   * Validates a service ticket.
   *
   * @param ticket
   *          the service ticket to validate
   * @param service
   *          the service URL the ticket was issued for
   * @return the successful result with the subject identifier and its attributes
   * @throws TicketValidationException
   *           if the server cannot be reached, the response cannot be parsed or the ticket is
   *           rejected
   */
  public ValidationResult validate(final String ticket, final String service)
      throws TicketValidationException {
    ValidationRequest request = requestBuilder.build(ticket, service);
    LOGGER.debug("Validating service ticket of [" + service + "] with request ["
        + request.getRequestId() + "]");

    String response = transport.execute(request);
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Response of request [" + request.getRequestId() + "]: " + response);
    }

    ValidationResult result = parser.parse(response);
    if (!result.isSuccess()) {
      throw new CasProtocolException(result.getCode(), result.getMessage());
    }
    return result;
  }

}
