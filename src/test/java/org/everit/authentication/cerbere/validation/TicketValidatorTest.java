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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.everit.authentication.cerbere.CasProtocolException;
import org.everit.authentication.cerbere.CasResponseParseException;
import org.everit.authentication.cerbere.CasTransportException;
import org.everit.authentication.cerbere.TicketValidationException;
import org.junit.Assert;
import org.junit.Test;

public class TicketValidatorTest {

  private final List<ValidationRequest> sentRequests = new ArrayList<>();

  private TicketValidator createValidator(final String response) {
    return new TicketValidator(
        new ValidationRequestBuilder(URI.create("https://cerbere.example.com/cas/public")),
        (request) -> {
          sentRequests.add(request);
          return response;
        },
        new ValidationResponseParser());
  }

  @Test
  public void testFailureResultBecomesProtocolException() throws TicketValidationException {
    TicketValidator validator = createValidator(
        "<cas:serviceResponse xmlns:cas=\"http://www.yale.edu/tp/cas\">"
            + "<cas:authenticationFailure code=\"INVALID_TICKET\">ticket expired"
            + "</cas:authenticationFailure></cas:serviceResponse>");

    try {
      validator.validate("ST-1", "https://app.example.com/");
      Assert.fail();
    } catch (CasProtocolException e) {
      Assert.assertEquals("INVALID_TICKET", e.getCode());
      Assert.assertEquals("ticket expired", e.getReason());
      Assert.assertEquals("Validation failed [INVALID_TICKET]: ticket expired", e.getMessage());
    }
  }

  @Test(expected = CasResponseParseException.class)
  public void testMalformedResponse() throws TicketValidationException {
    createValidator("<oops").validate("ST-1", "https://app.example.com/");
  }

  @Test
  public void testSuccess() throws TicketValidationException {
    TicketValidator validator = createValidator(
        "<cas:serviceResponse xmlns:cas=\"http://www.yale.edu/tp/cas\">"
            + "<cas:authenticationSuccess><cas:user>alice</cas:user>"
            + "<cas:attributes><cas:mail>a@x.com</cas:mail></cas:attributes>"
            + "</cas:authenticationSuccess></cas:serviceResponse>");

    ValidationResult result = validator.validate("ST-1", "https://app.example.com/");

    Assert.assertEquals("alice", result.getSubjectId());
    Assert.assertEquals(Collections.singletonList("a@x.com"), result.getAttributes().get("mail"));
    Assert.assertEquals(1, sentRequests.size());
    Assert.assertEquals("ST-1", sentRequests.get(0).getTicket());
    Assert.assertEquals("https://app.example.com/", sentRequests.get(0).getService());
  }

  @Test
  public void testTransportErrorIsPropagated() {
    TicketValidator validator = new TicketValidator(
        new ValidationRequestBuilder(URI.create("https://cerbere.example.com/cas/public")),
        (request) -> {
          throw new CasTransportException("Connection refused");
        },
        new ValidationResponseParser());

    try {
      validator.validate("ST-1", "https://app.example.com/");
      Assert.fail();
    } catch (CasTransportException e) {
      Assert.assertEquals("Connection refused", e.getMessage());
    } catch (TicketValidationException e) {
      Assert.fail(e.getMessage());
    }
  }

}
