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
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

public class ValidationRequestBuilderTest {

  private static final URI CAS_URL = URI.create("https://cerbere.example.com/cas/public");

  private static int countOccurrences(final String text, final String part) {
    int count = 0;
    int index = text.indexOf(part);
    while (index >= 0) {
      count++;
      index = text.indexOf(part, index + part.length());
    }
    return count;
  }

  @Test
  public void testBlankTicketIsRejected() {
    ValidationRequestBuilder builder = new ValidationRequestBuilder(CAS_URL);
    try {
      builder.build("  ", "https://app.example.com/");
      Assert.fail();
    } catch (IllegalArgumentException e) {
      Assert.assertEquals("ticket cannot be blank", e.getMessage());
    }
  }

  @Test
  public void testBodyContainsTicketOnceAndFreshRequestIds() {
    ValidationRequestBuilder builder = new ValidationRequestBuilder(CAS_URL);

    ValidationRequest first = builder.build("ST-1-abcdef-cas", "https://app.example.com/");
    ValidationRequest second = builder.build("ST-1-abcdef-cas", "https://app.example.com/");

    Assert.assertEquals(1, countOccurrences(first.getBody(), "ST-1-abcdef-cas"));
    Assert.assertNotEquals(first.getRequestId(), second.getRequestId());
    Assert.assertTrue(first.getBody().contains("RequestID=\"" + first.getRequestId() + "\""));
    Assert.assertTrue(first.getRequestId().startsWith("_"));
  }

  @Test
  public void testRequestShape() {
    AtomicInteger sequence = new AtomicInteger();
    Clock clock = Clock.fixed(Instant.parse("2020-03-04T05:06:07.890123Z"), ZoneOffset.UTC);
    ValidationRequestBuilder builder = new ValidationRequestBuilder(
        URI.create("https://cerbere.example.com/cas/public/"),
        () -> "_id" + sequence.incrementAndGet(), clock);

    ValidationRequest request = builder.build("ST-42", "https://app.example.com/page?a=b");

    Assert.assertEquals("POST", request.getMethod());
    Assert.assertEquals(
        "https://cerbere.example.com/cas/public/samlValidate"
            + "?TARGET=https%3A%2F%2Fapp.example.com%2Fpage%3Fa%3Db",
        request.getUri().toString());
    Assert.assertEquals("_id1", request.getRequestId());
    Assert.assertEquals(Instant.parse("2020-03-04T05:06:07.890Z"), request.getIssueInstant());
    Assert.assertEquals("http://www.oasis-open.org/committees/security",
        request.getHeaders().get("soapaction"));
    Assert.assertEquals("text/xml; charset=utf-8", request.getHeaders().get("content-type"));
    Assert.assertEquals("text/xml", request.getHeaders().get("accept"));
    Assert.assertEquals("keep-alive", request.getHeaders().get("connection"));
    Assert.assertEquals("no-cache", request.getHeaders().get("cache-control"));
    Assert.assertEquals("no-cache", request.getHeaders().get("pragma"));
    Assert.assertEquals(
        "<SOAP-ENV:Envelope xmlns:SOAP-ENV=\"http://schemas.xmlsoap.org/soap/envelope/\">"
            + "<SOAP-ENV:Header/><SOAP-ENV:Body>"
            + "<samlp:Request xmlns:samlp=\"urn:oasis:names:tc:SAML:1.0:protocol\""
            + " MajorVersion=\"1\" MinorVersion=\"1\" RequestID=\"_id1\""
            + " IssueInstant=\"2020-03-04T05:06:07.890Z\">"
            + "<samlp:AssertionArtifact>ST-42</samlp:AssertionArtifact>"
            + "</samlp:Request></SOAP-ENV:Body></SOAP-ENV:Envelope>",
        request.getBody());
  }

  @Test
  public void testTicketIsXmlEscaped() {
    ValidationRequestBuilder builder = new ValidationRequestBuilder(CAS_URL);

    ValidationRequest request = builder.build(
        "ST-1</samlp:AssertionArtifact><evil a='1'>&", "https://app.example.com/");

    Assert.assertTrue(request.getBody().contains(
        "<samlp:AssertionArtifact>ST-1&lt;/samlp:AssertionArtifact&gt;&lt;evil a=&apos;1&apos;&gt;"
            + "&amp;</samlp:AssertionArtifact>"));
    Assert.assertEquals("ST-1</samlp:AssertionArtifact><evil a='1'>&", request.getTicket());
  }

}
