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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.everit.authentication.cerbere.profile.PropertyMap;
import org.junit.Assert;
import org.junit.Test;

public class CerbereConfigurationTest {

  private static void assertInvalidCasUrl(final String casUrl, final String messagePart) {
    try {
      CerbereConfiguration.builder().casUrl(casUrl).serviceUrl("https://www.example.com/")
          .build();
      Assert.fail(casUrl);
    } catch (CasConfigurationException e) {
      Assert.assertTrue(e.getMessage(), e.getMessage().contains(messagePart));
    }
  }

  @Test
  public void testBuilderDefaults() {
    CerbereConfiguration configuration = CerbereConfiguration.builder()
        .casUrl("https://www.example.com/cas/public")
        .serviceUrl("https://www.example.com/")
        .build();

    Assert.assertEquals("www.example.com", configuration.getCasUrl().getHost());
    Assert.assertEquals("/cas/public", configuration.getCasUrl().getPath());
    Assert.assertEquals(1_000_000, configuration.getMaxResponseSize());
    Assert.assertEquals(5000, configuration.getConnectTimeout());
    Assert.assertEquals(5000, configuration.getReadTimeout());
    Assert.assertEquals(10000, configuration.getResponseTimeout());
    Assert.assertFalse(configuration.isPassReqToCallback());
    Assert.assertNull(configuration.getFailureUrl());
    Assert.assertTrue(configuration.getPropertyMap().getExtraFields().isEmpty());
  }

  @Test
  public void testFromProperties() {
    Map<String, Object> properties = new HashMap<>();
    properties.put(CerbereAuthenticationConstants.PROP_CAS_URL,
        "https://www.example.com/cas/public");
    properties.put(CerbereAuthenticationConstants.PROP_SERVICE_URL, "https://www.example.com/");
    properties.put(CerbereAuthenticationConstants.PROP_PASS_REQ_TO_CALLBACK, "true");
    properties.put(CerbereAuthenticationConstants.PROP_MAX_RESPONSE_SIZE, 2048);
    properties.put(CerbereAuthenticationConstants.PROP_READ_TIMEOUT, "1500");
    properties.put(CerbereAuthenticationConstants.PROP_RESPONSE_TIMEOUT, 15000L);
    properties.put(CerbereAuthenticationConstants.PROP_FAILURE_URL, "/failed.html");
    properties.put(CerbereAuthenticationConstants.PROP_PROPERTY_MAP,
        Collections.singletonMap("id", "UTILISATEUR.ID"));

    CerbereConfiguration configuration = CerbereConfiguration.fromProperties(properties);

    Assert.assertTrue(configuration.isPassReqToCallback());
    Assert.assertEquals(2048, configuration.getMaxResponseSize());
    Assert.assertEquals(1500, configuration.getReadTimeout());
    Assert.assertEquals(15000, configuration.getResponseTimeout());
    Assert.assertEquals("/failed.html", configuration.getFailureUrl());
    Assert.assertEquals("UTILISATEUR.ID", configuration.getPropertyMap().getId());
  }

  @Test
  public void testFromPropertiesWithInvalidNumber() {
    Map<String, Object> properties = new HashMap<>();
    properties.put(CerbereAuthenticationConstants.PROP_CAS_URL,
        "https://www.example.com/cas/public");
    properties.put(CerbereAuthenticationConstants.PROP_SERVICE_URL, "https://www.example.com/");
    properties.put(CerbereAuthenticationConstants.PROP_CONNECT_TIMEOUT, "soon");

    try {
      CerbereConfiguration.fromProperties(properties);
      Assert.fail();
    } catch (CasConfigurationException e) {
      Assert.assertTrue(e.getMessage().contains("[connect.timeout] must be an integer"));
    }
  }

  @Test
  public void testInvalidCasUrls() {
    assertInvalidCasUrl(null, "[cas.url] missing");
    assertInvalidCasUrl(" ", "[cas.url] missing");
    assertInvalidCasUrl("http://www.example.com/cas/public", "only https");
    assertInvalidCasUrl("www.example.com/cas/public", "only https");
    assertInvalidCasUrl("https:///cas/public", "must be a valid url");
    assertInvalidCasUrl("https://www.exa mple.com/", "must be a valid url");
  }

  @Test
  public void testInvalidLimits() {
    try {
      CerbereConfiguration.builder().casUrl("https://www.example.com/cas/public")
          .serviceUrl("https://www.example.com/").maxResponseSize(0).build();
      Assert.fail();
    } catch (CasConfigurationException e) {
      Assert.assertTrue(e.getMessage().contains("[max.response.size] must be positive"));
    }
    try {
      CerbereConfiguration.builder().casUrl("https://www.example.com/cas/public")
          .serviceUrl("https://www.example.com/").responseTimeout(-1).build();
      Assert.fail();
    } catch (CasConfigurationException e) {
      Assert.assertTrue(e.getMessage().contains("[response.timeout] must be positive"));
    }
  }

  @Test
  public void testMissingServiceUrl() {
    try {
      CerbereConfiguration.builder().casUrl("https://www.example.com/cas/public")
          .propertyMap(PropertyMap.empty()).build();
      Assert.fail();
    } catch (CasConfigurationException e) {
      Assert.assertTrue(e.getMessage().contains("[service.url] missing"));
    }
  }

}
