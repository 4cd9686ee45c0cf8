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
package org.everit.authentication.cerbere.profile;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class AttributeNormalizerTest {

  private Map<String, List<String>> attributes;

  private PropertyMap propertyMap;

  @Before
  public void before() {
    propertyMap = PropertyMap.builder()
        .id("UTILISATEUR.ID")
        .name(new PropertyMap.NameMapping("UTILISATEUR.CIVILITE", "UTILISATEUR.PRENOM",
            "UTILISATEUR.NOM", null))
        .email("UTILISATEUR.MEL", "work")
        .email("UTILISATEUR.MEL_PERSO", "home")
        .telephone("UTILISATEUR.TEL", "work")
        .address(new PropertyMap.AddressMapping("UTILISATEUR.ADRESSE", "UTILISATEUR.VILLE",
            "UTILISATEUR.CODE_POSTAL", "UTILISATEUR.PAYS", "work"))
        .organization("UTILISATEUR.SIGLE_SERVICE", "UTILISATEUR.SERVICE", "service")
        .extraField("unite", "UTILISATEUR.UNITE")
        .build();

    attributes = new HashMap<>();
    attributes.put("UTILISATEUR.ID", Collections.singletonList("42"));
    attributes.put("UTILISATEUR.CIVILITE", Collections.singletonList("M."));
    attributes.put("UTILISATEUR.PRENOM", Collections.singletonList("Jean"));
    attributes.put("UTILISATEUR.NOM", Collections.singletonList("Dupont"));
    attributes.put("UTILISATEUR.MEL", Arrays.asList("jean@x.com", "jd@x.com"));
    attributes.put("UTILISATEUR.TEL", Collections.singletonList("0102030405"));
    attributes.put("UTILISATEUR.ADRESSE", Collections.singletonList("1 rue de Paris"));
    attributes.put("UTILISATEUR.VILLE", Collections.singletonList("Paris"));
    attributes.put("UTILISATEUR.SIGLE_SERVICE", Collections.singletonList("DSI"));
    attributes.put("UTILISATEUR.UNITE", Collections.singletonList("U1"));
    attributes.put("UTILISATEUR.SECRET", Collections.singletonList("s3cr3t"));
  }

  @Test
  public void testDeterministic() {
    AttributeNormalizer normalizer = new AttributeNormalizer(propertyMap);

    Profile first = normalizer.normalize("jean", attributes);
    Profile second = normalizer.normalize("jean", new HashMap<>(attributes));

    Assert.assertEquals(first, second);
    Assert.assertEquals(first.toString(), second.toString());
  }

  @Test
  public void testDisplayNameSkipsMissingParts() {
    attributes.remove("UTILISATEUR.CIVILITE");

    Profile profile = new AttributeNormalizer(propertyMap).normalize("jean", attributes);

    Assert.assertNull(profile.getName().getCivility());
    Assert.assertEquals("Jean Dupont", profile.getName().getDisplayName());
  }

  @Test
  public void testEmptyPropertyMap() {
    Profile profile = new AttributeNormalizer(PropertyMap.empty()).normalize("jean", attributes);

    Assert.assertEquals("Cerbere", profile.getProvider());
    Assert.assertEquals("jean", profile.getId());
    Assert.assertEquals("", profile.getName().getDisplayName());
    Assert.assertTrue(profile.getEmails().isEmpty());
    Assert.assertTrue(profile.getExtraFields().isEmpty());
  }

  @Test
  public void testIdFallsBackToSubject() {
    attributes.remove("UTILISATEUR.ID");

    Profile profile = new AttributeNormalizer(propertyMap).normalize("jean", attributes);

    Assert.assertEquals("jean", profile.getId());
  }

  @Test
  public void testConsumedAttributeIsNotReused() {
    PropertyMap sharedKey = PropertyMap.builder()
        .email("UTILISATEUR.MEL", "work")
        .extraField("mail", "UTILISATEUR.MEL")
        .build();

    Profile profile = new AttributeNormalizer(sharedKey).normalize("jean", attributes);

    Assert.assertEquals("jean@x.com", profile.getEmails().get(0).getValue());
    Assert.assertTrue(profile.getExtraFields().containsKey("mail"));
    Assert.assertNull(profile.getExtraField("mail"));
  }

  @Test
  public void testNormalize() {
    Profile profile = new AttributeNormalizer(propertyMap).normalize("jean", attributes);

    Assert.assertEquals("Cerbere", profile.getProvider());
    Assert.assertEquals("42", profile.getId());
    Assert.assertEquals(new Profile.Name("M.", "Jean", "Dupont", null, "M. Jean Dupont"),
        profile.getName());
    Assert.assertEquals(Arrays.asList(
        new Profile.ContactValue("jean@x.com", "work"),
        new Profile.ContactValue(null, "home")), profile.getEmails());
    Assert.assertEquals(Collections.singletonList(new Profile.ContactValue("0102030405", "work")),
        profile.getTelephones());
    Assert.assertEquals(Collections.singletonList(
        new Profile.Address("1 rue de Paris", "Paris", null, null, "work")),
        profile.getAddresses());
    Assert.assertEquals(Collections.singletonList(
        new Profile.Organization("DSI", null, "service")), profile.getOrganizations());
    Assert.assertEquals(Collections.singletonMap("unite", "U1"), profile.getExtraFields());
    Assert.assertFalse(profile.toString().contains("s3cr3t"));
    Assert.assertEquals(11, attributes.size());
  }

}
