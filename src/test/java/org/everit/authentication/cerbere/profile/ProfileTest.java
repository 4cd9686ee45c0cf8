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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

public class ProfileTest {

  @Test
  public void testConstructorArgumentsAreCopied() {
    List<Profile.ContactValue> emails = new ArrayList<>();
    emails.add(new Profile.ContactValue("a@x.com", "work"));
    List<Profile.ContactValue> telephones = new ArrayList<>();
    List<Profile.Address> addresses = new ArrayList<>();
    List<Profile.Organization> organizations = new ArrayList<>();
    Map<String, String> extraFields = new HashMap<>();

    Profile profile = new Profile("Cerbere", "alice",
        new Profile.Name(null, "Alice", null, null, "Alice"), emails, telephones, addresses,
        organizations, extraFields);

    emails.add(new Profile.ContactValue("b@x.com", null));
    telephones.add(new Profile.ContactValue("0102030405", null));
    addresses.add(new Profile.Address("1 rue de la Paix", "Paris", "75002", "FR", null));
    organizations.add(new Profile.Organization("DGAC", "Direction", null));
    extraFields.put("login", "alice");

    Assert.assertEquals(Collections.singletonList(new Profile.ContactValue("a@x.com", "work")),
        profile.getEmails());
    Assert.assertTrue(profile.getTelephones().isEmpty());
    Assert.assertTrue(profile.getAddresses().isEmpty());
    Assert.assertTrue(profile.getOrganizations().isEmpty());
    Assert.assertNull(profile.getExtraField("login"));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testListsAreUnmodifiable() {
    Profile profile = new Profile("Cerbere", "alice",
        new Profile.Name(null, null, null, null, null), new ArrayList<>(), new ArrayList<>(),
        new ArrayList<>(), new ArrayList<>(), new HashMap<>());

    profile.getEmails().add(new Profile.ContactValue("b@x.com", null));
  }

}
