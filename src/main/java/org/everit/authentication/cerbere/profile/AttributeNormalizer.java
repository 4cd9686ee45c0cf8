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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import org.everit.authentication.cerbere.CerbereAuthenticationConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Profile} from the attributes of a validated service ticket based on a
 * {@link PropertyMap}.
 * <p>
 * Every attribute is consumed by the first section that reads it. The attributes that are not
 * referenced by the {@link PropertyMap} are dropped, they never reach the profile.
 * </p>
 * <p>
 * Instances hold no state besides the immutable {@link PropertyMap}, therefore they can be used
 * by concurrent validations.
 * </p>
 */
public class AttributeNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AttributeNormalizer.class);

  /**
   * Joins the non-empty parts with a single space.
   */
  private static String joinDisplayName(final String... parts) {
    StringBuilder builder = new StringBuilder();
    for (String part : parts) {
      if ((part == null) || part.trim().isEmpty()) {
        continue;
      }
      if (builder.length() > 0) {
        builder.append(' ');
      }
      builder.append(part.trim());
    }
    return builder.toString();
  }

  /**
   * Removes the attribute from the working copy and returns its first value.
   */
  private static String take(final Map<String, List<String>> attributes, final String key) {
    if (key == null) {
      return null;
    }
    List<String> values = attributes.remove(key);
    if ((values == null) || values.isEmpty()) {
      return null;
    }
    return values.get(0);
  }

  private final PropertyMap propertyMap;

  public AttributeNormalizer(final PropertyMap propertyMap) {
    this.propertyMap = Objects.requireNonNull(propertyMap, "propertyMap cannot be null");
  }

  /**
   * Creates the profile of a subject.
   *
   * @param subjectId
   *          the identifier of the subject returned by the server, used as profile id if the
   *          {@link PropertyMap} does not map the id or the attribute is missing
   * @param attributes
   *          the attributes of the subject, cannot be <code>null</code>. Not modified.
   * @return the profile, never <code>null</code>
   */
  public Profile normalize(final String subjectId, final Map<String, List<String>> attributes) {
    Objects.requireNonNull(attributes, "attributes cannot be null");
    Map<String, List<String>> remaining = new HashMap<>(attributes);

    String id = take(remaining, propertyMap.getId());
    if (id == null) {
      id = subjectId;
    }

    PropertyMap.NameMapping nameMapping = propertyMap.getName();
    String civility = take(remaining, nameMapping.getCivility());
    String givenName = take(remaining, nameMapping.getGivenName());
    String familyName = take(remaining, nameMapping.getFamilyName());
    String middleName = take(remaining, nameMapping.getMiddleName());
    Profile.Name name = new Profile.Name(civility, givenName, familyName, middleName,
        joinDisplayName(civility, givenName, familyName));

    List<Profile.ContactValue> emails = new ArrayList<>();
    for (PropertyMap.TypedKey email : propertyMap.getEmails()) {
      emails.add(new Profile.ContactValue(take(remaining, email.getKey()), email.getType()));
    }

    List<Profile.ContactValue> telephones = new ArrayList<>();
    for (PropertyMap.TypedKey telephone : propertyMap.getTelephones()) {
      telephones.add(
          new Profile.ContactValue(take(remaining, telephone.getKey()), telephone.getType()));
    }

    List<Profile.Address> addresses = new ArrayList<>();
    for (PropertyMap.AddressMapping address : propertyMap.getAddresses()) {
      addresses.add(new Profile.Address(
          take(remaining, address.getStreet()),
          take(remaining, address.getTown()),
          take(remaining, address.getStreetcode()),
          take(remaining, address.getCountry()),
          address.getType()));
    }

    List<Profile.Organization> organizations = new ArrayList<>();
    for (PropertyMap.OrganizationMapping organization : propertyMap.getOrganizations()) {
      organizations.add(new Profile.Organization(
          take(remaining, organization.getCodeKey()),
          take(remaining, organization.getNameKey()),
          organization.getType()));
    }

    Map<String, String> extraFields = new LinkedHashMap<>();
    for (Map.Entry<String, String> extraField : propertyMap.getExtraFields().entrySet()) {
      extraFields.put(extraField.getKey(), take(remaining, extraField.getValue()));
    }

    if (!remaining.isEmpty() && LOGGER.isDebugEnabled()) {
      LOGGER.debug("Dropping unmapped attributes of [" + subjectId + "]: "
          + new TreeSet<>(remaining.keySet()));
    }

    return new Profile(CerbereAuthenticationConstants.PROVIDER, id, name, emails, telephones,
        addresses, organizations, extraFields);
  }

}
