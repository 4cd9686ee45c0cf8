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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The normalized user profile built from the attributes of a validated service ticket. Instances
 * are immutable.
 */
public final class Profile {

  /**
   * A postal address.
   */
  public static final class Address {

    private final String country;

    private final String street;

    private final String streetcode;

    private final String town;

    private final String type;

    public Address(final String street, final String town, final String streetcode,
        final String country, final String type) {
      this.street = street;
      this.town = town;
      this.streetcode = streetcode;
      this.country = country;
      this.type = type;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Address)) {
        return false;
      }
      Address other = (Address) obj;
      return Objects.equals(street, other.street) && Objects.equals(town, other.town)
          && Objects.equals(streetcode, other.streetcode)
          && Objects.equals(country, other.country) && Objects.equals(type, other.type);
    }

    public String getCountry() {
      return country;
    }

    public String getStreet() {
      return street;
    }

    public String getStreetcode() {
      return streetcode;
    }

    public String getTown() {
      return town;
    }

    public String getType() {
      return type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(street, town, streetcode, country, type);
    }

    @Override
    public String toString() {
      return "Address [street=" + street + ", town=" + town + ", streetcode=" + streetcode
          + ", country=" + country + ", type=" + type + "]";
    }

  }

  /**
   * A labeled contact value, for e.g. an e-mail address or a telephone number.
   */
  public static final class ContactValue {

    private final String type;

    private final String value;

    public ContactValue(final String value, final String type) {
      this.value = value;
      this.type = type;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof ContactValue)) {
        return false;
      }
      ContactValue other = (ContactValue) obj;
      return Objects.equals(value, other.value) && Objects.equals(type, other.type);
    }

    public String getType() {
      return type;
    }

    public String getValue() {
      return value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, type);
    }

    @Override
    public String toString() {
      return "ContactValue [value=" + value + ", type=" + type + "]";
    }

  }

  /**
   * The name of the user.
   */
  public static final class Name {

    private final String civility;

    private final String displayName;

    private final String familyName;

    private final String givenName;

    private final String middleName;

    public Name(final String civility, final String givenName, final String familyName,
        final String middleName, final String displayName) {
      this.civility = civility;
      this.givenName = givenName;
      this.familyName = familyName;
      this.middleName = middleName;
      this.displayName = displayName;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Name)) {
        return false;
      }
      Name other = (Name) obj;
      return Objects.equals(civility, other.civility)
          && Objects.equals(givenName, other.givenName)
          && Objects.equals(familyName, other.familyName)
          && Objects.equals(middleName, other.middleName)
          && Objects.equals(displayName, other.displayName);
    }

    public String getCivility() {
      return civility;
    }

    public String getDisplayName() {
      return displayName;
    }

    public String getFamilyName() {
      return familyName;
    }

    public String getGivenName() {
      return givenName;
    }

    public String getMiddleName() {
      return middleName;
    }

    @Override
    public int hashCode() {
      return Objects.hash(civility, givenName, familyName, middleName, displayName);
    }

    @Override
    public String toString() {
      return "Name [civility=" + civility + ", givenName=" + givenName + ", familyName="
          + familyName + ", middleName=" + middleName + ", displayName=" + displayName + "]";
    }

  }

  /**
   * An organization the user belongs to.
   */
  public static final class Organization {

    private final String code;

    private final String name;

    private final String type;

    public Organization(final String code, final String name, final String type) {
      this.code = code;
      this.name = name;
      this.type = type;
    }

    @Override
    public boolean equals(final Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Organization)) {
        return false;
      }
      Organization other = (Organization) obj;
      return Objects.equals(code, other.code) && Objects.equals(name, other.name)
          && Objects.equals(type, other.type);
    }

    public String getCode() {
      return code;
    }

    public String getName() {
      return name;
    }

    public String getType() {
      return type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(code, name, type);
    }

    @Override
    public String toString() {
      return "Organization [code=" + code + ", name=" + name + ", type=" + type + "]";
    }

  }

  private final List<Address> addresses;

  private final List<ContactValue> emails;

  private final Map<String, String> extraFields;

  private final String id;

  private final Name name;

  private final List<Organization> organizations;

  private final String provider;

  private final List<ContactValue> telephones;

  /**
   * Constructor.
   *
   * @throws NullPointerException
   *           if the provider, the name or one of the lists is <code>null</code>
   */
  public Profile(final String provider, final String id, final Name name,
      final List<ContactValue> emails, final List<ContactValue> telephones,
      final List<Address> addresses, final List<Organization> organizations,
      final Map<String, String> extraFields) {
    this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    this.id = id;
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.emails = Collections.unmodifiableList(new ArrayList<>(
        Objects.requireNonNull(emails, "emails cannot be null")));
    this.telephones = Collections.unmodifiableList(new ArrayList<>(
        Objects.requireNonNull(telephones, "telephones cannot be null")));
    this.addresses = Collections.unmodifiableList(new ArrayList<>(
        Objects.requireNonNull(addresses, "addresses cannot be null")));
    this.organizations = Collections.unmodifiableList(new ArrayList<>(
        Objects.requireNonNull(organizations, "organizations cannot be null")));
    this.extraFields = Collections.unmodifiableMap(new LinkedHashMap<>(
        Objects.requireNonNull(extraFields, "extraFields cannot be null")));
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Profile)) {
      return false;
    }
    Profile other = (Profile) obj;
    return provider.equals(other.provider) && Objects.equals(id, other.id)
        && name.equals(other.name) && emails.equals(other.emails)
        && telephones.equals(other.telephones) && addresses.equals(other.addresses)
        && organizations.equals(other.organizations) && extraFields.equals(other.extraFields);
  }

  public List<Address> getAddresses() {
    return addresses;
  }

  public List<ContactValue> getEmails() {
    return emails;
  }

  /**
   * Returns the value of an extra field declared in the {@link PropertyMap}.
   */
  public String getExtraField(final String field) {
    return extraFields.get(field);
  }

  /**
   * The extra fields declared in the {@link PropertyMap}, in declaration order. A field is
   * present with a <code>null</code> value if the server did not send the mapped attribute.
   */
  public Map<String, String> getExtraFields() {
    return extraFields;
  }

  public String getId() {
    return id;
  }

  public Name getName() {
    return name;
  }

  public List<Organization> getOrganizations() {
    return organizations;
  }

  public String getProvider() {
    return provider;
  }

  public List<ContactValue> getTelephones() {
    return telephones;
  }

  @Override
  public int hashCode() {
    return Objects.hash(provider, id, name, emails, telephones, addresses, organizations,
        extraFields);
  }

  @Override
  public String toString() {
    return "Profile [provider=" + provider + ", id=" + id + ", name=" + name + ", emails="
        + emails + ", telephones=" + telephones + ", addresses=" + addresses
        + ", organizations=" + organizations + ", extraFields=" + extraFields + "]";
  }

}
