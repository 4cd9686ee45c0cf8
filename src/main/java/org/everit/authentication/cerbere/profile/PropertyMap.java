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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.everit.authentication.cerbere.CasConfigurationException;

/**
 * Maps the fields of a {@link Profile} to the attribute names sent by the Cerbere server. The
 * shape of every section is checked when the instance is created, therefore a
 * {@link PropertyMap} instance is always valid and immutable.
 * <p>
 * The nested {@link Map} form accepted by {@link #fromMap(Map)} is:
 * </p>
 *
 * <pre>
 * id            : attribute name
 * name          : {civility, givenName, familyName, middleName : attribute name}
 * emails        : [{key : attribute name, type : label}]
 * telephones    : [{key : attribute name, type : label}]
 * addresses     : [{key : {street, town, streetcode, country : attribute name}, type : label}]
 * organizations : [{key : {code, name : attribute name}, type : label}]
 * any other key : attribute name (copied to the extra fields of the profile)
 * </pre>
 */
public final class PropertyMap {

  /**
   * Attribute names of a postal address.
   */
  public static final class AddressMapping {

    private final String country;

    private final String street;

    private final String streetcode;

    private final String town;

    private final String type;

    public AddressMapping(final String street, final String town, final String streetcode,
        final String country, final String type) {
      this.street = street;
      this.town = town;
      this.streetcode = streetcode;
      this.country = country;
      this.type = type;
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

  }

  /**
   * Builder of {@link PropertyMap} instances.
   */
  public static final class Builder {

    private final List<AddressMapping> addresses = new ArrayList<>();

    private final List<TypedKey> emails = new ArrayList<>();

    private final Map<String, String> extraFields = new LinkedHashMap<>();

    private String id;

    private NameMapping name = new NameMapping(null, null, null, null);

    private final List<OrganizationMapping> organizations = new ArrayList<>();

    private final List<TypedKey> telephones = new ArrayList<>();

    private Builder() {
    }

    public Builder address(final AddressMapping address) {
      addresses.add(Objects.requireNonNull(address, "address cannot be null"));
      return this;
    }

    public PropertyMap build() {
      return new PropertyMap(this);
    }

    public Builder email(final String key, final String type) {
      emails.add(new TypedKey(key, type));
      return this;
    }

    /**
     * Copies the value of the attribute <code>key</code> to the extra field <code>field</code>
     * of the profile.
     *
     * @throws CasConfigurationException
     *           if the field name is used by the fixed part of the profile
     */
    public Builder extraField(final String field, final String key) {
      Objects.requireNonNull(field, "field cannot be null");
      if (RESERVED_FIELDS.contains(field)) {
        throw new CasConfigurationException(
            "Extra profile field [" + field + "] collides with a fixed profile field");
      }
      extraFields.put(field, key);
      return this;
    }

    public Builder id(final String id) {
      this.id = id;
      return this;
    }

    public Builder name(final NameMapping name) {
      this.name = Objects.requireNonNull(name, "name cannot be null");
      return this;
    }

    public Builder organization(final String codeKey, final String nameKey, final String type) {
      organizations.add(new OrganizationMapping(codeKey, nameKey, type));
      return this;
    }

    public Builder telephone(final String key, final String type) {
      telephones.add(new TypedKey(key, type));
      return this;
    }

  }

  /**
   * Attribute names of the parts of the name of the user.
   */
  public static final class NameMapping {

    private final String civility;

    private final String familyName;

    private final String givenName;

    private final String middleName;

    public NameMapping(final String civility, final String givenName, final String familyName,
        final String middleName) {
      this.civility = civility;
      this.givenName = givenName;
      this.familyName = familyName;
      this.middleName = middleName;
    }

    public String getCivility() {
      return civility;
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

  }

  /**
   * Attribute names of an organization the user belongs to.
   */
  public static final class OrganizationMapping {

    private final String codeKey;

    private final String nameKey;

    private final String type;

    public OrganizationMapping(final String codeKey, final String nameKey, final String type) {
      this.codeKey = codeKey;
      this.nameKey = nameKey;
      this.type = type;
    }

    public String getCodeKey() {
      return codeKey;
    }

    public String getNameKey() {
      return nameKey;
    }

    public String getType() {
      return type;
    }

  }

  /**
   * A single attribute name with a label, used by e-mails and telephones.
   */
  public static final class TypedKey {

    private final String key;

    private final String type;

    public TypedKey(final String key, final String type) {
      this.key = key;
      this.type = type;
    }

    public String getKey() {
      return key;
    }

    public String getType() {
      return type;
    }

  }

  private static final String ADDRESSES = "addresses";

  private static final String EMAILS = "emails";

  private static final String ID = "id";

  private static final String KEY = "key";

  private static final String NAME = "name";

  private static final String ORGANIZATIONS = "organizations";

  /**
   * The fields of a {@link Profile} that cannot be used as extra fields.
   */
  private static final Set<String> RESERVED_FIELDS = Collections.unmodifiableSet(
      new HashSet<>(Arrays.asList("provider", ID, NAME, EMAILS, "telephones", ADDRESSES,
          ORGANIZATIONS)));

  private static final String TELEPHONES = "telephones";

  private static final String TYPE = "type";

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a {@link PropertyMap} that maps nothing. Only the identifier of the subject is kept
   * in the profiles.
   */
  public static PropertyMap empty() {
    return new Builder().build();
  }

  private static Map<?, ?> asMap(final Object value, final String path) {
    if (!(value instanceof Map)) {
      throw new CasConfigurationException("[" + path + "] must be a map");
    }
    return (Map<?, ?>) value;
  }

  private static List<?> asList(final Object value, final String path) {
    if (!(value instanceof List)) {
      throw new CasConfigurationException("[" + path + "] must be a list");
    }
    return (List<?>) value;
  }

  private static String asString(final Object value, final String path) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw new CasConfigurationException("[" + path + "] must be a string");
    }
    return (String) value;
  }

  private static void checkKeys(final Map<?, ?> map, final String path,
      final String... allowedKeys) {
    List<String> allowed = Arrays.asList(allowedKeys);
    for (Object key : map.keySet()) {
      if (!allowed.contains(key)) {
        throw new CasConfigurationException(
            "Unknown key [" + key + "] in [" + path + "], allowed keys: " + allowed);
      }
    }
  }

  /**
   * Creates a {@link PropertyMap} from its nested {@link Map} representation. See the class
   * documentation for the expected shape.
   *
   * @param map
   *          the nested map, cannot be <code>null</code>
   * @return the validated property map
   * @throws CasConfigurationException
   *           if any section has an unexpected shape
   */
  public static PropertyMap fromMap(final Map<?, ?> map) {
    Objects.requireNonNull(map, "map cannot be null");
    Builder builder = new Builder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new CasConfigurationException(
            "Property map keys must be strings: " + entry.getKey());
      }
      String section = (String) entry.getKey();
      Object value = entry.getValue();
      switch (section) {
        case ID:
          builder.id(asString(value, ID));
          break;
        case NAME:
          builder.name(parseName(asMap(value, NAME)));
          break;
        case EMAILS:
        case TELEPHONES:
          parseTypedKeys(builder, section, asList(value, section));
          break;
        case ADDRESSES:
          parseAddresses(builder, asList(value, ADDRESSES));
          break;
        case ORGANIZATIONS:
          parseOrganizations(builder, asList(value, ORGANIZATIONS));
          break;
        default:
          builder.extraField(section, asString(value, section));
          break;
      }
    }
    return builder.build();
  }

  private static void parseAddresses(final Builder builder, final List<?> entries) {
    for (int i = 0; i < entries.size(); i++) {
      String path = ADDRESSES + "[" + i + "]";
      Map<?, ?> entry = asMap(entries.get(i), path);
      checkKeys(entry, path, KEY, TYPE);
      Map<?, ?> keys = asMap(entry.get(KEY), path + "." + KEY);
      checkKeys(keys, path + "." + KEY, "street", "town", "streetcode", "country");
      builder.address(new AddressMapping(
          asString(keys.get("street"), path + ".key.street"),
          asString(keys.get("town"), path + ".key.town"),
          asString(keys.get("streetcode"), path + ".key.streetcode"),
          asString(keys.get("country"), path + ".key.country"),
          asString(entry.get(TYPE), path + "." + TYPE)));
    }
  }

  private static NameMapping parseName(final Map<?, ?> name) {
    checkKeys(name, NAME, "civility", "givenName", "familyName", "middleName");
    return new NameMapping(
        asString(name.get("civility"), "name.civility"),
        asString(name.get("givenName"), "name.givenName"),
        asString(name.get("familyName"), "name.familyName"),
        asString(name.get("middleName"), "name.middleName"));
  }

  private static void parseOrganizations(final Builder builder, final List<?> entries) {
    for (int i = 0; i < entries.size(); i++) {
      String path = ORGANIZATIONS + "[" + i + "]";
      Map<?, ?> entry = asMap(entries.get(i), path);
      checkKeys(entry, path, KEY, TYPE);
      Map<?, ?> keys = asMap(entry.get(KEY), path + "." + KEY);
      checkKeys(keys, path + "." + KEY, "code", NAME);
      builder.organization(
          asString(keys.get("code"), path + ".key.code"),
          asString(keys.get(NAME), path + ".key.name"),
          asString(entry.get(TYPE), path + "." + TYPE));
    }
  }

  private static void parseTypedKeys(final Builder builder, final String section,
      final List<?> entries) {
    for (int i = 0; i < entries.size(); i++) {
      String path = section + "[" + i + "]";
      Map<?, ?> entry = asMap(entries.get(i), path);
      checkKeys(entry, path, KEY, TYPE);
      String key = asString(entry.get(KEY), path + "." + KEY);
      String type = asString(entry.get(TYPE), path + "." + TYPE);
      if (EMAILS.equals(section)) {
        builder.email(key, type);
      } else {
        builder.telephone(key, type);
      }
    }
  }

  private final List<AddressMapping> addresses;

  private final List<TypedKey> emails;

  private final Map<String, String> extraFields;

  private final String id;

  private final NameMapping name;

  private final List<OrganizationMapping> organizations;

  private final List<TypedKey> telephones;

  private PropertyMap(final Builder builder) {
    id = builder.id;
    name = builder.name;
    emails = Collections.unmodifiableList(new ArrayList<>(builder.emails));
    telephones = Collections.unmodifiableList(new ArrayList<>(builder.telephones));
    addresses = Collections.unmodifiableList(new ArrayList<>(builder.addresses));
    organizations = Collections.unmodifiableList(new ArrayList<>(builder.organizations));
    extraFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraFields));
  }

  public List<AddressMapping> getAddresses() {
    return addresses;
  }

  public List<TypedKey> getEmails() {
    return emails;
  }

  /**
   * The extra profile fields mapped to attribute names, in declaration order.
   */
  public Map<String, String> getExtraFields() {
    return extraFields;
  }

  public String getId() {
    return id;
  }

  public NameMapping getName() {
    return name;
  }

  public List<OrganizationMapping> getOrganizations() {
    return organizations;
  }

  public List<TypedKey> getTelephones() {
    return telephones;
  }

}
