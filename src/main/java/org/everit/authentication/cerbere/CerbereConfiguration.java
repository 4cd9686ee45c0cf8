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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Objects;

import org.everit.authentication.cerbere.profile.PropertyMap;

/**
 * The immutable configuration of a Cerbere client instance. The values are checked when the
 * instance is built, an invalid configuration is never created.
 */
public final class CerbereConfiguration {

  /**
   * Builder of {@link CerbereConfiguration} instances.
   */
  public static final class Builder {

    private String casUrl;

    private int connectTimeout = CerbereAuthenticationConstants.DEFAULT_CONNECT_TIMEOUT;

    private String failureUrl;

    private int maxResponseSize = CerbereAuthenticationConstants.DEFAULT_MAX_RESPONSE_SIZE;

    private boolean passReqToCallback;

    private PropertyMap propertyMap = PropertyMap.empty();

    private int readTimeout = CerbereAuthenticationConstants.DEFAULT_READ_TIMEOUT;

    private int responseTimeout = CerbereAuthenticationConstants.DEFAULT_RESPONSE_TIMEOUT;

    private String serviceUrl;

    private Builder() {
    }

    /**
     * Creates the configuration.
     *
     * @throws CasConfigurationException
     *           if a required value is missing or a value is invalid
     */
    public CerbereConfiguration build() {
      return new CerbereConfiguration(this);
    }

    /**
     * The full URL of the Cerbere server including the base path, for e.g.:
     * https://authentification.din.developpement-durable.gouv.fr/cas/public.
     */
    public Builder casUrl(final String casUrl) {
      this.casUrl = casUrl;
      return this;
    }

    public Builder connectTimeout(final int connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * The URL where the user is redirected if the authentication fails. If not set, the failure
     * is answered with 401.
     */
    public Builder failureUrl(final String failureUrl) {
      this.failureUrl = failureUrl;
      return this;
    }

    public Builder maxResponseSize(final int maxResponseSize) {
      this.maxResponseSize = maxResponseSize;
      return this;
    }

    /**
     * If <code>true</code>, the HTTP request is passed to the verify callback.
     */
    public Builder passReqToCallback(final boolean passReqToCallback) {
      this.passReqToCallback = passReqToCallback;
      return this;
    }

    public Builder propertyMap(final PropertyMap propertyMap) {
      this.propertyMap = Objects.requireNonNull(propertyMap, "propertyMap cannot be null");
      return this;
    }

    public Builder readTimeout(final int readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    /**
     * The overall deadline of a validation in milliseconds. The read timeout only bounds the
     * inactivity between two packets, this one bounds the whole exchange.
     */
    public Builder responseTimeout(final int responseTimeout) {
      this.responseTimeout = responseTimeout;
      return this;
    }

    /**
     * The URL of the application. Used as return URL when the user logs out.
     */
    public Builder serviceUrl(final String serviceUrl) {
      this.serviceUrl = serviceUrl;
      return this;
    }

  }

  public static Builder builder() {
    return new Builder();
  }

  private static boolean getBooleanProperty(final Map<String, ?> properties,
      final String propertyName) {
    Object value = properties.get(propertyName);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return Boolean.parseBoolean(String.valueOf(value).trim());
  }

  private static int getIntProperty(final Map<String, ?> properties, final String propertyName,
      final int defaultValue) {
    Object value = properties.get(propertyName);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new CasConfigurationException(
          "Property [" + propertyName + "] must be an integer: " + value, e);
    }
  }

  private static String getStringProperty(final Map<String, ?> properties,
      final String propertyName) {
    Object value = properties.get(propertyName);
    if (value == null) {
      return null;
    }
    return String.valueOf(value);
  }

  /**
   * Creates a configuration from properties named by the <code>PROP_*</code> constants of
   * {@link CerbereAuthenticationConstants}. The property map can be given as a
   * {@link PropertyMap} or as its nested {@link Map} form.
   *
   * @throws CasConfigurationException
   *           if a required property is missing or a property is invalid
   */
  public static CerbereConfiguration fromProperties(final Map<String, ?> properties) {
    Objects.requireNonNull(properties, "properties cannot be null");
    Builder builder = builder()
        .casUrl(getStringProperty(properties, CerbereAuthenticationConstants.PROP_CAS_URL))
        .serviceUrl(
            getStringProperty(properties, CerbereAuthenticationConstants.PROP_SERVICE_URL))
        .failureUrl(
            getStringProperty(properties, CerbereAuthenticationConstants.PROP_FAILURE_URL))
        .passReqToCallback(getBooleanProperty(properties,
            CerbereAuthenticationConstants.PROP_PASS_REQ_TO_CALLBACK))
        .maxResponseSize(getIntProperty(properties,
            CerbereAuthenticationConstants.PROP_MAX_RESPONSE_SIZE,
            CerbereAuthenticationConstants.DEFAULT_MAX_RESPONSE_SIZE))
        .connectTimeout(getIntProperty(properties,
            CerbereAuthenticationConstants.PROP_CONNECT_TIMEOUT,
            CerbereAuthenticationConstants.DEFAULT_CONNECT_TIMEOUT))
        .readTimeout(getIntProperty(properties,
            CerbereAuthenticationConstants.PROP_READ_TIMEOUT,
            CerbereAuthenticationConstants.DEFAULT_READ_TIMEOUT))
        .responseTimeout(getIntProperty(properties,
            CerbereAuthenticationConstants.PROP_RESPONSE_TIMEOUT,
            CerbereAuthenticationConstants.DEFAULT_RESPONSE_TIMEOUT));

    Object propertyMap = properties.get(CerbereAuthenticationConstants.PROP_PROPERTY_MAP);
    if (propertyMap instanceof PropertyMap) {
      builder.propertyMap((PropertyMap) propertyMap);
    } else if (propertyMap instanceof Map) {
      builder.propertyMap(PropertyMap.fromMap((Map<?, ?>) propertyMap));
    } else if (propertyMap != null) {
      throw new CasConfigurationException("Property ["
          + CerbereAuthenticationConstants.PROP_PROPERTY_MAP + "] must be a map");
    }
    return builder.build();
  }

  private static URI parseCasUrl(final String casUrl) {
    if ((casUrl == null) || casUrl.trim().isEmpty()) {
      throw new CasConfigurationException("Required Cerbere option ["
          + CerbereAuthenticationConstants.PROP_CAS_URL + "] missing");
    }
    URI uri;
    try {
      uri = new URI(casUrl.trim());
    } catch (URISyntaxException e) {
      throw new CasConfigurationException("Option [" + CerbereAuthenticationConstants.PROP_CAS_URL
          + "] must be a valid url like: https://cerbere.example.com/cas/public", e);
    }
    if (!"https".equalsIgnoreCase(uri.getScheme())) {
      throw new CasConfigurationException("Cerbere url supports only https protocol");
    }
    if ((uri.getHost() == null) || uri.getHost().isEmpty()) {
      throw new CasConfigurationException("Option [" + CerbereAuthenticationConstants.PROP_CAS_URL
          + "] must be a valid url like: https://cerbere.example.com/cas/public");
    }
    return uri;
  }

  private static int requirePositive(final int value, final String propertyName) {
    if (value <= 0) {
      throw new CasConfigurationException(
          "Property [" + propertyName + "] must be positive: " + value);
    }
    return value;
  }

  private final URI casUrl;

  private final int connectTimeout;

  private final String failureUrl;

  private final int maxResponseSize;

  private final boolean passReqToCallback;

  private final PropertyMap propertyMap;

  private final int readTimeout;

  private final int responseTimeout;

  private final String serviceUrl;

  private CerbereConfiguration(final Builder builder) {
    casUrl = parseCasUrl(builder.casUrl);
    if ((builder.serviceUrl == null) || builder.serviceUrl.trim().isEmpty()) {
      throw new CasConfigurationException("Required Cerbere option ["
          + CerbereAuthenticationConstants.PROP_SERVICE_URL + "] missing");
    }
    serviceUrl = builder.serviceUrl.trim();
    propertyMap = builder.propertyMap;
    passReqToCallback = builder.passReqToCallback;
    failureUrl = builder.failureUrl;
    maxResponseSize = requirePositive(builder.maxResponseSize,
        CerbereAuthenticationConstants.PROP_MAX_RESPONSE_SIZE);
    connectTimeout = requirePositive(builder.connectTimeout,
        CerbereAuthenticationConstants.PROP_CONNECT_TIMEOUT);
    readTimeout = requirePositive(builder.readTimeout,
        CerbereAuthenticationConstants.PROP_READ_TIMEOUT);
    responseTimeout = requirePositive(builder.responseTimeout,
        CerbereAuthenticationConstants.PROP_RESPONSE_TIMEOUT);
  }

  public URI getCasUrl() {
    return casUrl;
  }

  public int getConnectTimeout() {
    return connectTimeout;
  }

  public String getFailureUrl() {
    return failureUrl;
  }

  public int getMaxResponseSize() {
    return maxResponseSize;
  }

  public PropertyMap getPropertyMap() {
    return propertyMap;
  }

  public int getReadTimeout() {
    return readTimeout;
  }

  public int getResponseTimeout() {
    return responseTimeout;
  }

  public String getServiceUrl() {
    return serviceUrl;
  }

  public boolean isPassReqToCallback() {
    return passReqToCallback;
  }

}
