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

/**
 * Property names and default values of the Cerbere authentication configuration.
 */
public final class CerbereAuthenticationConstants {

  public static final String PROP_CAS_URL = "cas.url";

  public static final String PROP_SERVICE_URL = "service.url";

  public static final String PROP_PROPERTY_MAP = "property.map";

  public static final String PROP_PASS_REQ_TO_CALLBACK = "pass.req.to.callback";

  public static final String PROP_FAILURE_URL = "failure.url";

  public static final String PROP_MAX_RESPONSE_SIZE = "max.response.size";

  public static final int DEFAULT_MAX_RESPONSE_SIZE = 1_000_000;

  public static final String PROP_CONNECT_TIMEOUT = "connect.timeout";

  public static final int DEFAULT_CONNECT_TIMEOUT = 5000;

  public static final String PROP_READ_TIMEOUT = "read.timeout";

  public static final int DEFAULT_READ_TIMEOUT = 5000;

  /**
   * The maximum time in milliseconds between sending a validation request and reading the last
   * byte of its response.
   */
  public static final String PROP_RESPONSE_TIMEOUT = "response.timeout";

  public static final int DEFAULT_RESPONSE_TIMEOUT = 10000;

  /**
   * The request parameter that carries the service ticket sent by the Cerbere server.
   */
  public static final String REQ_PARAM_TICKET = "ticket";

  /**
   * The request parameter that marks a request as already retried in a time window.
   */
  public static final String REQ_PARAM_RETRY = "_cas_retry";

  /**
   * The name of the strategy and the value of the {@code provider} field of the profiles.
   */
  public static final String PROVIDER = "Cerbere";

  public static final String STRATEGY_NAME = "cerbere";

  private CerbereAuthenticationConstants() {
  }

}
