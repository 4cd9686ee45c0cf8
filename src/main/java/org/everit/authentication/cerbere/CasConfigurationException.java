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
 * Thrown when the configuration of the Cerbere client is invalid. This error is fatal, the
 * client cannot be constructed.
 */
public class CasConfigurationException extends RuntimeException {

  private static final long serialVersionUID = -1846359215047416802L;

  public CasConfigurationException(final String message) {
    super(message);
  }

  public CasConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
