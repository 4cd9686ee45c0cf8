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

import org.everit.authentication.cerbere.CasProtocolException;
import org.w3c.dom.Element;

/**
 * A wire format of the service ticket validation responses.
 */
public interface ResponseFormat {

  /**
   * Creates the validation result from the root element of a response.
   *
   * @param root
   *          the root element, for which {@link #supports(Element)} returned <code>true</code>
   * @return the result, never <code>null</code>
   * @throws CasProtocolException
   *           if the response does not contain the subject identifier or has an unexpected
   *           structure
   */
  ValidationResult parse(Element root) throws CasProtocolException;

  /**
   * Checks if the response belongs to this format.
   */
  boolean supports(Element root);

}
