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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.everit.authentication.cerbere.CasProtocolException;
import org.w3c.dom.Element;

/**
 * The CAS 2.0 / 3.0 response format where the result is carried by tagged elements:
 *
 * <pre>
 * &lt;cas:serviceResponse xmlns:cas="http://www.yale.edu/tp/cas"&gt;
 *   &lt;cas:authenticationSuccess&gt;
 *     &lt;cas:user&gt;alice&lt;/cas:user&gt;
 *     &lt;cas:attributes&gt;
 *       &lt;cas:mail&gt;a@x.com&lt;/cas:mail&gt;
 *     &lt;/cas:attributes&gt;
 *   &lt;/cas:authenticationSuccess&gt;
 * &lt;/cas:serviceResponse&gt;
 * </pre>
 * <p>
 * Attribute names are the lower-cased local names of the elements. Repeated elements are
 * accumulated, therefore an attribute can have multiple values.
 * </p>
 */
public class TaggedElementResponseFormat implements ResponseFormat {

  /**
   * The element that contains the attributes of the authenticated user.
   */
  private static final String ATTRIBUTES = "attributes";

  /**
   * The element name in the failed service ticket validation response that contains the message
   * why the authentication failed.
   */
  private static final String AUTHENTICATION_FAILURE = "authenticationFailure";

  private static final String AUTHENTICATION_SUCCESS = "authenticationSuccess";

  private static final String CODE = "code";

  private static final String SERVICE_RESPONSE = "serviceResponse";

  /**
   * The element name in the successful service ticket validation response that contains the
   * name/principal of the authenticated user.
   */
  private static final String USER = "user";

  @Override
  public ValidationResult parse(final Element root) throws CasProtocolException {
    Element success = XmlElements.child(root, AUTHENTICATION_SUCCESS);
    if (success != null) {
      String user = XmlElements.text(XmlElements.child(success, USER));
      if (user == null) {
        throw new CasProtocolException(CasProtocolException.CODE_MISSING_SUBJECT,
            "missing subject identifier");
      }
      return ValidationResult.success(user, parseAttributes(success));
    }

    Element failure = XmlElements.child(root, AUTHENTICATION_FAILURE);
    if (failure != null) {
      String message = XmlElements.text(failure);
      return ValidationResult.failure(failure.getAttribute(CODE),
          message == null ? "" : message);
    }

    throw new CasProtocolException(CasProtocolException.CODE_UNRECOGNIZED_FORMAT,
        "unrecognized response format");
  }

  private Map<String, List<String>> parseAttributes(final Element success) {
    Map<String, List<String>> attributes = new LinkedHashMap<>();
    Element attributesElement = XmlElements.child(success, ATTRIBUTES);
    if (attributesElement == null) {
      return attributes;
    }
    for (Element attribute : XmlElements.children(attributesElement)) {
      String key = attribute.getLocalName().toLowerCase(Locale.ROOT);
      String value = attribute.getTextContent().trim();
      attributes.computeIfAbsent(key, (k) -> new ArrayList<>()).add(value);
    }
    return attributes;
  }

  @Override
  public boolean supports(final Element root) {
    return SERVICE_RESPONSE.equals(root.getLocalName());
  }

}
