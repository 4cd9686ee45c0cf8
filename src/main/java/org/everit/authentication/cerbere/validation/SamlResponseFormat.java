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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.everit.authentication.cerbere.CasProtocolException;
import org.w3c.dom.Element;

/**
 * The SAML 1.1 response format of the <code>samlValidate</code> endpoint, a SOAP envelope that
 * contains a SAML response with an attribute assertion.
 * <p>
 * Unlike the {@link TaggedElementResponseFormat}, this format keeps a single value per attribute:
 * if an attribute name is repeated or has more values, the last value wins. The Cerbere server
 * sends every attribute with one value, the behavior is kept to stay compatible with it.
 * </p>
 */
public class SamlResponseFormat implements ResponseFormat {

  private static final String ASSERTION = "Assertion";

  private static final String ATTRIBUTE = "Attribute";

  private static final String ATTRIBUTE_NAME = "AttributeName";

  private static final String ATTRIBUTE_STATEMENT = "AttributeStatement";

  private static final String ATTRIBUTE_VALUE = "AttributeValue";

  private static final String AUTHENTICATION_STATEMENT = "AuthenticationStatement";

  private static final String ENVELOPE = "Envelope";

  private static final String NAME_IDENTIFIER = "NameIdentifier";

  private static final String STATUS = "Status";

  private static final String STATUS_CODE = "StatusCode";

  private static final String STATUS_MESSAGE = "StatusMessage";

  private static final String SUBJECT = "Subject";

  /**
   * The local part of the status code QName that means success. The prefix depends on the
   * server, for e.g. <code>samlp:Success</code> or <code>ns2:Success</code>.
   */
  private static final String SUCCESS = "Success";

  private static final String VALUE = "Value";

  private static String localPart(final String qualifiedName) {
    int colon = qualifiedName.indexOf(':');
    return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
  }

  private Map<String, List<String>> parseAttributes(final Element attributeStatement) {
    Map<String, List<String>> attributes = new LinkedHashMap<>();
    if (attributeStatement == null) {
      return attributes;
    }
    for (Element attribute : XmlElements.children(attributeStatement, ATTRIBUTE)) {
      String name = attribute.getAttribute(ATTRIBUTE_NAME);
      List<Element> values = XmlElements.children(attribute, ATTRIBUTE_VALUE);
      if (name.isEmpty() || values.isEmpty()) {
        continue;
      }
      String value = values.get(values.size() - 1).getTextContent().trim();
      attributes.put(name, Collections.singletonList(value));
    }
    return attributes;
  }

  @Override
  public ValidationResult parse(final Element root) throws CasProtocolException {
    Element response = XmlElements.path(root, "Body", "Response");
    Element statusCode = XmlElements.path(response, STATUS, STATUS_CODE);
    if (statusCode == null) {
      throw new CasProtocolException(CasProtocolException.CODE_UNRECOGNIZED_FORMAT,
          "unrecognized response format");
    }

    String status = statusCode.getAttribute(VALUE);
    if (!SUCCESS.equals(localPart(status))) {
      String message = XmlElements.text(XmlElements.path(response, STATUS, STATUS_MESSAGE));
      if (message == null) {
        message = XmlElements.text(statusCode);
      }
      return ValidationResult.failure(status, message == null ? "" : message);
    }

    Element assertion = XmlElements.child(response, ASSERTION);
    Element attributeStatement = XmlElements.child(assertion, ATTRIBUTE_STATEMENT);
    Element statement = attributeStatement;
    if (statement == null) {
      statement = XmlElements.child(assertion, AUTHENTICATION_STATEMENT);
    }
    String subjectId = XmlElements.text(XmlElements.path(statement, SUBJECT, NAME_IDENTIFIER));
    if (subjectId == null) {
      throw new CasProtocolException(CasProtocolException.CODE_MISSING_SUBJECT,
          "missing subject identifier");
    }

    return ValidationResult.success(subjectId, parseAttributes(attributeStatement));
  }

  @Override
  public boolean supports(final Element root) {
    return ENVELOPE.equals(root.getLocalName());
  }

}
