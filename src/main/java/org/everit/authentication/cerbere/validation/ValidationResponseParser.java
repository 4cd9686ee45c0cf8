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

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.everit.authentication.cerbere.CasProtocolException;
import org.everit.authentication.cerbere.CasResponseParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Parses the service ticket validation responses of the Cerbere server. The response is parsed
 * once and the {@link ResponseFormat} is selected by the root element of the document.
 */
public class ValidationResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(ValidationResponseParser.class);

  private static DocumentBuilderFactory createDocumentBuilderFactory() {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("Unable to configure DocumentBuilderFactory", e);
    }
    factory.setNamespaceAware(true);
    factory.setValidating(false);
    factory.setExpandEntityReferences(false);
    return factory;
  }

  private final DocumentBuilderFactory documentBuilderFactory;

  private final List<ResponseFormat> formats;

  /**
   * Constructor that supports the tagged-element and the SAML 1.1 formats.
   */
  public ValidationResponseParser() {
    this(Arrays.asList(new TaggedElementResponseFormat(), new SamlResponseFormat()));
  }

  public ValidationResponseParser(final List<ResponseFormat> formats) {
    this.formats = Collections.unmodifiableList(new ArrayList<>(formats));
    this.documentBuilderFactory = createDocumentBuilderFactory();
  }

  /**
   * Parses a response.
   *
   * @param payload
   *          the body of the response
   * @return the result of the validation, never <code>null</code>
   * @throws CasResponseParseException
   *           if the payload is not well-formed XML
   * @throws CasProtocolException
   *           if the response matches none of the formats or the subject identifier is missing
   */
  public ValidationResult parse(final String payload)
      throws CasResponseParseException, CasProtocolException {
    Element root = readDocument(payload).getDocumentElement();
    for (ResponseFormat format : formats) {
      if (format.supports(root)) {
        return format.parse(root);
      }
    }
    throw new CasProtocolException(CasProtocolException.CODE_UNRECOGNIZED_FORMAT,
        "unrecognized response format");
  }

  private Document readDocument(final String payload) throws CasResponseParseException {
    if (payload == null) {
      throw new CasResponseParseException("Empty response", null, null);
    }
    DocumentBuilder documentBuilder;
    try {
      documentBuilder = documentBuilderFactory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("Unable to create DocumentBuilder", e);
    }
    // the default handler does not print to stderr and fails on fatal errors
    documentBuilder.setErrorHandler(new DefaultHandler());
    try {
      return documentBuilder.parse(new InputSource(new StringReader(payload)));
    } catch (SAXException | IOException e) {
      LOGGER.trace("Unparseable response: " + payload);
      throw new CasResponseParseException("Malformed response: " + e.getMessage(), payload, e);
    }
  }

}
