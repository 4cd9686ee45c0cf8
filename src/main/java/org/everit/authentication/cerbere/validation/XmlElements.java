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
import java.util.List;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * DOM navigation helpers that match elements by local name, ignoring namespaces and prefixes.
 */
final class XmlElements {

  static Element child(final Element parent, final String localName) {
    if (parent == null) {
      return null;
    }
    Node node = parent.getFirstChild();
    while (node != null) {
      if ((node.getNodeType() == Node.ELEMENT_NODE) && localName.equals(node.getLocalName())) {
        return (Element) node;
      }
      node = node.getNextSibling();
    }
    return null;
  }

  static List<Element> children(final Element parent) {
    List<Element> result = new ArrayList<>();
    Node node = parent.getFirstChild();
    while (node != null) {
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        result.add((Element) node);
      }
      node = node.getNextSibling();
    }
    return result;
  }

  static List<Element> children(final Element parent, final String localName) {
    List<Element> result = new ArrayList<>();
    for (Element child : children(parent)) {
      if (localName.equals(child.getLocalName())) {
        result.add(child);
      }
    }
    return result;
  }

  /**
   * Descends along the given local names, returns <code>null</code> if one of them is missing.
   */
  static Element path(final Element root, final String... localNames) {
    Element current = root;
    for (String localName : localNames) {
      current = child(current, localName);
      if (current == null) {
        return null;
      }
    }
    return current;
  }

  /**
   * Returns the trimmed text content of the element or <code>null</code> if the element is
   * <code>null</code> or has no text.
   */
  static String text(final Element element) {
    if (element == null) {
      return null;
    }
    String text = element.getTextContent();
    if (text == null) {
      return null;
    }
    text = text.trim();
    return text.isEmpty() ? null : text;
  }

  private XmlElements() {
  }

}
