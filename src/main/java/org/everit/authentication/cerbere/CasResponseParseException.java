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
 * Thrown if the response of the Cerbere server is not well-formed XML. The raw response is kept
 * for diagnostics but it is never part of the message.
 */
public class CasResponseParseException extends TicketValidationException {

  private static final long serialVersionUID = -6024937462186151217L;

  private final String payload;

  public CasResponseParseException(final String message, final String payload,
      final Throwable cause) {
    super(message, cause);
    this.payload = payload;
  }

  /**
   * The raw response that could not be parsed. Must not be shown to the end user.
   */
  public String getPayload() {
    return payload;
  }

}
