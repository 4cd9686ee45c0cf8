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
 * Thrown if the response of the Cerbere server is well-formed but the ticket is not accepted:
 * the server reported a failure, the subject identifier is missing or the response has an
 * unknown shape.
 */
public class CasProtocolException extends TicketValidationException {

  /**
   * Code used when the success element is present but the subject identifier is empty.
   */
  public static final String CODE_MISSING_SUBJECT = "MISSING_SUBJECT";

  /**
   * Code used when the response matches none of the supported formats.
   */
  public static final String CODE_UNRECOGNIZED_FORMAT = "UNRECOGNIZED_FORMAT";

  private static final long serialVersionUID = 8152367904326880422L;

  private final String code;

  private final String reason;

  public CasProtocolException(final String code, final String reason) {
    super("Validation failed [" + code + "]: " + reason);
    this.code = code;
    this.reason = reason;
  }

  public String getCode() {
    return code;
  }

  /**
   * The message sent by the server or the description of the protocol violation, without the
   * code.
   */
  public String getReason() {
    return reason;
  }

}
