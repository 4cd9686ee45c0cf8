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

import org.everit.authentication.cerbere.CasTransportException;

/**
 * Sends a {@link ValidationRequest} to the Cerbere server.
 */
public interface Transport {

  /**
   * Executes the exchange and returns the body of the response.
   *
   * @param request
   *          the request to send
   * @return the body of the response, never <code>null</code>
   * @throws CasTransportException
   *           if the server cannot be reached, the exchange times out or the response is larger
   *           than the allowed size
   */
  String execute(ValidationRequest request) throws CasTransportException;

}
