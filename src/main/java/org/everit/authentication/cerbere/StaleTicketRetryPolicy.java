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

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a failed service ticket validation is retried. A common cause of failures is
 * an old <code>ticket</code> left in the query string after the session times out and the user
 * refreshes the page. Such requests are redirected once to the same URL without the ticket, so
 * the user gets a new ticket from the server.
 * <p>
 * The redirect URL carries the current one minute time window in the
 * {@value CerbereAuthenticationConstants#REQ_PARAM_RETRY} parameter. If a request that already
 * carries the current window fails again, the failure is final.
 * </p>
 */
public class StaleTicketRetryPolicy {

  private static final Pattern RETRY_PATTERN = Pattern.compile(
      "([?&])" + CerbereAuthenticationConstants.REQ_PARAM_RETRY + "=[^&#]*&?");

  private static final Pattern TICKET_PATTERN = Pattern.compile(
      "([?&])" + CerbereAuthenticationConstants.REQ_PARAM_TICKET + "=[^&#]*");

  /**
   * The length of a retry window in milliseconds.
   */
  public static final long WINDOW_MILLIS = 60_000L;

  private final Clock clock;

  public StaleTicketRetryPolicy() {
    this(Clock.systemUTC());
  }

  public StaleTicketRetryPolicy(final Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /**
   * Returns the token of the current time window.
   */
  public long currentToken() {
    return Math.floorDiv(clock.millis(), WINDOW_MILLIS);
  }

  /**
   * Computes the URL where a failed request is redirected.
   *
   * @param requestUrl
   *          the path and query string of the failed request
   * @param retryMarker
   *          the value of the {@value CerbereAuthenticationConstants#REQ_PARAM_RETRY} parameter of
   *          the failed request, <code>null</code> if the request is not a retry
   * @return the URL without the ticket and with the marker of the current window, or
   *         {@link Optional#empty()} if the request has already been retried in the current
   *         window
   */
  public Optional<String> retryUrl(final String requestUrl, final String retryMarker) {
    Objects.requireNonNull(requestUrl, "requestUrl cannot be null");
    String token = String.valueOf(currentToken());
    if ((retryMarker != null) && token.equals(retryMarker.trim())) {
      return Optional.empty();
    }

    String url = RETRY_PATTERN.matcher(requestUrl).replaceAll("$1");
    if (url.endsWith("?") || url.endsWith("&")) {
      url = url.substring(0, url.length() - 1);
    }

    String marker = CerbereAuthenticationConstants.REQ_PARAM_RETRY + "=" + token;
    Matcher ticketMatcher = TICKET_PATTERN.matcher(url);
    if (ticketMatcher.find()) {
      url = ticketMatcher.replaceFirst("$1" + marker);
    } else {
      url = url + (url.indexOf('?') < 0 ? "?" : "&") + marker;
    }
    return Optional.of(url);
  }

}
