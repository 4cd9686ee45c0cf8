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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.everit.authentication.cerbere.CasTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} implementation based on Apache HttpClient. The size of the accepted response
 * is limited: the connection is aborted as soon as the response exceeds the limit.
 * <p>
 * The socket timeout only bounds the inactivity between two packets. The response timeout bounds
 * the whole exchange: the body is not read further once it has passed since the request was
 * sent. As a blocked read is not interrupted, the exchange can take at most the response timeout
 * plus one socket timeout.
 * </p>
 */
public class HttpClientTransport implements Transport, Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientTransport.class);

  private static CloseableHttpClient createHttpClient(final int connectTimeout,
      final int readTimeout) {
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectTimeout(connectTimeout)
        .setConnectionRequestTimeout(connectTimeout)
        .setSocketTimeout(readTimeout)
        .build();
    return HttpClientBuilder.create()
        .setDefaultRequestConfig(requestConfig)
        .disableRedirectHandling()
        .build();
  }

  private final CloseableHttpClient httpClient;

  private final int maxResponseSize;

  private final int responseTimeout;

  /**
   * Constructor.
   *
   * @param httpClient
   *          the client that executes the requests. Closed together with this transport.
   * @param maxResponseSize
   *          the maximum number of bytes accepted in a response body
   * @param responseTimeout
   *          the maximum duration of an exchange in milliseconds
   */
  public HttpClientTransport(final CloseableHttpClient httpClient, final int maxResponseSize,
      final int responseTimeout) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
    if (maxResponseSize <= 0) {
      throw new IllegalArgumentException("maxResponseSize must be positive");
    }
    if (responseTimeout <= 0) {
      throw new IllegalArgumentException("responseTimeout must be positive");
    }
    this.maxResponseSize = maxResponseSize;
    this.responseTimeout = responseTimeout;
  }

  /**
   * Constructor that creates its own {@link CloseableHttpClient}.
   *
   * @param connectTimeout
   *          the connect timeout in milliseconds
   * @param readTimeout
   *          the maximum inactivity between two data packets in milliseconds
   * @param responseTimeout
   *          the maximum duration of an exchange in milliseconds
   * @param maxResponseSize
   *          the maximum number of bytes accepted in a response body
   */
  public HttpClientTransport(final int connectTimeout, final int readTimeout,
      final int responseTimeout, final int maxResponseSize) {
    this(createHttpClient(connectTimeout, readTimeout), maxResponseSize, responseTimeout);
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }

  @Override
  public String execute(final ValidationRequest request) throws CasTransportException {
    HttpPost httpPost = new HttpPost(request.getUri());
    for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
      httpPost.setHeader(header.getKey(), header.getValue());
    }
    httpPost.setEntity(new StringEntity(request.getBody(), StandardCharsets.UTF_8));

    long startNanos = System.nanoTime();
    try (CloseableHttpResponse response = httpClient.execute(httpPost)) {
      LOGGER.debug("Request [" + request.getRequestId() + "] answered with status "
          + response.getStatusLine());
      HttpEntity entity = response.getEntity();
      if (entity == null) {
        return "";
      }
      if (entity.getContentLength() > maxResponseSize) {
        httpPost.abort();
        throw oversized();
      }
      return readBody(httpPost, entity, startNanos);
    } catch (IOException e) {
      httpPost.abort();
      throw new CasTransportException("Unable to reach the Cerbere server at ["
          + request.getUri().getHost() + "]: " + e.getMessage(), e);
    }
  }

  private CasTransportException oversized() {
    return new CasTransportException(
        "Response of the Cerbere server exceeds " + maxResponseSize + " bytes");
  }

  private String readBody(final HttpPost httpPost, final HttpEntity entity,
      final long startNanos) throws IOException, CasTransportException {
    Charset charset = StandardCharsets.UTF_8;
    ContentType contentType = ContentType.get(entity);
    if ((contentType != null) && (contentType.getCharset() != null)) {
      charset = contentType.getCharset();
    }

    try (InputStream inputStream = new DeadlineInputStream(entity.getContent(), startNanos,
        responseTimeout)) {
      byte[] bytes;
      try {
        // one byte over the limit is enough to detect the overflow
        bytes = IOUtils.toByteArray(new BoundedInputStream(inputStream, maxResponseSize + 1L));
      } catch (IOException e) {
        // closing the stream would consume the rest of the response
        httpPost.abort();
        throw e;
      }
      if (bytes.length > maxResponseSize) {
        httpPost.abort();
        throw oversized();
      }
      return new String(bytes, charset);
    }
  }

}
