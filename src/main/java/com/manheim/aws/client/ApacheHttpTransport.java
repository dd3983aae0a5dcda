package com.manheim.aws.client;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link Transport} on Apache HttpClient. HttpClient's own retries are disabled; retrying is left to the caller,
 * which has to re-sign every attempt.
 */
public class ApacheHttpTransport implements Transport {
   private final CloseableHttpClient httpClient;

   public ApacheHttpTransport(ClientConfiguration config) {
      this(HttpClients.custom()
            .disableAutomaticRetries()
            .setDefaultRequestConfig(RequestConfig.custom()
                  .setConnectTimeout(config.getConnectionTimeoutMs())
                  .setSocketTimeout(config.getSocketTimeoutMs())
                  .build())
            .build());
   }

   public ApacheHttpTransport(CloseableHttpClient httpClient) {
      this.httpClient = httpClient;
   }

   @Override
   public TransportResponse send(String method, URI uri, Map<String, String> headers, byte[] body)
         throws IOException {
      return execute(createRequest(method, uri, headers, body != null ? new ByteArrayEntity(body) : null));
   }

   @Override
   public TransportResponse sendChunked(String method, URI uri, Map<String, String> headers, ChunkedBody body)
         throws IOException {
      return execute(createRequest(method, uri, headers, new AwsChunkedEntity(body)));
   }

   static HttpUriRequest createRequest(String method, URI uri, Map<String, String> headers, HttpEntity entity) {
      RequestBuilder builder = RequestBuilder.create(method).setUri(uri).setEntity(entity);
      for (Map.Entry<String, String> header : headers.entrySet()) {
         // HttpClient derives these from the entity and refuses requests that already carry them
         if (HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(header.getKey())
               || HttpHeaders.TRANSFER_ENCODING.equalsIgnoreCase(header.getKey())) {
            continue;
         }
         builder.addHeader(header.getKey(), header.getValue());
      }
      return builder.build();
   }

   private TransportResponse execute(HttpUriRequest request) throws IOException {
      return new HttpClientResponse(httpClient.execute(request));
   }

   @Override
   public void close() throws IOException {
      httpClient.close();
   }

   private static final class HttpClientResponse implements TransportResponse {
      private final CloseableHttpResponse response;
      private final Map<String, String> headers;

      HttpClientResponse(CloseableHttpResponse response) {
         this.response = response;
         Map<String, String> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
         for (Header header : response.getAllHeaders()) {
            result.put(header.getName(), header.getValue());
         }
         this.headers = Collections.unmodifiableMap(result);
      }

      @Override
      public int getStatusCode() {
         return response.getStatusLine().getStatusCode();
      }

      @Override
      public Map<String, String> getHeaders() {
         return headers;
      }

      @Override
      public InputStream getBody() throws IOException {
         HttpEntity entity = response.getEntity();
         return entity != null ? entity.getContent() : new ByteArrayInputStream(new byte[0]);
      }

      @Override
      public void close() throws IOException {
         response.close();
      }
   }
}
