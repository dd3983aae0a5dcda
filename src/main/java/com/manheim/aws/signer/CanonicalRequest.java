package com.manheim.aws.signer;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The canonical form of an HTTP request that V4 signatures are computed over. Built by
 * {@link CanonicalRequestBuilder}; immutable.
 *
 * @see <a href="http://docs.aws.amazon.com/general/latest/gr/sigv4-create-canonical-request.html">Canonical request</a>
 */
public final class CanonicalRequest {
   private final String method;
   private final String uri;
   private final SortedMap<String, String> queryParams;
   private final SortedMap<String, String> headers;
   private final String payloadHash;

   CanonicalRequest(String method, String uri, SortedMap<String, String> queryParams,
         SortedMap<String, String> headers, String payloadHash) {
      this.method = method;
      this.uri = uri;
      this.queryParams = Collections.unmodifiableSortedMap(new TreeMap<>(queryParams));
      this.headers = Collections.unmodifiableSortedMap(new TreeMap<>(headers));
      this.payloadHash = payloadHash;
   }

   public String getMethod() {
      return method;
   }

   public String getUri() {
      return uri;
   }

   /**
    * Query parameters, already RFC 3986 encoded and sorted by encoded key.
    */
   public SortedMap<String, String> getQueryParams() {
      return queryParams;
   }

   /**
    * Lowercase header names to verbatim values, sorted by name.
    */
   public SortedMap<String, String> getHeaders() {
      return headers;
   }

   public String getPayloadHash() {
      return payloadHash;
   }

   /**
    * The sorted, semicolon separated names of every canonical header. This is the only source the
    * {@code SignedHeaders} part of the authorization header may be built from.
    */
   public String getSignedHeaders() {
      return addSignedHeaders(new StringBuilder()).toString();
   }

   public String toCanonicalString() {
      StringBuilder result = new StringBuilder();
      result.append(method).append('\n').append(uri).append('\n');
      addCanonicalQueryString(result).append('\n');
      addCanonicalHeaders(result).append('\n');
      addSignedHeaders(result).append('\n');
      return result.append(payloadHash).toString();
   }

   StringBuilder addCanonicalQueryString(StringBuilder builder) {
      int startingLength = builder.length();
      for (Map.Entry<String, String> entry : queryParams.entrySet()) {
         if (builder.length() > startingLength) {
            builder.append('&');
         }
         builder.append(entry.getKey()).append('=').append(entry.getValue());
      }
      return builder;
   }

   StringBuilder addCanonicalHeaders(StringBuilder builder) {
      for (Map.Entry<String, String> entry : headers.entrySet()) {
         builder.append(entry.getKey()).append(':').append(entry.getValue()).append('\n');
      }
      return builder;
   }

   StringBuilder addSignedHeaders(StringBuilder builder) {
      int startingLength = builder.length();
      for (String headerName : headers.keySet()) {
         if (builder.length() > startingLength) {
            builder.append(';');
         }
         builder.append(headerName);
      }
      return builder;
   }

   @Override
   public String toString() {
      return toCanonicalString();
   }
}
