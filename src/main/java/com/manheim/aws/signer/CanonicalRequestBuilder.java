package com.manheim.aws.signer;

import com.manheim.aws.PreconditionViolationException;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Normalizes the parts of a request into a {@link CanonicalRequest}. Pure: no hashing of the payload and no I/O.
 *
 * @author Eric Haynes
 */
public final class CanonicalRequestBuilder {
   public static final String STREAMING_PAYLOAD = "STREAMING-AWS4-HMAC-SHA256-PAYLOAD";

   private static final String ENCODING = "UTF-8";

   private CanonicalRequestBuilder() {
   }

   /**
    * @param method      HTTP method, e.g. {@code POST}
    * @param uri         absolute path of the resource, must start with {@code /}
    * @param queryParams raw (not yet encoded) query parameters; may be empty
    * @param headers     headers to sign; names are lowercased, values are used as given
    * @param payloadHash hex SHA-256 of the body, or {@link #STREAMING_PAYLOAD}
    */
   public static CanonicalRequest build(String method, String uri, Map<String, String> queryParams,
         Map<String, String> headers, String payloadHash) {
      if (uri == null || !uri.startsWith("/")) {
         throw new PreconditionViolationException("Resource path must start with '/': " + uri);
      }
      if (payloadHash == null || payloadHash.isEmpty()) {
         throw new PreconditionViolationException("A payload hash is required");
      }
      return new CanonicalRequest(method, uri, encodedQueryParams(queryParams), sortedFormattedHeaders(headers),
            payloadHash);
   }

   static SortedMap<String, String> encodedQueryParams(Map<String, String> queryParams) {
      SortedMap<String, String> encodedParams = new TreeMap<>();
      if (queryParams != null) {
         for (Map.Entry<String, String> entry : queryParams.entrySet()) {
            encodedParams.put(encodeQueryStringValue(entry.getKey()), encodeQueryStringValue(entry.getValue()));
         }
      }
      return encodedParams;
   }

   static SortedMap<String, String> sortedFormattedHeaders(Map<String, String> headers) {
      SortedMap<String, String> sortedHeaders = new TreeMap<>();
      for (Map.Entry<String, String> header : headers.entrySet()) {
         String name = header.getKey().toLowerCase(Locale.ROOT);
         if (sortedHeaders.put(name, header.getValue()) != null) {
            throw new PreconditionViolationException("Header specified more than once: " + name);
         }
      }
      return sortedHeaders;
   }

   /**
    * RFC 3986 URI encoding, with substitution of the empty string for null values
    */
   static String encodeQueryStringValue(String s) {
      if (s == null) {
         return "";
      }
      try {
         return URLEncoder.encode(s, ENCODING)
               .replace("+", "%20")
               .replace("*", "%2A")
               .replace("%7E", "~");
      } catch (UnsupportedEncodingException e) {
         // Will never happen with "UTF-8" hardcoded.
         throw new IllegalStateException(e);
      }
   }
}
