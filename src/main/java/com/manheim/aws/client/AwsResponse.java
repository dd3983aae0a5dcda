package com.manheim.aws.client;

import com.amazonaws.util.IOUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * A successful response, read completely so the connection can be released right away.
 */
public class AwsResponse {
   private static final ObjectMapper MAPPER = new ObjectMapper();

   private final int statusCode;
   private final Map<String, String> headers;
   private final byte[] body;

   AwsResponse(int statusCode, Map<String, String> headers, byte[] body) {
      this.statusCode = statusCode;
      this.headers = headers;
      this.body = body;
   }

   static AwsResponse read(TransportResponse response) throws IOException {
      return new AwsResponse(response.getStatusCode(), response.getHeaders(), readBody(response));
   }

   static byte[] readBody(TransportResponse response) throws IOException {
      try (InputStream in = response.getBody()) {
         return IOUtils.toByteArray(in);
      }
   }

   public int getStatusCode() {
      return statusCode;
   }

   public Map<String, String> getHeaders() {
      return headers;
   }

   public byte[] getBody() {
      return body.clone();
   }

   /**
    * The body parsed as JSON; {@link MissingNode} if the body is empty.
    *
    * @throws IllegalStateException if the body is not JSON
    */
   public JsonNode responseBody() {
      if (body.length == 0) {
         return MissingNode.getInstance();
      }
      try {
         return MAPPER.readTree(body);
      } catch (IOException e) {
         throw new IllegalStateException("Response body is not JSON: " + toString(), e);
      }
   }

   @Override
   public String toString() {
      return new String(body, StandardCharsets.UTF_8);
   }
}
