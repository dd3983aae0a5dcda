package com.manheim.aws.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manheim.aws.AwsException;
import com.manheim.aws.PreconditionViolationException;
import com.manheim.aws.TransportFailureException;
import com.manheim.aws.credentials.CredentialSource;
import com.manheim.aws.credentials.Credentials;
import com.manheim.aws.retry.Attempt;
import com.manheim.aws.retry.AttemptResult;
import com.manheim.aws.retry.ExponentialBackoff;
import com.manheim.aws.retry.Sleeper;
import com.manheim.aws.signer.CanonicalRequest;
import com.manheim.aws.signer.CanonicalRequestBuilder;
import com.manheim.aws.signer.ChunkSignatureChain;
import com.manheim.aws.signer.ChunkWriter;
import com.manheim.aws.signer.RequestSigner;
import com.manheim.aws.signer.SignableRequest;
import com.manheim.aws.signer.SigningKeyDeriver;
import com.manheim.aws.signer.SigningUtils;
import com.manheim.aws.signer.V4RequestSigner;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calls an AWS service endpoint with V4 signed requests, retrying with exponential backoff.
 *
 * <p>Every attempt fetches credentials from the {@link CredentialSource}, takes a new timestamp and signs the
 * request again; nothing signed is reused between attempts. Credentials the service rejects are reported back to
 * the source before the next attempt.
 *
 * @author Eric Haynes
 */
public class AwsClient {
   public static final String DATE_HEADER_NAME = "x-amz-date";
   public static final String HOST_HEADER_NAME = "host";
   public static final String TARGET_HEADER_NAME = "x-amz-target";
   public static final String CONTENT_TYPE_HEADER_NAME = "content-type";
   public static final String CONTENT_SHA256_HEADER_NAME = "x-amz-content-sha256";
   public static final String SESSION_TOKEN_HEADER_NAME = "x-amz-security-token";
   public static final String CONTENT_ENCODING_HEADER_NAME = "content-encoding";
   public static final String CONTENT_LENGTH_HEADER_NAME = "content-length";
   public static final String TRANSFER_ENCODING_HEADER_NAME = "transfer-encoding";
   public static final String DECODED_CONTENT_LENGTH_HEADER_NAME = "x-amz-decoded-content-length";
   public static final String STORAGE_CLASS_HEADER_NAME = "x-amz-storage-class";
   public static final String JSON_CONTENT_TYPE = "application/x-amz-json-1.1";
   public static final String AWS_CHUNKED_ENCODING = "aws-chunked";
   public static final String DEFAULT_STORAGE_CLASS = "STANDARD";

   private static final Log LOG = LogFactory.getLog(AwsClient.class);
   private static final ObjectMapper MAPPER = new ObjectMapper();
   private static final String ERROR_TYPE_HEADER_NAME = "x-amzn-ErrorType";
   private static final String UNKNOWN_ERROR_TYPE = "UnknownError";

   private final String endpoint;
   private final String region;
   private final String service;
   private final CredentialSource credentialSource;
   private final ClientConfiguration config;
   private final Transport transport;
   private final RequestSigner signer;
   private final ErrorClassifier errorClassifier;
   private final Sleeper sleeper;
   private final Date currentTime;

   public AwsClient(String endpoint, String region, String service, CredentialSource credentialSource,
         ClientConfiguration config, Transport transport) {
      this(endpoint, region, service, credentialSource, config, transport, Sleeper.THREAD_SLEEPER, null);
   }

   /**
    * Test constructor with overriden sleeping and date
    */
   AwsClient(String endpoint, String region, String service, CredentialSource credentialSource,
         ClientConfiguration config, Transport transport, Sleeper sleeper, Date currentTime) {
      this.endpoint = endpoint;
      this.region = region;
      this.service = service;
      this.credentialSource = credentialSource;
      this.config = config;
      this.transport = transport;
      this.signer = new V4RequestSigner();
      this.errorClassifier = new ErrorClassifier();
      this.sleeper = sleeper;
      this.currentTime = currentTime;
   }

   /**
    * The key credentials are cached under, {@code region/service}.
    */
   public String credentialScope() {
      return region + '/' + service;
   }

   /**
    * Invokes a JSON protocol operation, e.g. {@code DynamoDB_20120810.ListTables}.
    */
   public AwsResponse doRequest(final String operation, JsonNode request) {
      final byte[] body;
      try {
         body = MAPPER.writeValueAsBytes(request);
      } catch (JsonProcessingException e) {
         throw new IllegalArgumentException("Could not serialize request for " + operation, e);
      }
      final String payloadHash = SigningUtils.sha256Hex(body);
      return newBackoff(config.getMaxErrorRetry()).run(new Attempt<AwsResponse>() {
         @Override
         public AttemptResult<AwsResponse> attempt(int triesLeft) {
            return requestAttempt(operation, body, payloadHash);
         }
      }, credentialSource);
   }

   AttemptResult<AwsResponse> requestAttempt(String operation, byte[] body, String payloadHash) {
      String scope = credentialScope();
      Credentials credentials = credentialSource.credentials(scope);

      Map<String, String> headers = new LinkedHashMap<>();
      headers.put(HOST_HEADER_NAME, endpoint);
      headers.put(TARGET_HEADER_NAME, operation);
      headers.put(DATE_HEADER_NAME, SignableRequest.isoTimestamp(now()));
      headers.put(CONTENT_TYPE_HEADER_NAME, JSON_CONTENT_TYPE);
      headers.put(CONTENT_SHA256_HEADER_NAME, payloadHash);
      if (credentials.hasSessionToken()) {
         headers.put(SESSION_TOKEN_HEADER_NAME, credentials.getSessionToken());
      }

      CanonicalRequest canonicalRequest = CanonicalRequestBuilder.build("POST", "/",
            Collections.<String, String>emptyMap(), headers, payloadHash);
      SignableRequest signableRequest = SignableRequest.forTimestamp(headers.get(DATE_HEADER_NAME), region, service,
            canonicalRequest);
      byte[] signingKey = signingKey(credentials, signableRequest);
      String signature = signer.sign(signableRequest, signingKey).signatureHex();
      headers.put(V4RequestSigner.AUTH_HEADER_NAME, authorizationHeader(credentials, signableRequest, signature));

      try (TransportResponse response = transport.send("POST", uri("/"), headers, body)) {
         return toResult(response, scope, credentials);
      } catch (IOException e) {
         return AttemptResult.failure(new TransportFailureException(e));
      }
   }

   /**
    * Uploads a stream with the client's configured block size.
    *
    * @see #doRestUpload(String, String, Map, InputStream, long, int)
    */
   public AwsResponse doRestUpload(String method, String resource, Map<String, String> headers,
         InputStream payload, long payloadSize) {
      return doRestUpload(method, resource, headers, payload, payloadSize, config.getUploadBlockSize());
   }

   /**
    * Uploads a stream as a chunked, chunk-signed request. The stream is not closed. A retry has to resend the
    * payload from its first byte, and the stream is read one block at a time without being buffered, so failed
    * uploads are only retried for a {@link ByteArrayInputStream}, which is already in memory. Use
    * {@link #doRestUpload(String, String, Map, UploadPayload, long, int)} for payloads that can be reopened.
    */
   public AwsResponse doRestUpload(String method, String resource, Map<String, String> headers,
         InputStream payload, long payloadSize, int blockSize) {
      ChunkSignatureChain.checkBlockSize(blockSize);
      int maxRetries = config.getMaxErrorRetry();
      if (payload instanceof ByteArrayInputStream) {
         payload.mark(0);
      } else if (maxRetries > 0) {
         LOG.debug("Payload stream cannot be reopened, upload to " + resource + " will not be retried");
         maxRetries = 0;
      }
      return doRestUpload(method, resource, headers, new RewindingPayload(payload), payloadSize, blockSize,
            maxRetries);
   }

   /**
    * Uploads a payload as a chunked, chunk-signed request, opening it again for every attempt.
    */
   public AwsResponse doRestUpload(String method, String resource, Map<String, String> headers,
         UploadPayload payload, long payloadSize, int blockSize) {
      return doRestUpload(method, resource, headers, payload, payloadSize, blockSize, config.getMaxErrorRetry());
   }

   private AwsResponse doRestUpload(final String method, String resource, final Map<String, String> headers,
         final UploadPayload payload, final long payloadSize, final int blockSize, int maxRetries) {
      ChunkSignatureChain.checkBlockSize(blockSize);
      if (payloadSize < 0) {
         throw new PreconditionViolationException("Payload size must not be negative: " + payloadSize);
      }
      final String path = resource.startsWith("/") ? resource : "/" + resource;
      return newBackoff(maxRetries).run(new Attempt<AwsResponse>() {
         @Override
         public AttemptResult<AwsResponse> attempt(int triesLeft) {
            return uploadAttempt(method, path, headers, payload, payloadSize, blockSize);
         }
      }, credentialSource);
   }

   AttemptResult<AwsResponse> uploadAttempt(String method, String path, Map<String, String> headers,
         UploadPayload payload, final long payloadSize, final int blockSize) {
      String scope = credentialScope();
      Credentials credentials = credentialSource.credentials(scope);

      Map<String, String> requestHeaders = uploadHeaders(headers, payloadSize, credentials);
      CanonicalRequest canonicalRequest = CanonicalRequestBuilder.build(method, path,
            Collections.<String, String>emptyMap(), signedUploadHeaders(requestHeaders),
            CanonicalRequestBuilder.STREAMING_PAYLOAD);
      SignableRequest signableRequest = SignableRequest.forTimestamp(requestHeaders.get(DATE_HEADER_NAME), region,
            service, canonicalRequest);
      byte[] signingKey = signingKey(credentials, signableRequest);
      final ChunkSignatureChain chain = ChunkSignatureChain.start(signer, signableRequest, signingKey);
      requestHeaders.put(V4RequestSigner.AUTH_HEADER_NAME,
            authorizationHeader(credentials, signableRequest, chain.currentSignature()));

      try (InputStream in = payload.open();
           TransportResponse response = transport.sendChunked(method, uri(path), requestHeaders, new ChunkedBody() {
              @Override
              public void writeTo(ChunkWriter writer) throws IOException {
                 chain.writeChunks(in, payloadSize, blockSize, writer);
              }
           })) {
         return toResult(response, scope, credentials);
      } catch (IOException e) {
         return AttemptResult.failure(new TransportFailureException(e));
      }
   }

   /**
    * The caller's headers plus everything the aws-chunked encoding needs. Names are matched case insensitively.
    */
   Map<String, String> uploadHeaders(Map<String, String> headers, long payloadSize, Credentials credentials) {
      Map<String, String> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      result.putAll(headers);

      String contentEncoding = result.get(CONTENT_ENCODING_HEADER_NAME);
      result.put(CONTENT_ENCODING_HEADER_NAME, contentEncoding == null || contentEncoding.isEmpty()
            ? AWS_CHUNKED_ENCODING
            : AWS_CHUNKED_ENCODING + "," + contentEncoding);
      result.remove(CONTENT_LENGTH_HEADER_NAME);
      result.put(TRANSFER_ENCODING_HEADER_NAME, "chunked");
      result.put(CONTENT_SHA256_HEADER_NAME, CanonicalRequestBuilder.STREAMING_PAYLOAD);
      result.put(DECODED_CONTENT_LENGTH_HEADER_NAME, Long.toString(payloadSize));
      if (!result.containsKey(STORAGE_CLASS_HEADER_NAME)) {
         result.put(STORAGE_CLASS_HEADER_NAME, DEFAULT_STORAGE_CLASS);
      }
      result.put(DATE_HEADER_NAME, SignableRequest.isoTimestamp(now()));
      result.put(HOST_HEADER_NAME, endpoint);
      if (credentials.hasSessionToken()) {
         result.put(SESSION_TOKEN_HEADER_NAME, credentials.getSessionToken());
      }
      return result;
   }

   /**
    * Host, the encoding headers and every {@code x-amz-*} header are signed.
    */
   static Map<String, String> signedUploadHeaders(Map<String, String> requestHeaders) {
      Map<String, String> signed = new TreeMap<>();
      for (Map.Entry<String, String> header : requestHeaders.entrySet()) {
         String name = header.getKey().toLowerCase(Locale.ROOT);
         if (name.equals(HOST_HEADER_NAME) || name.equals(CONTENT_ENCODING_HEADER_NAME)
               || name.equals(TRANSFER_ENCODING_HEADER_NAME) || name.startsWith("x-amz-")) {
            signed.put(name, header.getValue());
         }
      }
      return signed;
   }

   AttemptResult<AwsResponse> toResult(TransportResponse response, String scope, Credentials credentials)
         throws IOException {
      if (response.getStatusCode() < 400) {
         return AttemptResult.success(AwsResponse.read(response));
      }
      return AttemptResult.failure(toError(response), scope, credentials);
   }

   AwsException toError(TransportResponse response) throws IOException {
      byte[] body = AwsResponse.readBody(response);
      String type = null;
      String message = "";
      try {
         JsonNode error = body.length == 0 ? null : MAPPER.readTree(body);
         if (error != null && error.isObject()) {
            type = error.path("__type").asText(null);
            message = error.has("message") ? error.path("message").asText("") : error.path("Message").asText("");
         } else {
            message = new String(body, StandardCharsets.UTF_8);
         }
      } catch (JsonProcessingException e) {
         message = new String(body, StandardCharsets.UTF_8);
      }
      if (type == null) {
         type = errorTypeHeader(response);
      }
      return errorClassifier.classify(response.getStatusCode(), type, message);
   }

   private static String errorTypeHeader(TransportResponse response) {
      String header = response.getHeaders().get(ERROR_TYPE_HEADER_NAME);
      if (header == null || header.isEmpty()) {
         return UNKNOWN_ERROR_TYPE;
      }
      int colon = header.indexOf(':');
      return colon == -1 ? header : header.substring(0, colon);
   }

   private byte[] signingKey(Credentials credentials, SignableRequest signableRequest) {
      return SigningKeyDeriver.deriveKey(credentials.getSecretKey(), signableRequest.getDateStamp(), region, service);
   }

   private String authorizationHeader(Credentials credentials, SignableRequest signableRequest, String signature) {
      return signer.formatAuthorizationHeader(credentials.getAccessKeyId(), signableRequest.credentialScope(),
            signableRequest.getCanonicalRequest().getSignedHeaders(), signature);
   }

   private ExponentialBackoff newBackoff(int maxRetries) {
      return new ExponentialBackoff(maxRetries, sleeper, null);
   }

   private URI uri(String path) {
      return URI.create("https://" + endpoint + path);
   }

   private Date now() {
      return currentTime != null ? currentTime : new Date();
   }

   /**
    * Hands out the caller's stream for every attempt and keeps it open. Later attempts reset it, which only the
    * in-memory streams that are retried at all support.
    */
   private static final class RewindingPayload implements UploadPayload {
      private final InputStream payload;
      private boolean opened;

      RewindingPayload(InputStream payload) {
         this.payload = payload;
      }

      @Override
      public InputStream open() throws IOException {
         if (opened) {
            payload.reset();
         }
         opened = true;
         return new FilterInputStream(payload) {
            @Override
            public void close() {
               // the caller owns the stream
            }
         };
      }
   }
}
