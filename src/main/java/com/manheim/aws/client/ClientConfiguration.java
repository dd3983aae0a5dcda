package com.manheim.aws.client;

import com.manheim.aws.signer.ChunkSignatureChain;

/**
 * Configuration for AWS clients
 */
public class ClientConfiguration {
   public static final int DEFAULT_MAX_ERROR_RETRY = 3;
   public static final int DEFAULT_UPLOAD_BLOCK_SIZE = 512 * 1024;

   private int maxErrorRetry = DEFAULT_MAX_ERROR_RETRY;
   private int uploadBlockSize = DEFAULT_UPLOAD_BLOCK_SIZE;
   private int connectionTimeoutMs = 30000;
   private int socketTimeoutMs = 60000;

   /**
    * Sets how often a failed request is retried; a request is attempted at most {@code maxErrorRetry + 1} times.
    *
    * @return this configuration instance for method chaining
    */
   public ClientConfiguration withMaxErrorRetry(int maxErrorRetry) {
      if (maxErrorRetry < 0) {
         throw new IllegalArgumentException("maxErrorRetry must not be negative: " + maxErrorRetry);
      }
      this.maxErrorRetry = maxErrorRetry;
      return this;
   }

   /**
    * Sets the chunk size of streaming uploads. Must be bigger than 8KB.
    *
    * @return this configuration instance for method chaining
    */
   public ClientConfiguration withUploadBlockSize(int uploadBlockSize) {
      ChunkSignatureChain.checkBlockSize(uploadBlockSize);
      this.uploadBlockSize = uploadBlockSize;
      return this;
   }

   /**
    * Sets the connection timeout used by {@link ApacheHttpTransport}.
    *
    * @return this configuration instance for method chaining
    */
   public ClientConfiguration withConnectionTimeout(int timeoutMs) {
      this.connectionTimeoutMs = timeoutMs;
      return this;
   }

   /**
    * Sets the socket timeout used by {@link ApacheHttpTransport}.
    *
    * @return this configuration instance for method chaining
    */
   public ClientConfiguration withSocketTimeout(int timeoutMs) {
      this.socketTimeoutMs = timeoutMs;
      return this;
   }

   public int getMaxErrorRetry() {
      return maxErrorRetry;
   }

   public int getUploadBlockSize() {
      return uploadBlockSize;
   }

   public int getConnectionTimeoutMs() {
      return connectionTimeoutMs;
   }

   public int getSocketTimeoutMs() {
      return socketTimeoutMs;
   }
}
