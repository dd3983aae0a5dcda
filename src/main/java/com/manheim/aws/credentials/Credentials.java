package com.manheim.aws.credentials;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSSessionCredentials;

/**
 * An immutable snapshot of AWS credentials. The version identifies the snapshot within the
 * {@link CredentialSource} that issued it, so an invalidation can tell a stale snapshot from a fresh one.
 */
public final class Credentials {
   private final String accessKeyId;
   private final String secretKey;
   private final String sessionToken;
   private final long version;

   public Credentials(String accessKeyId, String secretKey, String sessionToken, long version) {
      if (accessKeyId == null || secretKey == null) {
         throw new IllegalArgumentException("Access key id and secret key are required");
      }
      this.accessKeyId = accessKeyId;
      this.secretKey = secretKey;
      this.sessionToken = sessionToken;
      this.version = version;
   }

   public static Credentials from(AWSCredentials credentials, long version) {
      String sessionToken = credentials instanceof AWSSessionCredentials
            ? ((AWSSessionCredentials) credentials).getSessionToken()
            : null;
      return new Credentials(credentials.getAWSAccessKeyId(), credentials.getAWSSecretKey(), sessionToken, version);
   }

   public String getAccessKeyId() {
      return accessKeyId;
   }

   public String getSecretKey() {
      return secretKey;
   }

   /**
    * @return the session token of temporary credentials, null for permanent ones
    */
   public String getSessionToken() {
      return sessionToken;
   }

   public boolean hasSessionToken() {
      return sessionToken != null && !sessionToken.isEmpty();
   }

   public long getVersion() {
      return version;
   }

   @Override
   public String toString() {
      return "Credentials[" + accessKeyId + ", version " + version + "]";
   }
}
