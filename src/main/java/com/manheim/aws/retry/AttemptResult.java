package com.manheim.aws.retry;

import com.manheim.aws.AuthorizationException;
import com.manheim.aws.AwsException;
import com.manheim.aws.credentials.Credentials;

/**
 * The outcome of an {@link Attempt}: a value, or a classified error. An authorization failure also carries the
 * credentials that were rejected, so the driver can invalidate them.
 */
public final class AttemptResult<T> {
   private final T value;
   private final AwsException error;
   private final String credentialScope;
   private final Credentials credentials;

   private AttemptResult(T value, AwsException error, String credentialScope, Credentials credentials) {
      this.value = value;
      this.error = error;
      this.credentialScope = credentialScope;
      this.credentials = credentials;
   }

   public static <T> AttemptResult<T> success(T value) {
      return new AttemptResult<>(value, null, null, null);
   }

   public static <T> AttemptResult<T> failure(AwsException error) {
      if (error == null) {
         throw new IllegalArgumentException("A failure needs an error");
      }
      return new AttemptResult<>(null, error, null, null);
   }

   /**
    * A failure of a request made with the given credentials.
    */
   public static <T> AttemptResult<T> failure(AwsException error, String credentialScope, Credentials credentials) {
      if (error == null) {
         throw new IllegalArgumentException("A failure needs an error");
      }
      return new AttemptResult<>(null, error, credentialScope, credentials);
   }

   public boolean isSuccess() {
      return error == null;
   }

   public T getValue() {
      if (error != null) {
         throw new IllegalStateException("Attempt failed", error);
      }
      return value;
   }

   public AwsException getError() {
      return error;
   }

   /**
    * True if the service rejected the credentials this attempt was made with.
    */
   public boolean isCredentialFailure() {
      return error instanceof AuthorizationException && credentials != null;
   }

   public String getCredentialScope() {
      return credentialScope;
   }

   public Credentials getCredentials() {
      return credentials;
   }
}
