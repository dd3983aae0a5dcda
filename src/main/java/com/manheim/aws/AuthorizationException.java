package com.manheim.aws;

/**
 * Thrown when the service rejects the signature or the credentials it was made with. Never retriable on its own;
 * a retry only makes sense after the credentials have been invalidated.
 */
public class AuthorizationException extends AwsException {

   public AuthorizationException(String type, String message) {
      super(type, false, message);
   }
}
