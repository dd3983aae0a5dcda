package com.manheim.aws;

/**
 * An error reported for a call to an AWS service, or a failure to deliver the call at all.
 *
 * @author Eric Haynes
 */
public class AwsException extends RuntimeException {
   private final String type;
   private final boolean retriable;

   public AwsException(String type, boolean retriable, String message) {
      this(type, retriable, message, null);
   }

   public AwsException(String type, boolean retriable, String message, Throwable cause) {
      super(type + ": " + message, cause);
      this.type = type;
      this.retriable = retriable;
   }

   /**
    * The error type as reported by the service, e.g. {@code com.amazon.coral.service#ThrottlingException}.
    */
   public String getType() {
      return type;
   }

   public boolean isRetriable() {
      return retriable;
   }

   /**
    * Returns 'ThrottlingException' from 'com.amazon.coral.service#ThrottlingException'.
    */
   public String simpleType() {
      int hash = type.lastIndexOf('#');
      return hash == -1 ? type : type.substring(hash + 1);
   }
}
