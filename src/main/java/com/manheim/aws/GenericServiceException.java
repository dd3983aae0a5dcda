package com.manheim.aws;

/**
 * Any other error reported by the service.
 */
public class GenericServiceException extends AwsException {
   private final int statusCode;

   public GenericServiceException(String type, int statusCode, String message) {
      super(type, statusCode / 100 == 5, message);
      this.statusCode = statusCode;
   }

   public int getStatusCode() {
      return statusCode;
   }
}
