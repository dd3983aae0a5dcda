package com.manheim.aws.client;

import com.manheim.aws.AuthorizationException;
import com.manheim.aws.AwsException;
import com.manheim.aws.GenericServiceException;

/**
 * Turns an error response into a typed exception. This is the only place that looks at status codes; everything
 * above it only sees {@link AwsException#isRetriable()}.
 */
public class ErrorClassifier {
   public static final String EXCEPTION_PREFIX = "com.amazon.coral.service#";
   public static final String UNRECOGNIZED_CLIENT = "UnrecognizedClientException";
   public static final String INVALID_SIGNATURE = "InvalidSignatureException";

   public AwsException classify(int httpStatus, String errorType, String message) {
      if (httpStatus < 400) {
         throw new IllegalArgumentException("Status " + httpStatus + " is not an error");
      }
      if (isAuthorizationError(errorType)) {
         return new AuthorizationException(errorType, message);
      }
      return new GenericServiceException(errorType, httpStatus, message);
   }

   boolean isAuthorizationError(String errorType) {
      return (EXCEPTION_PREFIX + UNRECOGNIZED_CLIENT).equals(errorType)
            || (EXCEPTION_PREFIX + INVALID_SIGNATURE).equals(errorType)
            || UNRECOGNIZED_CLIENT.equals(errorType)
            || INVALID_SIGNATURE.equals(errorType);
   }
}
