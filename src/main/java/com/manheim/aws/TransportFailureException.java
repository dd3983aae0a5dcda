package com.manheim.aws;

import java.io.IOException;

/**
 * The request never produced a response: connection, TLS or stream failure.
 */
public class TransportFailureException extends AwsException {
   public static final String TYPE = "TransportFailure";

   public TransportFailureException(IOException cause) {
      super(TYPE, true, cause.getClass().getName() + ": " + cause.getMessage(), cause);
   }
}
