package com.manheim.aws;

/**
 * A request that can never succeed, rejected before anything is sent.
 */
public class PreconditionViolationException extends IllegalArgumentException {

   public PreconditionViolationException(String message) {
      super(message);
   }
}
