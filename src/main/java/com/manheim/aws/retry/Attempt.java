package com.manheim.aws.retry;

/**
 * One try of an operation driven by {@link ExponentialBackoff}.
 */
public interface Attempt<T> {

   /**
    * @param triesLeft how many more attempts follow this one if it fails retriably
    */
   AttemptResult<T> attempt(int triesLeft);
}
