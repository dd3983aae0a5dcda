package com.manheim.aws.retry;

import com.manheim.aws.AwsException;
import com.manheim.aws.credentials.CredentialInvalidator;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs an operation up to {@code maxRetries + 1} times with jittered exponential backoff. After each failed attempt
 * it sleeps a random time between 1 ms and the current ceiling, which starts at 10 ms and doubles per failure.
 *
 * <p>Attempts are strictly sequential. An instance holds the state of one call and must not be shared or reused.
 */
public class ExponentialBackoff {
   public static final long INITIAL_MAX_SLEEP_MS = 10;
   public static final long MAX_SLEEP_CEILING_MS = Long.MAX_VALUE / 2;

   private static final Log LOG = LogFactory.getLog(ExponentialBackoff.class);

   private final int maxRetries;
   private final Sleeper sleeper;
   private final Random random;
   private int tries;
   private long maxSleepMs = INITIAL_MAX_SLEEP_MS;

   public ExponentialBackoff(int maxRetries) {
      this(maxRetries, Sleeper.THREAD_SLEEPER, null);
   }

   /**
    * @param random source of jitter; null for {@link ThreadLocalRandom}
    */
   public ExponentialBackoff(int maxRetries, Sleeper sleeper, Random random) {
      if (maxRetries < 0) {
         throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
      }
      this.maxRetries = maxRetries;
      this.sleeper = sleeper;
      this.random = random;
   }

   public boolean canRetry() {
      return tries < maxRetries;
   }

   public boolean finished() {
      return tries >= maxRetries + 1;
   }

   public int getTries() {
      return tries;
   }

   public long getMaxSleepMs() {
      return maxSleepMs;
   }

   void inc() {
      tries++;
      maxSleepMs = Math.min(maxSleepMs * 2, MAX_SLEEP_CEILING_MS);
   }

   /**
    * A uniformly distributed delay in {@code [1, maxSleepMs]}.
    */
   long nextSleepMs() {
      Random source = random != null ? random : ThreadLocalRandom.current();
      return 1 + (long) (source.nextDouble() * maxSleepMs);
   }

   /**
    * Runs the attempts until one succeeds or the failure is final, and returns the successful value.
    *
    * <p>A failure caused by rejected credentials is reported to the invalidator before anything else; the next
    * attempt then runs with fresh credentials even though the error itself is not retriable. Any other failure is
    * retried only if its error is retriable.
    *
    * @throws AwsException the error of the last attempt, unchanged
    */
   public <T> T run(Attempt<T> attempt, CredentialInvalidator invalidator) {
      for (; !finished(); inc()) {
         AttemptResult<T> result = attempt.attempt(maxRetries - tries);
         if (result.isSuccess()) {
            return result.getValue();
         }

         AwsException error = result.getError();
         LOG.warn(error.getMessage());
         boolean invalidated = false;
         if (result.isCredentialFailure() && invalidator != null) {
            invalidator.credentialsInvalid(result.getCredentialScope(), result.getCredentials(), error.getMessage());
            invalidated = true;
         }
         if (!canRetry()) {
            LOG.error("No retries left, failing request after " + (tries + 1) + " attempts");
            throw error;
         }
         if (!error.isRetriable() && !invalidated) {
            throw error;
         }
         sleep(error);
      }
      // finished() can only become true through the throw above
      throw new IllegalStateException("Retry loop exited without a result");
   }

   private void sleep(AwsException lastError) {
      long sleepMs = nextSleepMs();
      if (LOG.isDebugEnabled()) {
         LOG.debug("Retrying in " + sleepMs + " ms (" + (maxRetries - tries) + " retries left)");
      }
      try {
         sleeper.sleep(sleepMs);
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw lastError;
      }
   }
}
