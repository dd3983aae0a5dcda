package com.manheim.aws.retry;

import com.manheim.aws.AuthorizationException;
import com.manheim.aws.AwsException;
import com.manheim.aws.GenericServiceException;
import com.manheim.aws.TransportFailureException;
import com.manheim.aws.credentials.CredentialInvalidator;
import com.manheim.aws.credentials.Credentials;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class ExponentialBackoffTest {
   private static final String SCOPE = "us-east-1/dynamodb";

   private RecordingSleeper sleeper;
   private CredentialInvalidator invalidator;
   private Credentials credentials;

   @Before
   public final void before() {
      sleeper = new RecordingSleeper();
      invalidator = mock(CredentialInvalidator.class);
      credentials = new Credentials("AKIDEXAMPLE", "secret", null, 1);
   }

   @After
   public final void after() {
      // clear the flag a test may have left set
      Thread.interrupted();
   }

   @Test
   public final void returnsFirstSuccess() {
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.success("done"));

      assertEquals("done", backoff(3).run(attempt, invalidator));
      assertEquals(1, attempt.calls);
      assertTrue(sleeper.sleeps.isEmpty());
   }

   @Test
   public final void makesAtMostMaxRetriesPlusOneAttempts() {
      AwsException error = serverError();
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(error));

      try {
         backoff(3).run(attempt, invalidator);
         fail("Expected the last error");
      } catch (AwsException e) {
         assertSame(error, e);
      }
      assertEquals(4, attempt.calls);
      assertEquals(Arrays.asList(3, 2, 1, 0), attempt.triesLeft);
      assertEquals(3, sleeper.sleeps.size());
   }

   @Test
   public final void zeroRetriesMeansOneAttempt() {
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(serverError()));
      try {
         backoff(0).run(attempt, invalidator);
         fail("Expected the error");
      } catch (GenericServiceException expected) {
         assertEquals(1, attempt.calls);
         assertTrue(sleeper.sleeps.isEmpty());
      }
   }

   @Test
   public final void sleepCeilingStartsAtTenAndDoubles() {
      ExponentialBackoff backoff = backoff(5);
      assertEquals(10, backoff.getMaxSleepMs());
      for (int k = 1; k <= 5; k++) {
         backoff.inc();
         assertEquals(10L << k, backoff.getMaxSleepMs());
         assertEquals(k, backoff.getTries());
      }
   }

   @Test
   public final void sleepsStayWithinJitteredCeiling() {
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(serverError()));
      try {
         backoff(6).run(attempt, invalidator);
         fail("Expected the error");
      } catch (GenericServiceException expected) {
         assertEquals(6, sleeper.sleeps.size());
         for (int k = 0; k < sleeper.sleeps.size(); k++) {
            long sleep = sleeper.sleeps.get(k);
            assertTrue("sleep " + sleep + " after attempt " + k, sleep >= 1 && sleep <= (10L << k));
         }
      }
   }

   @Test
   public final void jitterCoversWholeRange() {
      ExponentialBackoff backoff = backoff(0);
      boolean sawMin = false;
      boolean sawMax = false;
      for (int i = 0; i < 10000; i++) {
         long sleep = backoff.nextSleepMs();
         assertTrue(sleep >= 1 && sleep <= 10);
         sawMin |= sleep == 1;
         sawMax |= sleep == 10;
      }
      assertTrue(sawMin && sawMax);
   }

   @Test
   public final void retriesRetriableErrorUntilSuccess() {
      CountingAttempt<String> attempt = new CountingAttempt<>(
            AttemptResult.<String>failure(serverError()),
            AttemptResult.<String>failure(new TransportFailureException(new IOException("connection reset"))),
            AttemptResult.success("done"));

      assertEquals("done", backoff(3).run(attempt, invalidator));
      assertEquals(3, attempt.calls);
      assertEquals(2, sleeper.sleeps.size());
   }

   @Test
   public final void nonRetriableErrorIsThrownImmediately() {
      AwsException error = new GenericServiceException("com.amazon.coral.validate#ValidationException", 400, "bad");
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(error, SCOPE, credentials));

      try {
         backoff(3).run(attempt, invalidator);
         fail("Expected the error");
      } catch (AwsException e) {
         assertSame(error, e);
      }
      assertEquals(1, attempt.calls);
      assertTrue(sleeper.sleeps.isEmpty());
      verify(invalidator, never()).credentialsInvalid(anyString(), any(Credentials.class), anyString());
   }

   @Test
   public final void authorizationFailureInvalidatesCredentialsAndRetries() {
      AuthorizationException error = authorizationError();
      CountingAttempt<String> attempt = new CountingAttempt<>(
            AttemptResult.<String>failure(error, SCOPE, credentials),
            AttemptResult.success("done"));

      assertEquals("done", backoff(3).run(attempt, invalidator));
      verify(invalidator).credentialsInvalid(SCOPE, credentials, error.getMessage());
      assertEquals(2, attempt.calls);
   }

   @Test
   public final void authorizationFailureInvalidatesBeforeGivingUp() {
      AuthorizationException error = authorizationError();
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(error, SCOPE, credentials));

      try {
         backoff(0).run(attempt, invalidator);
         fail("Expected the error");
      } catch (AuthorizationException e) {
         assertSame(error, e);
      }
      verify(invalidator).credentialsInvalid(SCOPE, credentials, error.getMessage());
   }

   @Test
   public final void authorizationFailureWithoutInvalidatorIsFinal() {
      AuthorizationException error = authorizationError();
      CountingAttempt<String> attempt = new CountingAttempt<>(AttemptResult.<String>failure(error, SCOPE, credentials));

      try {
         backoff(3).run(attempt, null);
         fail("Expected the error");
      } catch (AuthorizationException e) {
         assertSame(error, e);
      }
      assertEquals(1, attempt.calls);
   }

   @Test
   public final void interruptedSleepThrowsLastError() {
      AwsException error = serverError();
      ExponentialBackoff backoff = new ExponentialBackoff(3, new Sleeper() {
         @Override
         public void sleep(long millis) throws InterruptedException {
            throw new InterruptedException();
         }
      }, new Random(1));

      try {
         backoff.run(new CountingAttempt<>(AttemptResult.<String>failure(error)), invalidator);
         fail("Expected the error");
      } catch (AwsException e) {
         assertSame(error, e);
         assertTrue(Thread.currentThread().isInterrupted());
      }
   }

   @Test
   public final void sleepCeilingIsCappedInsteadOfOverflowing() {
      ExponentialBackoff backoff = backoff(100);
      for (int k = 0; k < 100; k++) {
         backoff.inc();
         assertTrue(backoff.getMaxSleepMs() > 0);
         assertTrue(backoff.nextSleepMs() >= 1);
      }
      assertEquals(ExponentialBackoff.MAX_SLEEP_CEILING_MS, backoff.getMaxSleepMs());
   }

   @Test(expected = IllegalArgumentException.class)
   public final void negativeRetriesAreRejected() {
      new ExponentialBackoff(-1);
   }

   private ExponentialBackoff backoff(int maxRetries) {
      return new ExponentialBackoff(maxRetries, sleeper, new Random(42));
   }

   private static GenericServiceException serverError() {
      return new GenericServiceException("com.amazon.coral.service#InternalFailure", 500, "try again");
   }

   private static AuthorizationException authorizationError() {
      return new AuthorizationException("com.amazon.coral.service#UnrecognizedClientException",
            "The security token included in the request is invalid.");
   }

   /**
    * Returns the given results in order, repeating the last one.
    */
   private static final class CountingAttempt<T> implements Attempt<T> {
      private final List<AttemptResult<T>> results;
      private final List<Integer> triesLeft = new ArrayList<>();
      private int calls;

      @SafeVarargs
      CountingAttempt(AttemptResult<T>... results) {
         this.results = Arrays.asList(results);
      }

      @Override
      public AttemptResult<T> attempt(int triesLeft) {
         this.triesLeft.add(triesLeft);
         return results.get(Math.min(calls++, results.size() - 1));
      }
   }

   private static final class RecordingSleeper implements Sleeper {
      private final List<Long> sleeps = new ArrayList<>();

      @Override
      public void sleep(long millis) {
         sleeps.add(millis);
      }
   }
}
