package com.manheim.aws.retry;

/**
 * Waits between attempts.
 */
public interface Sleeper {
   Sleeper THREAD_SLEEPER = new Sleeper() {
      @Override
      public void sleep(long millis) throws InterruptedException {
         Thread.sleep(millis);
      }
   };

   void sleep(long millis) throws InterruptedException;
}
