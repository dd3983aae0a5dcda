package com.manheim.aws.credentials;

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caches one credentials snapshot per scope, loaded from an AWS SDK credentials provider.
 *
 * <p>An invalidation only evicts the snapshot it was reported for. If another request already replaced it, the
 * report is stale and ignored, so a burst of failures made with the same old credentials refreshes the provider
 * once.
 */
public class CachingCredentialSource implements CredentialSource {
   private static final Log LOG = LogFactory.getLog(CachingCredentialSource.class);

   private final AWSCredentialsProvider provider;
   private final ConcurrentMap<String, Credentials> cache = new ConcurrentHashMap<>();
   private final AtomicLong versions = new AtomicLong();

   public CachingCredentialSource() {
      this(new DefaultAWSCredentialsProviderChain());
   }

   public CachingCredentialSource(AWSCredentialsProvider provider) {
      this.provider = provider;
   }

   @Override
   public Credentials credentials(String scope) {
      Credentials cached = cache.get(scope);
      if (cached != null) {
         return cached;
      }
      Credentials loaded = Credentials.from(provider.getCredentials(), versions.incrementAndGet());
      Credentials raced = cache.putIfAbsent(scope, loaded);
      return raced != null ? raced : loaded;
   }

   @Override
   public void credentialsInvalid(String scope, Credentials credentials, String reason) {
      Credentials cached = cache.get(scope);
      if (cached == null || cached.getVersion() != credentials.getVersion()) {
         LOG.debug("Ignoring invalidation of already replaced " + credentials + " for " + scope);
         return;
      }
      if (cache.remove(scope, cached)) {
         LOG.warn("Invalidating " + credentials + " for " + scope + ": " + reason);
         provider.refresh();
      }
   }
}
