package com.manheim.aws.credentials;

/**
 * Supplies credentials per credential scope ({@code region/service}). Implementations are shared between concurrent
 * requests and must be thread safe.
 */
public interface CredentialSource extends CredentialInvalidator {

   /**
    * May block while credentials are fetched or refreshed.
    */
   Credentials credentials(String scope);
}
