package com.manheim.aws.credentials;

/**
 * Told when the service rejected a set of credentials, so that the next caller gets fresh ones.
 */
public interface CredentialInvalidator {

   void credentialsInvalid(String scope, Credentials credentials, String reason);
}
