package com.mergington.highschool.security;

/**
 * Decides whether a caller-supplied identity may perform staff-only actions
 * (roster changes, announcement management).
 */
public interface CredentialVerifier {

    /**
     * @param identity the identity presented by the caller, may be {@code null}
     * @return {@code true} if the identity is recognised
     */
    boolean verify(String identity);
}
