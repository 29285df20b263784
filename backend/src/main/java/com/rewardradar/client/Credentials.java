package com.rewardradar.client;

/**
 * Login e-mail and password. Only ever handed to the credential exchange.
 */
public record Credentials(String email, String password) {

    /**
     * Rejects credentials that cannot possibly succeed, before any network call.
     */
    public void validate() {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            throw new CredentialsInvalidException("Email and password are required to fetch a new token");
        }
        if (!email.contains("@")) {
            throw new CredentialsInvalidException("Invalid email format");
        }
    }

    @Override
    public String toString() {
        return "Credentials[email=" + email + ", password=****]";
    }
}
