package com.phillippitts.windowanalysis.exception;

/**
 * Thrown when a provider credential cannot be found in the credential store.
 */
public class CredentialNotFoundException extends WindowAnalysisException {

    private final String credentialName;

    public CredentialNotFoundException(String credentialName) {
        super("Credential not found: " + credentialName);
        this.credentialName = credentialName;
    }

    public String getCredentialName() {
        return credentialName;
    }
}
