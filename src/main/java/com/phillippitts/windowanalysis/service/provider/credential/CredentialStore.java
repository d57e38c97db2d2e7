package com.phillippitts.windowanalysis.service.provider.credential;

import com.phillippitts.windowanalysis.exception.CredentialNotFoundException;

/**
 * Source of provider secrets.
 */
public interface CredentialStore {

    /**
     * Returns the secret registered under the name.
     *
     * @throws CredentialNotFoundException if no non-blank secret exists
     */
    String getCredential(String name);
}
