package com.phillippitts.windowanalysis.service.provider.credential;

import com.phillippitts.windowanalysis.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caches credentials for the process lifetime so each secret is looked up once, not per call.
 *
 * <p>Only successful lookups are cached; a missing credential is looked up again next time
 * so a secret added after startup is picked up.
 */
public class CachingCredentialStore implements CredentialStore {

    private static final Logger LOG = LogManager.getLogger(CachingCredentialStore.class);

    private final CredentialStore delegate;
    private final ConcurrentMap<String, String> cache = new ConcurrentHashMap<>();

    public CachingCredentialStore(CredentialStore delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public String getCredential(String name) {
        return cache.computeIfAbsent(name, key -> {
            String secret = delegate.getCredential(key);
            LOG.info("Loaded credential {} ({})", key, LogSanitizer.mask(secret));
            return secret;
        });
    }

    /**
     * Whether a lookup would currently succeed, without raising.
     */
    public boolean isAvailable(String name) {
        if (cache.containsKey(name)) {
            return true;
        }
        try {
            getCredential(name);
            return true;
        } catch (RuntimeException e) {
            LOG.debug("Credential {} unavailable: {}", name, e.getMessage());
            return false;
        }
    }

    /** Visible for tests */
    int cachedCount() {
        return cache.size();
    }
}
