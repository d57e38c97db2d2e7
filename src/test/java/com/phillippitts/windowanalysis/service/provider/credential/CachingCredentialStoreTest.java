package com.phillippitts.windowanalysis.service.provider.credential;

import com.phillippitts.windowanalysis.exception.CredentialNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachingCredentialStoreTest {

    @Test
    void resolvesFromEnvironmentAndTrims() {
        MockEnvironment env = new MockEnvironment().withProperty("ANTHROPIC_API_KEY", "  sk-ant-123  ");
        EnvironmentCredentialStore store = new EnvironmentCredentialStore(env);

        assertThat(store.getCredential("ANTHROPIC_API_KEY")).isEqualTo("sk-ant-123");
    }

    @Test
    void missingOrBlankCredentialIsNotFound() {
        MockEnvironment env = new MockEnvironment().withProperty("OPENAI_API_KEY", " ");
        EnvironmentCredentialStore store = new EnvironmentCredentialStore(env);

        assertThatThrownBy(() -> store.getCredential("OPENAI_API_KEY"))
                .isInstanceOfSatisfying(CredentialNotFoundException.class,
                        e -> assertThat(e.getCredentialName()).isEqualTo("OPENAI_API_KEY"));
        assertThatThrownBy(() -> store.getCredential("GOOGLE_VISION_API_KEY"))
                .isInstanceOf(CredentialNotFoundException.class);
        assertThatThrownBy(() -> store.getCredential(null))
                .isInstanceOf(CredentialNotFoundException.class);
    }

    @Test
    void looksUpEachSecretOnce() {
        AtomicInteger lookups = new AtomicInteger();
        CachingCredentialStore cache = new CachingCredentialStore(name -> {
            lookups.incrementAndGet();
            return "secret-" + name;
        });

        cache.getCredential("A");
        cache.getCredential("A");
        cache.getCredential("B");

        assertThat(lookups.get()).isEqualTo(2);
        assertThat(cache.cachedCount()).isEqualTo(2);
    }

    @Test
    void missingCredentialIsRetriedLater() {
        MockEnvironment env = new MockEnvironment();
        CachingCredentialStore cache = new CachingCredentialStore(new EnvironmentCredentialStore(env));

        assertThat(cache.isAvailable("OPENAI_API_KEY")).isFalse();
        assertThat(cache.cachedCount()).isZero();

        env.setProperty("OPENAI_API_KEY", "sk-late");
        assertThat(cache.isAvailable("OPENAI_API_KEY")).isTrue();
        assertThat(cache.getCredential("OPENAI_API_KEY")).isEqualTo("sk-late");
    }
}
