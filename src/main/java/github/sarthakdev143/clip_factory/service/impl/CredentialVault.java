package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps per-request AI credentials in process memory only; they are never written to the job store.
 */
@Component
public class CredentialVault {

    private final Map<String, String> perJobKeys = new ConcurrentHashMap<>();
    private final String defaultKey;

    public CredentialVault(ClipFactoryProperties properties) {
        this.defaultKey = properties.ai().apiKey();
    }

    public boolean hasDefault() {
        return defaultKey != null;
    }

    /**
     * Picks the request credential, falling back to the server default. Empty when neither exists.
     */
    public Optional<String> select(String requestKey) {
        if (requestKey != null && !requestKey.isBlank()) {
            return Optional.of(requestKey.trim());
        }
        return Optional.ofNullable(defaultKey);
    }

    /**
     * Only keys that differ from the server default are stored; the default is resolved at run time.
     */
    public void remember(String jobId, String key) {
        if (key != null && !key.equals(defaultKey)) {
            perJobKeys.put(jobId, key);
        }
    }

    public Optional<String> resolve(String jobId) {
        String key = perJobKeys.get(jobId);
        return key != null ? Optional.of(key) : Optional.ofNullable(defaultKey);
    }

    public void forget(String jobId) {
        perJobKeys.remove(jobId);
    }
}
