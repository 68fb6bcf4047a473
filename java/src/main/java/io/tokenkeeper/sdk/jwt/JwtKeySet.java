package io.tokenkeeper.sdk.jwt;

import com.auth0.jwt.algorithms.Algorithm;

import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Verification keys indexed by key id ({@code kid}), with an optional key for tokens that name none.
 */
public final class JwtKeySet {

    private final Map<String, Algorithm> keys;
    private final Algorithm defaultKey;

    private JwtKeySet(Map<String, Algorithm> keys, Algorithm defaultKey) {
        this.keys = Map.copyOf(keys);
        this.defaultKey = defaultKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param keyId the token's {@code kid} header, may be null.
     */
    public Optional<Algorithm> resolve(String keyId) {
        if (keyId == null) {
            return Optional.ofNullable(defaultKey);
        }
        return Optional.ofNullable(keys.get(keyId));
    }

    public static final class Builder {
        private final Map<String, Algorithm> keys = new LinkedHashMap<>();
        private Algorithm defaultKey;

        private Builder() {
        }

        public Builder key(String keyId, Algorithm algorithm) {
            keys.put(Objects.requireNonNull(keyId, "keyId"), Objects.requireNonNull(algorithm, "algorithm"));
            return this;
        }

        public Builder rsa256(String keyId, RSAPublicKey publicKey) {
            return key(keyId, Algorithm.RSA256(publicKey, null));
        }

        public Builder ecdsa256(String keyId, ECPublicKey publicKey) {
            return key(keyId, Algorithm.ECDSA256(publicKey, null));
        }

        /**
         * Key used for tokens without a {@code kid} header.
         */
        public Builder defaultKey(Algorithm algorithm) {
            this.defaultKey = Objects.requireNonNull(algorithm, "algorithm");
            return this;
        }

        public JwtKeySet build() {
            if (keys.isEmpty() && defaultKey == null) {
                throw new IllegalArgumentException("at least one verification key is required");
            }
            return new JwtKeySet(keys, defaultKey);
        }
    }
}
