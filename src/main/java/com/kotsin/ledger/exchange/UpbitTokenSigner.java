package com.kotsin.ledger.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Builds the per-request HS512 bearer token the exchange expects: the payload carries
 * the access key, a fresh nonce and the SHA-512 hash of the exact query string.
 *
 * <p>Signed with a raw {@link Mac}: exchange secret keys are shorter than the 512-bit
 * minimum a JWT library enforces for HS512.
 */
public class UpbitTokenSigner {

    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
    private static final String HEADER = "{\"alg\":\"HS512\",\"typ\":\"JWT\"}";

    private final String accessKey;
    private final String secretKey;
    private final ObjectMapper mapper;
    private final Supplier<String> nonces;

    public UpbitTokenSigner(String accessKey, String secretKey, ObjectMapper mapper) {
        this(accessKey, secretKey, mapper, () -> UUID.randomUUID().toString());
    }

    UpbitTokenSigner(String accessKey, String secretKey, ObjectMapper mapper, Supplier<String> nonces) {
        this.accessKey = accessKey;
        this.secretKey = secretKey;
        this.mapper = mapper;
        this.nonces = nonces;
    }

    public String authorizationHeader(String query) {
        return "Bearer " + token(query);
    }

    String token(String query) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("access_key", accessKey);
        payload.put("nonce", nonces.get());
        payload.put("query_hash", sha512Hex(query));
        payload.put("query_hash_alg", "SHA512");

        try {
            String signingInput = encode(HEADER) + "." + encode(mapper.writeValueAsString(payload));
            return signingInput + "." + B64URL.encodeToString(hmacSha512(signingInput));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise token payload", e);
        }
    }

    static String sha512Hex(String data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(md.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-512 unavailable", e);
        }
    }

    private byte[] hmacSha512(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to calculate HMAC-SHA512 signature", e);
        }
    }

    private static String encode(String json) {
        return B64URL.encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }
}
