package com.kalshi.bot.infra;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.PSSParameterSpec;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs API requests with the account's RSA key: RSASSA-PSS/SHA-256 over
 * {@code timestampMillis + METHOD + path}.
 */
@Slf4j
public class KalshiRequestSigner {

    public static final String HEADER_KEY = "KALSHI-ACCESS-KEY";
    public static final String HEADER_TIMESTAMP = "KALSHI-ACCESS-TIMESTAMP";
    public static final String HEADER_SIGNATURE = "KALSHI-ACCESS-SIGNATURE";

    static final PSSParameterSpec PSS_SHA256 =
            new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1);

    // AlgorithmIdentifier for rsaEncryption, DER encoded
    private static final byte[] RSA_ALGORITHM_ID = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86,
            (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private final String apiKeyId;
    private final PrivateKey privateKey;

    public KalshiRequestSigner(String apiKeyId, PrivateKey privateKey) {
        this.apiKeyId = apiKeyId;
        this.privateKey = privateKey;
    }

    public static KalshiRequestSigner fromPemFile(String apiKeyId, Path pemFile) {
        try {
            return new KalshiRequestSigner(apiKeyId, parsePrivateKey(Files.readString(pemFile)));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read private key " + pemFile, e);
        }
    }

    public String sign(long timestampMillis, String method, String path) {
        String message = timestampMillis + method.toUpperCase() + path;
        try {
            Signature signature = Signature.getInstance("RSASSA-PSS");
            signature.setParameter(PSS_SHA256);
            signature.initSign(privateKey);
            signature.update(message.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign request " + method + " " + path, e);
        }
    }

    public Map<String, String> headers(long timestampMillis, String method, String path) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_KEY, apiKeyId);
        headers.put(HEADER_TIMESTAMP, String.valueOf(timestampMillis));
        headers.put(HEADER_SIGNATURE, sign(timestampMillis, method, path));
        return headers;
    }

    /**
     * Reads a PEM private key in either PKCS#8 ("PRIVATE KEY") or PKCS#1
     * ("RSA PRIVATE KEY") form.
     */
    static PrivateKey parsePrivateKey(String pem) {
        boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
        if (!pkcs1 && !pem.contains("BEGIN PRIVATE KEY")) {
            throw new IllegalArgumentException("Expected a PEM encoded RSA private key");
        }
        String base64 = pem.replaceAll("-----(BEGIN|END)[A-Z ]*-----", "").replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        if (pkcs1) {
            der = wrapPkcs1(der);
        }
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid RSA private key", e);
        }
    }

    // PrivateKeyInfo ::= SEQUENCE { version INTEGER 0, algorithm, privateKey OCTET STRING }
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(new byte[]{0x02, 0x01, 0x00});
        body.writeBytes(RSA_ALGORITHM_ID);
        body.write(0x04);
        body.writeBytes(derLength(pkcs1.length));
        body.writeBytes(pkcs1);

        byte[] content = body.toByteArray();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        out.writeBytes(derLength(content.length));
        out.writeBytes(content);
        return out.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[]{(byte) length};
        }
        if (length <= 0xff) {
            return new byte[]{(byte) 0x81, (byte) length};
        }
        if (length <= 0xffff) {
            return new byte[]{(byte) 0x82, (byte) (length >> 8), (byte) length};
        }
        return new byte[]{(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
    }
}
