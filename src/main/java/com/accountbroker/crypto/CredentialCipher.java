package com.accountbroker.crypto;

import com.accountbroker.exception.BrokerException;
import com.accountbroker.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * 上游凭证 AES-256-GCM 加解密
 * <p>
 * 密文格式：{@code v1:<base64 iv>:<base64 ciphertext+tag>}，AAD 为账号 ID。
 * 明文只在调用方使用时解密，不落库、不写日志。
 */
public class CredentialCipher {

    private static final Logger log = LoggerFactory.getLogger(CredentialCipher.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String VERSION = "v1";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecretKey masterKey;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param base64MasterKey Base64 编码的 32 字节主密钥；为空时生成仅本进程有效的临时密钥
     */
    public CredentialCipher(String base64MasterKey) {
        byte[] keyBytes;
        if (base64MasterKey == null || base64MasterKey.isBlank()) {
            keyBytes = new byte[32];
            secureRandom.nextBytes(keyBytes);
            log.warn("未配置 broker.crypto.master-key, 使用临时主密钥, 重启后已存凭证将无法解密");
        } else {
            try {
                keyBytes = Base64.getDecoder().decode(base64MasterKey.trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("主密钥不是合法的 Base64");
            }
        }
        if (keyBytes.length != 32) {
            throw new ConfigurationException("主密钥必须为 32 字节 (256 bits), 实际 " + keyBytes.length);
        }
        this.masterKey = new SecretKeySpec(keyBytes, "AES");
    }

    public String encrypt(String plaintext, String aad) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            if (aad != null && !aad.isEmpty()) {
                cipher.updateAAD(aad.getBytes(StandardCharsets.UTF_8));
            }
            byte[] ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            Base64.Encoder encoder = Base64.getEncoder();
            return VERSION + ":" + encoder.encodeToString(iv) + ":" + encoder.encodeToString(ciphertextWithTag);
        } catch (GeneralSecurityException e) {
            throw new BrokerException("凭证加密失败", e);
        }
    }

    public String decrypt(String encrypted, String aad) {
        String[] parts = encrypted != null ? encrypted.split(":") : new String[0];
        if (parts.length != 3 || !VERSION.equals(parts[0])) {
            throw new BrokerException("无法识别的凭证密文格式");
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[1]);
            byte[] ciphertextWithTag = decoder.decode(parts[2]);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            if (aad != null && !aad.isEmpty()) {
                cipher.updateAAD(aad.getBytes(StandardCharsets.UTF_8));
            }
            return new String(cipher.doFinal(ciphertextWithTag), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new BrokerException("凭证解密失败", e);
        }
    }

    /**
     * 日志脱敏：只保留前 10 个字符
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= 10) {
            return "***";
        }
        return credential.substring(0, 10) + "...";
    }
}
