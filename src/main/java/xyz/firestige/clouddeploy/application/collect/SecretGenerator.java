package xyz.firestige.clouddeploy.application.collect;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 加密密钥与随机口令
 */
public final class SecretGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String PASSWORD_ALPHABET =
            "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789";

    private SecretGenerator() {
    }

    /**
     * 32 字节随机数的十六进制表示（64 字符）
     */
    public static String encryptionKey() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String password(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(PASSWORD_ALPHABET.charAt(RANDOM.nextInt(PASSWORD_ALPHABET.length())));
        }
        return sb.toString();
    }
}
