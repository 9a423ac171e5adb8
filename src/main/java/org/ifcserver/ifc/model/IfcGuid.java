package org.ifcserver.ifc.model;

import java.math.BigInteger;
import java.util.UUID;

/**
 * IFC GlobalId（22 字符压缩 GUID）生成与校验。
 * <p>
 * 编码规则：把 128 位 UUID 视为无符号整数，按 IFC 专用的 64 字符表从低位到高位逐 6 位编码，
 * 共 22 个字符；首字符只承载最高 2 位，因此取值只能是 {@code 0..3}。
 */
public final class IfcGuid {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_$";
    private static final int LENGTH = 22;
    private static final BigInteger RADIX = BigInteger.valueOf(64);

    private IfcGuid() {
    }

    public static String newGuid() {
        return compress(UUID.randomUUID());
    }

    public static String compress(UUID uuid) {
        BigInteger value = toUnsigned(uuid);
        char[] out = new char[LENGTH];
        for (int i = LENGTH - 1; i >= 0; i--) {
            BigInteger[] qr = value.divideAndRemainder(RADIX);
            out[i] = ALPHABET.charAt(qr[1].intValue());
            value = qr[0];
        }
        return new String(out);
    }

    public static UUID expand(String guid) {
        if (!isValid(guid)) {
            throw new IllegalArgumentException("不是合法的 IFC GlobalId：" + guid);
        }
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < LENGTH; i++) {
            value = value.multiply(RADIX).add(BigInteger.valueOf(ALPHABET.indexOf(guid.charAt(i))));
        }
        long most = value.shiftRight(64).longValue();
        long least = value.longValue();
        return new UUID(most, least);
    }

    public static boolean isValid(String guid) {
        if (guid == null || guid.length() != LENGTH) {
            return false;
        }
        if (ALPHABET.indexOf(guid.charAt(0)) > 3) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            if (ALPHABET.indexOf(guid.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private static BigInteger toUnsigned(UUID uuid) {
        BigInteger most = new BigInteger(Long.toUnsignedString(uuid.getMostSignificantBits()));
        BigInteger least = new BigInteger(Long.toUnsignedString(uuid.getLeastSignificantBits()));
        return most.shiftLeft(64).or(least);
    }
}
