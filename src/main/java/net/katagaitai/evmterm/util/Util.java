package net.katagaitai.evmterm.util;

import com.google.common.io.BaseEncoding;

import java.math.BigInteger;

public class Util {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    public static String toHexString(byte[] bytes) {
        return bytes == null ? "" : HEX.encode(bytes);
    }

    public static byte[] hexStringToBytes(String hex) {
        if (hex == null) {
            return new byte[0];
        }
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.length() % 2 == 1) {
            hex = "0" + hex;
        }
        return HEX.decode(hex.toLowerCase());
    }

    public static String normalizeAddress(String addressHex) {
        if (addressHex.length() < 40) {
            final String padding = new String(new char[40 - addressHex.length()]).replace("\0", "0");
            addressHex = padding + addressHex;
        } else if (addressHex.length() > 40) {
            addressHex = addressHex.substring(addressHex.length() - 40);
        }
        return addressHex.toLowerCase();
    }

    public static String addHexPrefix(String addressHex) {
        if (addressHex == null || addressHex.length() == 0) {
            return "";
        }
        return addressHex.startsWith("0x") ? addressHex : "0x" + addressHex;
    }

    public static String addressToHex(BigInteger address) {
        return addHexPrefix(normalizeAddress(address.toString(16)));
    }

    public static boolean isWord(BigInteger value) {
        return value.signum() >= 0 && value.bitLength() <= Constants.WORD_BITS;
    }

    public static boolean isAddress(BigInteger value) {
        return value.signum() >= 0 && value.bitLength() <= Constants.ADDRESS_BITS;
    }
}
