package io.bridgeconfig.core.validation;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Mixed-case checksum addresses (EIP-55). A letter in the hex part of the address is upper
 * case exactly when the corresponding nibble of keccak-256 over the lower-case hex part is 8 or
 * more. Addresses without letters are their own checksum form.
 */
public final class ChecksumAddresses {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0[xX][0-9a-fA-F]{40}$");

    private ChecksumAddresses() {}

    /** Returns {@code true} if {@code address} is {@code 0x} + 40 hex digits, in any case. */
    public static boolean isHexAddress(String address) {
        return address != null && HEX_ADDRESS.matcher(address).matches();
    }

    /** Returns {@code true} if {@code address} is a hex address written in its checksum case. */
    public static boolean isChecksumAddress(String address) {
        return isHexAddress(address) && address.equals(toChecksumAddress(address));
    }

    /**
     * Converts a hex address to its checksum form.
     *
     * @throws IllegalArgumentException if {@code address} is not a hex address
     */
    public static String toChecksumAddress(String address) {
        if (!isHexAddress(address)) {
            throw new IllegalArgumentException("not a hex address: " + address);
        }
        String lower = address.substring(2).toLowerCase(Locale.ROOT);
        String hash = Hex.toHexString(keccak256(lower.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder out = new StringBuilder(42).append("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c >= 'a' && Character.digit(hash.charAt(i), 16) >= 8) {
                out.append(Character.toUpperCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
