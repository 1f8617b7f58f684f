package com.minerpayout.ledger;

import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address format check: 0x + 40 hex. All-lower and all-upper addresses carry no checksum;
 * mixed case must match the EIP-55 checksum.
 */
@Component
public class EvmAddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        String trimmed = address.trim();
        if (!EVM_ADDRESS.matcher(trimmed).matches()) {
            return false;
        }
        String hex = trimmed.substring(2);
        if (hex.equals(hex.toLowerCase(Locale.ROOT)) || hex.equals(hex.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return trimmed.equals(toChecksumAddress(trimmed));
    }

    /**
     * EIP-55 mixed-case form of a well-formed address.
     */
    public static String toChecksumAddress(String address) {
        String lower = address.substring(2).toLowerCase(Locale.ROOT);
        String hash = Hex.toHexString(keccak256(lower.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder sb = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) && Character.digit(hash.charAt(i), 16) >= 8) {
                sb.append(Character.toUpperCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static byte[] keccak256(byte[] message) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(message, 0, message.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
