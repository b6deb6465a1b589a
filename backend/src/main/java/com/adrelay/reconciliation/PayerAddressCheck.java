package com.adrelay.reconciliation;

import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares TON account addresses across notations. User-friendly forms (bounceable EQ.., non-bounceable UQ..,
 * base64 or base64url) and raw "workchain:hex" forms are reduced to workchain + account hash.
 */
public final class PayerAddressCheck {

    private static final int FRIENDLY_LENGTH = 36;

    private PayerAddressCheck() {
    }

    public static boolean sameAccount(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String ka = accountKey(a.strip());
        String kb = accountKey(b.strip());
        return ka.equals(kb);
    }

    static String accountKey(String address) {
        int colon = address.indexOf(':');
        if (colon > 0) {
            try {
                int workchain = Integer.parseInt(address.substring(0, colon));
                byte[] hash = HexFormat.of().parseHex(address.substring(colon + 1));
                return workchain + ":" + HexFormat.of().formatHex(hash);
            } catch (IllegalArgumentException e) {
                return address.toLowerCase(Locale.ROOT);
            }
        }
        return friendlyKey(address).orElse(address);
    }

    private static Optional<String> friendlyKey(String address) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(address.replace('-', '+').replace('_', '/'));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (bytes.length != FRIENDLY_LENGTH) {
            return Optional.empty();
        }
        byte[] hash = new byte[32];
        System.arraycopy(bytes, 2, hash, 0, 32);
        return Optional.of(bytes[1] + ":" + HexFormat.of().formatHex(hash));
    }
}
