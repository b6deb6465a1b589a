package com.adrelay.order;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Payment reference codes: two uppercase letters followed by four digits (e.g. AB0042), 6.76 million values.
 */
@Component
public class ReferenceCodeGenerator {

    static final Pattern FORMAT = Pattern.compile("^[A-Z]{2}[0-9]{4}$");

    private final Random random;

    public ReferenceCodeGenerator() {
        this(new SecureRandom());
    }

    ReferenceCodeGenerator(Random random) {
        this.random = random;
    }

    public String next() {
        char first = (char) ('A' + random.nextInt(26));
        char second = (char) ('A' + random.nextInt(26));
        return String.format(Locale.ROOT, "%c%c%04d", first, second, random.nextInt(10_000));
    }

    /**
     * Trims and upper-cases user or ledger supplied text; null stays null.
     */
    public static String normalize(String code) {
        return code == null ? null : code.strip().toUpperCase(Locale.ROOT);
    }

    public static boolean isWellFormed(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }
}
