package com.roomsnap.collab.session;

import java.security.SecureRandom;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Human-shareable room codes: six characters from A-Z and 0-9.
 */
public final class RoomCodes {
    public static final int LENGTH = 6;
    
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern FORMAT = Pattern.compile("^[A-Z0-9]{" + LENGTH + "}$");
    private static final Random RANDOM = new SecureRandom();
    
    private RoomCodes() {
    }
    
    public static String generate() {
        return generate(RANDOM);
    }
    
    public static String generate(Random random) {
        StringBuilder code = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            code.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }
    
    /**
     * Checks the shape of a code. Codes are case-sensitive uppercase.
     * @param code The code to check.
     * @return true if the code is well formed.
     */
    public static boolean isValid(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }
}
