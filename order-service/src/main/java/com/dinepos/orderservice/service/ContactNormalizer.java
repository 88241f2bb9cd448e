package com.dinepos.orderservice.service;

/**
 * Contact numbers are compared in a fixed 10-digit form: digits only,
 * left-padded with zeros, keeping the last ten.
 */
public final class ContactNormalizer {

    public static final int CONTACT_LENGTH = 10;

    private ContactNormalizer() {
    }

    public static String normalize(String contact) {
        String digits = contact == null ? "" : contact.replaceAll("\\D", "");
        if (digits.length() >= CONTACT_LENGTH) {
            return digits.substring(digits.length() - CONTACT_LENGTH);
        }
        return "0".repeat(CONTACT_LENGTH - digits.length()) + digits;
    }
}
