package com.flagship.payout_engine.payout;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalisation and format checks for fund-account registration.
 * Every check throws {@link IllegalArgumentException} naming the field.
 */
final class FundAccountValidator {

    private static final Pattern IFSC = Pattern.compile("^[A-Z]{4}0[A-Z0-9]{6}$");
    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("^[0-9]{9,18}$");
    private static final Pattern VPA = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9._-]{2,49}@[a-zA-Z][a-zA-Z0-9]{2,}$");
    private static final Pattern INDIAN_MOBILE = Pattern.compile("^\\+91[6-9][0-9]{9}$");
    private static final int MAX_VPA_LENGTH = 40;
    private static final int MAX_NAME_LENGTH = 120;

    private FundAccountValidator() {
    }

    static String holderName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account holder name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Account holder name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static String ifsc(String ifsc) {
        String normalized = ifsc == null ? "" : ifsc.trim().toUpperCase(Locale.ROOT);
        if (!IFSC.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid IFSC code: " + ifsc);
        }
        return normalized;
    }

    static String accountNumber(String accountNumber) {
        String normalized = accountNumber == null ? "" : accountNumber.replace(" ", "");
        if (!ACCOUNT_NUMBER.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Account number must be 9 to 18 digits");
        }
        return normalized;
    }

    static String vpa(String vpa) {
        String normalized = vpa == null ? "" : vpa.trim();
        if (normalized.length() > MAX_VPA_LENGTH || !VPA.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid UPI address: " + vpa);
        }
        return normalized;
    }

    /**
     * Brings an Indian mobile number to +91XXXXXXXXXX. Blank input yields null.
     */
    static String phone(String phone) {
        if (phone == null || phone.isBlank()) {
            return null;
        }
        String digits = phone.replaceAll("[^0-9+]", "");
        String normalized;
        if (digits.startsWith("+91") && digits.length() == 13) {
            normalized = digits;
        } else if (digits.startsWith("91") && digits.length() == 12) {
            normalized = "+" + digits;
        } else if (digits.startsWith("0") && digits.length() == 11) {
            normalized = "+91" + digits.substring(1);
        } else if (digits.length() == 10) {
            normalized = "+91" + digits;
        } else {
            normalized = digits;
        }
        if (!INDIAN_MOBILE.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid Indian mobile number: " + phone);
        }
        return normalized;
    }
}
