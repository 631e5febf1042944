package com.ai.handoff.component;

import com.ai.handoff.dto.IdentityResult;
import com.ai.handoff.dto.IdentityResult.ErrorKind;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes phone-like sender ids into E.164 identities so every syntactic variant
 * of one subscriber ("whatsapp:+573001234567", "57 300 123 4567", "300-123-4567")
 * maps to the same key. Numbering plan: 10-digit national mobile numbers starting with 3.
 */
@Component
public class IdentityNormalizer {

    private static final Logger log = LoggerFactory.getLogger(IdentityNormalizer.class);

    public static final int NATIONAL_NUMBER_LENGTH = 10;

    private static final Pattern TRANSPORT_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*:");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    // 300-305 Tigo/ETB, 310-315 Claro, 316-319 Movistar/Virgin, 320-325 shared, 350-351 Avantel
    private static final Set<String> MOBILE_PREFIXES = Set.of(
            "300", "301", "302", "303", "304", "305",
            "310", "311", "312", "313", "314", "315",
            "316", "317", "318", "319",
            "320", "321", "322", "323", "324", "325",
            "350", "351");

    private final String countryCode;

    public IdentityNormalizer(@Value("${handoff.identity.country-code:57}") String countryCode) {
        this.countryCode = countryCode;
    }

    public IdentityResult normalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            return IdentityResult.invalid(raw, ErrorKind.EMPTY, "Empty sender id", "", "");
        }

        String digits = clean(raw);
        if (digits.isEmpty()) {
            return IdentityResult.invalid(raw, ErrorKind.NO_DIGITS, "Sender id contains no digits", "", "");
        }

        String national = extractNationalNumber(digits, raw);

        if (national.length() != NATIONAL_NUMBER_LENGTH) {
            return IdentityResult.invalid(raw, ErrorKind.INVALID_LENGTH,
                    "Invalid length: " + national.length() + " (expected " + NATIONAL_NUMBER_LENGTH + ")",
                    countryCode, national);
        }
        if (!national.startsWith("3")) {
            return IdentityResult.invalid(raw, ErrorKind.NOT_MOBILE,
                    "Not a mobile number (must start with 3)", countryCode, national);
        }
        String prefix = national.substring(0, 3);
        if (!MOBILE_PREFIXES.contains(prefix)) {
            log.warn("Unrecognized mobile prefix {} for {} (accepted)", prefix, raw);
        }

        String identity = "+" + countryCode + national;
        log.debug("Normalized {} -> {}", raw, identity);
        return IdentityResult.valid(raw, identity, countryCode, national);
    }

    /**
     * Same as {@link #normalize(String)} but throws for invalid input.
     */
    public String requireValid(String raw) {
        IdentityResult result = normalize(raw);
        if (!result.valid()) {
            throw new InvalidIdentityException(result);
        }
        return result.identity();
    }

    public boolean isValid(String raw) {
        return normalize(raw).valid();
    }

    private static String clean(String raw) {
        String stripped = raw.trim();
        while (TRANSPORT_PREFIX.matcher(stripped).find()) {
            stripped = TRANSPORT_PREFIX.matcher(stripped).replaceFirst("").trim();
        }
        return NON_DIGIT.matcher(stripped).replaceAll("");
    }

    private String extractNationalNumber(String digits, String raw) {
        if (digits.startsWith(countryCode)) {
            String remaining = digits.substring(countryCode.length());
            if (remaining.length() == NATIONAL_NUMBER_LENGTH) {
                return remaining;
            }
            if (remaining.length() == NATIONAL_NUMBER_LENGTH - 1) {
                log.warn("Possibly truncated number: {}", raw);
                return remaining;
            }
        }

        // trunk prefix of the old local format
        if (digits.startsWith("0")) {
            digits = digits.substring(1);
        }
        if (digits.length() == NATIONAL_NUMBER_LENGTH) {
            return digits;
        }
        if (digits.length() == countryCode.length() + NATIONAL_NUMBER_LENGTH && digits.startsWith(countryCode)) {
            return digits.substring(countryCode.length());
        }
        if (digits.length() > NATIONAL_NUMBER_LENGTH) {
            return digits.substring(digits.length() - NATIONAL_NUMBER_LENGTH);
        }
        return digits;
    }
}
