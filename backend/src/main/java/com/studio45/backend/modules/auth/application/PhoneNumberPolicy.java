package com.studio45.backend.modules.auth.application;

import com.studio45.backend.global.error.ProblemException;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Validates phone numbers against a default region and stores them in E.164 form.
 */
@Component
public class PhoneNumberPolicy {

    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();
    private final String defaultRegion;

    public PhoneNumberPolicy(@Value("${app.phone.default-region:ID}") String defaultRegion) {
        if (!phoneNumberUtil.getSupportedRegions().contains(defaultRegion)) {
            throw new IllegalArgumentException("Unsupported phone region: " + defaultRegion);
        }
        this.defaultRegion = defaultRegion;
    }

    public boolean isValid(String raw) {
        return parse(raw) != null;
    }

    public String normalize(String raw) {
        PhoneNumber number = parse(raw);
        if (number == null) {
            throw ProblemException.validation("validation_error", "Invalid phone number format");
        }
        return phoneNumberUtil.format(number, PhoneNumberFormat.E164);
    }

    private PhoneNumber parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            PhoneNumber number = phoneNumberUtil.parse(raw.trim(), defaultRegion);
            return phoneNumberUtil.isValidNumber(number) ? number : null;
        } catch (NumberParseException e) {
            return null;
        }
    }
}
