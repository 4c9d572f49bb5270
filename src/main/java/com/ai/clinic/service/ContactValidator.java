package com.ai.clinic.service;

import com.ai.clinic.exception.ErrorKind;
import com.ai.clinic.exception.SchedulingException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class ContactValidator {

    // 10-digit Indian mobile number
    private static final Pattern PHONE = Pattern.compile("^[6-9]\\d{9}$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /** @return the email trimmed and lower-cased, used as the user identifier */
    public String normalizeEmail(String email) {
        String e = StringUtils.trimToEmpty(email).toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(e).matches()) {
            throw new SchedulingException(ErrorKind.INVALID_EMAIL,
                    "'" + StringUtils.defaultString(email) + "' doesn't look like a valid email address. Could you check it?");
        }
        return e;
    }

    public String normalizePhone(String phone) {
        String p = StringUtils.deleteWhitespace(StringUtils.defaultString(phone));
        if (p.startsWith("+91")) {
            p = p.substring(3);
        }
        if (!PHONE.matcher(p).matches()) {
            throw new SchedulingException(ErrorKind.INVALID_PHONE,
                    "Invalid phone number format. It must be a 10-digit mobile number starting with 6-9.");
        }
        return p;
    }

    public String requireName(String name) {
        if (StringUtils.isBlank(name)) {
            throw new SchedulingException(ErrorKind.INVALID_REQUEST, "Please tell me the patient's full name.");
        }
        return name.trim();
    }
}
