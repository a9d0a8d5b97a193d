package com.bko.servicedesk.tools;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import org.springframework.lang.Nullable;

/**
 * Partial field set for {@code update_customer}. Absent fields are left untouched.
 */
public record CustomerUpdate(
        @Nullable @Size(max = 200) @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String name,
        @Nullable @Email @Size(max = 320) String email,
        @Nullable @Pattern(regexp = "[0-9+()\\-. ]{3,50}", message = "must be a phone number") String phone,
        @Nullable String status
) {

    public static CustomerUpdate email(String email) {
        return new CustomerUpdate(null, email, null, null);
    }

    public static CustomerUpdate phone(String phone) {
        return new CustomerUpdate(null, null, phone, null);
    }

    public static CustomerUpdate name(String name) {
        return new CustomerUpdate(name, null, null, null);
    }

    public static CustomerUpdate status(String status) {
        return new CustomerUpdate(null, null, null, status);
    }

    public boolean isEmpty() {
        return name == null && email == null && phone == null && status == null;
    }
}
