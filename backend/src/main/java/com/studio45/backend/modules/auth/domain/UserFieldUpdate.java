package com.studio45.backend.modules.auth.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * One typed change to a user record. {@code Optional.empty()} on the nullable fields means "clear the value";
 * a field that should stay untouched simply has no update in the list.
 */
public sealed interface UserFieldUpdate {

    void applyTo(AppUser user);

    record NameUpdate(String name) implements UserFieldUpdate {
        public NameUpdate {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void applyTo(AppUser user) {
            user.setName(name);
        }
    }

    record EmailUpdate(String email) implements UserFieldUpdate {
        public EmailUpdate {
            email = AppUser.normalizeEmail(Objects.requireNonNull(email, "email"));
        }

        @Override
        public void applyTo(AppUser user) {
            user.setEmail(email);
        }
    }

    record PhoneUpdate(Optional<String> phone) implements UserFieldUpdate {
        public PhoneUpdate {
            Objects.requireNonNull(phone, "phone");
        }

        public static PhoneUpdate clear() {
            return new PhoneUpdate(Optional.empty());
        }

        @Override
        public void applyTo(AppUser user) {
            user.setPhone(phone.orElse(null));
        }
    }

    record CompanyUpdate(Optional<String> company) implements UserFieldUpdate {
        public CompanyUpdate {
            Objects.requireNonNull(company, "company");
        }

        public static CompanyUpdate clear() {
            return new CompanyUpdate(Optional.empty());
        }

        @Override
        public void applyTo(AppUser user) {
            user.setCompany(company.orElse(null));
        }
    }
}
