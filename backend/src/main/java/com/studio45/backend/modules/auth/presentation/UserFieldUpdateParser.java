package com.studio45.backend.modules.auth.presentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.studio45.backend.global.error.ProblemException;
import com.studio45.backend.global.web.PartialUpdateFields;
import com.studio45.backend.modules.auth.application.PhoneNumberPolicy;
import com.studio45.backend.modules.auth.domain.UserFieldUpdate;

import com.fasterxml.jackson.databind.JsonNode;

import org.springframework.stereotype.Component;

/**
 * Maps a partial-update JSON body onto {@link UserFieldUpdate} variants.
 * Self-service bodies silently drop protected keys; admin bodies may also change the email.
 */
@Component
public class UserFieldUpdateParser {

    static final Set<String> PROTECTED_FIELDS = Set.of(
            "id", "email", "password", "roles", "createdAt", "updatedAt", "created_at", "updated_at", "deleted_at"
    );
    private static final Set<String> SELF_SERVICE_FIELDS = Set.of("name", "phone", "company");
    private static final Set<String> ADMIN_FIELDS = Set.of("email", "name", "phone", "company");
    private static final Set<String> ADMIN_IGNORED = Set.of("id", "createdAt", "updatedAt", "created_at", "updated_at");

    private final PhoneNumberPolicy phoneNumberPolicy;

    public UserFieldUpdateParser(PhoneNumberPolicy phoneNumberPolicy) {
        this.phoneNumberPolicy = phoneNumberPolicy;
    }

    public List<UserFieldUpdate> parseSelfService(JsonNode body) {
        PartialUpdateFields fields = PartialUpdateFields.of(body);
        fields.rejectUnknown(SELF_SERVICE_FIELDS, PROTECTED_FIELDS);
        return parse(fields, false);
    }

    public List<UserFieldUpdate> parseAdmin(JsonNode body) {
        PartialUpdateFields fields = PartialUpdateFields.of(body);
        fields.rejectUnknown(ADMIN_FIELDS, ADMIN_IGNORED);
        return parse(fields, true);
    }

    private List<UserFieldUpdate> parse(PartialUpdateFields fields, boolean allowEmail) {
        List<UserFieldUpdate> updates = new ArrayList<>();
        if (allowEmail && fields.has("email")) {
            String email = fields.requiredText("email", 3, 255);
            if (!email.contains("@")) {
                throw ProblemException.validation("validation_error", "email: must be a well-formed email address");
            }
            updates.add(new UserFieldUpdate.EmailUpdate(email));
        }
        if (fields.has("name")) {
            updates.add(new UserFieldUpdate.NameUpdate(fields.requiredText("name", 2, 255)));
        }
        if (fields.has("phone")) {
            Optional<String> phone = fields.clearableText("phone", 50);
            updates.add(phone.isEmpty()
                    ? UserFieldUpdate.PhoneUpdate.clear()
                    : new UserFieldUpdate.PhoneUpdate(Optional.of(phoneNumberPolicy.normalize(phone.get()))));
        }
        if (fields.has("company")) {
            Optional<String> company = fields.clearableText("company", 255);
            updates.add(company.isEmpty()
                    ? UserFieldUpdate.CompanyUpdate.clear()
                    : new UserFieldUpdate.CompanyUpdate(company));
        }
        return updates;
    }
}
