package com.studio45.backend.modules.rbac.presentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.studio45.backend.global.web.PartialUpdateFields;
import com.studio45.backend.modules.rbac.domain.PermissionUpdate;
import com.studio45.backend.modules.rbac.domain.RoleUpdate;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns partial-update bodies for roles and permissions into typed update lists.
 */
final class RbacUpdateParsers {

    private static final Set<String> ROLE_FIELDS = Set.of("name", "description");
    private static final Set<String> PERMISSION_FIELDS = Set.of("name", "resource", "action", "description");
    private static final Set<String> READ_ONLY_FIELDS = Set.of("id", "createdAt", "updatedAt", "permissions", "systemRole");
    private static final int DESCRIPTION_MAX = 1000;

    private RbacUpdateParsers() {
    }

    static List<RoleUpdate> parseRoleUpdates(JsonNode body) {
        PartialUpdateFields fields = PartialUpdateFields.of(body);
        fields.rejectUnknown(ROLE_FIELDS, READ_ONLY_FIELDS);

        List<RoleUpdate> updates = new ArrayList<>();
        if (fields.has("name")) {
            updates.add(new RoleUpdate.NameUpdate(fields.requiredText("name", 2, 50)));
        }
        if (fields.has("description")) {
            updates.add(new RoleUpdate.DescriptionUpdate(fields.clearableText("description", DESCRIPTION_MAX)));
        }
        return updates;
    }

    static List<PermissionUpdate> parsePermissionUpdates(JsonNode body) {
        PartialUpdateFields fields = PartialUpdateFields.of(body);
        fields.rejectUnknown(PERMISSION_FIELDS, READ_ONLY_FIELDS);

        List<PermissionUpdate> updates = new ArrayList<>();
        if (fields.has("name")) {
            updates.add(new PermissionUpdate.NameUpdate(fields.requiredText("name", 3, 100)));
        }
        if (fields.has("resource")) {
            updates.add(new PermissionUpdate.ResourceUpdate(fields.requiredText("resource", 2, 100)));
        }
        if (fields.has("action")) {
            updates.add(new PermissionUpdate.ActionUpdate(fields.requiredText("action", 2, 50)));
        }
        if (fields.has("description")) {
            updates.add(new PermissionUpdate.DescriptionUpdate(fields.clearableText("description", DESCRIPTION_MAX)));
        }
        return updates;
    }
}
