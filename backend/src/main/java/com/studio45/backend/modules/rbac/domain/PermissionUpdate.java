package com.studio45.backend.modules.rbac.domain;

import java.util.Objects;
import java.util.Optional;

public sealed interface PermissionUpdate {

    void applyTo(Permission permission);

    record NameUpdate(String name) implements PermissionUpdate {
        public NameUpdate {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void applyTo(Permission permission) {
            permission.setName(name);
        }
    }

    record ResourceUpdate(String resource) implements PermissionUpdate {
        public ResourceUpdate {
            Objects.requireNonNull(resource, "resource");
        }

        @Override
        public void applyTo(Permission permission) {
            permission.setResource(resource);
        }
    }

    record ActionUpdate(String action) implements PermissionUpdate {
        public ActionUpdate {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public void applyTo(Permission permission) {
            permission.setAction(action);
        }
    }

    record DescriptionUpdate(Optional<String> description) implements PermissionUpdate {
        public DescriptionUpdate {
            Objects.requireNonNull(description, "description");
        }

        @Override
        public void applyTo(Permission permission) {
            permission.setDescription(description.orElse(null));
        }
    }
}
