package com.studio45.backend.modules.rbac.domain;

import java.util.Objects;
import java.util.Optional;

public sealed interface RoleUpdate {

    void applyTo(Role role);

    record NameUpdate(String name) implements RoleUpdate {
        public NameUpdate {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void applyTo(Role role) {
            role.setName(name);
        }
    }

    record DescriptionUpdate(Optional<String> description) implements RoleUpdate {
        public DescriptionUpdate {
            Objects.requireNonNull(description, "description");
        }

        @Override
        public void applyTo(Role role) {
            role.setDescription(description.orElse(null));
        }
    }
}
