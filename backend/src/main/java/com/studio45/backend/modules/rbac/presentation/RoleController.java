package com.studio45.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.global.security.SecurityUtils;
import com.studio45.backend.modules.rbac.application.RoleCatalogService;
import com.studio45.backend.modules.rbac.application.RoleCatalogService.CreateRoleCommand;
import com.studio45.backend.modules.rbac.presentation.dto.CreateRoleRequest;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionListResponse;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;
import com.studio45.backend.modules.rbac.presentation.dto.ReplaceRolePermissionsRequest;
import com.studio45.backend.modules.rbac.presentation.dto.RoleListResponse;
import com.studio45.backend.modules.rbac.presentation.dto.RoleResponse;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/roles")
@Tag(name = "Roles", description = "Role catalog administration")
public class RoleController {

    private final RoleCatalogService roleCatalogService;

    public RoleController(RoleCatalogService roleCatalogService) {
        this.roleCatalogService = roleCatalogService;
    }

    @GetMapping
    public ResponseEntity<RoleListResponse> listRoles() {
        List<RoleResponse> roles = roleCatalogService.listRoles();
        return ResponseEntity.ok(new RoleListResponse(roles, roles.size()));
    }

    @PostMapping
    @Operation(summary = "Create a role")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Role created"),
            @ApiResponse(responseCode = "409", description = "Role name already exists")
    })
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        RoleResponse created = roleCatalogService.createRole(new CreateRoleCommand(request.name(), request.description()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<RoleResponse> getRole(@PathVariable("id") UUID roleId) {
        return ResponseEntity.ok(roleCatalogService.getRole(roleId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<RoleResponse> updateRole(@PathVariable("id") UUID roleId, @RequestBody JsonNode body) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(roleCatalogService.updateRole(actorId, roleId, RbacUpdateParsers.parseRoleUpdates(body)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a role", description = "System roles cannot be deleted; grants of the role are removed.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Role deleted"),
            @ApiResponse(responseCode = "400", description = "System role"),
            @ApiResponse(responseCode = "404", description = "Role not found")
    })
    public ResponseEntity<Void> deleteRole(@PathVariable("id") UUID roleId) {
        roleCatalogService.deleteRole(SecurityUtils.getCurrentUserId(), roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/permissions")
    public ResponseEntity<PermissionListResponse> getRolePermissions(@PathVariable("id") UUID roleId) {
        List<PermissionResponse> permissions = roleCatalogService.getRolePermissions(roleId);
        return ResponseEntity.ok(new PermissionListResponse(permissions, permissions.size()));
    }

    @PutMapping("/{id}/permissions")
    @Operation(summary = "Replace the permission set of a role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Permissions replaced"),
            @ApiResponse(responseCode = "400", description = "Unknown permission id or admin.access removed from admin")
    })
    public ResponseEntity<RoleResponse> replacePermissions(
            @PathVariable("id") UUID roleId,
            @Valid @RequestBody ReplaceRolePermissionsRequest request
    ) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(roleCatalogService.replacePermissions(actorId, roleId, request.permissionIds()));
    }
}
