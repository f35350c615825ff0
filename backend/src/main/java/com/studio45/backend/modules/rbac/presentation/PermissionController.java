package com.studio45.backend.modules.rbac.presentation;

import java.util.List;
import java.util.UUID;

import com.studio45.backend.global.security.SecurityUtils;
import com.studio45.backend.modules.rbac.application.PermissionCatalogService;
import com.studio45.backend.modules.rbac.application.PermissionCatalogService.CreatePermissionCommand;
import com.studio45.backend.modules.rbac.presentation.dto.CreatePermissionRequest;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionListResponse;
import com.studio45.backend.modules.rbac.presentation.dto.PermissionResponse;

import com.fasterxml.jackson.databind.JsonNode;

import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/v1/admin/permissions")
@Tag(name = "Permissions", description = "Permission catalog administration")
public class PermissionController {

    private final PermissionCatalogService permissionCatalogService;

    public PermissionController(PermissionCatalogService permissionCatalogService) {
        this.permissionCatalogService = permissionCatalogService;
    }

    @GetMapping
    public ResponseEntity<PermissionListResponse> listPermissions() {
        List<PermissionResponse> permissions = permissionCatalogService.listPermissions();
        return ResponseEntity.ok(new PermissionListResponse(permissions, permissions.size()));
    }

    @PostMapping
    public ResponseEntity<PermissionResponse> createPermission(@Valid @RequestBody CreatePermissionRequest request) {
        PermissionResponse created = permissionCatalogService.createPermission(new CreatePermissionCommand(
                request.name(),
                request.resource(),
                request.action(),
                request.description()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PermissionResponse> getPermission(@PathVariable("id") UUID permissionId) {
        return ResponseEntity.ok(permissionCatalogService.getPermission(permissionId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PermissionResponse> updatePermission(@PathVariable("id") UUID permissionId, @RequestBody JsonNode body) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(permissionCatalogService.updatePermission(
                actorId,
                permissionId,
                RbacUpdateParsers.parsePermissionUpdates(body)
        ));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a permission", description = "Links from every role are removed with it.")
    public ResponseEntity<Void> deletePermission(@PathVariable("id") UUID permissionId) {
        permissionCatalogService.deletePermission(SecurityUtils.getCurrentUserId(), permissionId);
        return ResponseEntity.noContent().build();
    }
}
