package com.studio45.backend.modules.admin.presentation;

import java.util.UUID;

import com.studio45.backend.global.security.SecurityUtils;
import com.studio45.backend.modules.admin.application.UserAdministrationService;
import com.studio45.backend.modules.admin.application.UserAdministrationService.CreateUserCommand;
import com.studio45.backend.modules.admin.application.UserAdministrationService.UserListQuery;
import com.studio45.backend.modules.admin.presentation.dto.AdminUserResponse;
import com.studio45.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.studio45.backend.modules.admin.presentation.dto.CreateUserRequest;
import com.studio45.backend.modules.admin.presentation.dto.PermissionCheckResponse;
import com.studio45.backend.modules.admin.presentation.dto.UpdateUserRolesRequest;
import com.studio45.backend.modules.admin.presentation.dto.UserPermissionsResponse;
import com.studio45.backend.modules.auth.presentation.UserFieldUpdateParser;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/users")
@Tag(name = "Admin users", description = "User administration")
public class AdminUserController {

    private final UserAdministrationService userAdministrationService;
    private final UserFieldUpdateParser updateParser;

    public AdminUserController(UserAdministrationService userAdministrationService, UserFieldUpdateParser updateParser) {
        this.userAdministrationService = userAdministrationService;
        this.updateParser = updateParser;
    }

    @GetMapping
    @Operation(summary = "List users", description = "Paged; search matches email or name case-insensitively.")
    public ResponseEntity<AdminUsersResponse> listUsers(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortDesc", defaultValue = "false") boolean sortDesc
    ) {
        return ResponseEntity.ok(userAdministrationService.listUsers(new UserListQuery(page, limit, search, sortBy, sortDesc)));
    }

    @PostMapping
    public ResponseEntity<AdminUserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        AdminUserResponse created = userAdministrationService.createUser(
                SecurityUtils.getCurrentUserId(),
                new CreateUserCommand(
                        request.email(),
                        request.password(),
                        request.name(),
                        request.phone(),
                        request.company(),
                        request.roles()
                )
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AdminUserResponse> getUser(@PathVariable("id") UUID userId) {
        return ResponseEntity.ok(userAdministrationService.getUser(userId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AdminUserResponse> updateUser(@PathVariable("id") UUID userId, @RequestBody JsonNode body) {
        return ResponseEntity.ok(userAdministrationService.updateUser(userId, updateParser.parseAdmin(body)));
    }

    @PutMapping("/{id}/roles")
    @Operation(summary = "Replace the roles of a user")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Roles replaced"),
            @ApiResponse(responseCode = "400", description = "Unknown role, or an admin removing their own admin role")
    })
    public ResponseEntity<AdminUserResponse> setUserRoles(
            @PathVariable("id") UUID userId,
            @Valid @RequestBody UpdateUserRolesRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.setUserRoles(SecurityUtils.getCurrentUserId(), userId, request.roles()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteUser(@PathVariable("id") UUID userId) {
        userAdministrationService.deleteUser(SecurityUtils.getCurrentUserId(), userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/permissions")
    public ResponseEntity<UserPermissionsResponse> getUserPermissions(@PathVariable("id") UUID userId) {
        return ResponseEntity.ok(userAdministrationService.getUserPermissions(userId));
    }

    @GetMapping("/{id}/permissions/{permission}")
    public ResponseEntity<PermissionCheckResponse> checkUserPermission(
            @PathVariable("id") UUID userId,
            @PathVariable("permission") String permission
    ) {
        return ResponseEntity.ok(userAdministrationService.checkUserPermission(userId, permission));
    }
}
