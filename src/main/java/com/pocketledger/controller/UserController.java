package com.pocketledger.controller;

import com.pocketledger.dto.ApiResponses;
import com.pocketledger.security.CurrentUser;
import com.pocketledger.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's own profile.
 */
@RestController
@RequestMapping("/users")
@Tag(name = "Users", description = "Profile of the authenticated user")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping("/me")
    @Operation(summary = "Current user", description = "Profile of the user owning the bearer token")
    public ResponseEntity<ApiResponses.UserResponse> me(Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.UserResponse(
                userService.get(CurrentUser.idOf(authentication))));
    }
}
