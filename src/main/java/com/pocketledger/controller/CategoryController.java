package com.pocketledger.controller;

import com.pocketledger.dto.ApiResponses;
import com.pocketledger.dto.CategoryRequest;
import com.pocketledger.security.CurrentUser;
import com.pocketledger.service.CategoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Owner-scoped category CRUD.
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /categories        → 201 | 400 | 409 duplicate name
 * GET    /categories        → 200
 * PUT    /categories/{id}   → 200 | 403 | 404 | 409 duplicate name
 * DELETE /categories/{id}   → 204 | 403 | 404 | 409 still used by transactions
 */
@RestController
@RequestMapping("/categories")
@Tag(name = "Categories", description = "Spending and income categories")
public class CategoryController {

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @PostMapping
    @Operation(summary = "Create category")
    public ResponseEntity<ApiResponses.CategoryResponse> create(
            @Valid @RequestBody CategoryRequest request,
            Authentication authentication) {
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new ApiResponses.CategoryResponse(
                        categoryService.create(CurrentUser.idOf(authentication), request.getName())));
    }

    @GetMapping
    @Operation(summary = "List categories")
    public ResponseEntity<List<ApiResponses.CategoryResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(categoryService.list(CurrentUser.idOf(authentication)).stream()
                .map(ApiResponses.CategoryResponse::new)
                .toList());
    }

    @PutMapping("/{categoryId}")
    @Operation(summary = "Rename category")
    public ResponseEntity<ApiResponses.CategoryResponse> rename(
            @PathVariable Long categoryId,
            @Valid @RequestBody CategoryRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.CategoryResponse(
                categoryService.rename(CurrentUser.idOf(authentication), categoryId, request.getName())));
    }

    @DeleteMapping("/{categoryId}")
    @Operation(summary = "Delete category", description = "Refused while transactions use the category")
    public ResponseEntity<Void> delete(@PathVariable Long categoryId, Authentication authentication) {
        categoryService.delete(CurrentUser.idOf(authentication), categoryId);
        return ResponseEntity.noContent().build();
    }
}
