package com.pocketledger.service;

import com.pocketledger.domain.Category;
import com.pocketledger.domain.User;
import com.pocketledger.exception.AccessDeniedException;
import com.pocketledger.exception.DuplicateCategoryException;
import com.pocketledger.exception.ResourceInUseException;
import com.pocketledger.exception.ResourceNotFoundException;
import com.pocketledger.repository.CategoryRepository;
import com.pocketledger.repository.TransactionRepository;
import com.pocketledger.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for category management.
 *
 * Category names are unique per user; the database constraint backs the
 * service-level duplicate check.
 */
@Service
@Transactional
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    /** Categories every new user starts with. */
    public static final List<String> DEFAULT_CATEGORIES = List.of(
            "Food", "Transport", "Housing", "Leisure", "Health",
            "Education", "Salary", "Other", Category.TRANSFER);

    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final UserRepository userRepository;

    public CategoryService(CategoryRepository categoryRepository,
                           TransactionRepository transactionRepository,
                           UserRepository userRepository) {
        this.categoryRepository = categoryRepository;
        this.transactionRepository = transactionRepository;
        this.userRepository = userRepository;
    }

    /**
     * Provision the default category set. Runs inside the registration transaction.
     */
    public List<Category> createDefaults(User user) {
        List<Category> categories = DEFAULT_CATEGORIES.stream()
                .map(name -> new Category(user, name))
                .toList();
        return categoryRepository.saveAll(categories);
    }

    public Category create(Long userId, String name) {
        User owner = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        Category category = new Category(owner, name);
        if (categoryRepository.existsByUserIdAndName(userId, category.getName())) {
            throw new DuplicateCategoryException(category.getName());
        }
        category = categoryRepository.save(category);
        log.info("Category created - userId={}, categoryId={}, name={}", userId, category.getId(), category.getName());
        return category;
    }

    @Transactional(readOnly = true)
    public List<Category> list(Long userId) {
        return categoryRepository.findByUserIdOrderByNameAsc(userId);
    }

    @Transactional(readOnly = true)
    public Category get(Long userId, Long categoryId) {
        Category category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> ResourceNotFoundException.of("Category", categoryId));
        if (!category.isOwnedBy(userId)) {
            throw new AccessDeniedException("You do not have permission to access category: " + categoryId);
        }
        return category;
    }

    public Category rename(Long userId, Long categoryId, String newName) {
        Category category = get(userId, categoryId);
        String normalized = newName != null ? newName.strip() : null;
        if (normalized != null && !normalized.equals(category.getName())
                && categoryRepository.existsByUserIdAndName(userId, normalized)) {
            throw new DuplicateCategoryException(normalized);
        }
        category.rename(newName);
        return categoryRepository.save(category);
    }

    /**
     * @throws ResourceInUseException if any transaction is filed under the category
     */
    public void delete(Long userId, Long categoryId) {
        Category category = get(userId, categoryId);
        if (transactionRepository.existsByCategoryId(categoryId)) {
            throw new ResourceInUseException(
                    "Category " + categoryId + " is used by existing transactions and cannot be deleted");
        }
        categoryRepository.delete(category);
        log.info("Category deleted - userId={}, categoryId={}", userId, categoryId);
    }

    /**
     * Find or create the user's "Transfer" category.
     *
     * Runs outside any surrounding transaction so the insert commits on its own.
     * Two first transfers racing here both try to insert; the loser hits the
     * unique (user_id, name) constraint and re-reads the winner's row.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Category resolveTransferCategory(Long userId) {
        return categoryRepository.findByUserIdAndName(userId, Category.TRANSFER)
                .orElseGet(() -> createTransferCategory(userId));
    }

    private Category createTransferCategory(Long userId) {
        User owner = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.of("User", userId));
        try {
            Category created = categoryRepository.saveAndFlush(new Category(owner, Category.TRANSFER));
            log.info("Transfer category created - userId={}, categoryId={}", userId, created.getId());
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Transfer category created concurrently for userId={}, re-reading", userId);
            return categoryRepository.findByUserIdAndName(userId, Category.TRANSFER)
                    .orElseThrow(() -> e);
        }
    }
}
