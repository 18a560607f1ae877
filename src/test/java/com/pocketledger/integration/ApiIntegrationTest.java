package com.pocketledger.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketledger.dto.RegisterUserRequest;
import com.pocketledger.dto.TransactionRequest;
import com.pocketledger.dto.TransactionUpdateRequest;
import com.pocketledger.dto.TransferRequest;
import com.pocketledger.receipt.ReceiptStorage;
import com.pocketledger.security.JwtTokenProvider;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Comprehensive API integration test.
 * Tests the full workflow: register → verify → login → post → edit → transfer → report
 *
 * Uses @SpringBootTest to load the full application context with real transaction management.
 * Uses H2 in-memory database (configured in application-test.yml). The mail sender and the
 * receipt store are mocked; nothing leaves the JVM.
 *
 * This verifies:
 * - All APIs return correct HTTP status codes
 * - Cached balances follow every create, edit, move, transfer and delete
 * - Reconstructed balances agree with the cache
 * - Ownership checks work (can't touch another user's accounts or transactions)
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ApiIntegrationTest {

    @Autowired private MockMvc          mockMvc;
    @Autowired private ObjectMapper     objectMapper;
    @Autowired private JwtTokenProvider tokenProvider;

    @MockBean private JavaMailSender mailSender;
    @MockBean private ReceiptStorage receiptStorage;

    // State shared across test methods (executed in order)
    private static String anaToken;
    private static String boToken;
    private static Long   anaId;
    private static Long   walletId;
    private static Long   checkingId;
    private static Long   foodId;
    private static Long   expenseId;

    // ── helpers ───────────────────────────────────────────────────────────────

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private void register(String name, String email, String password) throws Exception {
        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterUserRequest(name, email, password))))
                .andExpect(status().isOk());
    }

    private void verifyEmail(String email) throws Exception {
        mockMvc.perform(get("/auth/verify").param("token", tokenProvider.generateVerificationToken(email)))
                .andExpect(status().isOk());
    }

    private JsonNode login(String email, String password) throws Exception {
        String body = """
                {"email": "%s", "password": "%s"}
                """.formatted(email, password);
        return json(mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
                .andExpect(status().isOk())
                .andReturn());
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private BigDecimal cachedBalance(Long accountId) throws Exception {
        return json(mockMvc.perform(get("/accounts/" + accountId)
                .header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andReturn()).get("currentBalance").decimalValue();
    }

    private JsonNode postTransaction(String token, TransactionRequest request) throws Exception {
        return json(mockMvc.perform(post("/expenses")
                .header("Authorization", bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andReturn());
    }

    // ── 1. Registration and verification ──────────────────────────────────────

    @Test
    @Order(1)
    @DisplayName("POST /auth/register - Create user")
    void registerAna() throws Exception {
        register("Ana", "ana@api.test", "Password123!");
    }

    @Test
    @Order(2)
    @DisplayName("POST /auth/register - Duplicate email rejected")
    void registerDuplicateEmail() throws Exception {
        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new RegisterUserRequest("Ana Again", "ANA@api.test", "DifferentPass1!"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("already registered")));
    }

    @Test
    @Order(3)
    @DisplayName("POST /auth/register - Short password rejected")
    void registerShortPassword() throws Exception {
        mockMvc.perform(post("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RegisterUserRequest("X", "x@api.test", "short"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.password").exists());
    }

    @Test
    @Order(4)
    @DisplayName("POST /auth/login - Unverified e-mail refused")
    void loginBeforeVerification() throws Exception {
        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"ana@api.test\", \"password\": \"Password123!\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("not verified")));
    }

    @Test
    @Order(5)
    @DisplayName("GET /auth/verify - Verified, then already verified")
    void verifyEmailLink() throws Exception {
        String token = tokenProvider.generateVerificationToken("ana@api.test");

        mockMvc.perform(get("/auth/verify").param("token", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email verified successfully"));
        mockMvc.perform(get("/auth/verify").param("token", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email already verified"));
    }

    @Test
    @Order(6)
    @DisplayName("GET /auth/verify - Garbage token rejected")
    void verifyGarbage() throws Exception {
        mockMvc.perform(get("/auth/verify").param("token", "not-a-token"))
                .andExpect(status().isBadRequest());
    }

    // ── 2. Authentication ─────────────────────────────────────────────────────

    @Test
    @Order(10)
    @DisplayName("POST /auth/login - Both users log in")
    void loginUsers() throws Exception {
        JsonNode ana = login("ana@api.test", "Password123!");
        assertThat(ana.get("token").asText()).isNotBlank();
        assertThat(ana.get("email").asText()).isEqualTo("ana@api.test");
        anaToken = ana.get("token").asText();
        anaId = ana.get("id").asLong();

        register("Bo", "bo@api.test", "Password456!");
        verifyEmail("bo@api.test");
        boToken = login("bo@api.test", "Password456!").get("token").asText();
    }

    @Test
    @Order(11)
    @DisplayName("POST /auth/login - Wrong password rejected")
    void loginWrongPassword() throws Exception {
        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"ana@api.test\", \"password\": \"WrongPassword!\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid email or password"));
    }

    @Test
    @Order(12)
    @DisplayName("Protected endpoint without token → 401")
    void noToken() throws Exception {
        mockMvc.perform(get("/accounts")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/accounts").header("Authorization", "Bearer garbage"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @Order(13)
    @DisplayName("Verification token used as access token → 401")
    void verificationTokenIsNotAccessToken() throws Exception {
        mockMvc.perform(get("/users/me")
                .header("Authorization", bearer(tokenProvider.generateVerificationToken("ana@api.test"))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @Order(14)
    @DisplayName("GET /users/me - Own profile")
    void me() throws Exception {
        mockMvc.perform(get("/users/me").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("ana@api.test"))
                .andExpect(jsonPath("$.verified").value(true));
    }

    // ── 3. Defaults provisioned at registration ───────────────────────────────

    @Test
    @Order(20)
    @DisplayName("GET /accounts - Default Wallet account")
    void defaultAccount() throws Exception {
        JsonNode accounts = json(mockMvc.perform(get("/accounts").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("Wallet"))
                .andExpect(jsonPath("$[0].type").value("CASH"))
                .andReturn());
        walletId = accounts.get(0).get("id").asLong();
        assertThat(accounts.get(0).get("currentBalance").decimalValue()).isEqualByComparingTo("0");
    }

    @Test
    @Order(21)
    @DisplayName("GET /categories - Default categories including Transfer")
    void defaultCategories() throws Exception {
        JsonNode categories = json(mockMvc.perform(get("/categories").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].name").value(hasItems("Food", "Salary", "Transfer")))
                .andReturn());
        for (JsonNode category : categories) {
            if ("Food".equals(category.get("name").asText())) {
                foodId = category.get("id").asLong();
            }
        }
        assertThat(foodId).isNotNull();
    }

    @Test
    @Order(22)
    @DisplayName("POST /categories - Duplicate name → 409")
    void duplicateCategory() throws Exception {
        mockMvc.perform(post("/categories")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Food\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @Order(23)
    @DisplayName("POST /accounts - Checking with opening balance")
    void createChecking() throws Exception {
        JsonNode account = json(mockMvc.perform(post("/accounts")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Checking\", \"type\": \"CHECKING\", \"initialBalance\": 1000.00}"))
                .andExpect(status().isCreated())
                .andReturn());
        checkingId = account.get("id").asLong();
        assertThat(account.get("currentBalance").decimalValue()).isEqualByComparingTo("1000.00");
    }

    // ── 4. Postings move the cached balance ───────────────────────────────────

    @Test
    @Order(30)
    @DisplayName("POST /expenses - Expense debits, income credits")
    void postTransactions() throws Exception {
        JsonNode expense = postTransaction(anaToken,
                new TransactionRequest("Groceries", new BigDecimal("250.50"), null, null, foodId, checkingId));
        expenseId = expense.get("id").asLong();
        assertThat(expense.get("type").asText()).isEqualTo("EXPENSE");

        postTransaction(anaToken,
                new TransactionRequest("Refund", new BigDecimal("100.00"), "income", null, foodId, walletId));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("749.50");
        assertThat(cachedBalance(walletId)).isEqualByComparingTo("100.00");
    }

    @Test
    @Order(31)
    @DisplayName("PUT /expenses/{id} - Amount change applies the difference")
    void editAmount() throws Exception {
        mockMvc.perform(put("/expenses/" + expenseId)
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransactionUpdateRequest(null, new BigDecimal("200.00"), null, null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("EXPENSE"));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("800.00");
    }

    @Test
    @Order(32)
    @DisplayName("PUT /expenses/{id} - Moving to another account reverts and reapplies")
    void moveTransaction() throws Exception {
        mockMvc.perform(put("/expenses/" + expenseId)
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransactionUpdateRequest(null, null, null, null, walletId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accountId").value(walletId));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("1000.00");
        assertThat(cachedBalance(walletId)).isEqualByComparingTo("-100.00");
    }

    @Test
    @Order(33)
    @DisplayName("POST /expenses - Back-dated expense")
    void backDatedExpense() throws Exception {
        JsonNode tx = postTransaction(anaToken,
                new TransactionRequest("Old bill", new BigDecimal("50.00"), "expense", "2020-01-15", foodId, checkingId));
        assertThat(tx.get("date").asText()).startsWith("2020-01-15");
        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("950.00");
    }

    // ── 5. Transfers ──────────────────────────────────────────────────────────

    @Test
    @Order(40)
    @DisplayName("POST /accounts/transfer - Both legs posted")
    void transfer() throws Exception {
        mockMvc.perform(post("/accounts/transfer")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransferRequest(checkingId, walletId, new BigDecimal("300.00"), null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.debit.type").value("TRANSFER_OUT"))
                .andExpect(jsonPath("$.debit.description").value("Transfer to Wallet"))
                .andExpect(jsonPath("$.credit.type").value("TRANSFER_IN"))
                .andExpect(jsonPath("$.credit.categoryName").value("Transfer"));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("650.00");
        assertThat(cachedBalance(walletId)).isEqualByComparingTo("200.00");
    }

    @Test
    @Order(41)
    @DisplayName("POST /accounts/transfer - Same account → 400, balances unchanged")
    void transferSameAccount() throws Exception {
        mockMvc.perform(post("/accounts/transfer")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransferRequest(checkingId, checkingId, BigDecimal.TEN, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSFER"));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("650.00");
    }

    @Test
    @Order(42)
    @DisplayName("POST /accounts/transfer - Negative amount → 400")
    void transferNegative() throws Exception {
        mockMvc.perform(post("/accounts/transfer")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransferRequest(checkingId, walletId, new BigDecimal("-5"), null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSFER"));
    }

    // ── 6. Ownership ──────────────────────────────────────────────────────────

    @Test
    @Order(50)
    @DisplayName("Another user's transaction → 403")
    void foreignTransaction() throws Exception {
        mockMvc.perform(get("/expenses/" + expenseId).header("Authorization", bearer(boToken)))
                .andExpect(status().isForbidden());
        mockMvc.perform(delete("/expenses/" + expenseId).header("Authorization", bearer(boToken)))
                .andExpect(status().isForbidden());
    }

    @Test
    @Order(51)
    @DisplayName("Posting to another user's account → 400 INVALID_REFERENCE")
    void postToForeignAccount() throws Exception {
        mockMvc.perform(post("/expenses")
                .header("Authorization", bearer(boToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransactionRequest("Sneaky", BigDecimal.ONE, null, null, foodId, checkingId))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REFERENCE"));

        assertThat(cachedBalance(checkingId)).isEqualByComparingTo("650.00");
    }

    @Test
    @Order(52)
    @DisplayName("Transfer out of another user's account → 400 INVALID_REFERENCE")
    void transferFromForeignAccount() throws Exception {
        mockMvc.perform(post("/accounts/transfer")
                .header("Authorization", bearer(boToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                        new TransferRequest(checkingId, walletId, BigDecimal.TEN, null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REFERENCE"));
    }

    @Test
    @Order(53)
    @DisplayName("Unknown transaction → 404")
    void unknownTransaction() throws Exception {
        mockMvc.perform(get("/expenses/999999").header("Authorization", bearer(anaToken)))
                .andExpect(status().isNotFound());
    }

    // ── 7. Balance reports ────────────────────────────────────────────────────

    @Test
    @Order(60)
    @DisplayName("GET /accounts/balance - Reconstruction equals the cache")
    void reconstructionMatchesCache() throws Exception {
        JsonNode reports = json(mockMvc.perform(get("/accounts/balance").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andReturn());

        assertThat(reports).hasSize(2);
        for (JsonNode report : reports) {
            assertThat(report.get("balance").decimalValue())
                    .isEqualByComparingTo(report.get("cachedBalance").decimalValue());
        }
    }

    @Test
    @Order(61)
    @DisplayName("GET /accounts/balance/{id} - Opening and closing for a past month")
    void periodBalance() throws Exception {
        mockMvc.perform(get("/accounts/balance/" + checkingId)
                .header("Authorization", bearer(anaToken))
                .param("startDate", "2020-01-01")
                .param("endDate", "2020-01-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.openingBalance").value(1000.0))
                .andExpect(jsonPath("$.closingBalance").value(950.0))
                .andExpect(jsonPath("$.periodNet").value(-50.0))
                .andExpect(jsonPath("$.balance").value(950.0));
    }

    @Test
    @Order(62)
    @DisplayName("POST /accounts/balances - Selected accounts, foreign id rejected")
    void selectedBalances() throws Exception {
        mockMvc.perform(post("/accounts/balances")
                .header("Authorization", bearer(anaToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountIds\": [" + walletId + ", " + checkingId + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].accountId").value(walletId))
                .andExpect(jsonPath("$[1].accountId").value(checkingId));

        mockMvc.perform(post("/accounts/balances")
                .header("Authorization", bearer(boToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountIds\": [" + checkingId + "]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REFERENCE"));
    }

    @Test
    @Order(63)
    @DisplayName("GET /expenses - Date filter and account filter")
    void listFiltered() throws Exception {
        mockMvc.perform(get("/expenses")
                .header("Authorization", bearer(anaToken))
                .param("startDate", "2020-01-01")
                .param("endDate", "2020-12-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].description").value("Old bill"));

        mockMvc.perform(get("/expenses")
                .header("Authorization", bearer(anaToken))
                .param("accountId", String.valueOf(walletId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
    }

    // ── 8. Receipts ───────────────────────────────────────────────────────────

    @Test
    @Order(70)
    @DisplayName("POST /expenses/{id}/receipt - Stored under userId/transactionId")
    void uploadReceipt() throws Exception {
        var file = new MockMultipartFile("file", "receipt.png", "image/png", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/expenses/" + expenseId + "/receipt")
                .file(file)
                .header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value(anaId + "/" + expenseId));

        verify(receiptStorage).store(eq(anaId + "/" + expenseId), eq("image/png"), eq(new byte[]{1, 2, 3}));
    }

    // ── 9. Deletion ───────────────────────────────────────────────────────────

    @Test
    @Order(80)
    @DisplayName("DELETE /expenses/{id} - Reverts the balance")
    void deleteTransaction() throws Exception {
        mockMvc.perform(delete("/expenses/" + expenseId).header("Authorization", bearer(anaToken)))
                .andExpect(status().isNoContent());

        assertThat(cachedBalance(walletId)).isEqualByComparingTo("400.00");
        mockMvc.perform(get("/expenses/" + expenseId).header("Authorization", bearer(anaToken)))
                .andExpect(status().isNotFound());
    }

    @Test
    @Order(81)
    @DisplayName("DELETE /accounts/{id} and /categories/{id} still referenced → 409")
    void deleteReferenced() throws Exception {
        mockMvc.perform(delete("/accounts/" + checkingId).header("Authorization", bearer(anaToken)))
                .andExpect(status().isConflict());
        mockMvc.perform(delete("/categories/" + foodId).header("Authorization", bearer(anaToken)))
                .andExpect(status().isConflict());
    }
}
