package com.flagship.general_ledger;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountService;
import com.flagship.general_ledger.account.AccountType;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalEntryRequest;
import com.flagship.general_ledger.journal.JournalEntryService;
import com.flagship.general_ledger.journal.JournalEntryType;
import com.flagship.general_ledger.period.FiscalPeriod;
import com.flagship.general_ledger.period.FiscalPeriodService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;

/**
 * Base for tests that run against a real PostgreSQL.
 *
 * One container is shared by every subclass and started on first use, so the
 * Spring context (and its Flyway migration) is reused across test classes.
 * Each test starts from empty tables.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("general_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected AccountService accountService;

    @Autowired
    protected FiscalPeriodService periodService;

    @Autowired
    protected JournalEntryService journalEntryService;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE TABLE reconciling_items, bank_transactions, reconciliations, bank_accounts, " +
            "account_balances, journal_lines, journal_entries, fiscal_periods, accounts, outbox_events CASCADE");
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected Account createAccount(String code, String name, AccountType type) {
        return accountService.createAccount(code, name, null, type, null, null);
    }

    protected FiscalPeriod openPeriod(int year, int month) {
        return periodService.createPeriod(year, month);
    }

    protected JournalEntry createEntry(LocalDate date, String description, JournalEntryRequest.Line... lines) {
        return journalEntryService.createEntry(new JournalEntryRequest(
            date, description, null, JournalEntryType.MANUAL, "tester", List.of(lines)), null);
    }

    protected JournalEntry createAndPost(LocalDate date, String description, JournalEntryRequest.Line... lines) {
        JournalEntry entry = createEntry(date, description, lines);
        return journalEntryService.postEntry(entry.getId(), "tester");
    }

    protected int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count != null ? count : 0;
    }
}
