package com.pocketledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for Pocket Ledger, a personal-finance ledger API.
 *
 * @EnableTransactionManagement is declared explicitly so transaction support
 * is never accidentally disabled; every balance mutation depends on it.
 * @EnableAsync runs verification e-mail delivery off the request thread.
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAsync
public class PocketLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketLedgerApplication.class, args);
    }

}
