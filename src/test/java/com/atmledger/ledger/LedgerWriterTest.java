package com.atmledger.ledger;

import com.atmledger.common.Money;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ledger document rendering.
 */
class LedgerWriterTest {

    @Test
    void testHeaderOnlyWhenNoTransactions() throws IOException {
        StringWriter out = new StringWriter();

        LedgerWriter.write(out, "Sam Sepiol", 12345678L, 1234, List.of());

        assertEquals("Name: Sam Sepiol\nCard Number: 12345678\nPIN: 1234\n", out.toString());
    }

    @Test
    void testTransactionsFollowHeaderInOrder() throws IOException {
        List<TransactionRecord> records = List.of(
            TransactionRecord.withdrawal(Money.of("200.40"), Money.of("99.90")),
            TransactionRecord.deposit(Money.of("40000"), Money.of("40099.9"))
        );
        StringWriter out = new StringWriter();

        LedgerWriter.write(out, "Sam Sepiol", 12345678L, 1234, records);

        String[] lines = out.toString().split("\n");
        assertEquals(5, lines.length);
        assertEquals("Withdrawal - Amount: $200.40, Updated Balance: $99.90", lines[3]);
        assertEquals("Deposit - Amount: $40000.00, Updated Balance: $40099.90", lines[4]);
    }

    @Test
    void testDescriptionUsesTypeLabel() {
        assertEquals("Deposit", TransactionType.DEPOSIT.getLabel());
        assertEquals("Withdrawal", TransactionType.WITHDRAWAL.getLabel());
        assertTrue(TransactionRecord.deposit(Money.of("1"), Money.of("2"))
            .getDescription().startsWith("Deposit - Amount: $1.00"));
    }
}
