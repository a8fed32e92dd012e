package com.atmledger.ledger;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Renders an account ledger document.
 *
 * Layout:
 * <pre>
 * Name: &lt;owner&gt;
 * Card Number: &lt;card&gt;
 * PIN: &lt;pin&gt;
 * &lt;one line per transaction, oldest first&gt;
 * </pre>
 */
public final class LedgerWriter {

    private static final String NEWLINE = "\n";

    private LedgerWriter() {
    }

    public static void write(Writer out, String ownerName, long cardNumber, long pin,
                             List<TransactionRecord> records) throws IOException {
        out.write("Name: " + ownerName + NEWLINE);
        out.write("Card Number: " + cardNumber + NEWLINE);
        out.write("PIN: " + pin + NEWLINE);
        for (TransactionRecord record : records) {
            out.write(record.getDescription());
            out.write(NEWLINE);
        }
        out.flush();
    }
}
