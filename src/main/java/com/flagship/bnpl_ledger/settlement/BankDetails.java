package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import lombok.Value;

/**
 * Payout destination. Snapshotted onto each withdrawal so later edits do not rewrite history.
 */
@Value
public class BankDetails {
    String bankName;
    String bankAccount;
    String iban;

    public static BankDetails of(String bankName, String bankAccount, String iban) {
        if (isBlank(bankName) || (isBlank(bankAccount) && isBlank(iban))) {
            throw new LedgerValidationException("Bank details need a bank name and an account number or IBAN");
        }
        return new BankDetails(bankName.trim(), trimToNull(bankAccount), trimToNull(iban));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
