package com.flagship.bnpl_ledger.payment;

public enum PaymentMethod {
    WALLET,
    CARD,
    BANK_TRANSFER
}
