package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.settlement.BankDetails;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class BankDetailsPayload {

    @Size(max = 255)
    @JsonProperty("bank_name")
    String bankName;

    @Size(max = 64)
    @JsonProperty("bank_account")
    String bankAccount;

    @Pattern(regexp = "^[A-Z]{2}[0-9]{2}[A-Z0-9]{1,30}$", message = "IBAN must be 2 letters, 2 digits, then up to 30 letters or digits")
    @JsonProperty("iban")
    String iban;

    public BankDetails toDomain() {
        return BankDetails.of(bankName, bankAccount, iban);
    }

    public static BankDetailsPayload from(BankDetails bankDetails) {
        if (bankDetails == null) {
            return null;
        }
        return new BankDetailsPayload(bankDetails.getBankName(), bankDetails.getBankAccount(), bankDetails.getIban());
    }

    /**
     * Null when no payload was sent, otherwise validated domain details.
     */
    public static BankDetails toDomainOrNull(BankDetailsPayload payload) {
        return payload == null ? null : payload.toDomain();
    }
}
