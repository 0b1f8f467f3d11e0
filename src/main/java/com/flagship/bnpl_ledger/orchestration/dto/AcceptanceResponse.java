package com.flagship.bnpl_ledger.orchestration.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.orchestration.AcceptanceResult;
import com.flagship.bnpl_ledger.purchase.dto.PurchaseRequestResponse;
import com.flagship.bnpl_ledger.settlement.dto.SettlementResponse;
import com.flagship.bnpl_ledger.transaction.dto.ScheduleResponse;
import com.flagship.bnpl_ledger.transaction.dto.TransactionResponse;
import lombok.Value;

@Value
public class AcceptanceResponse {

    @JsonProperty("purchase_request")
    PurchaseRequestResponse purchaseRequest;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    @JsonProperty("repayment_plan")
    ScheduleResponse repaymentPlan;

    @JsonProperty("income_settlement")
    SettlementResponse incomeSettlement;

    public static AcceptanceResponse from(AcceptanceResult result) {
        return new AcceptanceResponse(
            PurchaseRequestResponse.from(result.getPurchaseRequest()),
            TransactionResponse.from(result.getTransaction()),
            ScheduleResponse.from(result.getSchedule()),
            SettlementResponse.from(result.getIncomeSettlement())
        );
    }
}
